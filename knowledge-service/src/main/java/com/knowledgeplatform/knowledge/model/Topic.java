package com.knowledgeplatform.knowledge.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Stored knowledge for one sector.
 *
 * Column mapping (R2DBC snake_case convention):
 *   furtherReading → further_reading
 *   lastUpdate     → last_update
 *
 * lastUpdate is UTC and never null for a persisted row.
 */
@Data
@NoArgsConstructor
@Table("topics")
public class Topic {

    @Id
    private Long id;

    private String sector;

    private String content;

    private String furtherReading;

    private LocalDateTime lastUpdate;
}
