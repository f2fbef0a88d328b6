package com.knowledgeplatform.knowledge.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@Table("user_progress")
public class UserProgress {

    @Id
    private Long id;

    private String sector;

    private LocalDateTime lastStudyDate;

    private Double performance;

    private String notes;
}
