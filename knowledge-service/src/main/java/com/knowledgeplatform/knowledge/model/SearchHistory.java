package com.knowledgeplatform.knowledge.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Audit row appended for every advanced search query.
 */
@Data
@NoArgsConstructor
@Table("search_history")
public class SearchHistory {

    @Id
    private Long id;

    private String query;

    private LocalDateTime timestamp;
}
