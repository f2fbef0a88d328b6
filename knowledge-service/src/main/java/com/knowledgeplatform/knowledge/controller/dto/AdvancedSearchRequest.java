package com.knowledgeplatform.knowledge.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Request body for POST /advanced_search.
 */
public record AdvancedSearchRequest(
    @JsonProperty("query")       String query,
    @JsonProperty("preferences") Map<String, Object> preferences
) {
    public String queryOrEmpty() {
        return query == null ? "" : query;
    }
}
