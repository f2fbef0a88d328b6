package com.knowledgeplatform.knowledge.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for POST /progress.
 */
public record ProgressRequest(
    @JsonProperty("sector")      String sector,
    @JsonProperty("performance") Double performance,
    @JsonProperty("notes")       String notes
) {}
