package com.knowledgeplatform.knowledge.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for POST /get_topic_content. Missing fields default to an empty
 * question/sector and online mode.
 */
public record TopicContentRequest(
    @JsonProperty("question")     String question,
    @JsonProperty("sector")       String sector,
    @JsonProperty("offline_mode") Boolean offlineMode
) {
    public String questionOrEmpty() {
        return question == null ? "" : question;
    }

    public String sectorOrEmpty() {
        return sector == null ? "" : sector;
    }

    public boolean offline() {
        return Boolean.TRUE.equals(offlineMode);
    }
}
