package com.knowledgeplatform.knowledge.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.knowledgeplatform.knowledge.service.TopicAnswer;

/**
 * Response body for POST /get_topic_content. {@code link} is always present,
 * {@code null} when the topic has no further reading.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record TopicContentResponse(
    @JsonProperty("answer") String answer,
    @JsonProperty("link")   String link
) {
    public static TopicContentResponse from(TopicAnswer answer) {
        return new TopicContentResponse(answer.answer(), answer.link());
    }
}
