package com.knowledgeplatform.knowledge.service;

/**
 * Outcome of a content request: the answer text and the topic's further-reading
 * link, or {@code null} when there is none to offer.
 */
public record TopicAnswer(
    String answer,
    String link
) {
    public static final String NOT_FOUND_MESSAGE = "I'm sorry, I don't have information on that sector.";

    public static TopicAnswer notFound() {
        return new TopicAnswer(NOT_FOUND_MESSAGE, null);
    }

    public static TopicAnswer error(Throwable cause) {
        return new TopicAnswer("An error occurred: " + cause.getMessage(), null);
    }
}
