package com.knowledgeplatform.knowledge.client.dto;

/**
 * Authoritative content for a sector as delivered by the external refresh API.
 *
 * @param content        knowledge body, never null
 * @param furtherReading optional link, may be null or empty
 * @param rawJson        the response body exactly as received, for caching
 */
public record ExternalTopicPayload(
    String content,
    String furtherReading,
    String rawJson
) {}
