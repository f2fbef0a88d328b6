package com.knowledgeplatform.common.ranking;

/**
 * A scored topic produced by a search. Carries the full content; display
 * snippeting is left to the caller.
 */
public record SearchResult(
    String sector,
    String content,
    double score
) {}
