package com.knowledgeplatform.knowledge.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.knowledgeplatform.common.ranking.SearchResult;

/**
 * One entry of the POST /advanced_search response. Content longer than
 * {@link #SNIPPET_LENGTH} characters is cut and suffixed with {@code "..."}.
 */
public record SearchResultResponse(
    @JsonProperty("sector")  String sector,
    @JsonProperty("content") String content,
    @JsonProperty("score")   double score
) {
    public static final int SNIPPET_LENGTH = 200;

    public static SearchResultResponse from(SearchResult result) {
        return new SearchResultResponse(result.sector(), snippet(result.content()), result.score());
    }

    static String snippet(String content) {
        if (content == null) {
            return "";
        }
        return content.length() > SNIPPET_LENGTH ? content.substring(0, SNIPPET_LENGTH) + "..." : content;
    }
}
