package com.knowledgeplatform.common.ranking;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders scored candidates for presentation.
 *
 * <p>Rules, applied in order:
 * <ol>
 *   <li>Drop candidates whose score is not strictly positive ({@code NaN} included).</li>
 *   <li>Sort by score descending. The sort is stable, so equal scores keep the
 *       input (scan) order.</li>
 *   <li>Keep at most {@code limit} results.</li>
 * </ol>
 */
public final class SearchRanker {

    public static final int DEFAULT_LIMIT = 10;

    private static final Comparator<SearchResult> BY_SCORE_DESC =
        Comparator.comparingDouble(SearchResult::score).reversed();

    private SearchRanker() {}

    public static List<SearchResult> rank(List<SearchResult> candidates) {
        return rank(candidates, DEFAULT_LIMIT);
    }

    public static List<SearchResult> rank(List<SearchResult> candidates, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + limit);
        }
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        List<SearchResult> included = new ArrayList<>(candidates.size());
        for (SearchResult candidate : candidates) {
            if (candidate.score() > 0) {
                included.add(candidate);
            }
        }
        // List.sort is a stable merge sort
        included.sort(BY_SCORE_DESC);
        return List.copyOf(included.subList(0, Math.min(limit, included.size())));
    }
}
