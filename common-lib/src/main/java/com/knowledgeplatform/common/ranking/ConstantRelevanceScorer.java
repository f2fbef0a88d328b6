package com.knowledgeplatform.common.ranking;

import java.time.Instant;
import java.util.Map;

/**
 * Placeholder scorer: every topic receives the same score, so search returns topics
 * in scan order. Replace with a real policy bean when one is available.
 */
public final class ConstantRelevanceScorer implements RelevanceScorer {

    public static final double DEFAULT_SCORE = 0.5;

    private final double score;

    public ConstantRelevanceScorer() {
        this(DEFAULT_SCORE);
    }

    public ConstantRelevanceScorer(double score) {
        this.score = score;
    }

    @Override
    public double score(String query, String content, Instant lastUpdate, Map<String, Object> preferences) {
        return score;
    }
}
