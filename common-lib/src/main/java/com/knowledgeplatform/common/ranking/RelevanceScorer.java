package com.knowledgeplatform.common.ranking;

import java.time.Instant;
import java.util.Map;

/**
 * Strategy interface for scoring one topic against a search query.
 *
 * <p>Implementations must be deterministic for identical inputs. A score of zero
 * or below (or {@code NaN}) excludes the topic from the result set.
 */
@FunctionalInterface
public interface RelevanceScorer {

    double score(String query, String content, Instant lastUpdate, Map<String, Object> preferences);
}
