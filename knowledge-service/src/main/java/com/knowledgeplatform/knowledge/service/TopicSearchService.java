package com.knowledgeplatform.knowledge.service;

import com.knowledgeplatform.common.ranking.RelevanceScorer;
import com.knowledgeplatform.common.ranking.SearchRanker;
import com.knowledgeplatform.common.ranking.SearchResult;
import com.knowledgeplatform.knowledge.model.SearchHistory;
import com.knowledgeplatform.knowledge.model.Topic;
import com.knowledgeplatform.knowledge.repository.SearchHistoryRepository;
import com.knowledgeplatform.knowledge.store.TopicStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

/**
 * Ranked search over every stored topic.
 *
 * <p>Scores each topic with the configured {@link RelevanceScorer}, then delegates
 * filtering, stable ordering and truncation to {@link SearchRanker}. A store failure
 * yields an empty list. Each query is appended to {@code search_history}; a failed
 * append is logged and does not affect the results.
 */
public class TopicSearchService {

    private static final Logger log = LoggerFactory.getLogger(TopicSearchService.class);

    private final TopicStore topicStore;
    private final SearchHistoryRepository searchHistoryRepository;
    private final RelevanceScorer relevanceScorer;
    private final Clock clock;
    private final int maxResults;

    public TopicSearchService(TopicStore topicStore,
                              SearchHistoryRepository searchHistoryRepository,
                              RelevanceScorer relevanceScorer,
                              Clock clock,
                              int maxResults) {
        this.topicStore              = topicStore;
        this.searchHistoryRepository = searchHistoryRepository;
        this.relevanceScorer         = relevanceScorer;
        this.clock                   = clock;
        this.maxResults              = maxResults;
    }

    public Mono<List<SearchResult>> advancedSearch(String query, Map<String, Object> preferences) {
        return topicStore.scanAll()
            .map(topic -> score(query, topic, preferences))
            .collectList()
            .map(candidates -> SearchRanker.rank(candidates, maxResults))
            .doOnSuccess(results -> log.info("Search complete. query={} results={}", query, results.size()))
            .onErrorResume(e -> {
                log.error("Search failed, returning no results. query={}", query, e);
                return Mono.just(List.of());
            })
            .flatMap(results -> recordQuery(query).thenReturn(results));
    }

    private SearchResult score(String query, Topic topic, Map<String, Object> preferences) {
        double score = relevanceScorer.score(query, topic.getContent(),
            topic.getLastUpdate() == null ? null : topic.getLastUpdate().toInstant(ZoneOffset.UTC),
            preferences);
        return new SearchResult(topic.getSector(), topic.getContent(), score);
    }

    private Mono<Void> recordQuery(String query) {
        SearchHistory entry = new SearchHistory();
        entry.setQuery(query);
        entry.setTimestamp(LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC));
        return Mono.defer(() -> searchHistoryRepository.save(entry))
            .then()
            .onErrorResume(e -> {
                log.warn("Failed to record search history. query={}", query, e);
                return Mono.empty();
            });
    }
}
