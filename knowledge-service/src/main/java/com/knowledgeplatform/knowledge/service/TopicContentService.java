package com.knowledgeplatform.knowledge.service;

import com.knowledgeplatform.common.answer.AnswerSynthesizer;
import com.knowledgeplatform.common.exception.SourceFetchException;
import com.knowledgeplatform.common.freshness.FreshnessPolicy;
import com.knowledgeplatform.knowledge.cache.CacheKeys;
import com.knowledgeplatform.knowledge.cache.TtlCache;
import com.knowledgeplatform.knowledge.client.AcademicResourceClient;
import com.knowledgeplatform.knowledge.client.ExternalTopicClient;
import com.knowledgeplatform.knowledge.client.dto.AcademicSummary;
import com.knowledgeplatform.knowledge.client.dto.ExternalTopicPayload;
import com.knowledgeplatform.knowledge.model.Topic;
import com.knowledgeplatform.knowledge.store.TopicStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

/**
 * Answers "what do we know about sector X" requests.
 *
 * <p><strong>Flow</strong> (online mode):
 * <ol>
 *   <li>Read the stored topic and ask {@link FreshnessPolicy} whether it is stale.</li>
 *   <li>If so, fetch from {@link ExternalTopicClient}; on success upsert the topic and
 *       cache the raw payload under {@code api_<sector>}. A failed fetch is logged and
 *       the request continues with whatever is stored.</li>
 *   <li>Re-read the topic. Absent → {@link TopicAnswer#notFound()}.</li>
 *   <li>Read {@code academic_<sector>} from the cache, fetching and caching it on a
 *       miss, and append each summary to the context on its own line.</li>
 *   <li>Hand the context to the {@link AnswerSynthesizer}.</li>
 * </ol>
 * Offline mode skips steps 1, 2 and 4 and touches no remote source.
 *
 * <p>Never emits an error: anything unexpected becomes {@link TopicAnswer#error}.
 * Nothing is retried here.
 */
public class TopicContentService {

    private static final Logger log = LoggerFactory.getLogger(TopicContentService.class);

    private final TopicStore topicStore;
    private final TtlCache cache;
    private final ExternalTopicClient externalTopicClient;
    private final AcademicResourceClient academicResourceClient;
    private final FreshnessPolicy freshnessPolicy;
    private final AnswerSynthesizer answerSynthesizer;
    private final RefreshCoordinator refreshCoordinator;
    private final Clock clock;
    private final Duration externalCacheTtl;
    private final Duration academicCacheTtl;

    public TopicContentService(TopicStore topicStore,
                               TtlCache cache,
                               ExternalTopicClient externalTopicClient,
                               AcademicResourceClient academicResourceClient,
                               FreshnessPolicy freshnessPolicy,
                               AnswerSynthesizer answerSynthesizer,
                               RefreshCoordinator refreshCoordinator,
                               Clock clock,
                               Duration externalCacheTtl,
                               Duration academicCacheTtl) {
        this.topicStore             = topicStore;
        this.cache                  = cache;
        this.externalTopicClient    = externalTopicClient;
        this.academicResourceClient = academicResourceClient;
        this.freshnessPolicy        = freshnessPolicy;
        this.answerSynthesizer      = answerSynthesizer;
        this.refreshCoordinator     = refreshCoordinator;
        this.clock                  = clock;
        this.externalCacheTtl       = externalCacheTtl;
        this.academicCacheTtl       = academicCacheTtl;
    }

    public Mono<TopicAnswer> getTopicContent(String question, String sector, boolean offlineMode) {
        Mono<Void> refreshStep = offlineMode ? Mono.empty() : refreshIfStale(sector);

        return refreshStep
            .then(Mono.defer(() -> topicStore.find(sector)))
            .map(Optional::of)
            .defaultIfEmpty(Optional.empty())
            .flatMap(topic -> {
                if (topic.isEmpty()) {
                    log.info("No topic stored. sector={} offline={}", sector, offlineMode);
                    return Mono.just(TopicAnswer.notFound());
                }
                return answerFrom(topic.get(), question, offlineMode);
            })
            .onErrorResume(e -> {
                log.error("Error retrieving content for sector {}", sector, e);
                return Mono.just(TopicAnswer.error(e));
            });
    }

    // ── refresh ───────────────────────────────────────────────────────────────

    private Mono<Void> refreshIfStale(String sector) {
        return topicStore.find(sector)
            .map(topic -> Optional.ofNullable(topic.getLastUpdate()).map(ts -> ts.toInstant(ZoneOffset.UTC)))
            .defaultIfEmpty(Optional.empty())
            .flatMap(lastUpdate -> {
                Instant now = clock.instant();
                if (!freshnessPolicy.needsRefresh(lastUpdate.orElse(null), now)) {
                    log.debug("Topic fresh. sector={} lastUpdate={}", sector, lastUpdate.orElse(null));
                    return Mono.empty();
                }
                log.info("Topic refresh needed. sector={} lastUpdate={}", sector, lastUpdate.orElse(null));
                return refreshCoordinator.run(sector, () -> refresh(sector));
            });
    }

    private Mono<Void> refresh(String sector) {
        return externalTopicClient.fetch(sector)
            .flatMap(payload -> topicStore
                .upsert(sector, payload.content(), payload.furtherReading(), nowUtc())
                .then(cacheExternalPayload(sector, payload)))
            .onErrorResume(SourceFetchException.class, e -> {
                log.warn("Refresh skipped, serving stored content. sector={} reason={} detail={}",
                         sector, e.getReason(), e.getMessage());
                return Mono.empty();
            });
    }

    private Mono<Void> cacheExternalPayload(String sector, ExternalTopicPayload payload) {
        return cache.set(CacheKeys.externalTopic(sector), payload.rawJson(), externalCacheTtl)
            .onErrorResume(e -> {
                log.warn("Failed to cache external payload. sector={}", sector, e);
                return Mono.empty();
            });
    }

    // ── context assembly ──────────────────────────────────────────────────────

    private Mono<TopicAnswer> answerFrom(Topic topic, String question, boolean offlineMode) {
        String content = topic.getContent() == null ? "" : topic.getContent();
        Mono<String> context = offlineMode
            ? Mono.just(content)
            : academicSummaries(topic.getSector()).map(summaries -> merge(content, summaries));

        return context.map(ctx -> new TopicAnswer(answerSynthesizer.answer(ctx, question),
                                                  topic.getFurtherReading()));
    }

    private Mono<List<AcademicSummary>> academicSummaries(String sector) {
        String key = CacheKeys.academicResources(sector);
        Mono<String> cached = cache.get(key)
            .onErrorResume(e -> {
                log.warn("Cache read failed, treating as miss. key={}", key, e);
                return Mono.empty();
            });

        return cached
            .switchIfEmpty(Mono.defer(() -> academicResourceClient.fetch(sector)
                .flatMap(raw -> cache.set(key, raw, academicCacheTtl)
                    .onErrorResume(e -> {
                        log.warn("Failed to cache academic resources. key={}", key, e);
                        return Mono.empty();
                    })
                    .thenReturn(raw))))
            .map(academicResourceClient::parseSummaries)
            .defaultIfEmpty(List.of())
            .onErrorResume(SourceFetchException.class, e -> {
                log.warn("Enrichment unavailable, using stored content only. sector={} reason={} detail={}",
                         sector, e.getReason(), e.getMessage());
                return Mono.just(List.of());
            });
    }

    static String merge(String content, List<AcademicSummary> summaries) {
        if (summaries.isEmpty()) {
            return content;
        }
        StringBuilder context = new StringBuilder(content);
        for (AcademicSummary summary : summaries) {
            context.append('\n').append(summary.summary());
        }
        return context.toString();
    }

    private LocalDateTime nowUtc() {
        return LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);
    }
}
