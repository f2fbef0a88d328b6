package com.knowledgeplatform.knowledge.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.knowledgeplatform.common.answer.AnswerSynthesizer;
import com.knowledgeplatform.common.answer.ExtractiveAnswerSynthesizer;
import com.knowledgeplatform.common.freshness.FreshnessPolicy;
import com.knowledgeplatform.common.ranking.ConstantRelevanceScorer;
import com.knowledgeplatform.common.ranking.RelevanceScorer;
import com.knowledgeplatform.knowledge.cache.InMemoryTtlCache;
import com.knowledgeplatform.knowledge.cache.TtlCache;
import com.knowledgeplatform.knowledge.client.AcademicResourceClient;
import com.knowledgeplatform.knowledge.client.ExternalTopicClient;
import com.knowledgeplatform.knowledge.repository.SearchHistoryRepository;
import com.knowledgeplatform.knowledge.service.RefreshCoordinator;
import com.knowledgeplatform.knowledge.service.TopicContentService;
import com.knowledgeplatform.knowledge.service.TopicSearchService;
import com.knowledgeplatform.knowledge.store.TopicStore;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Wires the retrieval pipeline. Everything here is built once at startup and shared
 * by reference; no component creates its own store or cache handle.
 */
@Configuration
public class KnowledgeConfig {

    @Value("${knowledge.external-api.base-url}")
    private String externalApiUrl;

    @Value("${knowledge.external-api.timeout:10s}")
    private Duration externalApiTimeout;

    @Value("${knowledge.academic-resources.base-url}")
    private String academicResourcesUrl;

    @Value("${knowledge.academic-resources.timeout:10s}")
    private Duration academicResourcesTimeout;

    @Value("${knowledge.freshness.staleness-window:7d}")
    private Duration stalenessWindow;

    @Value("${knowledge.cache.external-ttl:1h}")
    private Duration externalCacheTtl;

    @Value("${knowledge.cache.academic-ttl:1h}")
    private Duration academicCacheTtl;

    @Value("${knowledge.cache.max-entries:10000}")
    private int cacheMaxEntries;

    @Value("${knowledge.refresh.single-flight:false}")
    private boolean singleFlightRefresh;

    @Value("${knowledge.search.max-results:10}")
    private int searchMaxResults;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    // ── remote sources ────────────────────────────────────────────────────────

    @Bean
    public WebClient externalTopicWebClient(WebClient.Builder builder) {
        return builder.clone()
            .baseUrl(externalApiUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient(externalApiTimeout)))
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public WebClient academicResourcesWebClient(WebClient.Builder builder) {
        return builder.clone()
            .baseUrl(academicResourcesUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient(academicResourcesTimeout)))
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public ExternalTopicClient externalTopicClient(WebClient externalTopicWebClient, ObjectMapper objectMapper) {
        return new ExternalTopicClient(externalTopicWebClient, objectMapper, externalApiTimeout);
    }

    @Bean
    public AcademicResourceClient academicResourceClient(WebClient academicResourcesWebClient,
                                                         ObjectMapper objectMapper) {
        return new AcademicResourceClient(academicResourcesWebClient, objectMapper, academicResourcesTimeout);
    }

    // ── policies ──────────────────────────────────────────────────────────────

    @Bean
    public FreshnessPolicy freshnessPolicy() {
        return new FreshnessPolicy(stalenessWindow);
    }

    @Bean
    public RelevanceScorer relevanceScorer() {
        return new ConstantRelevanceScorer();
    }

    @Bean
    public AnswerSynthesizer answerSynthesizer() {
        return new ExtractiveAnswerSynthesizer();
    }

    // ── pipeline ──────────────────────────────────────────────────────────────

    @Bean
    public TtlCache ttlCache(Clock clock) {
        return new InMemoryTtlCache(clock, cacheMaxEntries);
    }

    @Bean
    public RefreshCoordinator refreshCoordinator() {
        return new RefreshCoordinator(singleFlightRefresh);
    }

    @Bean
    public TopicContentService topicContentService(TopicStore topicStore,
                                                   TtlCache ttlCache,
                                                   ExternalTopicClient externalTopicClient,
                                                   AcademicResourceClient academicResourceClient,
                                                   FreshnessPolicy freshnessPolicy,
                                                   AnswerSynthesizer answerSynthesizer,
                                                   RefreshCoordinator refreshCoordinator,
                                                   Clock clock) {
        return new TopicContentService(topicStore, ttlCache, externalTopicClient, academicResourceClient,
            freshnessPolicy, answerSynthesizer, refreshCoordinator, clock, externalCacheTtl, academicCacheTtl);
    }

    @Bean
    public TopicSearchService topicSearchService(TopicStore topicStore,
                                                 SearchHistoryRepository searchHistoryRepository,
                                                 RelevanceScorer relevanceScorer,
                                                 Clock clock) {
        return new TopicSearchService(topicStore, searchHistoryRepository, relevanceScorer, clock, searchMaxResults);
    }

    private static HttpClient httpClient(Duration timeout) {
        return HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, timeout.toMillis()))
            .responseTimeout(timeout)
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(timeout.toMillis(), TimeUnit.MILLISECONDS))
            );
    }

    private static ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            org.slf4j.LoggerFactory.getLogger(KnowledgeConfig.class)
                .debug("Outbound request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}
