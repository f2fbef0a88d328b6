package com.knowledgeplatform.knowledge.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.knowledgeplatform.common.exception.SourceFetchException;
import com.knowledgeplatform.common.exception.SourceFetchException.Reason;
import com.knowledgeplatform.knowledge.client.dto.AcademicSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Fetches supplementary summaries from the academic resources feed:
 * {@code GET <base-url>?sector=<sector>} returning a JSON array of {@code {"summary": ...}}.
 *
 * <p>{@link #fetch} emits the raw body after validating it with {@link #parseSummaries},
 * so whatever gets cached is known to parse.
 */
public class AcademicResourceClient {

    static final String SOURCE = "academic-resources";

    private static final Logger log = LoggerFactory.getLogger(AcademicResourceClient.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public AcademicResourceClient(WebClient academicResourcesWebClient, ObjectMapper objectMapper, Duration timeout) {
        this.webClient    = academicResourcesWebClient;
        this.objectMapper = objectMapper;
        this.timeout      = timeout;
    }

    public Mono<String> fetch(String sector) {
        return webClient.get()
            .uri(uriBuilder -> uriBuilder.queryParam("sector", sector).build())
            .retrieve()
            .bodyToMono(String.class)
            .timeout(timeout)
            .switchIfEmpty(Mono.error(() -> new SourceFetchException(SOURCE, Reason.MALFORMED_RESPONSE,
                "Empty body for sector " + sector)))
            .doOnNext(this::parseSummaries)
            .onErrorMap(e -> SourceErrors.translate(SOURCE, sector, e))
            .doOnSuccess(body -> log.info("Academic resources fetched. sector={} bytes={}", sector, body.length()))
            .doOnError(e -> log.warn("Academic resources fetch failed. sector={} reason={}", sector, e.getMessage()));
    }

    /**
     * Parses a feed payload. Every item must be an object with a textual
     * {@code summary}; otherwise the whole payload is rejected.
     *
     * @throws SourceFetchException with {@link Reason#MALFORMED_RESPONSE}
     */
    public List<AcademicSummary> parseSummaries(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new SourceFetchException(SOURCE, Reason.MALFORMED_RESPONSE, "Payload is not JSON", e);
        }
        if (root == null || !root.isArray()) {
            throw new SourceFetchException(SOURCE, Reason.MALFORMED_RESPONSE, "Expected a JSON array");
        }
        List<AcademicSummary> summaries = new ArrayList<>(root.size());
        for (JsonNode item : root) {
            JsonNode summary = item.path("summary");
            if (!summary.isTextual()) {
                throw new SourceFetchException(SOURCE, Reason.MALFORMED_RESPONSE,
                    "Item without textual 'summary': " + item);
            }
            summaries.add(new AcademicSummary(summary.asText()));
        }
        return summaries;
    }
}
