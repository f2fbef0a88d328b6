package com.knowledgeplatform.knowledge.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.knowledgeplatform.common.exception.SourceFetchException;
import com.knowledgeplatform.common.exception.SourceFetchException.Reason;
import com.knowledgeplatform.knowledge.client.dto.ExternalTopicPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Fetches authoritative sector content from the external refresh API:
 * {@code GET <base-url>?sector=<sector>} returning {@code {"content": ..., "further_reading": ...}}.
 *
 * <p>Failures are always emitted as {@link SourceFetchException}; this client never
 * retries and never falls back. The caller decides how to degrade.
 */
public class ExternalTopicClient {

    static final String SOURCE = "external-api";

    private static final Logger log = LoggerFactory.getLogger(ExternalTopicClient.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public ExternalTopicClient(WebClient externalTopicWebClient, ObjectMapper objectMapper, Duration timeout) {
        this.webClient    = externalTopicWebClient;
        this.objectMapper = objectMapper;
        this.timeout      = timeout;
    }

    public Mono<ExternalTopicPayload> fetch(String sector) {
        return webClient.get()
            .uri(uriBuilder -> uriBuilder.queryParam("sector", sector).build())
            .retrieve()
            .bodyToMono(String.class)
            .timeout(timeout)
            .switchIfEmpty(Mono.error(() -> new SourceFetchException(SOURCE, Reason.MALFORMED_RESPONSE,
                "Empty body for sector " + sector)))
            .map(body -> parse(sector, body))
            .onErrorMap(e -> SourceErrors.translate(SOURCE, sector, e))
            .doOnSuccess(p -> log.info("External topic fetched. sector={} contentLength={}",
                                       sector, p.content().length()))
            .doOnError(e -> log.error("Error fetching API data for sector {}: {}", sector, e.getMessage()));
    }

    private ExternalTopicPayload parse(String sector, String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new SourceFetchException(SOURCE, Reason.MALFORMED_RESPONSE,
                "Response is not JSON for sector " + sector, e);
        }
        if (root == null || !root.isObject()) {
            throw new SourceFetchException(SOURCE, Reason.MALFORMED_RESPONSE,
                "Expected a JSON object for sector " + sector);
        }
        JsonNode content = root.path("content");
        if (!content.isTextual()) {
            throw new SourceFetchException(SOURCE, Reason.MALFORMED_RESPONSE,
                "Missing textual 'content' for sector " + sector);
        }
        JsonNode furtherReading = root.path("further_reading");
        String link = furtherReading.isTextual() ? furtherReading.asText() : null;
        return new ExternalTopicPayload(content.asText(), link, body);
    }
}
