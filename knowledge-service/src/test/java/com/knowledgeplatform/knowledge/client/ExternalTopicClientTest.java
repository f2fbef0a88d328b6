package com.knowledgeplatform.knowledge.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.knowledgeplatform.common.exception.SourceFetchException;
import com.knowledgeplatform.common.exception.SourceFetchException.Reason;
import com.knowledgeplatform.knowledge.support.StubExchange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.test.StepVerifier;

import java.net.ConnectException;
import java.net.URI;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ExternalTopicClientTest {

    private final StubExchange exchange = new StubExchange();
    private final ExternalTopicClient client = new ExternalTopicClient(
        exchange.webClient("http://external.test/topics"), new ObjectMapper(), Duration.ofMillis(200));

    @Test
    @DisplayName("200 with content + further_reading → payload")
    void success() {
        String body = "{\"content\":\"Newton's laws...\",\"further_reading\":\"http://x\",\"extra\":1}";
        exchange.respond(HttpStatus.OK, body);

        StepVerifier.create(client.fetch("physics"))
            .assertNext(p -> {
                assertEquals("Newton's laws...", p.content());
                assertEquals("http://x", p.furtherReading());
                assertEquals(body, p.rawJson());
            })
            .verifyComplete();

        URI uri = exchange.lastRequest().url();
        assertEquals("/topics", uri.getPath());
        assertEquals("sector=physics", uri.getQuery());
    }

    @Test
    @DisplayName("missing further_reading → null link")
    void missingFurtherReading() {
        exchange.respond(HttpStatus.OK, "{\"content\":\"c\"}");

        StepVerifier.create(client.fetch("physics"))
            .assertNext(p -> assertNull(p.furtherReading()))
            .verifyComplete();
    }

    @Test
    @DisplayName("non-2xx → STATUS")
    void serverError() {
        exchange.respond(HttpStatus.SERVICE_UNAVAILABLE, "{}");

        StepVerifier.create(client.fetch("physics"))
            .expectErrorSatisfies(e -> assertReason(e, Reason.STATUS))
            .verify();
    }

    @Test
    @DisplayName("non-JSON body → MALFORMED_RESPONSE")
    void notJson() {
        exchange.respond(HttpStatus.OK, "<html>oops</html>");

        StepVerifier.create(client.fetch("physics"))
            .expectErrorSatisfies(e -> assertReason(e, Reason.MALFORMED_RESPONSE))
            .verify();
    }

    @Test
    @DisplayName("JSON without textual content → MALFORMED_RESPONSE")
    void schemaMismatch() {
        exchange.respond(HttpStatus.OK, "{\"content\":42}");

        StepVerifier.create(client.fetch("physics"))
            .expectErrorSatisfies(e -> assertReason(e, Reason.MALFORMED_RESPONSE))
            .verify();
    }

    @Test
    @DisplayName("JSON array instead of object → MALFORMED_RESPONSE")
    void arrayBody() {
        exchange.respond(HttpStatus.OK, "[]");

        StepVerifier.create(client.fetch("physics"))
            .expectErrorSatisfies(e -> assertReason(e, Reason.MALFORMED_RESPONSE))
            .verify();
    }

    @Test
    @DisplayName("empty body → MALFORMED_RESPONSE")
    void emptyBody() {
        exchange.respondEmpty();

        StepVerifier.create(client.fetch("physics"))
            .expectErrorSatisfies(e -> assertReason(e, Reason.MALFORMED_RESPONSE))
            .verify();
    }

    @Test
    @DisplayName("no response within timeout → TRANSPORT")
    void timeout() {
        exchange.hang();

        StepVerifier.create(client.fetch("physics"))
            .expectErrorSatisfies(e -> assertReason(e, Reason.TRANSPORT))
            .verify(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("connection failure → TRANSPORT")
    void connectionRefused() {
        exchange.fail(new WebClientRequestException(new ConnectException("refused"),
            HttpMethod.GET, URI.create("http://external.test/topics"), new HttpHeaders()));

        StepVerifier.create(client.fetch("physics"))
            .expectErrorSatisfies(e -> assertReason(e, Reason.TRANSPORT))
            .verify();
    }

    private static void assertReason(Throwable e, Reason expected) {
        assertInstanceOf(SourceFetchException.class, e);
        SourceFetchException sfe = (SourceFetchException) e;
        assertEquals(expected, sfe.getReason());
        assertEquals(ExternalTopicClient.SOURCE, sfe.getSource());
    }
}
