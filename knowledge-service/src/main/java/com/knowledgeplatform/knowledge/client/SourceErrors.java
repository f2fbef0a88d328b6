package com.knowledgeplatform.knowledge.client;

import com.knowledgeplatform.common.exception.SourceFetchException;
import com.knowledgeplatform.common.exception.SourceFetchException.Reason;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.concurrent.TimeoutException;

/**
 * Maps raw WebClient / Reactor failures onto the {@link SourceFetchException} taxonomy.
 */
final class SourceErrors {

    private SourceErrors() {}

    static SourceFetchException translate(String source, String sector, Throwable e) {
        if (e instanceof SourceFetchException sfe) {
            return sfe;
        }
        if (e instanceof WebClientResponseException wre) {
            return new SourceFetchException(source, Reason.STATUS,
                "API returned status code " + wre.getStatusCode().value() + " for sector " + sector, e);
        }
        if (e instanceof TimeoutException) {
            return new SourceFetchException(source, Reason.TRANSPORT, "Timed out fetching sector " + sector, e);
        }
        if (e instanceof WebClientRequestException) {
            return new SourceFetchException(source, Reason.TRANSPORT,
                "Request failed for sector " + sector + ": " + e.getMessage(), e);
        }
        return new SourceFetchException(source, Reason.TRANSPORT,
            "Unexpected failure for sector " + sector + ": " + e.getMessage(), e);
    }
}
