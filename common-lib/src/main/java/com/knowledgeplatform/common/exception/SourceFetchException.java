package com.knowledgeplatform.common.exception;

/**
 * Raised when a remote content source (external refresh API or academic resources
 * feed) cannot deliver usable data.
 */
public class SourceFetchException extends RuntimeException {

    public enum Reason {
        /** Connection failure or timeout. */
        TRANSPORT,
        /** Remote answered with a non-success status. */
        STATUS,
        /** Body was empty, not JSON, or did not match the expected shape. */
        MALFORMED_RESPONSE
    }

    private final String source;
    private final Reason reason;

    public SourceFetchException(String source, Reason reason, String message) {
        super("[" + source + "] " + message);
        this.source = source;
        this.reason = reason;
    }

    public SourceFetchException(String source, Reason reason, String message, Throwable cause) {
        super("[" + source + "] " + message, cause);
        this.source = source;
        this.reason = reason;
    }

    public String getSource() {
        return source;
    }

    public Reason getReason() {
        return reason;
    }
}
