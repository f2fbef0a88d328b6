package com.knowledgeplatform.common.exception;

/**
 * The topic store was unavailable or a query against it failed.
 */
public class StorageException extends RuntimeException {

    private final String operation;

    public StorageException(String operation, String message, Throwable cause) {
        super("[" + operation + "] " + message, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
