package com.workspace.common.exception;

/**
 * Raised when a remote backend (retrieval, assistant or generation) cannot be reached,
 * answers with a non-success status, or returns a body that is not valid JSON.
 * Calls are never retried; the failure travels up to the API boundary.
 */
public class BackendException extends RuntimeException {

    private final String backend;
    private final int statusCode;

    public BackendException(String message, String backend, int statusCode) {
        super(message);
        this.backend = backend;
        this.statusCode = statusCode;
    }

    public BackendException(String message, String backend, int statusCode, Throwable cause) {
        super(message, cause);
        this.backend = backend;
        this.statusCode = statusCode;
    }

    public String getBackend() { return backend; }
    public int getStatusCode() { return statusCode; }
    public boolean isTransportFailure() { return statusCode == 0; }
}
