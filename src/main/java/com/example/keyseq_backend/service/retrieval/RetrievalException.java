package com.example.keyseq_backend.service.retrieval;

/**
 * Raised when a call to the retrieval service fails, times out or returns an unusable body.
 */
public class RetrievalException extends RuntimeException {

    private final String endpoint;
    private final Integer status;

    public RetrievalException(String endpoint, String message) {
        this(endpoint, null, message, null);
    }

    public RetrievalException(String endpoint, Integer status, String message, Throwable cause) {
        super(message, cause);
        this.endpoint = endpoint;
        this.status = status;
    }

    public String getEndpoint() {
        return endpoint;
    }

    /**
     * HTTP status of the failed call, {@code null} for transport errors and timeouts.
     */
    public Integer getStatus() {
        return status;
    }
}
