package com.example.keyseq_backend.service;

/**
 * Fatal failure of a sequence search. Nothing partial is returned when this is thrown.
 */
public class SequenceSearchException extends RuntimeException {

    public enum Reason {
        TOO_FEW_EVENTS,
        CANDIDATE_RETRIEVAL_FAILED,
        NO_CANDIDATES
    }

    private final Reason reason;

    public SequenceSearchException(Reason reason, String message) {
        this(reason, message, null);
    }

    public SequenceSearchException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
