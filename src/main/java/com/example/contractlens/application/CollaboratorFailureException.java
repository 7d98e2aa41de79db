package com.example.contractlens.application;

/**
 * The semantic collaborator could not deliver a usable response. Always recoverable:
 * the comparison continues with rule-based results.
 */
public class CollaboratorFailureException extends Exception {

    public enum Reason {
        DISABLED,
        MISSING_CREDENTIALS,
        TIMEOUT,
        TRANSPORT,
        MALFORMED_RESPONSE
    }

    private final Reason reason;

    public CollaboratorFailureException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public CollaboratorFailureException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
