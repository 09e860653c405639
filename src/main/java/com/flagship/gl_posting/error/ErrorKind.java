package com.flagship.gl_posting.error;

/**
 * Failure kinds a posting can end in.
 *
 * Validation and COA errors are collected and reported together; SoD
 * violations and idempotency conflicts stop processing immediately.
 */
public enum ErrorKind {

    /**
     * Structural or balance problem with the entry. Fixable by the caller; never retried automatically.
     */
    VALIDATION_ERROR(false),

    /**
     * Missing, inactive, group or out-of-scope account. Reported per account.
     */
    COA_ERROR(false),

    /**
     * The acting role may not perform this action at all. Needs a different actor.
     */
    SOD_VIOLATION(false),

    /**
     * Idempotency key reused with a different payload. Client bug.
     */
    IDEMPOTENCY_CONFLICT(false),

    /**
     * The policy table itself is malformed. Deployment defect, logged at error.
     */
    POLICY_CONFIGURATION_ERROR(false),

    /**
     * A lookup collaborator failed. Safe to retry the whole request.
     */
    UPSTREAM_UNAVAILABLE(true),

    /**
     * Lifecycle move that the entry's current status does not allow.
     */
    INVALID_STATE_TRANSITION(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
