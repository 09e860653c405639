package com.flagship.gl_posting.journal;

/**
 * Lifecycle of a journal entry.
 *
 * DRAFT -> POSTED, or DRAFT -> PENDING_APPROVAL -> POSTED | REJECTED.
 * POSTED entries are never edited; the only later change is being marked
 * REVERSED once a reversal entry posts against them.
 */
public enum JournalStatus {
    /**
     * Validated but not yet decided. Never persisted.
     */
    DRAFT,

    /**
     * Held until a permitted approver acts. No ledger effect yet.
     */
    PENDING_APPROVAL,

    /**
     * Recorded in the ledger. Lines are immutable from here on.
     */
    POSTED,

    /**
     * Declined by an approver. Terminal.
     */
    REJECTED,

    /**
     * Posted, then offset by a reversal entry. Terminal.
     */
    REVERSED;

    public boolean canTransitionTo(JournalStatus target) {
        return switch (this) {
            case DRAFT -> target == POSTED || target == PENDING_APPROVAL;
            case PENDING_APPROVAL -> target == POSTED || target == REJECTED;
            case POSTED -> target == REVERSED;
            case REJECTED, REVERSED -> false;
        };
    }
}
