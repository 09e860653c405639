package com.flagship.gl_posting.journal;

import com.flagship.gl_posting.ledger.PostingContext;

import java.util.Optional;
import java.util.UUID;

/**
 * Persistence for journal entries. Every call participates in the caller's
 * transaction; implementations enforce tenant/company isolation themselves.
 */
public interface JournalStore {

    /**
     * Writes the entry and its lines.
     *
     * @return the stored entry's id
     */
    UUID insertJournal(JournalEntry entry);

    Optional<JournalEntry> findById(PostingContext scope, UUID journalId);

    /**
     * Persists a status change, but only if the stored status is still {@code expected}.
     *
     * @return false if another request moved the entry first
     */
    boolean updateStatus(JournalEntry updated, JournalStatus expected);

    boolean existsByJournalNumber(PostingContext scope, String journalNumber);

    /**
     * Id of a reversal entry already recorded against {@code originalId}, if any
     * that is still pending or posted.
     */
    Optional<UUID> findActiveReversalOf(PostingContext scope, UUID originalId);
}
