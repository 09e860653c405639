package com.flagship.gl_posting.posting.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Common shape of journal lifecycle events. Events are facts: once written to
 * the outbox they are never changed.
 */
public interface JournalEvent {

    /**
     * Unique per event instance, for consumer-side deduplication.
     */
    UUID getEventId();

    UUID getJournalId();

    UUID getTenantId();

    Instant getOccurredAt();

    String getEventType();
}
