package com.flagship.gl_posting.posting.event;

import com.flagship.gl_posting.journal.JournalEntry;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * The original entry has been offset. {@code journalId} is the original's id.
 */
@Value
public class JournalReversedEvent implements JournalEvent {

    public static final String EVENT_TYPE = "JournalReversed";

    UUID eventId;
    UUID journalId;
    UUID tenantId;
    String journalNumber;
    UUID reversalJournalId;
    String reversalJournalNumber;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static JournalReversedEvent from(JournalEntry original, JournalEntry reversal) {
        return new JournalReversedEvent(
            UUID.randomUUID(),
            original.getId(),
            original.getTenantId(),
            original.getJournalNumber(),
            reversal.getId(),
            reversal.getJournalNumber(),
            original.getUpdatedAt()
        );
    }
}
