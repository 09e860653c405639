package com.flagship.gl_posting.posting.event;

import com.flagship.gl_posting.error.PostingWarning;
import com.flagship.gl_posting.journal.JournalEntry;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Audit record: a journal was recorded with less tax than its lines asked for,
 * because a tax code was unknown or the tax master data was unavailable.
 */
@Value
public class TaxLookupDegradedEvent implements JournalEvent {

    public static final String EVENT_TYPE = "TaxLookupDegraded";

    UUID eventId;
    UUID journalId;
    UUID tenantId;
    String journalNumber;
    String status;
    UUID userId;
    List<PostingWarning> warnings;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static TaxLookupDegradedEvent from(JournalEntry entry, List<PostingWarning> warnings) {
        return new TaxLookupDegradedEvent(
            UUID.randomUUID(),
            entry.getId(),
            entry.getTenantId(),
            entry.getJournalNumber(),
            entry.getStatus().name(),
            entry.getCreatedBy(),
            List.copyOf(warnings),
            entry.getUpdatedAt()
        );
    }
}
