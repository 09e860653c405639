package com.flagship.gl_posting.posting.event;

import com.flagship.gl_posting.journal.JournalEntry;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class JournalRejectedEvent implements JournalEvent {

    public static final String EVENT_TYPE = "JournalRejected";

    UUID eventId;
    UUID journalId;
    UUID tenantId;
    String journalNumber;
    UUID rejectedBy;
    String reason;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static JournalRejectedEvent from(JournalEntry entry) {
        return new JournalRejectedEvent(
            UUID.randomUUID(),
            entry.getId(),
            entry.getTenantId(),
            entry.getJournalNumber(),
            entry.getDecidedBy(),
            entry.getRejectionReason(),
            entry.getUpdatedAt()
        );
    }
}
