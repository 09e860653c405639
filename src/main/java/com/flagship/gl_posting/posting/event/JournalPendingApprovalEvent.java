package com.flagship.gl_posting.posting.event;

import com.flagship.gl_posting.journal.JournalEntry;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * The entry is held; approval workflows pick it up from here.
 */
@Value
public class JournalPendingApprovalEvent implements JournalEvent {

    public static final String EVENT_TYPE = "JournalPendingApproval";

    UUID eventId;
    UUID journalId;
    UUID tenantId;
    String journalNumber;
    BigDecimal totalDebit;
    String currency;
    UUID createdBy;
    String createdByRole;
    List<String> approverRoles;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static JournalPendingApprovalEvent from(JournalEntry entry) {
        return new JournalPendingApprovalEvent(
            UUID.randomUUID(),
            entry.getId(),
            entry.getTenantId(),
            entry.getJournalNumber(),
            entry.getTotalDebit(),
            entry.getCurrency().name(),
            entry.getCreatedBy(),
            entry.getCreatedByRole(),
            entry.getApproverRoles(),
            entry.getUpdatedAt()
        );
    }
}
