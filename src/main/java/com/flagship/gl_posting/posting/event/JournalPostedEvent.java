package com.flagship.gl_posting.posting.event;

import com.flagship.gl_posting.journal.JournalEntry;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * The entry now affects the ledger, either directly or after approval.
 */
@Value
public class JournalPostedEvent implements JournalEvent {

    public static final String EVENT_TYPE = "JournalPosted";

    UUID eventId;
    UUID journalId;
    UUID tenantId;
    UUID companyId;
    String journalNumber;
    LocalDate journalDate;
    String currency;
    BigDecimal totalDebit;
    BigDecimal totalCredit;
    String sourceModule;
    UUID createdBy;
    UUID approvedBy;
    UUID reversalOf;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static JournalPostedEvent from(JournalEntry entry) {
        return new JournalPostedEvent(
            UUID.randomUUID(),
            entry.getId(),
            entry.getTenantId(),
            entry.getCompanyId(),
            entry.getJournalNumber(),
            entry.getJournalDate(),
            entry.getCurrency().name(),
            entry.getTotalDebit(),
            entry.getTotalCredit(),
            entry.getSourceModule(),
            entry.getCreatedBy(),
            entry.getDecidedBy(),
            entry.getReversalOf(),
            entry.getUpdatedAt()
        );
    }
}
