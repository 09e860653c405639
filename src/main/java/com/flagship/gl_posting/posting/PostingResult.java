package com.flagship.gl_posting.posting;

import com.flagship.gl_posting.error.PostingWarning;
import com.flagship.gl_posting.journal.JournalEntry;
import com.flagship.gl_posting.journal.JournalStatus;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * What the caller gets back from a posting operation. Also the exact value
 * stored as the idempotency snapshot, so a replay returns it unchanged.
 */
@Value
@Builder
@Jacksonized
public class PostingResult {
    UUID id;
    String journalNumber;
    JournalStatus status;
    BigDecimal totalDebit;
    BigDecimal totalCredit;
    String currency;
    boolean requiresApproval;
    @Singular
    List<String> approverRoles;
    @Singular
    List<PostingWarning> warnings;

    public static PostingResult from(JournalEntry entry, List<PostingWarning> warnings) {
        return PostingResult.builder()
            .id(entry.getId())
            .journalNumber(entry.getJournalNumber())
            .status(entry.getStatus())
            .totalDebit(entry.getTotalDebit())
            .totalCredit(entry.getTotalCredit())
            .currency(entry.getCurrency().name())
            .requiresApproval(entry.getStatus() == JournalStatus.PENDING_APPROVAL)
            .approverRoles(entry.getApproverRoles())
            .warnings(warnings)
            .build();
    }
}
