package com.flagship.gl_posting.journal;

import com.flagship.gl_posting.error.ErrorKind;
import com.flagship.gl_posting.error.PostingError;
import com.flagship.gl_posting.error.PostingException;
import com.flagship.gl_posting.ledger.CurrencyCode;
import com.flagship.gl_posting.ledger.PostingContext;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Journal entry domain object.
 *
 * Status changes go through the transition methods, each of which returns a new
 * instance and rejects moves {@link JournalStatus} does not allow. Lines are the
 * expanded set (including generated tax lines) and never change after creation.
 */
@Value
@Builder(toBuilder = true)
public class JournalEntry {
    UUID id;
    UUID tenantId;
    UUID companyId;
    String journalNumber;
    String description;
    LocalDate journalDate;
    CurrencyCode currency;
    BigDecimal exchangeRate;
    @Singular
    List<JournalLine> lines;
    BigDecimal totalDebit;
    BigDecimal totalCredit;
    JournalStatus status;
    String sourceModule;
    String idempotencyKey;
    UUID createdBy;
    String createdByRole;
    @Singular
    List<String> approverRoles;
    UUID decidedBy;
    String rejectionReason;
    UUID reversalOf;
    Instant createdAt;
    Instant updatedAt;

    /**
     * A new DRAFT entry built from an accepted validation.
     */
    public static JournalEntry draft(JournalPostingInput input, ValidationResult validation, Instant now) {
        PostingContext context = input.getContext();
        return JournalEntry.builder()
            .id(UUID.randomUUID())
            .tenantId(context.getTenantId())
            .companyId(context.getCompanyId())
            .journalNumber(input.getJournalNumber().trim())
            .description(input.getDescription())
            .journalDate(input.getJournalDate())
            .currency(validation.getCurrency())
            .exchangeRate(validation.getExchangeRate().getRate())
            .lines(validation.getExpandedLines())
            .totalDebit(validation.getTotalDebit().getAmount())
            .totalCredit(validation.getTotalCredit().getAmount())
            .status(JournalStatus.DRAFT)
            .sourceModule(input.getModule())
            .idempotencyKey(input.getIdempotencyKey())
            .createdBy(context.getUserId())
            .createdByRole(context.getUserRole())
            .reversalOf(input.getReversalOf())
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    public JournalEntry post(Instant now) {
        requireTransition(JournalStatus.POSTED);
        return toBuilder().status(JournalStatus.POSTED).updatedAt(now).build();
    }

    public JournalEntry submitForApproval(List<String> approverRoles, Instant now) {
        requireTransition(JournalStatus.PENDING_APPROVAL);
        return toBuilder()
            .status(JournalStatus.PENDING_APPROVAL)
            .clearApproverRoles()
            .approverRoles(approverRoles)
            .updatedAt(now)
            .build();
    }

    public JournalEntry approve(UUID approverId, Instant now) {
        requireStatus(JournalStatus.PENDING_APPROVAL, "approve");
        return toBuilder().status(JournalStatus.POSTED).decidedBy(approverId).updatedAt(now).build();
    }

    public JournalEntry reject(UUID approverId, String reason, Instant now) {
        requireStatus(JournalStatus.PENDING_APPROVAL, "reject");
        return toBuilder()
            .status(JournalStatus.REJECTED)
            .decidedBy(approverId)
            .rejectionReason(reason)
            .updatedAt(now)
            .build();
    }

    public JournalEntry markReversed(Instant now) {
        requireStatus(JournalStatus.POSTED, "reverse");
        return toBuilder().status(JournalStatus.REVERSED).updatedAt(now).build();
    }

    public boolean isReversal() {
        return reversalOf != null;
    }

    private void requireTransition(JournalStatus target) {
        if (!status.canTransitionTo(target)) {
            throw invalidTransition(String.format(
                "Cannot move journal %s from %s to %s", journalNumber, status, target));
        }
    }

    private void requireStatus(JournalStatus expected, String action) {
        if (status != expected) {
            throw invalidTransition(String.format(
                "Cannot %s journal %s in %s status, it must be %s",
                action, journalNumber, status, expected));
        }
    }

    private PostingException invalidTransition(String message) {
        return new PostingException(PostingError.builder()
            .kind(ErrorKind.INVALID_STATE_TRANSITION)
            .code("INVALID_STATE_TRANSITION")
            .message(message)
            .detail("journalId", String.valueOf(id))
            .detail("status", status.name())
            .build());
    }
}
