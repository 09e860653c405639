package com.flagship.gl_posting.journal;

import com.flagship.gl_posting.ledger.EntryType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One debit or credit line of a journal entry.
 *
 * A well-formed line has exactly one positive side and the other side zero.
 * Nulls are read as zero; the validator reports anything else.
 */
@Value
@Builder(toBuilder = true)
public class JournalLine {
    UUID accountId;
    BigDecimal debit;
    BigDecimal credit;
    String description;
    String taxCode;
    String costCenter;

    /**
     * Optional per-line currency. When present it must equal the entry's currency.
     */
    String currency;

    /**
     * Set on tax lines produced by expansion or by a derived posting. Generated lines are never expanded again.
     */
    boolean generated;

    public static JournalLine debit(UUID accountId, BigDecimal amount, String description) {
        return JournalLine.builder().accountId(accountId).debit(amount).credit(BigDecimal.ZERO)
            .description(description).build();
    }

    public static JournalLine credit(UUID accountId, BigDecimal amount, String description) {
        return JournalLine.builder().accountId(accountId).debit(BigDecimal.ZERO).credit(amount)
            .description(description).build();
    }

    public BigDecimal debitOrZero() {
        return debit == null ? BigDecimal.ZERO : debit;
    }

    public BigDecimal creditOrZero() {
        return credit == null ? BigDecimal.ZERO : credit;
    }

    public EntryType side() {
        return debitOrZero().signum() > 0 ? EntryType.DEBIT : EntryType.CREDIT;
    }

    /**
     * The non-zero side's amount.
     */
    public BigDecimal amount() {
        return side() == EntryType.DEBIT ? debitOrZero() : creditOrZero();
    }

    /**
     * Same account and amount on the opposite side, used for reversals.
     */
    public JournalLine swapSides() {
        return toBuilder().debit(creditOrZero()).credit(debitOrZero()).taxCode(null).build();
    }
}
