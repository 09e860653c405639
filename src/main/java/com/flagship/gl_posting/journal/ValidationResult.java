package com.flagship.gl_posting.journal;

import com.flagship.gl_posting.error.PostingError;
import com.flagship.gl_posting.error.PostingWarning;
import com.flagship.gl_posting.ledger.CurrencyCode;
import com.flagship.gl_posting.ledger.ExchangeRate;
import com.flagship.gl_posting.ledger.Money;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of validating one entry: either valid with totals and the expanded
 * line set, or invalid with every error found. Warnings may accompany either.
 */
@Value
@Builder
public class ValidationResult {
    @Singular
    List<PostingError> errors;
    @Singular
    List<PostingWarning> warnings;
    @Singular
    List<JournalLine> expandedLines;
    CurrencyCode currency;
    Money totalDebit;
    Money totalCredit;
    ExchangeRate exchangeRate;

    /**
     * Debit total converted line by line into the functional currency. This is
     * the amount approval thresholds are compared against.
     */
    Money functionalTotal;

    public boolean isValid() {
        return errors.isEmpty();
    }
}
