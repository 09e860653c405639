package com.flagship.gl_posting.tax;

import com.flagship.gl_posting.error.PostingWarning;
import com.flagship.gl_posting.ledger.Money;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

/**
 * Tax computed for one line. A non-null warning means tax was expected
 * but could not be applied, and {@code taxAmount} is zero.
 */
@Value
public class LineTax {
    String taxCode;
    BigDecimal taxRate;
    Money taxAmount;
    UUID taxAccountId;
    PostingWarning warning;

    public static LineTax none(Money lineAmount) {
        return new LineTax(null, BigDecimal.ZERO, Money.zero(lineAmount.getCurrency()), null, null);
    }

    public static LineTax degraded(Money lineAmount, String taxCode, PostingWarning warning) {
        return new LineTax(taxCode, BigDecimal.ZERO, Money.zero(lineAmount.getCurrency()), null, warning);
    }

    public boolean hasTax() {
        return !taxAmount.isZero();
    }

    public Optional<PostingWarning> warning() {
        return Optional.ofNullable(warning);
    }
}
