package com.flagship.gl_posting.posting.derived;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One revenue (invoice) or expense (bill) line, net of tax, in document currency.
 */
@Value
@Builder
public class DocumentLine {
    UUID accountId;
    BigDecimal amount;
    String taxCode;
    String description;
    String costCenter;
}
