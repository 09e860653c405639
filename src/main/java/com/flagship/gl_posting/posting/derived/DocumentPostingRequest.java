package com.flagship.gl_posting.posting.derived;

import com.flagship.gl_posting.ledger.PostingContext;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * A sales invoice or supplier bill to be turned into a journal entry.
 *
 * {@code controlAccountId} is the receivable (invoice) or payable (bill) account.
 * {@code exchangeRate} converts document currency to the functional currency and
 * is required only when they differ.
 */
@Value
@Builder(toBuilder = true)
public class DocumentPostingRequest {
    String documentNumber;
    String description;
    LocalDate documentDate;
    String currency;
    BigDecimal exchangeRate;
    UUID controlAccountId;
    @Singular
    List<DocumentLine> lines;
    String idempotencyKey;
    PostingContext context;
}
