package com.flagship.gl_posting.journal;

import com.flagship.gl_posting.ledger.PostingContext;
import com.flagship.gl_posting.sod.SodAction;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * A proposed journal entry as handed to the engine by its caller.
 *
 * {@code currency} is kept as the caller sent it so an unknown code is reported
 * as a validation error instead of failing deserialization.
 */
@Value
@Builder(toBuilder = true)
public class JournalPostingInput {
    String journalNumber;
    String description;
    LocalDate journalDate;
    String currency;
    @Singular
    List<JournalLine> lines;
    String idempotencyKey;
    PostingContext context;

    /**
     * Rate from {@code currency} to the functional currency. Required only when they differ.
     */
    BigDecimal exchangeRate;

    @Builder.Default
    SodAction action = SodAction.JOURNAL_POST;

    @Builder.Default
    String module = "GL";

    /**
     * Set when this entry reverses an earlier posted one.
     */
    UUID reversalOf;
}
