package com.flagship.gl_posting.posting;

import com.flagship.gl_posting.ledger.PostingContext;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Request to offset a posted entry. {@code journalNumber} is optional and
 * defaults to the original's number with a "-REV" suffix.
 */
@Value
@Builder
public class ReversalRequest {
    UUID journalId;
    PostingContext context;
    String reason;
    LocalDate reversalDate;
    String idempotencyKey;
    String journalNumber;
}
