package com.flagship.gl_posting.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A journal lifecycle or audit event waiting in the outbox.
 *
 * Written in the same transaction as the journal change it describes and
 * published to Kafka afterwards, so the ledger and the event stream never disagree.
 */
@Value
public class OutboxEvent {

    public static final String AGGREGATE_JOURNAL = "Journal";
    public static final String AGGREGATE_POSTING_AUDIT = "PostingAudit";

    UUID id;
    String aggregateType;
    UUID aggregateId;
    UUID tenantId;
    String eventType;
    String payload;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, UUID aggregateId, UUID tenantId,
                                     String eventType, String payload, Instant createdAt) {
        return new OutboxEvent(UUID.randomUUID(), aggregateType, aggregateId, tenantId, eventType, payload,
            createdAt, null, 0, null, null);
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
