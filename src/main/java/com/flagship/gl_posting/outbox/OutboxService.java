package com.flagship.gl_posting.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Writes journal events to the outbox and tracks their publication.
 *
 * {@link #saveEvent} joins the caller's transaction: if the journal write rolls
 * back, so does the event. Publication bookkeeping runs in its own transactions
 * so a Kafka failure never touches ledger data.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Saves an event within the current transaction.
     *
     * @param payload event body, serialized to JSON
     * @throws org.springframework.transaction.IllegalTransactionStateException if no transaction is active
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(String aggregateType, UUID aggregateId, UUID tenantId,
                                 String eventType, Object payload) {
        OutboxEvent event = OutboxEvent.create(aggregateType, aggregateId, tenantId, eventType,
            serializePayload(payload), clock.instant());
        OutboxEventEntity saved = repository.save(OutboxEventEntity.fromDomain(event));

        log.debug("Saved outbox event: type={}, aggregateId={}, tenantId={}", eventType, aggregateId, tenantId);
        return saved.toDomain();
    }

    /**
     * Reads the next batch in its own short transaction. The rows are not held while
     * they are published; see {@link OutboxEventRepository#findPublishableForUpdate}.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findPublishableEvents(int limit, int maxRetries) {
        return repository.findPublishableForUpdate(limit, maxRetries)
            .stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished(clock.instant());
            repository.save(entity);
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String errorMessage) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markFailed(errorMessage);
            repository.save(entity);
            log.warn("Outbox event {} failed to publish (attempt {}): {}",
                eventId, entity.getRetryCount(), errorMessage);
        });
    }

    /**
     * Events recorded for one journal, oldest first. Used for audit trails and in tests.
     */
    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForJournal(UUID journalId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(
                OutboxEvent.AGGREGATE_JOURNAL, journalId)
            .stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    private String serializePayload(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }
}
