package com.flagship.gl_posting.idempotency;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.gl_posting.error.ErrorKind;
import com.flagship.gl_posting.error.PostingError;
import com.flagship.gl_posting.error.PostingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Guarantees one ledger effect per idempotency key.
 *
 * The database row in {@code idempotency_keys} is the source of truth. When Redis is
 * available it serves as a read-through cache: lookups try it first and fall back
 * to the database on a miss or any Redis error. Cache writes happen only after the
 * surrounding transaction commits, so a rolled-back posting is never replayed.
 *
 * Records expire after {@code idempotency.ttl}; an expired record counts as absent.
 */
@Service
@Slf4j
public class IdempotencyGate {

    public static final String IDEMPOTENCY_CONFLICT = "IDEMPOTENCY_CONFLICT";
    private static final String REDIS_KEY_PREFIX = "gl:idempotency:";

    private final IdempotencyRecordRepository repository;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration ttl;
    private final boolean redisEnabled;

    public IdempotencyGate(IdempotencyRecordRepository repository,
                           Optional<StringRedisTemplate> redisTemplate,
                           ObjectMapper objectMapper,
                           Clock clock,
                           @Value("${idempotency.ttl:PT24H}") Duration ttl,
                           @Value("${idempotency.redis.enabled:true}") boolean redisEnabled) {
        this.repository = repository;
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.ttl = ttl;
        this.redisEnabled = redisEnabled;
    }

    /**
     * Looks up the key and classifies the request.
     */
    public AdmitOutcome admit(UUID tenantId, String key, String requestHash) {
        requireKey(key);
        Instant now = clock.instant();

        Optional<IdempotencyRecord> existing = findCached(tenantId, key)
            .or(() -> repository.findByTenantIdAndIdempotencyKey(tenantId, key).map(IdempotencyRecordEntity::toDomain))
            .filter(record -> !record.isExpired(now));

        if (existing.isEmpty()) {
            return AdmitOutcome.fresh();
        }
        IdempotencyRecord record = existing.get();
        if (!record.matches(requestHash)) {
            log.warn("Idempotency key {} reused with a different payload", key);
            return AdmitOutcome.conflict();
        }
        log.debug("Idempotency key {} matched a stored response", key);
        return AdmitOutcome.replay(record.getResponseSnapshot());
    }

    /**
     * Whether a live record exists for the key. Reads in its own transaction, so a record
     * committed by a concurrent request is visible even when the caller's transaction has
     * already failed.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW, readOnly = true)
    public boolean isRecorded(UUID tenantId, String key) {
        Instant now = clock.instant();
        return repository.findByTenantIdAndIdempotencyKey(tenantId, key)
            .map(IdempotencyRecordEntity::toDomain)
            .filter(record -> !record.isExpired(now))
            .isPresent();
    }

    /**
     * Stores the response for a FRESH request. Must run in the transaction that made the ledger change.
     *
     * @throws PostingException with {@link ErrorKind#IDEMPOTENCY_CONFLICT} if a concurrent request
     *         recorded the same key first; the caller's transaction then rolls back
     */
    public void record(UUID tenantId, String key, String requestHash, String responseSnapshot) {
        requireKey(key);
        Instant now = clock.instant();
        IdempotencyRecord record = IdempotencyRecord.builder()
            .tenantId(tenantId)
            .key(key)
            .requestHash(requestHash)
            .responseSnapshot(responseSnapshot)
            .createdAt(now)
            .expiresAt(now.plus(ttl))
            .build();

        try {
            Optional<IdempotencyRecordEntity> expired = repository.findByTenantIdAndIdempotencyKey(tenantId, key)
                .filter(entity -> entity.toDomain().isExpired(now));
            if (expired.isPresent()) {
                expired.get().replaceWith(record);
                repository.saveAndFlush(expired.get());
            } else {
                repository.saveAndFlush(IdempotencyRecordEntity.fromDomain(record));
            }
        } catch (DataIntegrityViolationException e) {
            throw new PostingException(PostingError.builder()
                .kind(ErrorKind.IDEMPOTENCY_CONFLICT)
                .code(IDEMPOTENCY_CONFLICT)
                .message("Another request with idempotency key " + key + " completed first")
                .detail("idempotencyKey", key)
                .build(), e);
        }

        cacheAfterCommit(record);
    }

    private Optional<IdempotencyRecord> findCached(UUID tenantId, String key) {
        if (!useRedis()) {
            return Optional.empty();
        }
        try {
            String json = redisTemplate.get().opsForValue().get(redisKey(tenantId, key));
            return json == null ? Optional.empty() : Optional.of(objectMapper.readValue(json, IdempotencyRecord.class));
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private void cacheAfterCommit(IdempotencyRecord record) {
        if (!useRedis()) {
            return;
        }
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    writeCache(record);
                }
            });
        } else {
            writeCache(record);
        }
    }

    private void writeCache(IdempotencyRecord record) {
        try {
            Duration remaining = Duration.between(clock.instant(), record.getExpiresAt());
            if (remaining.isNegative() || remaining.isZero()) {
                return;
            }
            redisTemplate.get().opsForValue().set(
                redisKey(record.getTenantId(), record.getKey()),
                objectMapper.writeValueAsString(record),
                remaining);
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Failed to cache idempotency key {} in Redis: {}", record.getKey(), e.getMessage());
        }
    }

    private boolean useRedis() {
        return redisEnabled && redisTemplate.isPresent();
    }

    private static String redisKey(UUID tenantId, String key) {
        return REDIS_KEY_PREFIX + tenantId + ":" + key;
    }

    private static void requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}
