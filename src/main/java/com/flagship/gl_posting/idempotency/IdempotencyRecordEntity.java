package com.flagship.gl_posting.idempotency;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA mapping of {@code idempotency_keys}. One row per (tenant, key).
 */
@Entity
@Table(name = "idempotency_keys",
    uniqueConstraints = @UniqueConstraint(name = "uq_idempotency_tenant_key",
        columnNames = {"tenant_id", "idempotency_key"}))
@Getter
@Setter
@NoArgsConstructor
public class IdempotencyRecordEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "idempotency_key", nullable = false, updatable = false)
    private String idempotencyKey;

    @Column(name = "request_hash", nullable = false, length = 64)
    private String requestHash;

    @Column(name = "response_snapshot", nullable = false, columnDefinition = "TEXT")
    private String responseSnapshot;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    public static IdempotencyRecordEntity fromDomain(IdempotencyRecord record) {
        IdempotencyRecordEntity entity = new IdempotencyRecordEntity();
        entity.setId(UUID.randomUUID());
        entity.setTenantId(record.getTenantId());
        entity.setIdempotencyKey(record.getKey());
        entity.setRequestHash(record.getRequestHash());
        entity.setResponseSnapshot(record.getResponseSnapshot());
        entity.setCreatedAt(record.getCreatedAt());
        entity.setExpiresAt(record.getExpiresAt());
        return entity;
    }

    /**
     * Reuses an expired row for a new request under the same key.
     */
    public void replaceWith(IdempotencyRecord record) {
        this.requestHash = record.getRequestHash();
        this.responseSnapshot = record.getResponseSnapshot();
        this.createdAt = record.getCreatedAt();
        this.expiresAt = record.getExpiresAt();
    }

    public IdempotencyRecord toDomain() {
        return IdempotencyRecord.builder()
            .tenantId(tenantId)
            .key(idempotencyKey)
            .requestHash(requestHash)
            .responseSnapshot(responseSnapshot)
            .createdAt(createdAt)
            .expiresAt(expiresAt)
            .build();
    }
}
