package com.flagship.gl_posting.idempotency;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.UUID;

/**
 * The stored outcome of the first successful request under a key.
 */
@Value
@Builder
@Jacksonized
public class IdempotencyRecord {
    UUID tenantId;
    String key;
    String requestHash;
    String responseSnapshot;
    Instant createdAt;
    Instant expiresAt;

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public boolean matches(String requestHash) {
        return this.requestHash.equals(requestHash);
    }
}
