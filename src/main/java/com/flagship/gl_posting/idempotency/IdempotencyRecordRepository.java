package com.flagship.gl_posting.idempotency;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface IdempotencyRecordRepository extends JpaRepository<IdempotencyRecordEntity, UUID> {

    Optional<IdempotencyRecordEntity> findByTenantIdAndIdempotencyKey(UUID tenantId, String idempotencyKey);

    @Modifying
    @Query("DELETE FROM IdempotencyRecordEntity r WHERE r.expiresAt <= :now")
    int deleteExpired(@Param("now") Instant now);
}
