package com.flagship.gl_posting.ledger;

import lombok.Value;

import java.util.Objects;
import java.util.UUID;

/**
 * The scope a posting runs under: which tenant and company, and who is acting.
 *
 * Supplied by the caller end to end. Nothing here is ever defaulted inside the engine.
 */
@Value
public class PostingContext {
    UUID tenantId;
    UUID companyId;
    UUID userId;
    String userRole;

    public PostingContext(UUID tenantId, UUID companyId, UUID userId, String userRole) {
        this.tenantId = Objects.requireNonNull(tenantId, "tenantId");
        this.companyId = Objects.requireNonNull(companyId, "companyId");
        this.userId = Objects.requireNonNull(userId, "userId");
        this.userRole = Objects.requireNonNull(userRole, "userRole");
    }

    /**
     * Same tenant and company, different actor. Used when an approver acts on
     * an entry someone else created.
     */
    public PostingContext withActor(UUID userId, String userRole) {
        return new PostingContext(tenantId, companyId, userId, userRole);
    }

    public boolean sameScopeAs(UUID tenantId, UUID companyId) {
        return this.tenantId.equals(tenantId) && this.companyId.equals(companyId);
    }
}
