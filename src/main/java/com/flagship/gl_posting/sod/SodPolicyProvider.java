package com.flagship.gl_posting.sod;

import java.util.UUID;

/**
 * Supplies the policy table a tenant's postings are evaluated against.
 */
public interface SodPolicyProvider {

    SodPolicyTable policyFor(UUID tenantId);
}
