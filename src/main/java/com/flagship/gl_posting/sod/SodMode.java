package com.flagship.gl_posting.sod;

/**
 * How a role may perform an action.
 */
public enum SodMode {
    /** Posts directly, no approval. */
    ALLOW,
    /** Always held for approval. */
    APPROVAL,
    /** Posts directly up to a threshold amount, held for approval above it. */
    THRESHOLD,
    /** Never allowed. */
    DENY
}
