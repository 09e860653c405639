package com.flagship.gl_posting.sod;

import lombok.Value;

import java.util.List;

/**
 * Outcome of a policy evaluation. Derived on every call, never stored by the evaluator.
 */
@Value
public class SodDecision {
    boolean allowed;
    boolean requiresApproval;
    List<String> approverRoles;
    String reason;

    public static SodDecision allow(String reason) {
        return new SodDecision(true, false, List.of(), reason);
    }

    public static SodDecision requireApproval(List<String> approverRoles, String reason) {
        return new SodDecision(true, true, List.copyOf(approverRoles), reason);
    }

    public static SodDecision deny(String reason) {
        return new SodDecision(false, false, List.of(), reason);
    }
}
