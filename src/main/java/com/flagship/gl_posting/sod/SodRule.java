package com.flagship.gl_posting.sod;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * One cell of the policy table: what {@code role} may do for {@code action}.
 */
@Value
@Builder
public class SodRule {
    String role;
    SodAction action;
    SodMode mode;

    /**
     * Inclusive upper bound for direct posting. Only meaningful for {@link SodMode#THRESHOLD}.
     */
    BigDecimal threshold;

    @Singular
    List<String> approverRoles;

    public static SodRule allow(String role, SodAction action) {
        return SodRule.builder().role(role).action(action).mode(SodMode.ALLOW).build();
    }

    public static SodRule deny(String role, SodAction action) {
        return SodRule.builder().role(role).action(action).mode(SodMode.DENY).build();
    }

    public static SodRule approval(String role, SodAction action, List<String> approverRoles) {
        return SodRule.builder().role(role).action(action).mode(SodMode.APPROVAL)
            .approverRoles(approverRoles).build();
    }

    public static SodRule threshold(String role, SodAction action, BigDecimal threshold, List<String> approverRoles) {
        return SodRule.builder().role(role).action(action).mode(SodMode.THRESHOLD)
            .threshold(threshold).approverRoles(approverRoles).build();
    }
}
