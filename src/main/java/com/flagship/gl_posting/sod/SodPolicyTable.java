package com.flagship.gl_posting.sod;

import com.flagship.gl_posting.error.ErrorKind;
import com.flagship.gl_posting.error.PostingError;
import com.flagship.gl_posting.error.PostingException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Immutable role x action policy, plus per-tenant threshold overrides.
 *
 * Built once from configuration and handed to {@link SodPolicyEvaluator} on every
 * call. A malformed table is rejected when it is built, not when a request hits it.
 */
public final class SodPolicyTable {

    public static final String MALFORMED_POLICY = "MALFORMED_SOD_POLICY";

    private final Map<String, Map<SodAction, SodRule>> rules;
    private final Map<UUID, Map<String, BigDecimal>> tenantThresholds;

    private SodPolicyTable(Map<String, Map<SodAction, SodRule>> rules,
                           Map<UUID, Map<String, BigDecimal>> tenantThresholds) {
        this.rules = rules;
        this.tenantThresholds = tenantThresholds;
    }

    /**
     * Builds and validates a table.
     *
     * @throws PostingException with {@link ErrorKind#POLICY_CONFIGURATION_ERROR} listing every defect found
     */
    public static SodPolicyTable of(Collection<SodRule> ruleList,
                                    Map<UUID, Map<String, BigDecimal>> tenantThresholds) {
        Map<String, Map<SodAction, SodRule>> byRole = new HashMap<>();
        List<PostingError> defects = new ArrayList<>();

        for (SodRule rule : ruleList) {
            String role = normalize(rule.getRole());
            SodRule previous = byRole.computeIfAbsent(role, r -> new EnumMap<>(SodAction.class))
                .put(rule.getAction(), rule);
            if (previous != null) {
                defects.add(defect("Duplicate rule for role " + role + " and action " + rule.getAction()));
            }
        }

        for (SodRule rule : ruleList) {
            String where = normalize(rule.getRole()) + "/" + rule.getAction();
            if (rule.getMode() == null) {
                defects.add(defect("Rule " + where + " has no mode"));
                continue;
            }
            if (rule.getMode() == SodMode.THRESHOLD
                && (rule.getThreshold() == null || rule.getThreshold().signum() < 0)) {
                defects.add(defect("Threshold rule " + where + " needs a non-negative threshold"));
            }
            boolean needsApprovers = rule.getMode() == SodMode.APPROVAL || rule.getMode() == SodMode.THRESHOLD;
            if (needsApprovers && rule.getApproverRoles().isEmpty()) {
                defects.add(defect("Rule " + where + " requires approval but names no approver roles"));
            }
            for (String approver : rule.getApproverRoles()) {
                if (!byRole.containsKey(normalize(approver))) {
                    defects.add(defect("Rule " + where + " names unknown approver role " + approver));
                }
            }
        }

        Map<UUID, Map<String, BigDecimal>> overrides = new HashMap<>();
        tenantThresholds.forEach((tenantId, thresholds) -> {
            Map<String, BigDecimal> normalized = new HashMap<>();
            thresholds.forEach((role, amount) -> {
                if (!byRole.containsKey(normalize(role))) {
                    defects.add(defect("Tenant " + tenantId + " overrides threshold of unknown role " + role));
                } else if (amount == null || amount.signum() < 0) {
                    defects.add(defect("Tenant " + tenantId + " threshold for " + role + " must be non-negative"));
                } else {
                    normalized.put(normalize(role), amount);
                }
            });
            overrides.put(tenantId, Map.copyOf(normalized));
        });

        if (!defects.isEmpty()) {
            throw new PostingException(defects);
        }

        Map<String, Map<SodAction, SodRule>> frozen = new HashMap<>();
        byRole.forEach((role, actions) -> frozen.put(role, Map.copyOf(actions)));
        return new SodPolicyTable(Map.copyOf(frozen), Map.copyOf(overrides));
    }

    public boolean knowsRole(String role) {
        return role != null && rules.containsKey(normalize(role));
    }

    public Optional<SodRule> ruleFor(String role, SodAction action) {
        if (role == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(rules.getOrDefault(normalize(role), Map.of()).get(action));
    }

    /**
     * Threshold for a rule, with the tenant's override applied if one exists for the rule's role.
     */
    public BigDecimal thresholdFor(UUID tenantId, SodRule rule) {
        return tenantThresholds.getOrDefault(tenantId, Map.of())
            .getOrDefault(normalize(rule.getRole()), rule.getThreshold());
    }

    static String normalize(String role) {
        return role.trim().toLowerCase(Locale.ROOT);
    }

    private static PostingError defect(String message) {
        return PostingError.of(ErrorKind.POLICY_CONFIGURATION_ERROR, MALFORMED_POLICY, message);
    }
}
