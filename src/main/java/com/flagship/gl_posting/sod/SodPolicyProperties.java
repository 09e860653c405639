package com.flagship.gl_posting.sod;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Binds the declarative policy table from {@code posting.sod.*}.
 *
 * <pre>
 * posting:
 *   sod:
 *     roles:
 *       "[manager]":
 *         journal-post: { mode: threshold, threshold: 50000, approver-roles: [finance-lead, admin] }
 *     tenant-thresholds:
 *       "[7c1e...]":
 *         manager: 20000
 * </pre>
 *
 * Mutable only while Spring binds it; the engine only ever sees the
 * {@link SodPolicyTable} built by {@link #toPolicyTable()}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "posting.sod")
public class SodPolicyProperties {

    private Map<String, Map<SodAction, RuleProperties>> roles = new LinkedHashMap<>();

    private Map<UUID, Map<String, BigDecimal>> tenantThresholds = new HashMap<>();

    public SodPolicyTable toPolicyTable() {
        List<SodRule> rules = new ArrayList<>();
        roles.forEach((role, actions) -> new EnumMap<>(actions).forEach((action, rule) ->
            rules.add(SodRule.builder()
                .role(role)
                .action(action)
                .mode(rule.getMode())
                .threshold(rule.getThreshold())
                .approverRoles(rule.getApproverRoles())
                .build())));
        return SodPolicyTable.of(rules, tenantThresholds);
    }

    @Getter
    @Setter
    public static class RuleProperties {
        private SodMode mode;
        private BigDecimal threshold;
        private List<String> approverRoles = new ArrayList<>();
    }
}
