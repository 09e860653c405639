package com.flagship.gl_posting.sod;

import com.flagship.gl_posting.error.ErrorKind;
import com.flagship.gl_posting.error.PostingError;
import com.flagship.gl_posting.error.PostingException;
import com.flagship.gl_posting.ledger.PostingContext;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * Maps {role, action, amount} to a {@link SodDecision}.
 *
 * Pure and deterministic: the policy table is passed in, nothing is read from
 * global state, so the same inputs give the same decision live and in audit replay.
 * Unknown roles and missing rules are denied.
 */
@Component
public class SodPolicyEvaluator {

    public static final String NO_ELIGIBLE_APPROVER = "NO_ELIGIBLE_APPROVER";

    public SodDecision evaluate(SodPolicyTable policy, PostingContext context, SodAction action, SodRequest request) {
        String role = context.getUserRole();

        if (!policy.knowsRole(role)) {
            return SodDecision.deny("Unknown role '" + role + "'");
        }

        SodRule rule = policy.ruleFor(role, action).orElse(null);
        if (rule == null) {
            return SodDecision.deny("Role '" + role + "' has no rule for " + action);
        }

        return switch (rule.getMode()) {
            case ALLOW -> SodDecision.allow("Role '" + role + "' may " + action + " directly");
            case DENY -> SodDecision.deny("Role '" + role + "' may not " + action);
            case APPROVAL -> SodDecision.requireApproval(
                eligibleApprovers(rule, request.getCreatorRole()),
                "Role '" + role + "' always requires approval for " + action);
            case THRESHOLD -> evaluateThreshold(policy, context, rule, request);
        };
    }

    private SodDecision evaluateThreshold(SodPolicyTable policy, PostingContext context, SodRule rule, SodRequest request) {
        BigDecimal threshold = policy.thresholdFor(context.getTenantId(), rule);
        if (request.getAmount().compareTo(threshold) <= 0) {
            return SodDecision.allow("Amount within threshold " + threshold.toPlainString()
                + " for role '" + rule.getRole() + "'");
        }
        return SodDecision.requireApproval(
            eligibleApprovers(rule, request.getCreatorRole()),
            "Amount " + request.getAmount().toPlainString() + " exceeds threshold "
                + threshold.toPlainString() + " for role '" + rule.getRole() + "'");
    }

    /**
     * The creator's own role can never approve their entry. If that leaves no one,
     * the table is unusable for this request.
     */
    private List<String> eligibleApprovers(SodRule rule, String creatorRole) {
        String creator = creatorRole == null ? null : SodPolicyTable.normalize(creatorRole);
        List<String> approvers = rule.getApproverRoles().stream()
            .map(SodPolicyTable::normalize)
            .filter(approver -> !approver.equals(creator))
            .distinct()
            .toList();
        if (approvers.isEmpty()) {
            throw new PostingException(PostingError.builder()
                .kind(ErrorKind.POLICY_CONFIGURATION_ERROR)
                .code(NO_ELIGIBLE_APPROVER)
                .message("No approver role remains for " + rule.getAction()
                    + " once the creator's role '" + creatorRole + "' is excluded")
                .detail("role", rule.getRole())
                .detail("action", rule.getAction().name())
                .build());
        }
        return approvers;
    }
}
