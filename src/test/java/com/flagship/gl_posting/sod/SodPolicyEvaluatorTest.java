package com.flagship.gl_posting.sod;

import com.flagship.gl_posting.error.ErrorKind;
import com.flagship.gl_posting.error.PostingException;
import com.flagship.gl_posting.ledger.PostingContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class SodPolicyEvaluatorTest {

    private static final UUID TENANT = UUID.randomUUID();
    private static final UUID OTHER_TENANT = UUID.randomUUID();

    private final SodPolicyEvaluator evaluator = new SodPolicyEvaluator();

    private final SodPolicyTable policy = SodPolicyTable.of(List.of(
        SodRule.allow("admin", SodAction.JOURNAL_POST),
        SodRule.allow("finance-lead", SodAction.JOURNAL_POST),
        SodRule.threshold("manager", SodAction.JOURNAL_POST, new BigDecimal("50000"), List.of("finance-lead", "admin")),
        SodRule.approval("clerk", SodAction.JOURNAL_POST, List.of("manager", "admin")),
        SodRule.deny("viewer", SodAction.JOURNAL_POST),
        SodRule.approval("reviewer", SodAction.JOURNAL_POST, List.of("reviewer"))
    ), Map.of(TENANT, Map.of("manager", new BigDecimal("20000"))));

    private static PostingContext as(String role, UUID tenant) {
        return new PostingContext(tenant, UUID.randomUUID(), UUID.randomUUID(), role);
    }

    private SodDecision evaluate(String role, UUID tenant, String amount) {
        return evaluator.evaluate(policy, as(role, tenant), SodAction.JOURNAL_POST,
            new SodRequest(new BigDecimal(amount), "GL", role));
    }

    @Test
    @DisplayName("ALLOW posts directly")
    void allowRole() {
        SodDecision decision = evaluate("admin", OTHER_TENANT, "1000000.00");

        assertTrue(decision.isAllowed());
        assertFalse(decision.isRequiresApproval());
    }

    @Test
    @DisplayName("APPROVAL always requires approval, whatever the amount")
    void approvalRole() {
        SodDecision decision = evaluate("clerk", OTHER_TENANT, "0.01");

        assertTrue(decision.isAllowed());
        assertTrue(decision.isRequiresApproval());
        assertEquals(List.of("manager", "admin"), decision.getApproverRoles());
    }

    @Test
    @DisplayName("DENY refuses outright")
    void denyRole() {
        SodDecision decision = evaluate("viewer", OTHER_TENANT, "1.00");

        assertFalse(decision.isAllowed());
        assertNotNull(decision.getReason());
    }

    @Test
    @DisplayName("Unknown roles are denied, not allowed")
    void unknownRoleIsDenied() {
        assertFalse(evaluate("intern", OTHER_TENANT, "1.00").isAllowed());
    }

    @Test
    @DisplayName("A known role with no rule for the action is denied")
    void missingRuleIsDenied() {
        SodDecision decision = evaluator.evaluate(policy, as("admin", TENANT), SodAction.BILL_POST,
            new SodRequest(BigDecimal.ONE, "AP", "admin"));

        assertFalse(decision.isAllowed());
    }

    @Test
    @DisplayName("Roles are matched case-insensitively")
    void roleCaseInsensitive() {
        assertTrue(evaluate("  Admin ", OTHER_TENANT, "1.00").isAllowed());
    }

    @Nested
    @DisplayName("THRESHOLD")
    class Threshold {

        @Test
        @DisplayName("Amount equal to the threshold posts directly")
        void atThreshold() {
            assertFalse(evaluate("manager", OTHER_TENANT, "50000.00").isRequiresApproval());
        }

        @Test
        @DisplayName("Amount above the threshold needs approval")
        void aboveThreshold() {
            SodDecision decision = evaluate("manager", OTHER_TENANT, "50000.01");

            assertTrue(decision.isRequiresApproval());
            assertEquals(List.of("finance-lead", "admin"), decision.getApproverRoles());
        }

        @Test
        @DisplayName("A tenant override replaces the default threshold for that tenant only")
        void tenantOverride() {
            assertTrue(evaluate("manager", TENANT, "20000.01").isRequiresApproval());
            assertFalse(evaluate("manager", OTHER_TENANT, "20000.01").isRequiresApproval());
        }
    }

    @Nested
    @DisplayName("Self-approval")
    class SelfApproval {

        @Test
        @DisplayName("The creator's own role is removed from the approver list")
        void creatorRoleExcluded() {
            SodDecision decision = evaluator.evaluate(policy, as("clerk", TENANT), SodAction.JOURNAL_POST,
                new SodRequest(BigDecimal.TEN, "GL", "manager"));

            assertEquals(List.of("admin"), decision.getApproverRoles());
        }

        @Test
        @DisplayName("If only the creator's role could approve, the policy is a configuration error")
        void noApproverLeft() {
            PostingException e = assertThrows(PostingException.class,
                () -> evaluate("reviewer", TENANT, "1.00"));

            assertEquals(ErrorKind.POLICY_CONFIGURATION_ERROR, e.getKind());
            assertTrue(e.hasCode(SodPolicyEvaluator.NO_ELIGIBLE_APPROVER));
        }
    }

    @Test
    @DisplayName("The same inputs always give the same decision")
    void deterministic() {
        assertEquals(evaluate("manager", TENANT, "30000.00"), evaluate("manager", TENANT, "30000.00"));
    }
}
