package com.flagship.gl_posting.posting;

import com.flagship.gl_posting.error.ErrorKind;
import com.flagship.gl_posting.error.PostingError;
import com.flagship.gl_posting.error.PostingException;
import com.flagship.gl_posting.journal.JournalEntry;
import com.flagship.gl_posting.journal.JournalStatus;
import com.flagship.gl_posting.journal.ValidationResult;
import com.flagship.gl_posting.ledger.PostingContext;
import com.flagship.gl_posting.sod.SodAction;
import com.flagship.gl_posting.sod.SodDecision;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Journal lifecycle: DRAFT to POSTED, or DRAFT to PENDING_APPROVAL and then
 * POSTED or REJECTED.
 *
 * Correctness is judged before authority. An invalid entry is refused without
 * the SoD decision ever being computed, which is why it arrives as a supplier.
 */
@Component
public class PostingDecisionMachine {

    public static final String SOD_VIOLATION = "SOD_VIOLATION";
    public static final String SELF_APPROVAL_FORBIDDEN = "SELF_APPROVAL_FORBIDDEN";
    public static final String APPROVER_ROLE_NOT_PERMITTED = "APPROVER_ROLE_NOT_PERMITTED";

    /**
     * @throws PostingException carrying every validation error if the entry is invalid,
     *         or {@link ErrorKind#SOD_VIOLATION} if the actor may not perform the action at all
     */
    public PostingDecision decide(ValidationResult validation, String role, SodAction action,
                                  Supplier<SodDecision> sod) {
        if (!validation.isValid()) {
            throw new PostingException(validation.getErrors());
        }

        SodDecision decision = sod.get();
        if (!decision.isAllowed()) {
            throw new PostingException(PostingError.builder()
                .kind(ErrorKind.SOD_VIOLATION)
                .code(SOD_VIOLATION)
                .message(decision.getReason())
                .detail("role", String.valueOf(role))
                .detail("action", action.name())
                .build());
        }
        if (decision.isRequiresApproval()) {
            return new PostingDecision(JournalStatus.PENDING_APPROVAL, decision.getApproverRoles(), decision.getReason());
        }
        return new PostingDecision(JournalStatus.POSTED, List.of(), decision.getReason());
    }

    public JournalEntry apply(JournalEntry draft, PostingDecision decision, Instant now) {
        if (decision.requiresApproval()) {
            return draft.submitForApproval(decision.getApproverRoles(), now);
        }
        return draft.post(now);
    }

    /**
     * Moves a pending entry to POSTED. The approver must hold one of the entry's
     * approver roles and must not be the user who created it, whatever their role.
     */
    public JournalEntry approve(JournalEntry pending, PostingContext approver, Instant now) {
        requireApprover(pending, approver, "approve");
        return pending.approve(approver.getUserId(), now);
    }

    public JournalEntry reject(JournalEntry pending, PostingContext approver, String reason, Instant now) {
        requireApprover(pending, approver, "reject");
        return pending.reject(approver.getUserId(), reason, now);
    }

    private void requireApprover(JournalEntry pending, PostingContext approver, String action) {
        if (pending.getStatus() != JournalStatus.PENDING_APPROVAL) {
            throw new PostingException(PostingError.builder()
                .kind(ErrorKind.INVALID_STATE_TRANSITION)
                .code("INVALID_STATE_TRANSITION")
                .message(String.format("Cannot %s journal %s in %s status, it must be PENDING_APPROVAL",
                    action, pending.getJournalNumber(), pending.getStatus()))
                .detail("journalId", String.valueOf(pending.getId()))
                .detail("status", pending.getStatus().name())
                .build());
        }
        if (approver.getUserId().equals(pending.getCreatedBy())) {
            throw new PostingException(PostingError.builder()
                .kind(ErrorKind.SOD_VIOLATION)
                .code(SELF_APPROVAL_FORBIDDEN)
                .message("The creator of journal " + pending.getJournalNumber() + " cannot " + action + " it")
                .detail("journalId", String.valueOf(pending.getId()))
                .detail("userId", approver.getUserId().toString())
                .build());
        }
        String role = approver.getUserRole().trim().toLowerCase(Locale.ROOT);
        if (!pending.getApproverRoles().contains(role)) {
            throw new PostingException(PostingError.builder()
                .kind(ErrorKind.SOD_VIOLATION)
                .code(APPROVER_ROLE_NOT_PERMITTED)
                .message("Role '" + approver.getUserRole() + "' may not " + action + " journal "
                    + pending.getJournalNumber())
                .detail("journalId", String.valueOf(pending.getId()))
                .detail("role", approver.getUserRole())
                .detail("approverRoles", pending.getApproverRoles())
                .build());
        }
    }
}
