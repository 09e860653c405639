package com.flagship.gl_posting.posting;

import com.flagship.gl_posting.error.ErrorKind;
import com.flagship.gl_posting.error.PostingError;
import com.flagship.gl_posting.error.PostingException;
import com.flagship.gl_posting.journal.JournalEntry;
import com.flagship.gl_posting.journal.JournalStatus;
import com.flagship.gl_posting.journal.JournalStore;
import com.flagship.gl_posting.ledger.PostingContext;
import com.flagship.gl_posting.observability.CorrelationContext;
import com.flagship.gl_posting.observability.PostingMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Approve and reject actions on entries held in PENDING_APPROVAL.
 *
 * The status update is conditional on the entry still being pending, so two
 * approvers acting at once cannot both succeed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ApprovalService {

    public static final String JOURNAL_NOT_FOUND = "JOURNAL_NOT_FOUND";

    private final JournalStore journalStore;
    private final PostingDecisionMachine decisionMachine;
    private final PostingFinalizer finalizer;
    private final JournalEventWriter eventWriter;
    private final PostingMetrics metrics;
    private final Clock clock;

    /**
     * @param approver the acting user, in the same tenant and company as the entry
     * @throws PostingException {@link ErrorKind#SOD_VIOLATION} for self-approval or a role outside the
     *         entry's approver roles; {@link ErrorKind#INVALID_STATE_TRANSITION} if the entry is not pending
     */
    @Transactional
    public PostingResult approve(UUID journalId, PostingContext approver) {
        try (CorrelationContext.Scope ignored = CorrelationContext.open(
                approver.getTenantId().toString(), null, null)) {
            JournalEntry pending = load(approver, journalId);
            Instant now = clock.instant();
            JournalEntry posted = decide(() -> decisionMachine.approve(pending, approver, now), "approve");

            persist(posted);
            finalizer.onPosted(posted, approver, now);

            metrics.recordApproval("approved");
            log.info("Journal {} approved by {} ({})", posted.getJournalNumber(), approver.getUserId(),
                approver.getUserRole());
            return PostingResult.from(posted, List.of());
        }
    }

    @Transactional
    public PostingResult reject(UUID journalId, PostingContext approver, String reason) {
        try (CorrelationContext.Scope ignored = CorrelationContext.open(
                approver.getTenantId().toString(), null, null)) {
            JournalEntry pending = load(approver, journalId);
            Instant now = clock.instant();
            JournalEntry rejected = decide(() -> decisionMachine.reject(pending, approver, reason, now), "reject");

            persist(rejected);
            eventWriter.rejected(rejected);

            metrics.recordApproval("rejected");
            log.info("Journal {} rejected by {}: {}", rejected.getJournalNumber(), approver.getUserId(), reason);
            return PostingResult.from(rejected, List.of());
        }
    }

    private JournalEntry decide(Supplier<JournalEntry> action, String name) {
        try {
            return action.get();
        } catch (PostingException e) {
            metrics.recordApproval(name + "_refused");
            metrics.recordFailure(e.getKind().name());
            log.warn("Cannot {} journal: kind={}, error={}", name, e.getKind(), e.getMessage());
            throw e;
        }
    }

    private JournalEntry load(PostingContext scope, UUID journalId) {
        JournalEntry entry = journalStore.findById(scope, journalId)
            .orElseThrow(() -> new PostingException(PostingError.builder()
                .kind(ErrorKind.INVALID_STATE_TRANSITION)
                .code(JOURNAL_NOT_FOUND)
                .message("Journal not found: " + journalId)
                .detail("journalId", journalId.toString())
                .build()));
        MDC.put(CorrelationContext.JOURNAL_NUMBER_MDC_KEY, entry.getJournalNumber());
        MDC.put(CorrelationContext.JOURNAL_ID_MDC_KEY, journalId.toString());
        return entry;
    }

    private void persist(JournalEntry updated) {
        if (!journalStore.updateStatus(updated, JournalStatus.PENDING_APPROVAL)) {
            throw new PostingException(PostingError.builder()
                .kind(ErrorKind.INVALID_STATE_TRANSITION)
                .code("INVALID_STATE_TRANSITION")
                .message("Journal " + updated.getJournalNumber() + " was decided by another request")
                .detail("journalId", updated.getId().toString())
                .build());
        }
    }
}
