package com.flagship.gl_posting.posting;

import com.flagship.gl_posting.error.PostingWarning;
import com.flagship.gl_posting.journal.JournalEntry;
import com.flagship.gl_posting.outbox.OutboxEvent;
import com.flagship.gl_posting.outbox.OutboxService;
import com.flagship.gl_posting.posting.event.JournalEvent;
import com.flagship.gl_posting.posting.event.JournalPendingApprovalEvent;
import com.flagship.gl_posting.posting.event.JournalPostedEvent;
import com.flagship.gl_posting.posting.event.JournalRejectedEvent;
import com.flagship.gl_posting.posting.event.JournalReversedEvent;
import com.flagship.gl_posting.posting.event.TaxLookupDegradedEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Writes lifecycle events to the outbox in the caller's transaction.
 */
@Component
@RequiredArgsConstructor
public class JournalEventWriter {

    private final OutboxService outboxService;

    public void posted(JournalEntry entry) {
        journal(JournalPostedEvent.from(entry));
    }

    public void pendingApproval(JournalEntry entry) {
        journal(JournalPendingApprovalEvent.from(entry));
    }

    public void rejected(JournalEntry entry) {
        journal(JournalRejectedEvent.from(entry));
    }

    public void reversed(JournalEntry original, JournalEntry reversal) {
        journal(JournalReversedEvent.from(original, reversal));
    }

    /**
     * Sends the tax warnings of a recorded entry to the audit stream. No-op if there are none.
     */
    public void taxDegraded(JournalEntry entry, List<PostingWarning> warnings) {
        List<PostingWarning> degraded = warnings.stream().filter(PostingWarning::isTaxDegradation).toList();
        if (degraded.isEmpty()) {
            return;
        }
        TaxLookupDegradedEvent event = TaxLookupDegradedEvent.from(entry, degraded);
        outboxService.saveEvent(OutboxEvent.AGGREGATE_POSTING_AUDIT, event.getJournalId(), event.getTenantId(),
            event.getEventType(), event);
    }

    private void journal(JournalEvent event) {
        outboxService.saveEvent(OutboxEvent.AGGREGATE_JOURNAL, event.getJournalId(), event.getTenantId(),
            event.getEventType(), event);
    }
}
