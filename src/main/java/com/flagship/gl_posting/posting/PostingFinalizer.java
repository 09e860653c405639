package com.flagship.gl_posting.posting;

import com.flagship.gl_posting.error.ErrorKind;
import com.flagship.gl_posting.error.PostingError;
import com.flagship.gl_posting.error.PostingException;
import com.flagship.gl_posting.journal.JournalEntry;
import com.flagship.gl_posting.journal.JournalStatus;
import com.flagship.gl_posting.journal.JournalStore;
import com.flagship.gl_posting.ledger.PostingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Side effects of an entry reaching POSTED, whether directly or through approval.
 *
 * A posted reversal moves its original to REVERSED. The conditional update is
 * the guard against two reversals of the same entry racing each other.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PostingFinalizer {

    private final JournalStore journalStore;
    private final JournalEventWriter eventWriter;

    @Transactional(propagation = Propagation.MANDATORY)
    public void onPosted(JournalEntry posted, PostingContext scope, Instant now) {
        if (posted.isReversal()) {
            JournalEntry original = journalStore.findById(scope, posted.getReversalOf())
                .orElseThrow(() -> stateError("Reversed journal " + posted.getReversalOf() + " no longer exists",
                    posted));
            JournalEntry reversed = original.markReversed(now);
            if (!journalStore.updateStatus(reversed, JournalStatus.POSTED)) {
                throw stateError("Journal " + original.getJournalNumber() + " was changed by another request", posted);
            }
            eventWriter.reversed(reversed, posted);
            log.info("Journal {} reversed by {}", original.getJournalNumber(), posted.getJournalNumber());
        }
        eventWriter.posted(posted);
    }

    private static PostingException stateError(String message, JournalEntry reversal) {
        return new PostingException(PostingError.builder()
            .kind(ErrorKind.INVALID_STATE_TRANSITION)
            .code("INVALID_STATE_TRANSITION")
            .message(message)
            .detail("journalId", String.valueOf(reversal.getReversalOf()))
            .build());
    }
}
