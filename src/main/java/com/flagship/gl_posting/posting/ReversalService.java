package com.flagship.gl_posting.posting;

import com.flagship.gl_posting.error.ErrorKind;
import com.flagship.gl_posting.error.PostingError;
import com.flagship.gl_posting.error.PostingException;
import com.flagship.gl_posting.journal.JournalEntry;
import com.flagship.gl_posting.journal.JournalPostingInput;
import com.flagship.gl_posting.journal.JournalStore;
import com.flagship.gl_posting.journal.ReversalFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Reverses a posted entry by recording a new one with every line swapped.
 *
 * The reversal runs the whole posting pipeline, SoD under JOURNAL_REVERSE
 * included. The original moves to REVERSED only once the reversal itself posts;
 * a reversal held for approval leaves the original POSTED until approved.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReversalService {

    private final JournalStore journalStore;
    private final ReversalFactory reversalFactory;
    private final PostingService postingService;

    @Transactional
    public PostingResult reverse(ReversalRequest request) {
        JournalEntry original = journalStore.findById(request.getContext(), request.getJournalId())
            .orElseThrow(() -> new PostingException(PostingError.builder()
                .kind(ErrorKind.INVALID_STATE_TRANSITION)
                .code(ApprovalService.JOURNAL_NOT_FOUND)
                .message("Journal to reverse not found: " + request.getJournalId())
                .detail("journalId", request.getJournalId().toString())
                .build()));

        JournalPostingInput input = reversalFactory.reversalOf(original, request.getContext(), request.getReason(),
            request.getReversalDate(), request.getIdempotencyKey(), request.getJournalNumber());

        log.debug("Reversing journal {} as {}", original.getJournalNumber(), input.getJournalNumber());
        return postingService.post(input);
    }
}
