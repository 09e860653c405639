package com.flagship.gl_posting.journal;

import com.flagship.gl_posting.ledger.PostingContext;
import com.flagship.gl_posting.sod.SodAction;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * Builds the entry that offsets a posted journal.
 *
 * Every stored line, generated tax lines included, is copied with debit and
 * credit swapped and the tax code dropped, so the reversal is not taxed again
 * and negates the original exactly.
 */
@Component
public class ReversalFactory {

    static final String NUMBER_SUFFIX = "-REV";

    /**
     * @param journalNumber number for the reversal entry; null means the original's number plus
     *                      {@value #NUMBER_SUFFIX}, with the original's number cut short if needed to fit
     *                      {@link JournalValidator#MAX_JOURNAL_NUMBER_LENGTH}
     */
    public JournalPostingInput reversalOf(JournalEntry original, PostingContext context, String reason,
                                          LocalDate reversalDate, String idempotencyKey, String journalNumber) {
        JournalPostingInput.JournalPostingInputBuilder input = JournalPostingInput.builder()
            .journalNumber(journalNumber != null ? journalNumber : defaultNumber(original.getJournalNumber()))
            .description("Reversal of " + original.getJournalNumber() + (reason == null ? "" : ": " + reason))
            .journalDate(reversalDate)
            .currency(original.getCurrency().name())
            .exchangeRate(original.getExchangeRate())
            .idempotencyKey(idempotencyKey)
            .context(context)
            .action(SodAction.JOURNAL_REVERSE)
            .module(original.getSourceModule())
            .reversalOf(original.getId());

        for (JournalLine line : original.getLines()) {
            input.line(line.swapSides().toBuilder().generated(false).build());
        }
        return input.build();
    }

    static String defaultNumber(String originalNumber) {
        int room = JournalValidator.MAX_JOURNAL_NUMBER_LENGTH - NUMBER_SUFFIX.length();
        String base = originalNumber.length() > room ? originalNumber.substring(0, room) : originalNumber;
        return base + NUMBER_SUFFIX;
    }
}
