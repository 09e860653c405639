package com.flagship.gl_posting.posting.derived;

import com.flagship.gl_posting.error.PostingWarning;
import com.flagship.gl_posting.journal.JournalPostingInput;
import com.flagship.gl_posting.ledger.Money;
import lombok.Value;

import java.util.List;

/**
 * A document translated into a journal input, with its functional-currency totals
 * and any tax warnings raised while computing them.
 */
@Value
public class DerivedPosting {
    JournalPostingInput input;
    List<PostingWarning> warnings;
    Money totalNet;
    Money totalTax;
    Money totalGross;
}
