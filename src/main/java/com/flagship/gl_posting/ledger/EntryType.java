package com.flagship.gl_posting.ledger;

/**
 * The side of a double-entry posting. Also used for an account's normal balance.
 */
public enum EntryType {
    DEBIT,
    CREDIT;

    public EntryType opposite() {
        return this == DEBIT ? CREDIT : DEBIT;
    }
}
