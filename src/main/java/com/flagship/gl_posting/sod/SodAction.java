package com.flagship.gl_posting.sod;

/**
 * Ledger-affecting actions that segregation-of-duties rules are keyed on.
 */
public enum SodAction {
    JOURNAL_POST,
    JOURNAL_REVERSE,
    INVOICE_POST,
    BILL_POST
}
