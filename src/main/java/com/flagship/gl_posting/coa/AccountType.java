package com.flagship.gl_posting.coa;

import com.flagship.gl_posting.ledger.EntryType;

/**
 * Chart-of-accounts classification.
 *
 * The five root types carry the normal balance side. Sub-kinds (receivable,
 * bank, tax and so on) resolve to their root type.
 */
public enum AccountType {
    ASSET(null, EntryType.DEBIT),
    LIABILITY(null, EntryType.CREDIT),
    EQUITY(null, EntryType.CREDIT),
    INCOME(null, EntryType.CREDIT),
    EXPENSE(null, EntryType.DEBIT),

    RECEIVABLE(ASSET, EntryType.DEBIT),
    BANK(ASSET, EntryType.DEBIT),
    CASH(ASSET, EntryType.DEBIT),
    STOCK(ASSET, EntryType.DEBIT),
    PAYABLE(LIABILITY, EntryType.CREDIT),
    TAX(LIABILITY, EntryType.CREDIT);

    private final AccountType parent;
    private final EntryType normalBalance;

    AccountType(AccountType parent, EntryType normalBalance) {
        this.parent = parent;
        this.normalBalance = normalBalance;
    }

    public AccountType rootType() {
        return parent == null ? this : parent;
    }

    /**
     * Side on which this type of account normally carries its balance.
     * For ASSET: debit increases. For LIABILITY/EQUITY/INCOME: credit increases.
     */
    public EntryType normalBalance() {
        return normalBalance;
    }
}
