package com.flagship.gl_posting.coa;

import com.flagship.gl_posting.ledger.CurrencyCode;
import com.flagship.gl_posting.ledger.EntryType;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Domain model for a chart-of-accounts entry.
 * Read-only to the posting engine; accounts are managed elsewhere.
 *
 * Group (header) accounts organise the hierarchy and never receive postings.
 */
@Value
@Builder(toBuilder = true)
public class Account {
    UUID id;
    UUID tenantId;
    UUID companyId;
    String code;
    String name;
    AccountType accountType;
    EntryType normalBalance;
    boolean group;
    boolean active;

    /**
     * Account currency. Null means the account accepts any posting currency.
     */
    CurrencyCode currency;

    public EntryType effectiveNormalBalance() {
        return normalBalance != null ? normalBalance : accountType.normalBalance();
    }
}
