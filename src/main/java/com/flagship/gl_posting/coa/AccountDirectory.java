package com.flagship.gl_posting.coa;

import com.flagship.gl_posting.ledger.PostingContext;

import java.util.Collection;
import java.util.Map;
import java.util.UUID;

/**
 * Read access to the chart of accounts.
 *
 * Implementations must scope every lookup to the context's tenant and company.
 * Failures are thrown, never reported as "not found": the engine fails closed on them.
 */
public interface AccountDirectory {

    /**
     * Loads all requested accounts in one round trip.
     *
     * @return accounts keyed by id; ids that do not exist in scope are absent
     */
    Map<UUID, Account> lookupAccounts(PostingContext scope, Collection<UUID> accountIds);
}
