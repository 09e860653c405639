package com.flagship.gl_posting.tax;

import com.flagship.gl_posting.ledger.PostingContext;

import java.util.Collection;
import java.util.List;

/**
 * Read access to tax master data, scoped to the context's tenant and company.
 */
public interface TaxCodeDirectory {

    /**
     * Loads the active tax codes among {@code codes}. Unknown or inactive codes are simply absent.
     */
    List<TaxCode> lookupTaxCodes(PostingContext scope, Collection<String> codes);
}
