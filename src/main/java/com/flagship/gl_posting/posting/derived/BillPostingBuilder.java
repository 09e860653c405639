package com.flagship.gl_posting.posting.derived;

import com.flagship.gl_posting.config.PostingProperties;
import com.flagship.gl_posting.ledger.EntryType;
import com.flagship.gl_posting.sod.SodAction;
import com.flagship.gl_posting.tax.TaxCalculator;
import org.springframework.stereotype.Component;

/**
 * Supplier bill: expense and input tax debited, payable credited for the gross.
 */
@Component
public class BillPostingBuilder extends DocumentPostingBuilder {

    public BillPostingBuilder(TaxCalculator taxCalculator, PostingProperties properties) {
        super(taxCalculator, properties);
    }

    @Override
    protected EntryType documentSide() {
        return EntryType.DEBIT;
    }

    @Override
    protected SodAction action() {
        return SodAction.BILL_POST;
    }

    @Override
    protected String module() {
        return "AP";
    }

    @Override
    protected String controlDescription(DocumentPostingRequest request) {
        return "Payable for bill " + request.getDocumentNumber();
    }
}
