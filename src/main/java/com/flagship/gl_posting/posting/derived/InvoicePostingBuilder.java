package com.flagship.gl_posting.posting.derived;

import com.flagship.gl_posting.config.PostingProperties;
import com.flagship.gl_posting.ledger.EntryType;
import com.flagship.gl_posting.sod.SodAction;
import com.flagship.gl_posting.tax.TaxCalculator;
import org.springframework.stereotype.Component;

/**
 * Sales invoice: revenue and output tax credited, receivable debited for the gross.
 */
@Component
public class InvoicePostingBuilder extends DocumentPostingBuilder {

    public InvoicePostingBuilder(TaxCalculator taxCalculator, PostingProperties properties) {
        super(taxCalculator, properties);
    }

    @Override
    protected EntryType documentSide() {
        return EntryType.CREDIT;
    }

    @Override
    protected SodAction action() {
        return SodAction.INVOICE_POST;
    }

    @Override
    protected String module() {
        return "AR";
    }

    @Override
    protected String controlDescription(DocumentPostingRequest request) {
        return "Receivable for invoice " + request.getDocumentNumber();
    }
}
