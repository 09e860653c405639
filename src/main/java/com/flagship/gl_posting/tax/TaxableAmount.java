package com.flagship.gl_posting.tax;

import com.flagship.gl_posting.ledger.Money;
import lombok.Value;

/**
 * A line amount and the tax code (possibly null) it is subject to.
 */
@Value
public class TaxableAmount {
    Money amount;
    String taxCode;
}
