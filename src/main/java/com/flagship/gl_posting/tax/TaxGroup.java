package com.flagship.gl_posting.tax;

import com.flagship.gl_posting.ledger.Money;
import lombok.Value;

import java.util.UUID;

/**
 * Summed tax for one code, posted as a single line to the code's tax account.
 */
@Value
public class TaxGroup {
    String taxCode;
    UUID taxAccountId;
    Money taxAmount;
}
