package com.flagship.gl_posting.tax;

/**
 * OUTPUT tax is charged on sales, INPUT tax is paid on purchases.
 * EXEMPT codes exist so exempt lines can still be tagged and reported.
 */
public enum TaxType {
    INPUT,
    OUTPUT,
    EXEMPT
}
