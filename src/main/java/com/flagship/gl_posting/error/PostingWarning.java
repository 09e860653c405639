package com.flagship.gl_posting.error;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Non-fatal finding returned alongside a successful posting, e.g. a tax code
 * that could not be resolved or a line on an account's non-normal side.
 */
@Value
@Builder
@Jacksonized
public class PostingWarning {

    public static final String TAX_CODE_NOT_FOUND = "TAX_CODE_NOT_FOUND";
    public static final String TAX_LOOKUP_UNAVAILABLE = "TAX_LOOKUP_UNAVAILABLE";
    public static final String TAX_ACCOUNT_MISSING = "TAX_ACCOUNT_MISSING";
    public static final String ABNORMAL_BALANCE_SIDE = "ABNORMAL_BALANCE_SIDE";

    String code;
    String message;
    @Singular
    Map<String, String> details;

    /**
     * Tax warnings mean tax was expected but not applied, so they are also sent to audit.
     */
    public boolean isTaxDegradation() {
        return TAX_CODE_NOT_FOUND.equals(code)
            || TAX_LOOKUP_UNAVAILABLE.equals(code)
            || TAX_ACCOUNT_MISSING.equals(code);
    }
}
