package com.flagship.gl_posting.config;

import com.flagship.gl_posting.ledger.CurrencyCode;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Posting rules bound from {@code posting.*}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "posting")
public class PostingProperties {

    /**
     * Upper bound on lines per entry, before tax expansion.
     */
    private int maxLines = 100;

    private boolean allowFutureDates = false;

    /**
     * Currency the books are kept in. Foreign-currency entries need a rate into it.
     */
    private CurrencyCode functionalCurrency = CurrencyCode.MYR;
}
