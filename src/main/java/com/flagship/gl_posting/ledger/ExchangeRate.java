package com.flagship.gl_posting.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A supplied conversion rate from a transaction currency to the functional currency.
 * The engine does not source rates; callers pass them in.
 */
@Value
public class ExchangeRate {
    CurrencyCode from;
    CurrencyCode to;
    BigDecimal rate;

    private ExchangeRate(CurrencyCode from, CurrencyCode to, BigDecimal rate) {
        this.from = Objects.requireNonNull(from);
        this.to = Objects.requireNonNull(to);
        this.rate = Objects.requireNonNull(rate);
        if (rate.signum() <= 0) {
            throw new IllegalArgumentException("Exchange rate must be positive");
        }
    }

    public static ExchangeRate of(CurrencyCode from, CurrencyCode to, BigDecimal rate) {
        return new ExchangeRate(from, to, rate);
    }

    public static ExchangeRate identity(CurrencyCode currency) {
        return new ExchangeRate(currency, currency, BigDecimal.ONE);
    }
}
