package com.flagship.gl_posting.ledger;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;

/**
 * Currency code enum following ISO-4217 standard.
 *
 * Each currency carries its minor-unit scale, which is the precision that
 * amounts in that currency are stored and rounded to.
 */
public enum CurrencyCode {
    MYR(2), // Malaysian Ringgit
    SGD(2), // Singapore Dollar
    USD(2), // US Dollar
    EUR(2), // Euro
    GBP(2), // British Pound
    INR(2), // Indian Rupee
    IDR(2), // Indonesian Rupiah
    THB(2), // Thai Baht
    CNY(2), // Chinese Yuan
    AUD(2), // Australian Dollar
    JPY(0); // Japanese Yen

    private final int scale;

    CurrencyCode(int scale) {
        this.scale = scale;
    }

    /**
     * Number of decimal places in the minor unit (2 for cents, 0 for yen).
     */
    public int scale() {
        return scale;
    }

    /**
     * The smallest representable amount, e.g. 0.01 for MYR or 1 for JPY.
     */
    public BigDecimal minorUnit() {
        return BigDecimal.ONE.movePointLeft(scale);
    }

    /**
     * Parses a three-letter code, ignoring case and surrounding whitespace.
     *
     * @return the currency, or empty if the code is blank or not supported
     */
    public static Optional<CurrencyCode> parse(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        if (normalized.length() != 3) {
            return Optional.empty();
        }
        try {
            return Optional.of(CurrencyCode.valueOf(normalized));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
