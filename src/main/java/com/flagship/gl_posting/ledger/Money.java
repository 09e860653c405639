package com.flagship.gl_posting.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Exact monetary amount in a single currency.
 *
 * Amounts are held as {@link BigDecimal} at the currency's minor-unit scale.
 * Addition and subtraction are exact. The only operation that rounds is
 * {@link #multiply(BigDecimal)} (tax rates, FX rates), which rounds once,
 * half away from zero, back to the minor unit.
 *
 * Invariant: never backed by binary floating point.
 */
@Value
public class Money implements Comparable<Money> {

    /**
     * Rounding used wherever a rate is applied. HALF_UP on BigDecimal rounds
     * half away from zero for negative amounts as well.
     */
    public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    BigDecimal amount;
    CurrencyCode currency;

    private Money(BigDecimal amount, CurrencyCode currency) {
        this.currency = Objects.requireNonNull(currency, "currency");
        this.amount = Objects.requireNonNull(amount, "amount").setScale(currency.scale(), RoundingMode.UNNECESSARY);
    }

    /**
     * Creates a Money value from an exact amount.
     *
     * @throws ArithmeticException if the amount has more decimal places than the currency allows
     */
    public static Money of(BigDecimal amount, CurrencyCode currency) {
        return new Money(amount, currency);
    }

    public static Money of(String amount, CurrencyCode currency) {
        return new Money(new BigDecimal(amount), currency);
    }

    public static Money zero(CurrencyCode currency) {
        return new Money(BigDecimal.ZERO, currency);
    }

    /**
     * Rounds an arbitrary-precision amount to the given scale, half away from zero.
     */
    public static BigDecimal round(BigDecimal amount, int scale) {
        return amount.setScale(scale, ROUNDING);
    }

    /**
     * Whether the amount fits the currency's minor unit without rounding.
     */
    public static boolean fitsScale(BigDecimal amount, CurrencyCode currency) {
        return amount.stripTrailingZeros().scale() <= currency.scale();
    }

    public Money add(Money other) {
        requireSameCurrency(other);
        return new Money(amount.add(other.amount), currency);
    }

    public Money subtract(Money other) {
        requireSameCurrency(other);
        return new Money(amount.subtract(other.amount), currency);
    }

    /**
     * Multiplies by a rate and rounds once to the minor unit.
     */
    public Money multiply(BigDecimal rate) {
        Objects.requireNonNull(rate, "rate");
        return new Money(round(amount.multiply(rate), currency.scale()), currency);
    }

    /**
     * Converts into the rate's target currency, rounding once to the target minor unit.
     */
    public Money convert(ExchangeRate rate) {
        if (rate.getFrom() != currency) {
            throw new IllegalArgumentException(
                String.format("Cannot convert %s using a %s->%s rate", currency, rate.getFrom(), rate.getTo()));
        }
        BigDecimal converted = round(amount.multiply(rate.getRate()), rate.getTo().scale());
        return new Money(converted, rate.getTo());
    }

    public Money negate() {
        return new Money(amount.negate(), currency);
    }

    public Money abs() {
        return new Money(amount.abs(), currency);
    }

    public boolean isZero() {
        return amount.signum() == 0;
    }

    public boolean isNegative() {
        return amount.signum() < 0;
    }

    /**
     * Whether the two amounts differ by no more than one minor unit.
     * This absorbs rounding residue spread across several lines.
     */
    public boolean isWithinToleranceOf(Money other) {
        requireSameCurrency(other);
        return amount.subtract(other.amount).abs().compareTo(currency.minorUnit()) <= 0;
    }

    @Override
    public int compareTo(Money other) {
        requireSameCurrency(other);
        return amount.compareTo(other.amount);
    }

    @Override
    public String toString() {
        return amount.toPlainString() + " " + currency;
    }

    private void requireSameCurrency(Money other) {
        if (other.currency != currency) {
            throw new IllegalArgumentException(
                String.format("Currency mismatch: %s vs %s", currency, other.currency));
        }
    }
}
