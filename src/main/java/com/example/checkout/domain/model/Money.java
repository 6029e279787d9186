package com.example.checkout.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Non-negative amount in a single ISO-4217 currency, held at two decimal places.
 * Providers are paid in minor units, see {@link #toMinorUnits()}.
 */
public final class Money {

    private static final int SCALE = 2;
    private static final Pattern CURRENCY_CODE = Pattern.compile("^[A-Z]{3}$");

    private final BigDecimal amount;
    private final String currency;

    private Money(BigDecimal amount, String currency) {
        this.amount = amount.setScale(SCALE, RoundingMode.HALF_UP);
        this.currency = currency;
    }

    /**
     * @param amount   the amount, rounded half-up to two decimals
     * @param currency three-letter upper-case currency code
     * @throws IllegalArgumentException if amount is negative or the code is malformed
     */
    public static Money of(BigDecimal amount, String currency) {
        Objects.requireNonNull(amount, "Amount cannot be null");
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Amount cannot be negative: " + amount);
        }
        return new Money(amount, requireCurrency(currency));
    }

    public static Money zero(String currency) {
        return new Money(BigDecimal.ZERO, requireCurrency(currency));
    }

    /**
     * Creates Money from minor units (paise, cents).
     */
    public static Money ofMinorUnits(long minorUnits, String currency) {
        return of(BigDecimal.valueOf(minorUnits, SCALE), currency);
    }

    public Money add(Money other) {
        Objects.requireNonNull(other, "Cannot add null Money");
        if (!currency.equals(other.currency)) {
            throw new IllegalArgumentException(
                    "Currency mismatch: " + currency + " vs " + other.currency);
        }
        return new Money(amount.add(other.amount), currency);
    }

    /**
     * Line total for {@code quantity} units priced at this amount.
     */
    public Money times(int quantity) {
        if (quantity < 0) {
            throw new IllegalArgumentException("Quantity cannot be negative: " + quantity);
        }
        return new Money(amount.multiply(BigDecimal.valueOf(quantity)), currency);
    }

    /**
     * Amount in minor units, e.g. 1499.50 INR is 149950.
     *
     * @throws ArithmeticException if the value does not fit in a long
     */
    public long toMinorUnits() {
        return amount.movePointRight(SCALE).longValueExact();
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public String getCurrency() {
        return currency;
    }

    private static String requireCurrency(String currency) {
        if (currency == null || !CURRENCY_CODE.matcher(currency).matches()) {
            throw new IllegalArgumentException("Invalid currency code: " + currency);
        }
        return currency;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Money other)) return false;
        return amount.equals(other.amount) && currency.equals(other.currency);
    }

    @Override
    public int hashCode() {
        return Objects.hash(amount, currency);
    }

    @Override
    public String toString() {
        return amount.toPlainString() + " " + currency;
    }
}
