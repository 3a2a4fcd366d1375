package com.flagship.erp_ledger.common;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;

/**
 * Monetary arithmetic helpers. Amounts are carried at two decimal places, rounded half-up.
 */
public final class Money {

    public static final int SCALE = 2;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE, ROUNDING);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private Money() {
    }

    public static BigDecimal of(BigDecimal value) {
        return value == null ? ZERO : value.setScale(SCALE, ROUNDING);
    }

    public static BigDecimal of(String value) {
        return of(new BigDecimal(value));
    }

    public static BigDecimal orZero(BigDecimal value) {
        return value == null ? ZERO : value;
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    public static boolean isNegative(BigDecimal value) {
        return value != null && value.signum() < 0;
    }

    public static boolean isZero(BigDecimal value) {
        return value == null || value.signum() == 0;
    }

    public static boolean fitsScale(BigDecimal value) {
        return value.stripTrailingZeros().scale() <= SCALE;
    }

    public static BigDecimal sum(Collection<BigDecimal> values) {
        return of(values.stream()
                .map(Money::orZero)
                .reduce(BigDecimal.ZERO, BigDecimal::add));
    }

    /**
     * rate is a percentage, e.g. 7.5 for 7.5%.
     */
    public static BigDecimal percentOf(BigDecimal amount, BigDecimal rate) {
        if (isZero(amount) || isZero(rate)) {
            return ZERO;
        }
        return amount.multiply(rate).divide(HUNDRED, SCALE, ROUNDING);
    }
}
