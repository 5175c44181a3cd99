package com.gillianbc.forensicloss.model;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Shared numeric settings. Pipeline arithmetic keeps full precision; only report
 * rendering rounds to {@link #CURRENCY_SCALE}.
 */
public final class Decimals {

    public static final MathContext MATH_CONTEXT = MathContext.DECIMAL128;
    // Partial final years shorter than this are dropped
    public static final BigDecimal YEAR_EPSILON = new BigDecimal("0.000001");
    public static final BigDecimal DAYS_PER_YEAR = new BigDecimal("365.25");
    public static final int CURRENCY_SCALE = 2;
    public static final RoundingMode REPORT_ROUNDING = RoundingMode.HALF_UP;

    private Decimals() {
    }

    public static BigDecimal sum(Iterable<BigDecimal> values) {
        BigDecimal total = BigDecimal.ZERO;
        for (BigDecimal value : values) {
            total = total.add(value, MATH_CONTEXT);
        }
        return total;
    }
}
