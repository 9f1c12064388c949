package com.fundengine.metrics;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Ratio metrics of private-capital performance.
 *
 * <p>Inputs are dollar totals; results are plain multiples. Each ratio guards its denominator:
 * a null, zero or negative denominator returns null rather than dividing. Percentages are
 * scaled to 0-100.
 */
public final class PerformanceRatios {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private PerformanceRatios() {}

    /** TVPI = (distributions + NAV) / paid-in. */
    public static Double tvpi(BigDecimal totalValue, BigDecimal paidIn) {
        return ratio(totalValue, paidIn);
    }

    /** DPI = distributions / paid-in. */
    public static Double dpi(BigDecimal distributions, BigDecimal paidIn) {
        return ratio(distributions, paidIn);
    }

    /** RVPI = NAV / paid-in, the unrealized part of TVPI. */
    public static Double rvpi(BigDecimal nav, BigDecimal paidIn) {
        return ratio(nav, paidIn);
    }

    /** MOIC = total value / invested capital. */
    public static Double moic(BigDecimal totalValue, BigDecimal investedCapital) {
        return ratio(totalValue, investedCapital);
    }

    /** Called % = 100 * paid-in / commitment. */
    public static Double calledPercent(BigDecimal paidIn, BigDecimal commitment) {
        return paidIn == null ? null : ratio(paidIn.multiply(HUNDRED), commitment);
    }

    /** Distributed % = 100 * distributions / commitment. */
    public static Double distributedPercent(BigDecimal distributions, BigDecimal commitment) {
        return distributions == null ? null : ratio(distributions.multiply(HUNDRED), commitment);
    }

    private static Double ratio(BigDecimal numerator, BigDecimal denominator) {
        if (numerator == null || denominator == null || denominator.signum() <= 0) {
            return null;
        }
        return numerator.divide(denominator, MathContext.DECIMAL64).doubleValue();
    }
}
