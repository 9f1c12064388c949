package com.fundengine.unit.metrics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.fundengine.metrics.PerformanceRatios;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class PerformanceRatiosTest {

    @Test
    void multiples_fromDollarTotals() {
        assertThat(PerformanceRatios.tvpi(usd("150000"), usd("100000"))).isEqualTo(1.5);
        assertThat(PerformanceRatios.dpi(usd("80000"), usd("100000"))).isEqualTo(0.8);
        assertThat(PerformanceRatios.rvpi(usd("70000"), usd("100000"))).isEqualTo(0.7);
        assertThat(PerformanceRatios.moic(usd("240000"), usd("120000"))).isEqualTo(2.0);
    }

    @Test
    void percentages_scaledTo100() {
        assertThat(PerformanceRatios.calledPercent(usd("75000"), usd("100000"))).isCloseTo(75.0, within(1e-9));
        assertThat(PerformanceRatios.distributedPercent(usd("12500"), usd("50000"))).isCloseTo(25.0, within(1e-9));
    }

    @Test
    void repeatingQuotient_roundedToDoublePrecision() {
        assertThat(PerformanceRatios.tvpi(usd("100"), usd("300"))).isCloseTo(1.0 / 3, within(1e-15));
    }

    @Test
    void nonPositiveDenominator_returnsNull() {
        assertThat(PerformanceRatios.tvpi(usd("150000"), BigDecimal.ZERO)).isNull();
        assertThat(PerformanceRatios.dpi(usd("80000"), usd("-1"))).isNull();
        assertThat(PerformanceRatios.rvpi(usd("70000"), usd("0.00"))).isNull();
        assertThat(PerformanceRatios.moic(usd("1"), usd("-100"))).isNull();
        assertThat(PerformanceRatios.calledPercent(usd("100"), BigDecimal.ZERO)).isNull();
        assertThat(PerformanceRatios.distributedPercent(usd("100"), usd("-5"))).isNull();
    }

    @Test
    void nullDenominator_returnsNull() {
        assertThat(PerformanceRatios.tvpi(usd("1"), null)).isNull();
    }

    @Test
    void zeroNumerator_isZeroNotNull() {
        assertThat(PerformanceRatios.dpi(BigDecimal.ZERO, usd("100000"))).isEqualTo(0.0);
    }

    private static BigDecimal usd(String amount) {
        return new BigDecimal(amount);
    }
}
