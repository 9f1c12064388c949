package com.fundengine.unit.projection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.fundengine.projection.CashFlowShapes;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class CashFlowShapesTest {

    @ParameterizedTest
    @CsvSource({"1, 0, 2.0", "4, 1, 2.5", "20, 8, 2.0", "20, 0, 1.5", "40, 39, 3.0", "12, 30, 2.0"})
    void sCurve_weightsSumToOne(int numPeriods, int peakPeriod, double steepness) {
        List<Double> weights = CashFlowShapes.generateSCurve(numPeriods, peakPeriod, steepness);

        assertThat(weights).hasSize(numPeriods);
        assertThat(sum(weights)).isCloseTo(1.0, within(1e-9));
    }

    @ParameterizedTest
    @CsvSource({"1, 0, 1.5", "4, 2, 1.2", "20, 8, 1.5", "20, 0, 3.0", "40, 40, 2.0", "12, 50, 2.0"})
    void jCurve_weightsSumToOne(int numPeriods, int troughPeriod, double steepness) {
        List<Double> weights = CashFlowShapes.generateJCurve(numPeriods, troughPeriod, steepness);

        assertThat(weights).hasSize(numPeriods);
        assertThat(sum(weights)).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void sCurve_increasesTowardLaterPeriods() {
        List<Double> weights = CashFlowShapes.generateSCurve(20, 8, 2.0);

        for (int i = 1; i < weights.size(); i++) {
            assertThat(weights.get(i)).isGreaterThan(weights.get(i - 1));
        }
    }

    @Test
    void jCurve_flatBeforeTroughAndRisingAfter() {
        List<Double> weights = CashFlowShapes.generateJCurve(20, 8, 1.5);

        for (int i = 1; i < 8; i++) {
            assertThat(weights.get(i)).isEqualTo(weights.get(0));
        }
        assertThat(weights.get(8)).isGreaterThan(weights.get(7));
        for (int i = 9; i < weights.size(); i++) {
            assertThat(weights.get(i)).isGreaterThan(weights.get(i - 1));
        }
    }

    @Test
    void nonPositivePeriodCount_returnsEmpty() {
        assertThat(CashFlowShapes.generateSCurve(0, 0, 2.0)).isEmpty();
        assertThat(CashFlowShapes.generateJCurve(-3, 0, 2.0)).isEmpty();
    }

    @Test
    void sCurve_underflowingWeights_fallBackToZeros() {
        // every sigmoid underflows to 0 when the peak sits absurdly far past the horizon
        List<Double> weights = CashFlowShapes.generateSCurve(4, 1000, 1e6);

        assertThat(weights).containsExactly(0.0, 0.0, 0.0, 0.0);
    }

    private static double sum(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).sum();
    }
}
