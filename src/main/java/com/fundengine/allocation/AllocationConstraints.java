package com.fundengine.allocation;

import java.math.BigDecimal;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Per-strategy bounds on new investment. A strategy without a minimum is floored at zero;
 * one without a maximum is capped at the available capital.
 */
@Value
@Builder
public class AllocationConstraints {

    @Singular("minimum")
    Map<String, BigDecimal> minimums;

    @Singular("maximum")
    Map<String, BigDecimal> maximums;

    public static AllocationConstraints none() {
        return AllocationConstraints.builder().build();
    }

    public BigDecimal minimumFor(String strategy) {
        return minimums.getOrDefault(strategy, BigDecimal.ZERO);
    }

    public BigDecimal maximumFor(String strategy, BigDecimal availableCapital) {
        return maximums.getOrDefault(strategy, availableCapital);
    }
}
