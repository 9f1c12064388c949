package com.fundengine.projection;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Portfolio projection: quarterly totals, the same totals per strategy, and each fund's own
 * projection. Funds that could not be projected are named in {@code failedFunds}.
 */
@Value
@Builder
public class PortfolioProjection {

    List<ProjectionPeriodTotal> totals;
    Map<String, List<ProjectionPeriodTotal>> byStrategy;
    List<FundProjection> byFund;
    List<String> failedFunds;

    public static PortfolioProjection empty() {
        return PortfolioProjection.builder()
                .totals(List.of())
                .byStrategy(Map.of())
                .byFund(List.of())
                .failedFunds(List.of())
                .build();
    }

    /**
     * Projected distributions per strategy summed over the first {@code quarters} quarters.
     */
    public Map<String, BigDecimal> distributionsByStrategy(int quarters) {
        Map<String, BigDecimal> distributions = new LinkedHashMap<>();
        byStrategy.forEach((strategy, periods) -> distributions.put(
                strategy,
                periods.stream()
                        .filter(p -> p.getPeriodIndex() <= quarters)
                        .map(ProjectionPeriodTotal::getDistributions)
                        .reduce(BigDecimal.ZERO, BigDecimal::add)));
        return distributions;
    }

    public BigDecimal totalDistributions() {
        return totals.stream()
                .map(ProjectionPeriodTotal::getDistributions)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
