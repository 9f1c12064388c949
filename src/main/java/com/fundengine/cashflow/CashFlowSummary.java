package com.fundengine.cashflow;

import com.fundengine.domain.enums.AggregationPeriod;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Combined cash-flow report: totals and counts, per-period aggregation, J-curve and YTD activity.
 *
 * <p>totalCalls is a positive magnitude. earliestDate/latestDate are null when there are no flows.
 */
@Value
@Builder
public class CashFlowSummary {

    BigDecimal totalCalls;
    BigDecimal totalDistributions;
    BigDecimal netCashFlow;
    int callCount;
    int distributionCount;
    int totalTransactions;
    LocalDate earliestDate;
    LocalDate latestDate;
    AggregationPeriod period;
    Map<String, BigDecimal> aggregatedByPeriod;
    List<JCurvePoint> jCurve;
    YtdMetrics ytdMetrics;
}
