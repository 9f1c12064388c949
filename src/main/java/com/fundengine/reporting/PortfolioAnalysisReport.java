package com.fundengine.reporting;

import com.fundengine.cashflow.CashFlowSummary;
import com.fundengine.metrics.HierarchyMetricsReport;
import com.fundengine.projection.PortfolioProjection;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Output of one end-to-end portfolio analysis run.
 */
@Value
@Builder
public class PortfolioAnalysisReport {

    LocalDate asOfDate;
    CashFlowSummary cashFlowSummary;
    HierarchyMetricsReport metrics;
    PortfolioProjection projection;

    /** Current NAV per strategy. */
    Map<String, BigDecimal> currentExposures;

    /** Projected distributions per strategy over the look-ahead window. */
    Map<String, BigDecimal> projectedDistributions;

    Map<String, BigDecimal> recommendedAllocation;
}
