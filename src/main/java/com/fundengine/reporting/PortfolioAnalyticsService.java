package com.fundengine.reporting;

import com.fundengine.allocation.AllocationConstraints;
import com.fundengine.allocation.AllocationOptimizer;
import com.fundengine.cashflow.CashFlowProcessor;
import com.fundengine.cashflow.CashFlowSummary;
import com.fundengine.config.ProjectionConfig;
import com.fundengine.domain.enums.AggregationPeriod;
import com.fundengine.domain.model.CashFlow;
import com.fundengine.domain.model.Fund;
import com.fundengine.domain.model.ModelingAssumption;
import com.fundengine.exception.ValidationException;
import com.fundengine.metrics.HierarchicalMetricsService;
import com.fundengine.metrics.HierarchyMetricsReport;
import com.fundengine.projection.FundState;
import com.fundengine.projection.PortfolioProjection;
import com.fundengine.projection.PortfolioProjectionService;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs the full analysis pipeline over one portfolio snapshot.
 *
 * <p>Stages, in order: cash-flow summary, hierarchical metrics, projection from each fund's
 * measured state, then allocation against current NAV and the projected distributions of the
 * configured look-ahead window. Funds whose metrics failed are not projected.
 */
@Service
public class PortfolioAnalyticsService {

    private static final Logger log = LoggerFactory.getLogger(PortfolioAnalyticsService.class);

    private final CashFlowProcessor cashFlowProcessor;
    private final HierarchicalMetricsService hierarchicalMetricsService;
    private final PortfolioProjectionService portfolioProjectionService;
    private final AllocationOptimizer allocationOptimizer;
    private final ProjectionConfig projectionConfig;

    public PortfolioAnalyticsService(
            CashFlowProcessor cashFlowProcessor,
            HierarchicalMetricsService hierarchicalMetricsService,
            PortfolioProjectionService portfolioProjectionService,
            AllocationOptimizer allocationOptimizer,
            ProjectionConfig projectionConfig) {
        this.cashFlowProcessor = cashFlowProcessor;
        this.hierarchicalMetricsService = hierarchicalMetricsService;
        this.portfolioProjectionService = portfolioProjectionService;
        this.allocationOptimizer = allocationOptimizer;
        this.projectionConfig = projectionConfig;
    }

    public PortfolioAnalysisReport analyze(
            List<Fund> funds,
            List<CashFlow> cashFlows,
            Map<String, ModelingAssumption> assumptionsByStrategy,
            Map<String, Double> targetFractions,
            BigDecimal availableCapital,
            AllocationConstraints constraints,
            int numPeriods,
            LocalDate asOfDate) {
        if (funds == null || cashFlows == null || assumptionsByStrategy == null || targetFractions == null) {
            throw new ValidationException("funds, cashFlows, assumptionsByStrategy and targetFractions must not be null");
        }
        if (asOfDate == null) {
            throw new ValidationException("asOfDate must not be null");
        }
        log.info("Starting portfolio analysis for {} funds as of {}", funds.size(), asOfDate);

        List<CashFlow> asOfFlows = cashFlowProcessor.filterByDateRange(cashFlows, null, asOfDate);
        CashFlowSummary summary =
                cashFlowProcessor.generateCashFlowSummary(asOfFlows, true, AggregationPeriod.QUARTERLY, asOfDate);

        HierarchyMetricsReport metrics = hierarchicalMetricsService.calculateHierarchy(funds, asOfFlows);

        List<FundState> fundStates = funds.stream()
                .filter(f -> !metrics.getFailedFunds().contains(f.getFundId()))
                .map(f -> FundState.of(f, metrics.getFundResults().get(f.getFundId())))
                .toList();
        PortfolioProjection projection =
                portfolioProjectionService.projectPortfolio(fundStates, assumptionsByStrategy, numPeriods, asOfDate);

        Map<String, BigDecimal> currentExposures = new LinkedHashMap<>();
        metrics.getStrategyResults().forEach((strategy, result) -> currentExposures.put(strategy, result.getCurrentNav()));
        Map<String, BigDecimal> projectedDistributions =
                projection.distributionsByStrategy(projectionConfig.getDistributionLookaheadQuarters());

        Map<String, BigDecimal> allocation = allocationOptimizer.calculateOptimalAllocation(
                currentExposures, targetFractions, availableCapital, projectedDistributions, constraints);

        log.info("Portfolio analysis complete: {} funds measured, {} projected, {} strategies allocated",
                metrics.getFundResults().size() - metrics.getFailedFunds().size(),
                projection.getByFund().size(),
                allocation.size());

        return PortfolioAnalysisReport.builder()
                .asOfDate(asOfDate)
                .cashFlowSummary(summary)
                .metrics(metrics)
                .projection(projection)
                .currentExposures(currentExposures)
                .projectedDistributions(projectedDistributions)
                .recommendedAllocation(allocation)
                .build();
    }
}
