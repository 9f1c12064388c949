package com.fundengine.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.fundengine.allocation.AllocationConstraints;
import com.fundengine.allocation.AllocationOptimizer;
import com.fundengine.cashflow.CashFlowProcessor;
import com.fundengine.config.IrrSolverConfig;
import com.fundengine.config.ProjectionBeans;
import com.fundengine.config.ProjectionConfig;
import com.fundengine.domain.enums.CashFlowType;
import com.fundengine.domain.enums.MetricName;
import com.fundengine.domain.model.CashFlow;
import com.fundengine.domain.model.Fund;
import com.fundengine.domain.model.MetricsResult;
import com.fundengine.domain.model.ModelingAssumption;
import com.fundengine.metrics.HierarchicalMetricsService;
import com.fundengine.metrics.MetricsAggregator;
import com.fundengine.metrics.MetricsEngine;
import com.fundengine.metrics.XirrSolver;
import com.fundengine.projection.FundProjection;
import com.fundengine.projection.FundProjectionEngine;
import com.fundengine.projection.PortfolioProjectionService;
import com.fundengine.reporting.PortfolioAnalysisReport;
import com.fundengine.reporting.PortfolioAnalyticsService;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Runs the whole analysis pipeline over a small multi-strategy portfolio with the
 * default configuration, wiring the components the way the application context does.
 */
class PortfolioAnalyticsPipelineTest {

    private static final LocalDate AS_OF = LocalDate.of(2024, 12, 31);
    private static final BigDecimal CAPITAL = new BigDecimal("2000000");

    private PortfolioAnalyticsService analyticsService;
    private MetricsAggregator metricsAggregator;

    private final List<Fund> funds = List.of(
            fund("PE-1", "Private Equity", "Buyout", 2018, "10000000"),
            fund("PE-2", "Private Equity", "Growth", 2021, "5000000"),
            fund("VC-1", "Venture Capital", "Early Stage", 2020, "3000000"),
            fund("RE-1", "Real Estate", "Core Plus", 2019, "4000000"));

    @BeforeEach
    void setUp() {
        ProjectionConfig projectionConfig = new ProjectionConfig();
        ProjectionBeans projectionBeans = new ProjectionBeans();
        XirrSolver xirrSolver = new XirrSolver(new IrrSolverConfig());
        metricsAggregator = new MetricsAggregator(xirrSolver);

        analyticsService = new PortfolioAnalyticsService(
                new CashFlowProcessor(),
                new HierarchicalMetricsService(new MetricsEngine(xirrSolver), metricsAggregator),
                new PortfolioProjectionService(
                        new FundProjectionEngine(
                                projectionBeans.strategyShapeTable(projectionConfig),
                                projectionBeans.managementFeeSchedule(projectionConfig)),
                        projectionConfig),
                new AllocationOptimizer(),
                projectionConfig);
    }

    @Test
    void fullPipeline_producesConsistentReport() {
        List<CashFlow> ledger = ledger();
        Map<String, Double> targets = new LinkedHashMap<>();
        targets.put("Private Equity", 0.5);
        targets.put("Venture Capital", 0.2);
        targets.put("Real Estate", 0.3);

        PortfolioAnalysisReport report = analyticsService.analyze(
                funds, ledger, assumptions(), targets, CAPITAL, AllocationConstraints.none(), 20, AS_OF);

        // cash-flow stage ignores the post-as-of entry
        assertThat(report.getCashFlowSummary().getLatestDate()).isBefore(AS_OF.plusDays(1));
        assertThat(report.getCashFlowSummary().getYtdMetrics().getReferenceYear()).isEqualTo(2024);

        // metrics stage
        MetricsResult portfolio = report.getMetrics().getPortfolioResult();
        assertThat(report.getMetrics().getFailedFunds()).isEmpty();
        assertThat(portfolio.getEntityCount()).isEqualTo(4);
        assertThat(portfolio.getTotalCommitment()).isEqualByComparingTo("22000000");
        assertThat(portfolio.getIrr()).isNotNull();
        BigDecimal pooledPaidIn = report.getMetrics().getFundResults().values().stream()
                .map(MetricsResult::getPaidIn)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        assertThat(portfolio.getPaidIn()).isEqualByComparingTo(pooledPaidIn);
        assertThat(portfolio.getTvpi())
                .isCloseTo(portfolio.getDistributions().add(portfolio.getCurrentNav())
                        .divide(portfolio.getPaidIn(), MathContext.DECIMAL64).doubleValue(), within(1e-12));
        assertThat(portfolio.isAbsent(MetricName.DPI)).isFalse();

        // projection stage
        assertThat(report.getProjection().getByFund()).extracting(FundProjection::getFundId)
                .containsExactly("PE-1", "PE-2", "VC-1", "RE-1");
        assertThat(report.getProjection().getTotals()).hasSize(20);
        assertThat(report.getProjection().getTotals())
                .allSatisfy(total -> assertThat(total.getNav()).isGreaterThanOrEqualTo(BigDecimal.ZERO));
        assertThat(report.getProjection().getTotals().get(0).getDate()).isEqualTo(LocalDate.of(2025, 3, 31));

        // allocation stage
        assertThat(report.getCurrentExposures()).containsOnlyKeys("Private Equity", "Real Estate", "Venture Capital");
        assertThat(report.getRecommendedAllocation().keySet())
                .containsExactly("Private Equity", "Venture Capital", "Real Estate");
        BigDecimal allocated = report.getRecommendedAllocation().values().stream()
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        assertThat(allocated).isLessThanOrEqualTo(CAPITAL);
        assertThat(report.getRecommendedAllocation().values())
                .allSatisfy(v -> assertThat(v).isGreaterThanOrEqualTo(BigDecimal.ZERO));
    }

    @Test
    void strategyIrr_matchesPooledFlowsOfItsFunds() {
        PortfolioAnalysisReport report = analyticsService.analyze(
                funds, ledger(), assumptions(), Map.of("Private Equity", 1.0), BigDecimal.ZERO, null, 8, AS_OF);

        List<CashFlow> privateEquityFlows = ledger().stream()
                .filter(cf -> cf.getFundId().startsWith("PE-"))
                .filter(cf -> !cf.getDate().isAfter(AS_OF))
                .toList();
        MetricsResult privateEquity = report.getMetrics().getStrategyResults().get("Private Equity");

        assertThat(privateEquity.getIrr()).isEqualTo(metricsAggregator.aggregateIrr(privateEquityFlows).getRate());
        assertThat(report.getRecommendedAllocation().get("Private Equity")).isEqualByComparingTo(BigDecimal.ZERO);
    }

    private static List<CashFlow> ledger() {
        List<CashFlow> ledger = new ArrayList<>();
        // PE-1: mature buyout fund, mostly called, distributing
        ledger.add(flow("PE-1", "2018-06-30", CashFlowType.CALL_INVESTMENT, "-3000000"));
        ledger.add(flow("PE-1", "2018-06-30", CashFlowType.CALL_FEES, "-50000"));
        ledger.add(flow("PE-1", "2019-09-30", CashFlowType.CALL_INVESTMENT, "-4000000"));
        ledger.add(flow("PE-1", "2021-03-31", CashFlowType.DISTRIBUTION_RETURN_OF_CAPITAL, "2500000"));
        ledger.add(flow("PE-1", "2023-06-30", CashFlowType.DISTRIBUTION_PROFIT, "3500000"));
        ledger.add(flow("PE-1", "2024-09-30", CashFlowType.NAV_UPDATE, "6200000"));
        // PE-2: early growth fund
        ledger.add(flow("PE-2", "2021-09-30", CashFlowType.CALL_INVESTMENT, "-1500000"));
        ledger.add(flow("PE-2", "2022-12-31", CashFlowType.CALL_INVESTMENT, "-1000000"));
        ledger.add(flow("PE-2", "2024-06-30", CashFlowType.DISTRIBUTION_PROFIT, "200000"));
        ledger.add(flow("PE-2", "2024-09-30", CashFlowType.NAV_UPDATE, "2600000"));
        // VC-1: in the J-curve trough
        ledger.add(flow("VC-1", "2020-03-31", CashFlowType.CALL_INVESTMENT, "-1200000"));
        ledger.add(flow("VC-1", "2021-03-31", CashFlowType.CALL_FEES, "-60000"));
        ledger.add(flow("VC-1", "2022-03-31", CashFlowType.CALL_INVESTMENT, "-800000"));
        ledger.add(flow("VC-1", "2024-06-30", CashFlowType.NAV_UPDATE, "1700000"));
        // RE-1: income-producing real estate
        ledger.add(flow("RE-1", "2019-03-31", CashFlowType.CALL_INVESTMENT, "-3500000"));
        ledger.add(flow("RE-1", "2020-12-31", CashFlowType.DISTRIBUTION_PROFIT, "250000"));
        ledger.add(flow("RE-1", "2022-12-31", CashFlowType.DISTRIBUTION_PROFIT, "300000"));
        ledger.add(flow("RE-1", "2024-03-31", CashFlowType.DISTRIBUTION_RETURN_OF_CAPITAL, "900000"));
        ledger.add(flow("RE-1", "2024-09-30", CashFlowType.NAV_UPDATE, "3100000"));
        // booked after the analysis date
        ledger.add(flow("RE-1", "2025-02-15", CashFlowType.DISTRIBUTION_PROFIT, "400000"));
        return ledger;
    }

    private static Map<String, ModelingAssumption> assumptions() {
        return Map.of(
                "Private Equity", assumption("Private Equity", 1.8, 0.15),
                "Venture Capital", assumption("Venture Capital", 2.5, 0.25));
    }

    private static ModelingAssumption assumption(String strategy, double moic, double irr) {
        return ModelingAssumption.builder()
                .strategy(strategy)
                .expectedMoic(moic)
                .targetIrr(irr)
                .investmentPeriodYears(5)
                .fundLifeYears(10)
                .build();
    }

    private static Fund fund(String fundId, String strategy, String subStrategy, int vintage, String commitment) {
        return Fund.builder()
                .fundId(fundId)
                .fundName(fundId + " Partners")
                .vintageYear(vintage)
                .primaryStrategy(strategy)
                .subStrategy(subStrategy)
                .totalCommitment(new BigDecimal(commitment))
                .build();
    }

    private static CashFlow flow(String fundId, String date, CashFlowType type, String amount) {
        return CashFlow.builder()
                .transactionId(fundId + "-" + date + "-" + type.getCode())
                .fundId(fundId)
                .date(LocalDate.parse(date))
                .type(type)
                .amount(new BigDecimal(amount))
                .build();
    }
}
