package com.fundengine.metrics;

import com.fundengine.domain.enums.HierarchyLevel;
import com.fundengine.domain.enums.MetricFailureReason;
import com.fundengine.domain.enums.MetricName;
import com.fundengine.domain.model.CashFlow;
import com.fundengine.domain.model.MetricsResult;
import com.fundengine.exception.ValidationException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Rolls fund-level metrics up to strategy and portfolio level.
 *
 * <p>Dollar totals are summed and every ratio is recomputed from the pooled totals, so a large
 * fund weighs more than a small one. IRR cannot be combined from child IRRs; it needs the
 * union of the underlying dated flows and is only produced by
 * {@link #aggregateMetrics(List, List, HierarchyLevel, String)} or {@link #aggregateIrr(List)}.
 */
@Service
public class MetricsAggregator {

    private static final Logger log = LoggerFactory.getLogger(MetricsAggregator.class);

    static final String PORTFOLIO_ENTITY_ID = "portfolio";

    private final XirrSolver xirrSolver;

    public MetricsAggregator(XirrSolver xirrSolver) {
        this.xirrSolver = xirrSolver;
    }

    /**
     * Portfolio-level roll-up without IRR.
     */
    public MetricsResult aggregateMetrics(List<MetricsResult> results) {
        return aggregateMetrics(results, HierarchyLevel.PORTFOLIO, PORTFOLIO_ENTITY_ID);
    }

    /**
     * Sums dollar fields and recomputes ratios. IRR is left absent with INSUFFICIENT_DATA.
     */
    public MetricsResult aggregateMetrics(List<MetricsResult> results, HierarchyLevel level, String entityId) {
        if (results == null) {
            throw new ValidationException("results must not be null");
        }
        if (results.isEmpty()) {
            return MetricsResult.empty(level, entityId);
        }
        MetricsResult.MetricsResultBuilder builder = pooledTotals(results, level, entityId);
        builder.failure(MetricName.IRR, MetricFailureReason.INSUFFICIENT_DATA);
        return builder.build();
    }

    /**
     * Sums dollar fields, recomputes ratios and solves the pooled IRR over {@code combinedCashFlows}.
     */
    public MetricsResult aggregateMetrics(
            List<MetricsResult> results, List<CashFlow> combinedCashFlows, HierarchyLevel level, String entityId) {
        if (results == null || combinedCashFlows == null) {
            throw new ValidationException("results and combinedCashFlows must not be null");
        }
        if (results.isEmpty()) {
            return MetricsResult.empty(level, entityId);
        }
        MetricsResult.MetricsResultBuilder builder = pooledTotals(results, level, entityId);
        IrrSolution irr = aggregateIrr(combinedCashFlows);
        MetricsEngine.applyIrr(builder, irr);
        if (!irr.isConverged() && irr.getFailureReason() != MetricFailureReason.INSUFFICIENT_DATA) {
            log.warn("Pooled IRR unavailable for {} {}: {}", level, entityId, irr.getFailureReason());
        }
        return builder.build();
    }

    /**
     * Pooled IRR over ledger entries from several funds.
     *
     * <p>Non-NAV entries are sorted by date. The terminal mark is the sum of each fund's
     * latest NAV_UPDATE, dated at the last transaction date.
     */
    public IrrSolution aggregateIrr(List<CashFlow> combinedCashFlows) {
        if (combinedCashFlows == null) {
            throw new ValidationException("combinedCashFlows must not be null");
        }

        List<CashFlow> sorted = combinedCashFlows.stream()
                .sorted(Comparator.comparing(CashFlow::getDate))
                .toList();

        Map<String, BigDecimal> latestNavByFund = new HashMap<>();
        List<Double> amounts = new ArrayList<>();
        List<LocalDate> dates = new ArrayList<>();
        for (CashFlow cashFlow : sorted) {
            if (cashFlow.isNavUpdate()) {
                latestNavByFund.put(cashFlow.getFundId(), cashFlow.getAmount());
            } else {
                amounts.add(cashFlow.getAmount().doubleValue());
                dates.add(cashFlow.getDate());
            }
        }

        if (amounts.isEmpty()) {
            return IrrSolution.failed(MetricFailureReason.INSUFFICIENT_DATA, 0);
        }

        BigDecimal terminalNav = latestNavByFund.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        amounts.add(terminalNav.doubleValue());
        dates.add(dates.get(dates.size() - 1));

        log.debug("Pooled IRR over {} flows from {} funds with terminal NAV {}",
                amounts.size() - 1, latestNavByFund.size(), terminalNav);
        return xirrSolver.calculateXirr(amounts, dates);
    }

    /**
     * Pooled IRR over already-combined signed amounts, terminal mark included by the caller.
     */
    public IrrSolution aggregateIrr(List<Double> amounts, List<LocalDate> dates) {
        return xirrSolver.calculateXirr(amounts, dates);
    }

    private MetricsResult.MetricsResultBuilder pooledTotals(
            List<MetricsResult> results, HierarchyLevel level, String entityId) {
        BigDecimal paidIn = BigDecimal.ZERO;
        BigDecimal distributions = BigDecimal.ZERO;
        BigDecimal nav = BigDecimal.ZERO;
        BigDecimal commitment = BigDecimal.ZERO;
        int entityCount = 0;
        for (MetricsResult result : results) {
            paidIn = paidIn.add(result.getPaidIn());
            distributions = distributions.add(result.getDistributions());
            nav = nav.add(result.getCurrentNav());
            commitment = commitment.add(result.getTotalCommitment());
            entityCount += result.getEntityCount();
        }

        MetricsResult.MetricsResultBuilder builder = MetricsResult.builder()
                .level(level)
                .entityId(entityId)
                .entityCount(entityCount)
                .paidIn(paidIn)
                .distributions(distributions)
                .currentNav(nav)
                .totalValue(distributions.add(nav))
                .totalCommitment(commitment)
                .unfundedCommitment(commitment.subtract(paidIn));
        MetricsEngine.applyRatios(builder, paidIn, distributions, nav, commitment);

        log.debug("Aggregated {} results into {} {}: paidIn={}, nav={}", results.size(), level, entityId, paidIn, nav);
        return builder;
    }
}
