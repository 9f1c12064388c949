package com.fundengine.metrics;

import com.fundengine.domain.enums.HierarchyLevel;
import com.fundengine.domain.enums.MetricFailureReason;
import com.fundengine.domain.enums.MetricName;
import com.fundengine.domain.model.CashFlow;
import com.fundengine.domain.model.Fund;
import com.fundengine.domain.model.MetricsResult;
import com.fundengine.exception.ValidationException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Computes the full set of performance metrics for a single fund.
 *
 * <p>Dollar totals are exact {@link BigDecimal} sums; the IRR solve works in doubles.
 * Paid-in is the magnitude of all negative flows (investment calls and fees), distributions
 * the sum of all positive flows. Ratios are computed by {@link PerformanceRatios}; a ratio with
 * a non-positive denominator is left null and flagged DIVISION_GUARD. IRR failures leave the
 * IRR null with the solver's reason while every other metric is still computed.
 *
 * <p><b>Terminal mark.</b> The fund's current NAV is treated for IRR purposes as if it were
 * realized on the last transaction date: it is appended as one extra positive flow dated at
 * that date. An unrealized mark is not a cash event, so the resulting IRR is an interim estimate.
 */
@Service
public class MetricsEngine {

    private static final Logger log = LoggerFactory.getLogger(MetricsEngine.class);

    private final XirrSolver xirrSolver;

    public MetricsEngine(XirrSolver xirrSolver) {
        this.xirrSolver = xirrSolver;
    }

    /**
     * Calculates all metrics for one stream of signed, dated cash flows.
     *
     * @param cashFlows signed amounts in chronological order, NAV marks excluded
     * @param dates one date per flow
     * @param totalCommitment committed capital of the entity
     * @param currentNav latest NAV, used as the terminal mark for IRR
     */
    public MetricsResult calculateAllMetrics(
            List<BigDecimal> cashFlows, List<LocalDate> dates, BigDecimal totalCommitment, BigDecimal currentNav) {
        if (cashFlows == null || dates == null || totalCommitment == null || currentNav == null) {
            throw new ValidationException("cashFlows, dates, totalCommitment and currentNav must not be null");
        }

        BigDecimal paidIn = cashFlows.stream()
                .filter(cf -> cf.signum() < 0)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .abs();
        BigDecimal distributions = cashFlows.stream()
                .filter(cf -> cf.signum() > 0)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal totalValue = distributions.add(currentNav);

        MetricsResult.MetricsResultBuilder builder = MetricsResult.builder()
                .level(HierarchyLevel.FUND)
                .entityCount(1)
                .paidIn(paidIn)
                .distributions(distributions)
                .currentNav(currentNav)
                .totalValue(totalValue)
                .totalCommitment(totalCommitment)
                .unfundedCommitment(totalCommitment.subtract(paidIn));

        applyIrr(builder, solveWithTerminalMark(cashFlows, dates, currentNav));
        applyRatios(builder, paidIn, distributions, currentNav, totalCommitment);

        MetricsResult result = builder.build();
        log.debug(
                "Metrics calculated: paidIn={}, distributions={}, nav={}, irr={}, tvpi={}",
                paidIn, distributions, currentNav, result.getIrr(), result.getTvpi());
        return result;
    }

    /**
     * Calculates metrics for a fund from its ledger entries.
     *
     * <p>Entries belonging to other funds are ignored. The current NAV is the most recent
     * NAV_UPDATE amount (zero when the fund has none); NAV entries are excluded from the flow
     * series. Flows are sorted chronologically before the IRR solve.
     */
    public MetricsResult calculateFundMetrics(Fund fund, List<CashFlow> cashFlows) {
        if (fund == null || cashFlows == null) {
            throw new ValidationException("fund and cashFlows must not be null");
        }

        List<CashFlow> fundFlows = cashFlows.stream()
                .filter(cf -> fund.getFundId().equals(cf.getFundId()))
                .sorted(Comparator.comparing(CashFlow::getDate))
                .toList();

        BigDecimal currentNav = latestNav(fundFlows);

        List<BigDecimal> amounts = new ArrayList<>();
        List<LocalDate> dates = new ArrayList<>();
        for (CashFlow cashFlow : fundFlows) {
            if (!cashFlow.isNavUpdate()) {
                amounts.add(cashFlow.getAmount());
                dates.add(cashFlow.getDate());
            }
        }

        BigDecimal commitment = fund.getTotalCommitment() != null ? fund.getTotalCommitment() : BigDecimal.ZERO;

        MetricsResult result = calculateAllMetrics(amounts, dates, commitment, currentNav).toBuilder()
                .entityId(fund.getFundId())
                .build();
        if (result.getIrr() == null
                && result.getFailureReason(MetricName.IRR) != MetricFailureReason.INSUFFICIENT_DATA) {
            log.warn("IRR unavailable for fund {}: {}", fund.getFundId(), result.getFailureReason(MetricName.IRR));
        }
        return result;
    }

    /**
     * Latest NAV mark in a chronologically sorted list; the last entry wins on equal dates.
     */
    static BigDecimal latestNav(List<CashFlow> sortedFlows) {
        BigDecimal nav = BigDecimal.ZERO;
        for (CashFlow cashFlow : sortedFlows) {
            if (cashFlow.isNavUpdate()) {
                nav = cashFlow.getAmount();
            }
        }
        return nav;
    }

    private IrrSolution solveWithTerminalMark(
            List<BigDecimal> cashFlows, List<LocalDate> dates, BigDecimal currentNav) {
        if (cashFlows.isEmpty() || dates.isEmpty()) {
            return IrrSolution.failed(MetricFailureReason.INSUFFICIENT_DATA, 0);
        }
        List<Double> flowsWithMark = new ArrayList<>(cashFlows.size() + 1);
        for (BigDecimal cashFlow : cashFlows) {
            flowsWithMark.add(cashFlow.doubleValue());
        }
        flowsWithMark.add(currentNav.doubleValue());
        List<LocalDate> datesWithMark = new ArrayList<>(dates);
        datesWithMark.add(dates.get(dates.size() - 1));
        return xirrSolver.calculateXirr(flowsWithMark, datesWithMark);
    }

    static void applyIrr(MetricsResult.MetricsResultBuilder builder, IrrSolution irrSolution) {
        if (irrSolution.isConverged()) {
            builder.irr(irrSolution.getRate());
        } else {
            builder.failure(MetricName.IRR, irrSolution.getFailureReason());
        }
    }

    /**
     * Sets every ratio metric on the builder from dollar totals, flagging guarded ones.
     * MOIC uses paid-in as invested capital.
     */
    static void applyRatios(
            MetricsResult.MetricsResultBuilder builder,
            BigDecimal paidIn,
            BigDecimal distributions,
            BigDecimal nav,
            BigDecimal commitment) {
        BigDecimal totalValue = distributions.add(nav);

        Double tvpi = PerformanceRatios.tvpi(totalValue, paidIn);
        Double dpi = PerformanceRatios.dpi(distributions, paidIn);
        Double rvpi = PerformanceRatios.rvpi(nav, paidIn);
        Double moic = PerformanceRatios.moic(totalValue, paidIn);
        Double calledPercent = PerformanceRatios.calledPercent(paidIn, commitment);
        Double distributedPercent = PerformanceRatios.distributedPercent(distributions, commitment);

        builder.tvpi(tvpi).dpi(dpi).rvpi(rvpi).moic(moic).calledPercent(calledPercent).distributedPercent(distributedPercent);

        flagIfAbsent(builder, MetricName.TVPI, tvpi);
        flagIfAbsent(builder, MetricName.DPI, dpi);
        flagIfAbsent(builder, MetricName.RVPI, rvpi);
        flagIfAbsent(builder, MetricName.MOIC, moic);
        flagIfAbsent(builder, MetricName.CALLED_PERCENT, calledPercent);
        flagIfAbsent(builder, MetricName.DISTRIBUTED_PERCENT, distributedPercent);
    }

    private static void flagIfAbsent(MetricsResult.MetricsResultBuilder builder, MetricName metricName, Double value) {
        if (value == null) {
            builder.failure(metricName, MetricFailureReason.DIVISION_GUARD);
        }
    }
}
