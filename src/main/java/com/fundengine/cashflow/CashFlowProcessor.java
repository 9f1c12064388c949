package com.fundengine.cashflow;

import com.fundengine.domain.enums.AggregationPeriod;
import com.fundengine.domain.model.CashFlow;
import com.fundengine.exception.ValidationException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Aggregation, filtering and J-curve analysis over collections of {@link CashFlow} records.
 *
 * <p>All sums work on the raw signed amounts. NAV_UPDATE entries are valuation marks and are
 * left out of every total, bucket and running balance; the date and fund filters keep them.
 *
 * <p>Period keys are built by {@link #periodKey(LocalDate, AggregationPeriod)} and kept in a
 * {@link TreeMap}, so periods come back in lexicographic order. That order is chronological
 * for four-digit years in all three key formats.
 */
@Service
public class CashFlowProcessor {

    private static final Logger log = LoggerFactory.getLogger(CashFlowProcessor.class);

    static final String ALL_TIME_KEY = "all_time";

    /**
     * Sums signed amounts per period bucket.
     *
     * @return period key to net amount, sorted by key
     */
    public Map<String, BigDecimal> aggregateByPeriod(List<CashFlow> cashFlows, AggregationPeriod period) {
        requireNonNull(cashFlows, "cashFlows");
        requireNonNull(period, "period");

        Map<String, BigDecimal> aggregated = new TreeMap<>();
        for (CashFlow cashFlow : cashFlows) {
            if (cashFlow.isNavUpdate()) {
                continue;
            }
            aggregated.merge(periodKey(cashFlow.getDate(), period), cashFlow.getAmount(), BigDecimal::add);
        }

        log.debug("Aggregated {} cash flows into {} {} periods", cashFlows.size(), aggregated.size(), period);
        return aggregated;
    }

    /**
     * Returns the running net cash position after each flow, oldest first.
     * Flows sharing a date keep their input order.
     */
    public List<CumulativeCashFlow> calculateCumulativeCashFlows(List<CashFlow> cashFlows) {
        requireNonNull(cashFlows, "cashFlows");

        List<CashFlow> sorted = cashFlows.stream()
                .filter(cf -> !cf.isNavUpdate())
                .sorted(Comparator.comparing(CashFlow::getDate))
                .toList();

        List<CumulativeCashFlow> series = new ArrayList<>(sorted.size());
        BigDecimal runningTotal = BigDecimal.ZERO;
        for (CashFlow cashFlow : sorted) {
            runningTotal = runningTotal.add(cashFlow.getAmount());
            series.add(new CumulativeCashFlow(cashFlow.getDate(), runningTotal));
        }
        return series;
    }

    /**
     * Partitions flows by sign. With {@code includeFees=false}, fee calls are dropped from the
     * calls partition. Zero amounts and NAV marks land in neither partition.
     */
    public CallsAndDistributions separateCallsAndDistributions(List<CashFlow> cashFlows, boolean includeFees) {
        requireNonNull(cashFlows, "cashFlows");

        List<CashFlow> calls = new ArrayList<>();
        List<CashFlow> distributions = new ArrayList<>();

        for (CashFlow cashFlow : cashFlows) {
            if (cashFlow.isCall()) {
                if (includeFees || !cashFlow.isFee()) {
                    calls.add(cashFlow);
                }
            } else if (cashFlow.isDistribution()) {
                distributions.add(cashFlow);
            }
        }

        log.debug("Separated into {} calls and {} distributions", calls.size(), distributions.size());
        return new CallsAndDistributions(List.copyOf(calls), List.copyOf(distributions));
    }

    /**
     * Net cash flow = sum of distributions - sum of |calls|. Positive once distributions exceed calls.
     */
    public BigDecimal calculateNetCashFlow(List<CashFlow> calls, List<CashFlow> distributions) {
        requireNonNull(calls, "calls");
        requireNonNull(distributions, "distributions");
        return sumAmounts(distributions).subtract(sumMagnitudes(calls));
    }

    /**
     * Keeps flows dated within [startDate, endDate]. A null bound is open.
     */
    public List<CashFlow> filterByDateRange(List<CashFlow> cashFlows, LocalDate startDate, LocalDate endDate) {
        requireNonNull(cashFlows, "cashFlows");

        List<CashFlow> filtered = cashFlows.stream()
                .filter(cf -> startDate == null || !cf.getDate().isBefore(startDate))
                .filter(cf -> endDate == null || !cf.getDate().isAfter(endDate))
                .toList();

        log.debug("Filtered to {} cash flows between {} and {}", filtered.size(), startDate, endDate);
        return filtered;
    }

    public List<CashFlow> filterByFund(List<CashFlow> cashFlows, Collection<String> fundIds) {
        requireNonNull(cashFlows, "cashFlows");
        requireNonNull(fundIds, "fundIds");

        Set<String> wanted = Set.copyOf(fundIds);
        List<CashFlow> filtered =
                cashFlows.stream().filter(cf -> wanted.contains(cf.getFundId())).toList();

        log.debug("Filtered to {} cash flows for {} funds", filtered.size(), wanted.size());
        return filtered;
    }

    /**
     * Net flow per period with the cumulative net flow through each period, in period order.
     * The cumulative series dips while capital is being called and recovers as distributions
     * arrive.
     */
    public List<JCurvePoint> calculateJCurve(List<CashFlow> cashFlows, AggregationPeriod period) {
        Map<String, BigDecimal> aggregated = aggregateByPeriod(cashFlows, period);

        List<JCurvePoint> jCurve = new ArrayList<>(aggregated.size());
        BigDecimal cumulative = BigDecimal.ZERO;
        for (Map.Entry<String, BigDecimal> entry : aggregated.entrySet()) {
            cumulative = cumulative.add(entry.getValue());
            jCurve.add(new JCurvePoint(entry.getKey(), entry.getValue(), cumulative));
        }

        log.debug("Generated J-curve with {} points", jCurve.size());
        return jCurve;
    }

    /**
     * Cash activity from January 1 of the reference date's year through the reference date,
     * inclusive. Fees count as calls.
     */
    public YtdMetrics calculateYtdMetrics(List<CashFlow> cashFlows, LocalDate referenceDate) {
        requireNonNull(referenceDate, "referenceDate");

        LocalDate yearStart = LocalDate.of(referenceDate.getYear(), 1, 1);
        List<CashFlow> ytdFlows = filterByDateRange(cashFlows, yearStart, referenceDate).stream()
                .filter(cf -> !cf.isNavUpdate())
                .toList();
        CallsAndDistributions split = separateCallsAndDistributions(ytdFlows, true);

        BigDecimal totalCalls = sumMagnitudes(split.getCalls());
        BigDecimal totalDistributions = sumAmounts(split.getDistributions());

        return YtdMetrics.builder()
                .calls(totalCalls)
                .distributions(totalDistributions)
                .netFlow(totalDistributions.subtract(totalCalls))
                .transactionCount(ytdFlows.size())
                .referenceYear(referenceDate.getYear())
                .build();
    }

    /**
     * Summary with YTD activity measured up to the latest flow date.
     */
    public CashFlowSummary generateCashFlowSummary(
            List<CashFlow> cashFlows, boolean includeFees, AggregationPeriod period) {
        requireNonNull(cashFlows, "cashFlows");
        LocalDate latest =
                cashFlows.stream().map(CashFlow::getDate).max(Comparator.naturalOrder()).orElse(null);
        return generateCashFlowSummary(cashFlows, includeFees, period, latest);
    }

    /**
     * Builds the full cash-flow report: call/distribution totals and counts, date span,
     * per-period aggregation, J-curve and YTD activity as of {@code referenceDate}.
     *
     * <p>{@code includeFees} only affects the call totals; the per-period and J-curve series
     * always carry every cash movement. A null reference date (no flows) yields empty YTD figures.
     */
    public CashFlowSummary generateCashFlowSummary(
            List<CashFlow> cashFlows, boolean includeFees, AggregationPeriod period, LocalDate referenceDate) {
        CallsAndDistributions split = separateCallsAndDistributions(cashFlows, includeFees);

        BigDecimal totalCalls = sumMagnitudes(split.getCalls());
        BigDecimal totalDistributions = sumAmounts(split.getDistributions());

        LocalDate earliest =
                cashFlows.stream().map(CashFlow::getDate).min(Comparator.naturalOrder()).orElse(null);
        LocalDate latest =
                cashFlows.stream().map(CashFlow::getDate).max(Comparator.naturalOrder()).orElse(null);

        YtdMetrics ytd = referenceDate != null
                ? calculateYtdMetrics(cashFlows, referenceDate)
                : YtdMetrics.builder()
                        .calls(BigDecimal.ZERO)
                        .distributions(BigDecimal.ZERO)
                        .netFlow(BigDecimal.ZERO)
                        .transactionCount(0)
                        .build();

        CashFlowSummary summary = CashFlowSummary.builder()
                .totalCalls(totalCalls)
                .totalDistributions(totalDistributions)
                .netCashFlow(totalDistributions.subtract(totalCalls))
                .callCount(split.getCalls().size())
                .distributionCount(split.getDistributions().size())
                .totalTransactions(cashFlows.size())
                .earliestDate(earliest)
                .latestDate(latest)
                .period(period)
                .aggregatedByPeriod(aggregateByPeriod(cashFlows, period))
                .jCurve(calculateJCurve(cashFlows, period))
                .ytdMetrics(ytd)
                .build();

        log.debug("Generated cash flow summary for {} transactions", cashFlows.size());
        return summary;
    }

    /**
     * Bucket key for a date: "YYYY", "YYYY-Qn", "YYYY-MM" or "all_time".
     */
    static String periodKey(LocalDate date, AggregationPeriod period) {
        return switch (period) {
            case YEARLY -> String.valueOf(date.getYear());
            case QUARTERLY -> date.getYear() + "-Q" + ((date.getMonthValue() - 1) / 3 + 1);
            case MONTHLY -> date.getYear() + "-" + String.format("%02d", date.getMonthValue());
            case ALL_TIME -> ALL_TIME_KEY;
        };
    }

    private static BigDecimal sumAmounts(List<CashFlow> cashFlows) {
        return cashFlows.stream().map(CashFlow::getAmount).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static BigDecimal sumMagnitudes(List<CashFlow> cashFlows) {
        return cashFlows.stream()
                .map(CashFlow::getAmount)
                .map(BigDecimal::abs)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static void requireNonNull(Object value, String name) {
        if (value == null) {
            throw new ValidationException(name + " must not be null");
        }
    }
}
