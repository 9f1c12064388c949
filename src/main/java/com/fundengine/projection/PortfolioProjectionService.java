package com.fundengine.projection;

import com.fundengine.config.ProjectionConfig;
import com.fundengine.domain.model.Fund;
import com.fundengine.domain.model.ModelingAssumption;
import com.fundengine.domain.model.ProjectionPeriod;
import com.fundengine.exception.ValidationException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Projects every fund in a portfolio and rolls the results up per quarter, overall and
 * per strategy.
 *
 * <p>Each fund uses the modeling assumption of its primary strategy; strategies without an
 * assumption use the configured default MOIC and target IRR. A fund whose projection fails
 * is logged, named in {@link PortfolioProjection#getFailedFunds()} and left out of the totals.
 */
@Service
public class PortfolioProjectionService {

    private static final Logger log = LoggerFactory.getLogger(PortfolioProjectionService.class);

    static final String UNSPECIFIED_STRATEGY = "unspecified";

    private final FundProjectionEngine fundProjectionEngine;
    private final ProjectionConfig projectionConfig;

    public PortfolioProjectionService(FundProjectionEngine fundProjectionEngine, ProjectionConfig projectionConfig) {
        this.fundProjectionEngine = fundProjectionEngine;
        this.projectionConfig = projectionConfig;
    }

    /**
     * Projects over the configured default horizon.
     */
    public PortfolioProjection projectPortfolio(
            List<FundState> fundStates, Map<String, ModelingAssumption> assumptionsByStrategy, LocalDate asOfDate) {
        return projectPortfolio(fundStates, assumptionsByStrategy, projectionConfig.getDefaultQuarters(), asOfDate);
    }

    public PortfolioProjection projectPortfolio(
            List<FundState> fundStates,
            Map<String, ModelingAssumption> assumptionsByStrategy,
            int numPeriods,
            LocalDate asOfDate) {
        if (fundStates == null || assumptionsByStrategy == null) {
            throw new ValidationException("fundStates and assumptionsByStrategy must not be null");
        }
        if (fundStates.isEmpty()) {
            return PortfolioProjection.empty();
        }

        List<FundProjection> fundProjections = new ArrayList<>();
        List<String> failedFunds = new ArrayList<>();

        for (FundState fundState : fundStates) {
            Fund fund = fundState.getFund();
            try {
                fundProjections.add(projectFund(fundState, assumptionsByStrategy, numPeriods, asOfDate));
            } catch (RuntimeException e) {
                log.warn("Failed to project fund {}: {}", fund.getFundId(), e.getMessage());
                failedFunds.add(fund.getFundId());
            }
        }

        // Roll up per quarter, overall and per strategy
        Map<Integer, PeriodAccumulator> totals = new TreeMap<>();
        Map<String, Map<Integer, PeriodAccumulator>> strategyTotals = new TreeMap<>();
        for (FundProjection fundProjection : fundProjections) {
            Map<Integer, PeriodAccumulator> strategyBuckets =
                    strategyTotals.computeIfAbsent(fundProjection.getStrategy(), s -> new TreeMap<>());
            for (ProjectionPeriod period : fundProjection.getPeriods()) {
                totals.computeIfAbsent(period.getPeriodIndex(), i -> new PeriodAccumulator(i, period.getDate()))
                        .add(period);
                strategyBuckets.computeIfAbsent(period.getPeriodIndex(), i -> new PeriodAccumulator(i, period.getDate()))
                        .add(period);
            }
        }

        Map<String, List<ProjectionPeriodTotal>> byStrategy = new LinkedHashMap<>();
        strategyTotals.forEach((strategy, buckets) -> byStrategy.put(strategy, toTotals(buckets)));

        log.info("Portfolio projection complete: {} funds over {} quarters, {} strategies, {} failed",
                fundProjections.size(), numPeriods, byStrategy.size(), failedFunds.size());

        return PortfolioProjection.builder()
                .totals(toTotals(totals))
                .byStrategy(Collections.unmodifiableMap(byStrategy))
                .byFund(List.copyOf(fundProjections))
                .failedFunds(List.copyOf(failedFunds))
                .build();
    }

    private FundProjection projectFund(
            FundState fundState,
            Map<String, ModelingAssumption> assumptionsByStrategy,
            int numPeriods,
            LocalDate asOfDate) {
        Fund fund = fundState.getFund();
        String strategy = fund.getPrimaryStrategy() != null ? fund.getPrimaryStrategy() : UNSPECIFIED_STRATEGY;

        ModelingAssumption assumption = assumptionsByStrategy.get(strategy);
        double expectedMoic = assumption != null ? assumption.getExpectedMoic() : projectionConfig.getDefaultExpectedMoic();
        double targetIrr = assumption != null ? assumption.getTargetIrr() : projectionConfig.getDefaultTargetIrr();
        if (assumption == null) {
            log.debug("No modeling assumption for strategy {}, using defaults for fund {}", strategy, fund.getFundId());
        }

        FundProjectionRequest request = FundProjectionRequest.builder()
                .unfundedCommitment(fundState.getUnfundedCommitment())
                .currentNav(fundState.getCurrentNav())
                .expectedMoic(expectedMoic)
                .targetIrr(targetIrr)
                .strategy(fund.getPrimaryStrategy())
                .numPeriods(numPeriods)
                .vintageYear(fund.getVintageYear())
                .asOfDate(asOfDate)
                .build();

        return FundProjection.builder()
                .fundId(fund.getFundId())
                .fundName(fund.getFundName())
                .strategy(strategy)
                .periods(fundProjectionEngine.projectFund(request))
                .build();
    }

    private static List<ProjectionPeriodTotal> toTotals(Map<Integer, PeriodAccumulator> buckets) {
        return buckets.values().stream().map(PeriodAccumulator::toTotal).toList();
    }

    private static final class PeriodAccumulator {

        private final int periodIndex;
        private final LocalDate date;
        private BigDecimal calls = BigDecimal.ZERO;
        private BigDecimal fees = BigDecimal.ZERO;
        private BigDecimal distributions = BigDecimal.ZERO;
        private BigDecimal nav = BigDecimal.ZERO;

        private PeriodAccumulator(int periodIndex, LocalDate date) {
            this.periodIndex = periodIndex;
            this.date = date;
        }

        private void add(ProjectionPeriod period) {
            calls = calls.subtract(period.getCallInvestment());
            fees = fees.subtract(period.getManagementFees());
            distributions = distributions.add(period.getDistribution());
            nav = nav.add(period.getNav());
        }

        private ProjectionPeriodTotal toTotal() {
            return ProjectionPeriodTotal.builder()
                    .periodIndex(periodIndex)
                    .date(date)
                    .calls(calls)
                    .fees(fees)
                    .distributions(distributions)
                    .nav(nav)
                    .build();
        }
    }
}
