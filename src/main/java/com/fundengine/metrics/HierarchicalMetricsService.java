package com.fundengine.metrics;

import com.fundengine.domain.enums.HierarchyLevel;
import com.fundengine.domain.enums.MetricFailureReason;
import com.fundengine.domain.enums.MetricName;
import com.fundengine.domain.model.CashFlow;
import com.fundengine.domain.model.Fund;
import com.fundengine.domain.model.MetricsResult;
import com.fundengine.exception.ValidationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Computes fund metrics and rolls them up through sub-strategy, strategy and portfolio.
 *
 * <p>Each roll-up carries a pooled IRR solved over the combined ledger of its funds.
 * A fund whose computation throws is reported with ENTITY_FAILURE and excluded from the
 * roll-ups; the remaining funds are still processed. Fund ids must be unique.
 */
@Service
public class HierarchicalMetricsService {

    private static final Logger log = LoggerFactory.getLogger(HierarchicalMetricsService.class);

    static final String UNSPECIFIED = "unspecified";

    private final MetricsEngine metricsEngine;
    private final MetricsAggregator metricsAggregator;

    public HierarchicalMetricsService(MetricsEngine metricsEngine, MetricsAggregator metricsAggregator) {
        this.metricsEngine = metricsEngine;
        this.metricsAggregator = metricsAggregator;
    }

    public HierarchyMetricsReport calculateHierarchy(List<Fund> funds, List<CashFlow> cashFlows) {
        if (funds == null || cashFlows == null) {
            throw new ValidationException("funds and cashFlows must not be null");
        }
        rejectDuplicateFundIds(funds);

        Map<String, MetricsResult> fundResults = new LinkedHashMap<>();
        List<String> failedFunds = new ArrayList<>();
        List<Fund> measuredFunds = new ArrayList<>();

        for (Fund fund : funds) {
            try {
                fundResults.put(fund.getFundId(), metricsEngine.calculateFundMetrics(fund, cashFlows));
                measuredFunds.add(fund);
            } catch (RuntimeException e) {
                log.warn("Failed to calculate metrics for fund {}: {}", fund.getFundId(), e.getMessage());
                fundResults.put(fund.getFundId(), failedFundResult(fund.getFundId()));
                failedFunds.add(fund.getFundId());
            }
        }

        Map<String, List<Fund>> bySubStrategy = measuredFunds.stream()
                .collect(Collectors.groupingBy(
                        f -> strategyOf(f) + "/" + subStrategyOf(f), TreeMap::new, Collectors.toList()));
        Map<String, List<Fund>> byStrategy = measuredFunds.stream()
                .collect(Collectors.groupingBy(this::strategyOf, TreeMap::new, Collectors.toList()));

        Map<String, MetricsResult> subStrategyResults = new LinkedHashMap<>();
        bySubStrategy.forEach((key, group) ->
                subStrategyResults.put(key, rollUp(group, fundResults, cashFlows, HierarchyLevel.SUB_STRATEGY, key)));

        Map<String, MetricsResult> strategyResults = new LinkedHashMap<>();
        byStrategy.forEach((key, group) ->
                strategyResults.put(key, rollUp(group, fundResults, cashFlows, HierarchyLevel.STRATEGY, key)));

        MetricsResult portfolioResult = rollUp(
                measuredFunds, fundResults, cashFlows, HierarchyLevel.PORTFOLIO, MetricsAggregator.PORTFOLIO_ENTITY_ID);

        log.info("Hierarchy metrics calculated for {} funds ({} failed), {} strategies",
                funds.size(), failedFunds.size(), strategyResults.size());

        return HierarchyMetricsReport.builder()
                .fundResults(Collections.unmodifiableMap(fundResults))
                .subStrategyResults(Collections.unmodifiableMap(subStrategyResults))
                .strategyResults(Collections.unmodifiableMap(strategyResults))
                .portfolioResult(portfolioResult)
                .failedFunds(List.copyOf(failedFunds))
                .build();
    }

    private MetricsResult rollUp(
            List<Fund> group,
            Map<String, MetricsResult> fundResults,
            List<CashFlow> cashFlows,
            HierarchyLevel level,
            String entityId) {
        Set<String> fundIds = group.stream().map(Fund::getFundId).collect(Collectors.toSet());
        List<MetricsResult> children = group.stream().map(f -> fundResults.get(f.getFundId())).toList();
        List<CashFlow> combined = cashFlows.stream().filter(cf -> fundIds.contains(cf.getFundId())).toList();
        return metricsAggregator.aggregateMetrics(children, combined, level, entityId);
    }

    private static void rejectDuplicateFundIds(List<Fund> funds) {
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new TreeSet<>();
        for (Fund fund : funds) {
            if (!seen.add(fund.getFundId())) {
                duplicates.add(fund.getFundId());
            }
        }
        if (!duplicates.isEmpty()) {
            throw new ValidationException(
                    "Fund ids must be unique", Map.of("duplicateFundIds", List.copyOf(duplicates)));
        }
    }

    private String strategyOf(Fund fund) {
        return fund.getPrimaryStrategy() != null ? fund.getPrimaryStrategy() : UNSPECIFIED;
    }

    private String subStrategyOf(Fund fund) {
        return fund.getSubStrategy() != null ? fund.getSubStrategy() : UNSPECIFIED;
    }

    private static MetricsResult failedFundResult(String fundId) {
        Map<MetricName, MetricFailureReason> failures = new EnumMap<>(MetricName.class);
        for (MetricName metricName : MetricName.values()) {
            failures.put(metricName, MetricFailureReason.ENTITY_FAILURE);
        }
        return MetricsResult.builder()
                .level(HierarchyLevel.FUND)
                .entityId(fundId)
                .entityCount(1)
                .failures(failures)
                .build();
    }
}
