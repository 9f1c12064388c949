package com.fundengine.metrics;

import com.fundengine.domain.model.MetricsResult;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Metrics at every level of the fund hierarchy.
 *
 * <p>Sub-strategy keys are "strategy/subStrategy". Funds listed in {@code failedFunds} still
 * appear in {@code fundResults} with ENTITY_FAILURE reasons but are left out of every roll-up.
 */
@Value
@Builder
public class HierarchyMetricsReport {

    Map<String, MetricsResult> fundResults;
    Map<String, MetricsResult> subStrategyResults;
    Map<String, MetricsResult> strategyResults;
    MetricsResult portfolioResult;
    List<String> failedFunds;

    public boolean hasFailures() {
        return !failedFunds.isEmpty();
    }
}
