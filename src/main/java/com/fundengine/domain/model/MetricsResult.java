package com.fundengine.domain.model;

import com.fundengine.domain.enums.HierarchyLevel;
import com.fundengine.domain.enums.MetricFailureReason;
import com.fundengine.domain.enums.MetricName;
import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Performance metrics for one entity (a fund or a roll-up of funds).
 *
 * <p>Dollar fields are always present and default to zero. Ratio metrics and IRR are null
 * when they cannot be computed; every null metric has an entry in {@code failures} explaining
 * why. Instances are created fresh for each computation and never modified.
 */
@Value
@Builder(toBuilder = true)
public class MetricsResult {

    HierarchyLevel level;
    String entityId;

    /** Number of funds behind this result (1 for a fund). */
    int entityCount;

    @Builder.Default
    BigDecimal paidIn = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal distributions = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal currentNav = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal totalValue = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal totalCommitment = BigDecimal.ZERO;

    /** Commitment less paid-in; negative for an over-called fund. */
    @Builder.Default
    BigDecimal unfundedCommitment = BigDecimal.ZERO;

    Double irr;
    Double tvpi;
    Double dpi;
    Double rvpi;
    Double moic;
    Double calledPercent;
    Double distributedPercent;

    @Singular
    Map<MetricName, MetricFailureReason> failures;

    public Double getMetric(MetricName metricName) {
        return switch (metricName) {
            case IRR -> irr;
            case TVPI -> tvpi;
            case DPI -> dpi;
            case RVPI -> rvpi;
            case MOIC -> moic;
            case CALLED_PERCENT -> calledPercent;
            case DISTRIBUTED_PERCENT -> distributedPercent;
        };
    }

    public boolean isAbsent(MetricName metricName) {
        return getMetric(metricName) == null;
    }

    /** Reason the metric is absent, or null if it was computed. */
    public MetricFailureReason getFailureReason(MetricName metricName) {
        return failures.get(metricName);
    }

    /**
     * Result for an entity with nothing to measure: zero totals, every metric absent
     * with INSUFFICIENT_DATA.
     */
    public static MetricsResult empty(HierarchyLevel level, String entityId) {
        Map<MetricName, MetricFailureReason> failures = new EnumMap<>(MetricName.class);
        for (MetricName metricName : MetricName.values()) {
            failures.put(metricName, MetricFailureReason.INSUFFICIENT_DATA);
        }
        return MetricsResult.builder()
                .level(level)
                .entityId(entityId)
                .entityCount(0)
                .failures(failures)
                .build();
    }
}
