package com.fundengine.domain.enums;

/**
 * The nullable performance metrics of a MetricsResult. Each may be absent independently.
 */
public enum MetricName {
    IRR,
    TVPI,
    DPI,
    RVPI,
    MOIC,
    CALLED_PERCENT,
    DISTRIBUTED_PERCENT
}
