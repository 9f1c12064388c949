package com.fundengine.domain.enums;

/**
 * Levels at which performance metrics are reported, from a single fund up to the whole portfolio.
 */
public enum HierarchyLevel {
    FUND,
    SUB_STRATEGY,
    STRATEGY,
    PORTFOLIO
}
