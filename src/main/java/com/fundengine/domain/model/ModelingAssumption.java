package com.fundengine.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Per-strategy forecasting parameters maintained by the investment team.
 *
 * <p>expectedMoic and targetIrr drive the projection. The remaining fields describe the
 * strategy's fund lifecycle and initial NAV markdown as recorded in the assumptions table;
 * the quarterly NAV markdown applied by the projection comes from the strategy's
 * shape profile (jCurveDepth), not from navInitialQtrDepreciation.
 */
@Value
@Builder
public class ModelingAssumption {

    String strategy;
    double expectedMoic;

    /** Annual target IRR as a decimal (0.15 = 15%). */
    double targetIrr;

    int investmentPeriodYears;
    int fundLifeYears;

    /** Quarterly NAV change during the initial markdown phase, e.g. -0.0150. */
    double navInitialQtrDepreciation;

    int navInitialDepreciationQtrs;
}
