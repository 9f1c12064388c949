package com.fundengine.projection;

import lombok.Builder;
import lombok.Value;

/**
 * Cash-flow pacing parameters for one strategy.
 *
 * <p>Peak and trough are expressed as fractions of the projection horizon so one profile
 * serves any number of quarters.
 */
@Value
@Builder
public class StrategyShapeProfile {

    String strategy;

    /** Fraction of the horizon at which capital calls peak. */
    double callPeakFraction;

    double callSteepness;

    /** Fraction of the horizon at which distributions start to ramp up. */
    double distTroughFraction;

    double distSteepness;

    /** Annual NAV markdown applied quarterly before the distribution trough. */
    double jCurveDepth;

    public int callPeakPeriod(int numPeriods) {
        return (int) Math.floor(numPeriods * callPeakFraction);
    }

    public int distTroughPeriod(int numPeriods) {
        return (int) Math.floor(numPeriods * distTroughFraction);
    }
}
