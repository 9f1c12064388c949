package com.fundengine.projection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Pacing curves used to spread capital calls and distributions across projection quarters.
 *
 * <p>Both generators return weights that sum to 1.0. If the raw weights sum to zero the
 * result is all zeros; a non-positive period count yields an empty list.
 */
public final class CashFlowShapes {

    /** Raw weight for quarters before the distribution trough. */
    static final double PRE_TROUGH_WEIGHT = 0.01;

    private CashFlowShapes() {}

    /**
     * Logistic S-curve centered at {@code peakPeriod}: w_i = 1 / (1 + e^-x) with
     * x = (i - peakPeriod) / (n / steepness). Higher steepness concentrates deployment
     * around the peak.
     */
    public static List<Double> generateSCurve(int numPeriods, int peakPeriod, double steepness) {
        if (numPeriods <= 0) {
            return Collections.emptyList();
        }
        double[] raw = new double[numPeriods];
        double scale = numPeriods / steepness;
        for (int i = 0; i < numPeriods; i++) {
            double x = (i - peakPeriod) / scale;
            raw[i] = 1.0 / (1.0 + Math.exp(-x));
        }
        return normalize(raw);
    }

    /**
     * Back-loaded J-curve: a flat 0.01 before {@code troughPeriod}, then
     * exp(((i - troughPeriod) / recoverySteepness) / n) from the trough on.
     */
    public static List<Double> generateJCurve(int numPeriods, int troughPeriod, double recoverySteepness) {
        if (numPeriods <= 0) {
            return Collections.emptyList();
        }
        double[] raw = new double[numPeriods];
        for (int i = 0; i < numPeriods; i++) {
            if (i < troughPeriod) {
                raw[i] = PRE_TROUGH_WEIGHT;
            } else {
                double x = (i - troughPeriod) / recoverySteepness;
                raw[i] = Math.exp(x / numPeriods);
            }
        }
        return normalize(raw);
    }

    private static List<Double> normalize(double[] raw) {
        double total = 0.0;
        for (double value : raw) {
            total += value;
        }
        List<Double> weights = new ArrayList<>(raw.length);
        for (double value : raw) {
            weights.add(total > 0 ? value / total : 0.0);
        }
        return weights;
    }
}
