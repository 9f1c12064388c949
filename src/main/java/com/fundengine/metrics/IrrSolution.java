package com.fundengine.metrics;

import com.fundengine.domain.enums.MetricFailureReason;
import java.util.Optional;
import lombok.Getter;

/**
 * Outcome of an XIRR solve: either a converged rate or the reason there is none.
 *
 * <p>Solver failures are ordinary outcomes here, never exceptions.
 */
@Getter
public class IrrSolution {

    private final Double rate;
    private final int iterations;
    private final MetricFailureReason failureReason;

    private IrrSolution(Double rate, int iterations, MetricFailureReason failureReason) {
        this.rate = rate;
        this.iterations = iterations;
        this.failureReason = failureReason;
    }

    public static IrrSolution converged(double rate, int iterations) {
        return new IrrSolution(rate, iterations, null);
    }

    public static IrrSolution failed(MetricFailureReason failureReason, int iterations) {
        return new IrrSolution(null, iterations, failureReason);
    }

    public boolean isConverged() {
        return rate != null;
    }

    public Optional<Double> asOptional() {
        return Optional.ofNullable(rate);
    }

    @Override
    public String toString() {
        return isConverged()
                ? "IrrSolution[rate=" + rate + ", iterations=" + iterations + "]"
                : "IrrSolution[failed=" + failureReason + ", iterations=" + iterations + "]";
    }
}
