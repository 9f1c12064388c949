package com.fundengine.metrics;

import com.fundengine.config.IrrSolverConfig;
import com.fundengine.domain.enums.MetricFailureReason;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Newton-Raphson solver for the internal rate of return of irregularly dated cash flows (XIRR).
 *
 * <p>Finds r such that sum(cf_i / (1 + r)^t_i) = 0, where t_i is the Actual/365.25 year
 * fraction between dates[0] and dates[i]. The first date is the time origin, so callers
 * pass flows in chronological order.
 *
 * <p>Stops without a rate when:
 * <ul>
 *   <li>fewer than 2 flows, or flows and dates differ in length (INSUFFICIENT_DATA)</li>
 *   <li>|dNPV| falls below the tolerance (NON_CONVERGENCE)</li>
 *   <li>the iteration limit is reached before |NPV| &lt; tolerance (NON_CONVERGENCE)</li>
 *   <li>the rate leaves [-0.99, 10] or any intermediate value is not finite (NUMERIC_INSTABILITY)</li>
 * </ul>
 */
@Component
public class XirrSolver {

    private static final Logger log = LoggerFactory.getLogger(XirrSolver.class);

    static final double DAYS_PER_YEAR = 365.25;
    static final double MIN_RATE = -0.99;
    static final double MAX_RATE = 10.0;

    private final IrrSolverConfig irrSolverConfig;

    public XirrSolver(IrrSolverConfig irrSolverConfig) {
        this.irrSolverConfig = irrSolverConfig;
    }

    /**
     * Solves XIRR with the configured initial guess, iteration limit and tolerance.
     */
    public IrrSolution calculateXirr(List<Double> cashFlows, List<LocalDate> dates) {
        return calculateXirr(
                cashFlows,
                dates,
                irrSolverConfig.getInitialGuess(),
                irrSolverConfig.getMaxIterations(),
                irrSolverConfig.getTolerance());
    }

    /**
     * Solves XIRR with explicit solver settings.
     *
     * @param cashFlows signed amounts, negative for money paid in
     * @param dates one date per flow, dates[0] being the time origin
     * @return the converged rate as a decimal (0.15 = 15%), or the failure reason
     */
    public IrrSolution calculateXirr(
            List<Double> cashFlows, List<LocalDate> dates, double initialGuess, int maxIterations, double tolerance) {
        if (cashFlows == null || cashFlows.size() < 2) {
            log.debug("Insufficient cash flows for IRR calculation");
            return IrrSolution.failed(MetricFailureReason.INSUFFICIENT_DATA, 0);
        }
        if (dates == null || dates.size() != cashFlows.size()) {
            log.debug("Cash flows ({}) and dates ({}) differ in length", cashFlows.size(), dates == null ? 0 : dates.size());
            return IrrSolution.failed(MetricFailureReason.INSUFFICIENT_DATA, 0);
        }

        int n = cashFlows.size();
        double[] amounts = new double[n];
        double[] years = new double[n];
        LocalDate origin = dates.get(0);
        for (int i = 0; i < n; i++) {
            amounts[i] = cashFlows.get(i);
            years[i] = ChronoUnit.DAYS.between(origin, dates.get(i)) / DAYS_PER_YEAR;
        }

        double rate = initialGuess;

        for (int iteration = 0; iteration < maxIterations; iteration++) {
            double npv = 0.0;
            double derivative = 0.0;
            for (int i = 0; i < n; i++) {
                npv += amounts[i] / Math.pow(1 + rate, years[i]);
                derivative += -amounts[i] * years[i] / Math.pow(1 + rate, years[i] + 1);
            }

            if (!Double.isFinite(npv) || !Double.isFinite(derivative)) {
                log.debug("IRR calculation hit a non-finite value at rate={}", rate);
                return IrrSolution.failed(MetricFailureReason.NUMERIC_INSTABILITY, iteration + 1);
            }

            if (Math.abs(npv) < tolerance) {
                log.debug("IRR converged in {} iterations: {}", iteration + 1, rate);
                return IrrSolution.converged(rate, iteration + 1);
            }

            if (Math.abs(derivative) < tolerance) {
                log.debug("IRR derivative too small ({}), calculation unstable", derivative);
                return IrrSolution.failed(MetricFailureReason.NON_CONVERGENCE, iteration + 1);
            }

            rate = rate - npv / derivative;

            if (!Double.isFinite(rate) || rate < MIN_RATE || rate > MAX_RATE) {
                log.debug("IRR calculation diverging (rate={})", rate);
                return IrrSolution.failed(MetricFailureReason.NUMERIC_INSTABILITY, iteration + 1);
            }
        }

        log.debug("IRR did not converge after {} iterations", maxIterations);
        return IrrSolution.failed(MetricFailureReason.NON_CONVERGENCE, maxIterations);
    }
}
