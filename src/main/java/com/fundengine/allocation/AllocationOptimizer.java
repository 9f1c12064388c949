package com.fundengine.allocation;

import com.fundengine.exception.ValidationException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Recommends new commitments per strategy to move the portfolio back toward target weights
 * once projected distributions have come out.
 *
 * <p>Formula per strategy s:
 * <pre>
 * projectedTotal = sum(current) - sum(projectedDistributions) + availableCapital
 * gap(s)         = projectedTotal * target(s) - (current(s) - projectedDistributions(s))
 * allocation(s)  = max(0, max(min(s), min(gap(s), max(s))))
 * </pre>
 * Allocations are rounded to cents. If they add up to more than the available capital they
 * are scaled down proportionally, each share rounded down, so the total never exceeds the budget.
 */
@Service
public class AllocationOptimizer {

    private static final Logger log = LoggerFactory.getLogger(AllocationOptimizer.class);

    private static final int MONEY_SCALE = 2;

    /**
     * @param currentExposures current NAV per strategy
     * @param targetFractions target weight per strategy, iteration order is kept in the result
     * @param availableCapital capital available for new investment
     * @param projectedDistributions expected distributions per strategy over the planning window
     * @param constraints per-strategy bounds, {@link AllocationConstraints#none()} for none
     * @return recommended new investment per strategy in {@code targetFractions} order
     */
    public Map<String, BigDecimal> calculateOptimalAllocation(
            Map<String, BigDecimal> currentExposures,
            Map<String, Double> targetFractions,
            BigDecimal availableCapital,
            Map<String, BigDecimal> projectedDistributions,
            AllocationConstraints constraints) {
        if (currentExposures == null || targetFractions == null || projectedDistributions == null) {
            throw new ValidationException("Exposures, targets and projected distributions must not be null");
        }
        if (availableCapital == null || availableCapital.signum() < 0) {
            throw new ValidationException(
                    "Available capital must not be null or negative",
                    Map.of("availableCapital", String.valueOf(availableCapital)));
        }
        AllocationConstraints bounds = constraints != null ? constraints : AllocationConstraints.none();

        BigDecimal totalCurrent = sum(currentExposures);
        BigDecimal totalDistributions = sum(projectedDistributions);
        BigDecimal projectedTotal = totalCurrent.subtract(totalDistributions).add(availableCapital);

        Map<String, BigDecimal> allocations = new LinkedHashMap<>();
        BigDecimal totalAllocated = BigDecimal.ZERO;

        for (Map.Entry<String, Double> target : targetFractions.entrySet()) {
            String strategy = target.getKey();
            BigDecimal targetValue = projectedTotal.multiply(BigDecimal.valueOf(target.getValue()));
            BigDecimal projectedValue = currentExposures.getOrDefault(strategy, BigDecimal.ZERO)
                    .subtract(projectedDistributions.getOrDefault(strategy, BigDecimal.ZERO));
            BigDecimal gap = targetValue.subtract(projectedValue);

            BigDecimal allocation = bounds.minimumFor(strategy)
                    .max(gap.min(bounds.maximumFor(strategy, availableCapital)));
            // No negative allocations
            allocation = allocation.max(BigDecimal.ZERO).setScale(MONEY_SCALE, RoundingMode.HALF_UP);

            allocations.put(strategy, allocation);
            totalAllocated = totalAllocated.add(allocation);
        }

        if (totalAllocated.compareTo(availableCapital) > 0) {
            BigDecimal total = totalAllocated;
            log.debug("Allocations {} exceed available capital {}, scaling down", total, availableCapital);
            allocations.replaceAll((strategy, allocation) -> allocation
                    .multiply(availableCapital)
                    .divide(total, MONEY_SCALE, RoundingMode.DOWN));
        }

        log.info("Calculated optimal allocation across {} strategies", allocations.size());
        return allocations;
    }

    private static BigDecimal sum(Map<String, BigDecimal> values) {
        return values.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
