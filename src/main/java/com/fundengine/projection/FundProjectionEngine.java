package com.fundengine.projection;

import com.fundengine.domain.model.ProjectionPeriod;
import com.fundengine.exception.ValidationException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Quarterly cash-flow and NAV projection for a single fund (Takahashi/Alexander style).
 *
 * <p>Balances are {@link BigDecimal} and every quarterly amount is rounded to cents; the
 * pacing weights and growth rates come from double-valued curve math.
 *
 * <p>Capital calls follow the strategy's S-curve applied to the running unfunded balance.
 * Distributions follow its J-curve applied to the remaining distribution pool, which starts
 * at max(0, unfunded * expectedMoic - currentNav). Each quarter:
 * <ol>
 *   <li>call = runningUnfunded * callShape[q]</li>
 *   <li>fee = (unfunded + currentNav) * quarterly fee rate, on the starting balances. An unknown
 *       vintage is taken to be the as-of year</li>
 *   <li>distribution = remainingPool * distShape[q]</li>
 *   <li>navChange = markdown of jCurveDepth/4 before the distribution trough, growth at
 *       (1 + targetIrr)^0.25 - 1 from the trough on</li>
 *   <li>nav = max(0, nav + call - fee - distribution + navChange)</li>
 * </ol>
 */
@Service
public class FundProjectionEngine {

    private static final Logger log = LoggerFactory.getLogger(FundProjectionEngine.class);

    private static final int MONEY_SCALE = 2;

    private final StrategyShapeTable strategyShapeTable;
    private final ManagementFeeSchedule managementFeeSchedule;

    public FundProjectionEngine(StrategyShapeTable strategyShapeTable, ManagementFeeSchedule managementFeeSchedule) {
        this.strategyShapeTable = strategyShapeTable;
        this.managementFeeSchedule = managementFeeSchedule;
    }

    public List<ProjectionPeriod> projectFund(FundProjectionRequest request) {
        validate(request);

        int numPeriods = request.getNumPeriods();
        StrategyShapeProfile profile = strategyShapeTable.resolve(request.getStrategy());
        int troughPeriod = profile.distTroughPeriod(numPeriods);

        List<Double> callShape = CashFlowShapes.generateSCurve(
                numPeriods, profile.callPeakPeriod(numPeriods), profile.getCallSteepness());
        List<Double> distShape = CashFlowShapes.generateJCurve(numPeriods, troughPeriod, profile.getDistSteepness());

        BigDecimal unfunded = request.getUnfundedCommitment();
        BigDecimal startingNav = request.getCurrentNav();
        BigDecimal feeBase = unfunded.add(startingNav);
        BigDecimal quarterlyGrowth = BigDecimal.valueOf(Math.pow(1 + request.getTargetIrr(), 0.25) - 1);
        BigDecimal quarterlyMarkdown = BigDecimal.valueOf(-profile.getJCurveDepth() / 4);

        // Everything not yet held as NAV must come back as distributions to hit the target multiple
        BigDecimal remainingPool = unfunded.multiply(BigDecimal.valueOf(request.getExpectedMoic()))
                .subtract(startingNav)
                .max(BigDecimal.ZERO);
        BigDecimal remainingUnfunded = unfunded;
        BigDecimal nav = startingNav;

        int startYear = request.getAsOfDate().getYear();
        int vintageYear = request.getVintageYear() != null ? request.getVintageYear() : startYear;
        LocalDate firstQuarterEnd = nextQuarterEnd(request.getAsOfDate());

        List<ProjectionPeriod> periods = new ArrayList<>(numPeriods);
        for (int q = 0; q < numPeriods; q++) {
            BigDecimal call = money(remainingUnfunded.multiply(BigDecimal.valueOf(callShape.get(q))))
                    .min(remainingUnfunded);
            remainingUnfunded = remainingUnfunded.subtract(call);

            int yearsSinceVintage = (startYear + q / 4) - vintageYear;
            BigDecimal feeRate = BigDecimal.valueOf(managementFeeSchedule.quarterlyRate(yearsSinceVintage));
            BigDecimal fee = money(feeBase.multiply(feeRate));

            BigDecimal distribution = money(remainingPool.multiply(BigDecimal.valueOf(distShape.get(q))))
                    .min(remainingPool);
            remainingPool = remainingPool.subtract(distribution);

            BigDecimal navChange = money(nav.multiply(q < troughPeriod ? quarterlyMarkdown : quarterlyGrowth));
            nav = money(nav.add(call).subtract(fee).subtract(distribution).add(navChange).max(BigDecimal.ZERO));

            periods.add(ProjectionPeriod.builder()
                    .periodIndex(q + 1)
                    .date(quarterEnd(firstQuarterEnd, q))
                    .callInvestment(call.negate())
                    .managementFees(fee.negate())
                    .distribution(distribution)
                    .nav(nav)
                    .navChange(navChange)
                    .build());
        }

        log.debug("Projected {} quarters for strategy {} (trough at {}), ending NAV {}",
                numPeriods, profile.getStrategy(), troughPeriod, nav);
        return periods;
    }

    /**
     * First calendar quarter-end strictly after {@code date}.
     */
    static LocalDate nextQuarterEnd(LocalDate date) {
        int quarterEndMonth = ((date.getMonthValue() - 1) / 3 + 1) * 3;
        LocalDate quarterEnd = LocalDate.of(date.getYear(), quarterEndMonth, 1)
                .with(TemporalAdjusters.lastDayOfMonth());
        return quarterEnd.isAfter(date) ? quarterEnd : quarterEnd(quarterEnd, 1);
    }

    private static LocalDate quarterEnd(LocalDate firstQuarterEnd, int offset) {
        return firstQuarterEnd.plusMonths(3L * offset).with(TemporalAdjusters.lastDayOfMonth());
    }

    private static BigDecimal money(BigDecimal amount) {
        return amount.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }

    private static void validate(FundProjectionRequest request) {
        if (request == null) {
            throw new ValidationException("Projection request must not be null");
        }
        Map<String, Object> details = new HashMap<>();
        if (request.getUnfundedCommitment() == null || request.getUnfundedCommitment().signum() < 0) {
            details.put("unfundedCommitment", String.valueOf(request.getUnfundedCommitment()));
        }
        if (request.getCurrentNav() == null || request.getCurrentNav().signum() < 0) {
            details.put("currentNav", String.valueOf(request.getCurrentNav()));
        }
        if (!(request.getTargetIrr() > -1) || !Double.isFinite(request.getExpectedMoic())) {
            details.put("targetIrr", request.getTargetIrr());
            details.put("expectedMoic", request.getExpectedMoic());
        }
        if (request.getNumPeriods() < 0) {
            details.put("numPeriods", request.getNumPeriods());
        }
        if (request.getAsOfDate() == null) {
            details.put("asOfDate", "null");
        }
        if (!details.isEmpty()) {
            throw new ValidationException("Invalid projection request", details);
        }
    }
}
