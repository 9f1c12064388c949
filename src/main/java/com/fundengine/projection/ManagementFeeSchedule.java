package com.fundengine.projection;

import com.fundengine.exception.ValidationException;
import lombok.Getter;

/**
 * Two-tier management fee schedule.
 *
 * <p>The quarterly rate is a quarter of the annual rate while the fund is at most
 * {@code stepDownAfterYears} years past its vintage, and half of that afterwards. The
 * step-down year itself is still charged the full rate.
 */
@Getter
public class ManagementFeeSchedule {

    private final double annualRate;
    private final int stepDownAfterYears;

    public ManagementFeeSchedule(double annualRate, int stepDownAfterYears) {
        if (annualRate < 0 || stepDownAfterYears < 0) {
            throw new ValidationException("Fee rate and step-down year must not be negative");
        }
        this.annualRate = annualRate;
        this.stepDownAfterYears = stepDownAfterYears;
    }

    public double quarterlyRate(int yearsSinceVintage) {
        double fullRate = annualRate / 4;
        return yearsSinceVintage > stepDownAfterYears ? fullRate / 2 : fullRate;
    }
}
