package com.fundengine.projection;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * Projected totals across several funds for one quarter.
 *
 * <p>Unlike {@link com.fundengine.domain.model.ProjectionPeriod}, calls and fees are positive
 * magnitudes here.
 */
@Value
@Builder
public class ProjectionPeriodTotal {

    int periodIndex;
    LocalDate date;
    BigDecimal calls;
    BigDecimal fees;
    BigDecimal distributions;
    BigDecimal nav;

    /** Distributions less calls and fees. */
    public BigDecimal getNetCashFlow() {
        return distributions.subtract(calls).subtract(fees);
    }
}
