package com.fundengine.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * One simulated quarter of a fund projection.
 *
 * <p>Follows the ledger sign convention: callInvestment and managementFees are zero or
 * negative, distribution is zero or positive. nav is the end-of-quarter NAV, floored at zero.
 * Amounts are rounded to cents.
 */
@Value
@Builder
public class ProjectionPeriod {

    /** 1-based quarter number within the projection horizon. */
    int periodIndex;

    LocalDate date;
    BigDecimal callInvestment;
    BigDecimal managementFees;
    BigDecimal distribution;
    BigDecimal nav;

    /** Valuation change applied this quarter (markdown before the distribution trough, growth after). */
    BigDecimal navChange;
}
