package com.fundengine.projection;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * Inputs for projecting a single fund.
 */
@Value
@Builder
public class FundProjectionRequest {

    BigDecimal unfundedCommitment;
    BigDecimal currentNav;
    double expectedMoic;

    /** Annual target IRR as a decimal. */
    double targetIrr;

    String strategy;
    int numPeriods;

    /** Null when unknown; the as-of year is then used as the vintage. */
    Integer vintageYear;

    /** Projection quarters are the calendar quarter-ends after this date. */
    LocalDate asOfDate;
}
