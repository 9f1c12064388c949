package com.fundengine.cashflow;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Year-to-date cash activity from January 1 of the reference year through the reference date.
 * Calls are reported as a positive magnitude.
 */
@Value
@Builder
public class YtdMetrics {

    BigDecimal calls;
    BigDecimal distributions;
    BigDecimal netFlow;
    int transactionCount;
    int referenceYear;
}
