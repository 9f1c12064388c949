package com.fundengine.cashflow;

import java.math.BigDecimal;
import lombok.Value;

/**
 * One period of a J-curve: the period's net flow and the cumulative net flow through it.
 */
@Value
public class JCurvePoint {

    /** Period key, e.g. "2021", "2021-Q3" or "2021-07". */
    String period;

    BigDecimal netFlow;
    BigDecimal cumulativeFlow;
}
