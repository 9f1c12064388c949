package com.fundengine.cashflow;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Value;

/** Running net cash position after the flow dated {@code date}. */
@Value
public class CumulativeCashFlow {

    LocalDate date;
    BigDecimal runningTotal;
}
