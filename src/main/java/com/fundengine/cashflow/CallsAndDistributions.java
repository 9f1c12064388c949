package com.fundengine.cashflow;

import com.fundengine.domain.model.CashFlow;
import java.util.List;
import lombok.Value;

/**
 * Cash flows partitioned by sign: calls (negative) and distributions (positive).
 */
@Value
public class CallsAndDistributions {

    List<CashFlow> calls;
    List<CashFlow> distributions;
}
