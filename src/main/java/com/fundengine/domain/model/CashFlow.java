package com.fundengine.domain.model;

import com.fundengine.domain.enums.CashFlowType;
import com.fundengine.exception.ValidationException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * One ledger entry of a fund, as supplied by the ingestion layer.
 *
 * <p>The amount is always the raw signed value: negative for capital leaving the investor
 * (investment calls and fees), positive for capital returned (distributions). A NAV_UPDATE
 * entry carries the latest mark-to-market NAV; it is a valuation, not cash, and is never
 * counted as a call or a distribution.
 *
 * <p>fundId, date, type and amount are required; the builder rejects an entry missing any of them.
 */
@Value
public class CashFlow {

    String transactionId;
    String fundId;
    LocalDate date;
    CashFlowType type;
    BigDecimal amount;

    /** Free-text note from the source ledger. May be null. */
    String description;

    @Builder
    private CashFlow(
            String transactionId, String fundId, LocalDate date, CashFlowType type, BigDecimal amount, String description) {
        Map<String, Object> missing = new LinkedHashMap<>();
        if (fundId == null) {
            missing.put("fundId", "null");
        }
        if (date == null) {
            missing.put("date", "null");
        }
        if (type == null) {
            missing.put("type", "null");
        }
        if (amount == null) {
            missing.put("amount", "null");
        }
        if (!missing.isEmpty()) {
            missing.put("transactionId", String.valueOf(transactionId));
            throw new ValidationException("Cash flow is missing required fields", missing);
        }
        this.transactionId = transactionId;
        this.fundId = fundId;
        this.date = date;
        this.type = type;
        this.amount = amount;
        this.description = description;
    }

    public boolean isNavUpdate() {
        return type == CashFlowType.NAV_UPDATE;
    }

    public boolean isFee() {
        return type.isFee();
    }

    /** True for a negative cash movement (investment call or fee). */
    public boolean isCall() {
        return !isNavUpdate() && amount.signum() < 0;
    }

    /** True for a positive cash movement (return of capital or profit). */
    public boolean isDistribution() {
        return !isNavUpdate() && amount.signum() > 0;
    }
}
