package com.fundengine.domain.enums;

import com.fundengine.exception.ErrorCode;
import com.fundengine.exception.ValidationException;
import java.util.Map;

/**
 * Ledger entry types supplied by the ingestion layer.
 *
 * <p>Each type carries the lowercase code used in stored transaction records
 * (e.g. "call_investment"). Calls and fees are negative amounts, distributions positive.
 * NAV_UPDATE entries are valuation marks, not cash, and never count toward paid-in or
 * distributed totals.
 */
public enum CashFlowType {
    CALL_INVESTMENT("call_investment"),
    CALL_FEES("call_fees"),
    DISTRIBUTION_RETURN_OF_CAPITAL("distribution_return_of_capital"),
    DISTRIBUTION_PROFIT("distribution_profit"),
    NAV_UPDATE("nav_update");

    private final String code;

    CashFlowType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public boolean isFee() {
        return this == CALL_FEES;
    }

    public boolean isNavUpdate() {
        return this == NAV_UPDATE;
    }

    /**
     * Resolve a CashFlowType from its stored code (e.g., "call_fees" → CALL_FEES).
     * Matching ignores case and surrounding whitespace.
     *
     * @throws ValidationException if no type matches the code
     */
    public static CashFlowType fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase();
            for (CashFlowType type : values()) {
                if (type.code.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new ValidationException(
                ErrorCode.UNKNOWN_CODE, "Unknown cash flow type: " + code, Map.of("code", String.valueOf(code)));
    }
}
