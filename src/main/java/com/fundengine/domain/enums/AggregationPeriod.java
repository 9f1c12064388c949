package com.fundengine.domain.enums;

import com.fundengine.exception.ErrorCode;
import com.fundengine.exception.ValidationException;
import java.util.Map;

/**
 * Time bucketing for cash-flow aggregation and J-curve analysis.
 * Used by CashFlowProcessor to derive period keys ("2021", "2021-Q3", "2021-07", "all_time").
 */
public enum AggregationPeriod {
    MONTHLY("monthly"),
    QUARTERLY("quarterly"),
    YEARLY("yearly"),
    ALL_TIME("all_time");

    private final String code;

    AggregationPeriod(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * @throws ValidationException if no period matches the code
     */
    public static AggregationPeriod fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase();
            for (AggregationPeriod period : values()) {
                if (period.code.equals(normalized)) {
                    return period;
                }
            }
        }
        throw new ValidationException(
                ErrorCode.UNKNOWN_CODE, "Unknown aggregation period: " + code, Map.of("code", String.valueOf(code)));
    }
}
