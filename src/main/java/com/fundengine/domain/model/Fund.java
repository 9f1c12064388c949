package com.fundengine.domain.model;

import com.fundengine.exception.ValidationException;
import java.math.BigDecimal;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Static fund reference data. Read-only input to the engine.
 *
 * <p>fundId is required and totalCommitment, when present, must not be negative.
 */
@Value
public class Fund {

    String fundId;
    String fundName;

    /** Year the fund began investing. Null when unknown; fee tiers then count years from the projection start. */
    Integer vintageYear;

    String primaryStrategy;
    String subStrategy;
    BigDecimal totalCommitment;

    @Builder
    private Fund(
            String fundId,
            String fundName,
            Integer vintageYear,
            String primaryStrategy,
            String subStrategy,
            BigDecimal totalCommitment) {
        if (fundId == null) {
            throw new ValidationException("Fund id must not be null", Map.of("fundName", String.valueOf(fundName)));
        }
        if (totalCommitment != null && totalCommitment.signum() < 0) {
            throw new ValidationException(
                    "Total commitment must not be negative",
                    Map.of("fundId", fundId, "totalCommitment", totalCommitment));
        }
        this.fundId = fundId;
        this.fundName = fundName;
        this.vintageYear = vintageYear;
        this.primaryStrategy = primaryStrategy;
        this.subStrategy = subStrategy;
        this.totalCommitment = totalCommitment;
    }
}
