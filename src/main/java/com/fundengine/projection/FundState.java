package com.fundengine.projection;

import com.fundengine.domain.model.Fund;
import com.fundengine.domain.model.MetricsResult;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * A fund together with the balances a projection starts from.
 */
@Value
@Builder
public class FundState {

    Fund fund;
    BigDecimal unfundedCommitment;
    BigDecimal currentNav;

    /**
     * Starting state from the fund's measured metrics. Over-called funds (paid-in above
     * commitment) start with zero unfunded commitment.
     */
    public static FundState of(Fund fund, MetricsResult metricsResult) {
        return FundState.builder()
                .fund(fund)
                .unfundedCommitment(metricsResult.getUnfundedCommitment().max(BigDecimal.ZERO))
                .currentNav(metricsResult.getCurrentNav().max(BigDecimal.ZERO))
                .build();
    }
}
