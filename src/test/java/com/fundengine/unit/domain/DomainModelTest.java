package com.fundengine.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fundengine.domain.enums.AggregationPeriod;
import com.fundengine.domain.enums.CashFlowType;
import com.fundengine.domain.enums.HierarchyLevel;
import com.fundengine.domain.enums.MetricFailureReason;
import com.fundengine.domain.enums.MetricName;
import com.fundengine.domain.model.CashFlow;
import com.fundengine.domain.model.Fund;
import com.fundengine.domain.model.MetricsResult;
import com.fundengine.exception.ErrorCode;
import com.fundengine.exception.ValidationException;
import java.math.BigDecimal;
import java.time.LocalDate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DomainModelTest {

    @Nested
    @DisplayName("Cash flow type codes")
    class CashFlowTypeCodes {

        @Test
        void fromCode_resolvesStoredCodes() {
            assertThat(CashFlowType.fromCode("call_investment")).isEqualTo(CashFlowType.CALL_INVESTMENT);
            assertThat(CashFlowType.fromCode("call_fees")).isEqualTo(CashFlowType.CALL_FEES);
            assertThat(CashFlowType.fromCode("distribution_profit")).isEqualTo(CashFlowType.DISTRIBUTION_PROFIT);
            assertThat(CashFlowType.fromCode("nav_update")).isEqualTo(CashFlowType.NAV_UPDATE);
        }

        @Test
        void fromCode_ignoresCaseAndWhitespace() {
            assertThat(CashFlowType.fromCode("  Distribution_Return_Of_Capital "))
                    .isEqualTo(CashFlowType.DISTRIBUTION_RETURN_OF_CAPITAL);
        }

        @Test
        void fromCode_unknownCode_throwsWithUnknownCodeError() {
            assertThatThrownBy(() -> CashFlowType.fromCode("dividend"))
                    .isInstanceOfSatisfying(ValidationException.class, e -> {
                        assertThat(e.getErrorCode()).isEqualTo(ErrorCode.UNKNOWN_CODE);
                        assertThat(e.getDetails()).containsEntry("code", "dividend");
                    });
        }

        @Test
        void fromCode_null_throws() {
            assertThatThrownBy(() -> CashFlowType.fromCode(null)).isInstanceOf(ValidationException.class);
        }

        @Test
        void aggregationPeriodFromCode() {
            assertThat(AggregationPeriod.fromCode("QUARTERLY")).isEqualTo(AggregationPeriod.QUARTERLY);
            assertThat(AggregationPeriod.fromCode("all_time")).isEqualTo(AggregationPeriod.ALL_TIME);
            assertThatThrownBy(() -> AggregationPeriod.fromCode("weekly")).isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    @DisplayName("Cash flow sign classification")
    class SignClassification {

        @Test
        void negativeAmount_isCall() {
            CashFlow call = flow(CashFlowType.CALL_INVESTMENT, "-1000");

            assertThat(call.isCall()).isTrue();
            assertThat(call.isDistribution()).isFalse();
            assertThat(call.isFee()).isFalse();
        }

        @Test
        void feeCall_isCallAndFee() {
            CashFlow fee = flow(CashFlowType.CALL_FEES, "-50");

            assertThat(fee.isCall()).isTrue();
            assertThat(fee.isFee()).isTrue();
        }

        @Test
        void positiveAmount_isDistribution() {
            assertThat(flow(CashFlowType.DISTRIBUTION_PROFIT, "700").isDistribution()).isTrue();
        }

        @Test
        void navUpdate_isNeitherCallNorDistribution() {
            CashFlow nav = flow(CashFlowType.NAV_UPDATE, "125000");

            assertThat(nav.isNavUpdate()).isTrue();
            assertThat(nav.isCall()).isFalse();
            assertThat(nav.isDistribution()).isFalse();
        }

        @Test
        void zeroAmount_isNeither() {
            CashFlow zero = flow(CashFlowType.CALL_INVESTMENT, "0");

            assertThat(zero.isCall()).isFalse();
            assertThat(zero.isDistribution()).isFalse();
        }
    }

    @Nested
    @DisplayName("Metrics result")
    class MetricsResultBehaviour {

        @Test
        void empty_hasEveryMetricAbsentWithInsufficientData() {
            MetricsResult empty = MetricsResult.empty(HierarchyLevel.STRATEGY, "Venture Capital");

            assertThat(empty.getEntityCount()).isZero();
            assertThat(empty.getPaidIn()).isEqualByComparingTo(BigDecimal.ZERO);
            assertThat(empty.getCurrentNav()).isEqualByComparingTo(BigDecimal.ZERO);
            for (MetricName metricName : MetricName.values()) {
                assertThat(empty.isAbsent(metricName)).isTrue();
                assertThat(empty.getFailureReason(metricName)).isEqualTo(MetricFailureReason.INSUFFICIENT_DATA);
            }
        }

        @Test
        void getMetric_readsNamedField() {
            MetricsResult result = MetricsResult.builder()
                    .tvpi(1.4)
                    .dpi(0.6)
                    .failure(MetricName.IRR, MetricFailureReason.NON_CONVERGENCE)
                    .build();

            assertThat(result.getMetric(MetricName.TVPI)).isEqualTo(1.4);
            assertThat(result.getMetric(MetricName.DPI)).isEqualTo(0.6);
            assertThat(result.isAbsent(MetricName.IRR)).isTrue();
            assertThat(result.getFailureReason(MetricName.IRR)).isEqualTo(MetricFailureReason.NON_CONVERGENCE);
            assertThat(result.getFailureReason(MetricName.TVPI)).isNull();
        }
    }

    @Nested
    @DisplayName("Required fields")
    class RequiredFields {

        @Test
        void cashFlowWithoutAmount_rejectedWithMissingFieldDetails() {
            assertThatThrownBy(() -> CashFlow.builder()
                            .transactionId("T9")
                            .fundId("F1")
                            .date(LocalDate.of(2022, 3, 31))
                            .type(CashFlowType.CALL_INVESTMENT)
                            .build())
                    .isInstanceOfSatisfying(ValidationException.class, e -> {
                        assertThat(e.getErrorCode()).isEqualTo(ErrorCode.VALIDATION_ERROR);
                        assertThat(e.getDetails()).containsKey("amount").containsEntry("transactionId", "T9");
                    });
        }

        @Test
        void cashFlowWithoutDateOrType_rejected() {
            assertThatThrownBy(() -> CashFlow.builder()
                            .fundId("F1")
                            .amount(new BigDecimal("-100"))
                            .build())
                    .isInstanceOfSatisfying(ValidationException.class, e ->
                            assertThat(e.getDetails()).containsKeys("date", "type"));
        }

        @Test
        void cashFlowWithoutFund_rejected() {
            assertThatThrownBy(() -> CashFlow.builder()
                            .date(LocalDate.of(2022, 3, 31))
                            .type(CashFlowType.NAV_UPDATE)
                            .amount(new BigDecimal("100"))
                            .build())
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        void fundWithoutId_rejected() {
            assertThatThrownBy(() -> Fund.builder().fundName("Orphan Fund").build())
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        void fundWithNegativeCommitment_rejected() {
            assertThatThrownBy(() -> Fund.builder().fundId("F1").totalCommitment(new BigDecimal("-1")).build())
                    .isInstanceOfSatisfying(ValidationException.class, e ->
                            assertThat(e.getDetails()).containsEntry("fundId", "F1"));
        }

        @Test
        void fundOptionalFields_mayBeNull() {
            Fund fund = Fund.builder().fundId("F1").build();

            assertThat(fund.getVintageYear()).isNull();
            assertThat(fund.getTotalCommitment()).isNull();
        }
    }

    private static CashFlow flow(CashFlowType type, String amount) {
        return CashFlow.builder()
                .transactionId("T1")
                .fundId("F1")
                .date(LocalDate.of(2022, 3, 31))
                .type(type)
                .amount(new BigDecimal(amount))
                .build();
    }
}
