package com.fundengine.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the quarterly projection engine, loaded from application.properties.
 *
 * <p>Properties prefix: {@code fundengine.projection.*}.
 *
 * <p>Defaults:
 * <ul>
 *   <li>defaultQuarters: 20 (five-year horizon)</li>
 *   <li>managementFeeRate: 0.02 annual, charged quarterly</li>
 *   <li>feeStepDownAfterYears: 5 (fee rate halves once a fund is older than this)</li>
 *   <li>defaultExpectedMoic / defaultTargetIrr: 2.0 / 0.15, used when a strategy has no assumption row</li>
 *   <li>distributionLookaheadQuarters: 4 (window of projected distributions fed to the optimizer)</li>
 *   <li>fallbackStrategy: "Private Equity" (shape profile used for unrecognized strategies)</li>
 * </ul>
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "fundengine.projection")
public class ProjectionConfig {

    @Min(1)
    private int defaultQuarters = 20;

    @PositiveOrZero
    private double managementFeeRate = 0.02;

    @PositiveOrZero
    private int feeStepDownAfterYears = 5;

    @Positive
    private double defaultExpectedMoic = 2.0;

    private double defaultTargetIrr = 0.15;

    @Min(1)
    private int distributionLookaheadQuarters = 4;

    @NotBlank
    private String fallbackStrategy = "Private Equity";
}
