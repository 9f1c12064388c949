package com.fundengine.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Newton-Raphson settings for the XIRR solver, loaded from application.properties.
 *
 * <p>Properties prefix: {@code fundengine.irr.*}.
 *
 * <p>Defaults:
 * <ul>
 *   <li>initialGuess: 0.1 (10%)</li>
 *   <li>maxIterations: 100</li>
 *   <li>tolerance: 1e-6, applied to both |NPV| (converged) and |dNPV| (unstable)</li>
 * </ul>
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "fundengine.irr")
public class IrrSolverConfig {

    @DecimalMin("-0.99")
    private double initialGuess = 0.1;

    @Min(1)
    private int maxIterations = 100;

    @Positive
    private double tolerance = 1e-6;
}
