package com.fundengine.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Error codes carried by engine exceptions.
 *
 * <p>Analytic failures (non-convergence, zero denominators) are never raised as exceptions;
 * they surface as absent metric values. These codes cover caller errors only.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", "Input failed validation"),
    UNKNOWN_CODE("UNKNOWN_CODE", "Unrecognized enumeration code"),
    CONFIGURATION_ERROR("CONFIGURATION_ERROR", "Engine configuration is incomplete");

    private final String code;
    private final String description;
}
