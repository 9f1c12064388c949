package com.fundengine.domain.enums;

/**
 * Why a metric is absent from a result.
 *
 * <ul>
 *   <li>INSUFFICIENT_DATA: fewer than 2 dated flows, mismatched inputs, or nothing to aggregate</li>
 *   <li>NON_CONVERGENCE: IRR iteration limit reached or derivative too small to continue</li>
 *   <li>DIVISION_GUARD: the ratio's denominator was zero or negative</li>
 *   <li>NUMERIC_INSTABILITY: overflow, non-finite intermediate, or rate outside [-0.99, 10]</li>
 *   <li>ENTITY_FAILURE: computing the entity raised an unexpected error; the batch continued</li>
 * </ul>
 */
public enum MetricFailureReason {
    INSUFFICIENT_DATA,
    NON_CONVERGENCE,
    DIVISION_GUARD,
    NUMERIC_INSTABILITY,
    ENTITY_FAILURE
}
