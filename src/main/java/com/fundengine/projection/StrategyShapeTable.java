package com.fundengine.projection;

import com.fundengine.exception.ErrorCode;
import com.fundengine.exception.ValidationException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lookup of {@link StrategyShapeProfile} by strategy name.
 *
 * <p>The table always holds a {@value #DEFAULT_ENTRY} row, returned for any strategy it does
 * not recognize. In the standard table the default row is a copy of the Private Equity row.
 */
public class StrategyShapeTable {

    private static final Logger log = LoggerFactory.getLogger(StrategyShapeTable.class);

    public static final String DEFAULT_ENTRY = "default";

    public static final String VENTURE_CAPITAL = "Venture Capital";
    public static final String PRIVATE_EQUITY = "Private Equity";
    public static final String REAL_ESTATE = "Real Estate";
    public static final String INFRASTRUCTURE = "Infrastructure";

    private final Map<String, StrategyShapeProfile> profiles;

    public StrategyShapeTable(Map<String, StrategyShapeProfile> profiles) {
        if (profiles == null || !profiles.containsKey(DEFAULT_ENTRY)) {
            throw new ValidationException(
                    ErrorCode.CONFIGURATION_ERROR, "Strategy shape table must contain a '" + DEFAULT_ENTRY + "' entry");
        }
        this.profiles = Collections.unmodifiableMap(new LinkedHashMap<>(profiles));
    }

    /**
     * Standard four-strategy table with the default entry copied from {@code fallbackStrategy}.
     */
    public static StrategyShapeTable standard(String fallbackStrategy) {
        Map<String, StrategyShapeProfile> profiles = new LinkedHashMap<>();
        profiles.put(VENTURE_CAPITAL, profile(VENTURE_CAPITAL, 0.3, 2.5, 0.5, 1.2, 0.15));
        profiles.put(PRIVATE_EQUITY, profile(PRIVATE_EQUITY, 0.4, 2.0, 0.4, 1.5, 0.08));
        profiles.put(REAL_ESTATE, profile(REAL_ESTATE, 0.2, 3.0, 0.1, 2.0, 0.02));
        profiles.put(INFRASTRUCTURE, profile(INFRASTRUCTURE, 0.5, 1.5, 0.2, 3.0, 0.01));

        StrategyShapeProfile fallback = profiles.get(fallbackStrategy);
        if (fallback == null) {
            throw new ValidationException(
                    ErrorCode.CONFIGURATION_ERROR,
                    "Fallback strategy is not in the shape table: " + fallbackStrategy,
                    Map.of("fallbackStrategy", String.valueOf(fallbackStrategy)));
        }
        profiles.put(DEFAULT_ENTRY, fallback);
        return new StrategyShapeTable(profiles);
    }

    /**
     * Profile for {@code strategy}, or the default entry when the name is unknown or null.
     */
    public StrategyShapeProfile resolve(String strategy) {
        StrategyShapeProfile profile = strategy != null ? profiles.get(strategy) : null;
        if (profile == null) {
            log.debug("No shape profile for strategy '{}', using default entry", strategy);
            return profiles.get(DEFAULT_ENTRY);
        }
        return profile;
    }

    public boolean isFallback(String strategy) {
        return strategy == null || DEFAULT_ENTRY.equals(strategy) || !profiles.containsKey(strategy);
    }

    public Set<String> strategies() {
        return profiles.keySet();
    }

    private static StrategyShapeProfile profile(
            String strategy,
            double callPeakFraction,
            double callSteepness,
            double distTroughFraction,
            double distSteepness,
            double jCurveDepth) {
        return StrategyShapeProfile.builder()
                .strategy(strategy)
                .callPeakFraction(callPeakFraction)
                .callSteepness(callSteepness)
                .distTroughFraction(distTroughFraction)
                .distSteepness(distSteepness)
                .jCurveDepth(jCurveDepth)
                .build();
    }
}
