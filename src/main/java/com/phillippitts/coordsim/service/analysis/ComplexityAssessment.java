package com.phillippitts.coordsim.service.analysis;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Factor breakdown and overall complexity score of a coordinate.
 *
 * @param factors each factor normalized to [0,1]
 * @param score   unweighted mean of the factors
 */
public record ComplexityAssessment(Map<ComplexityFactor, Double> factors, double score) {

    public ComplexityAssessment {
        Objects.requireNonNull(factors, "factors must not be null");
        factors = Collections.unmodifiableMap(new EnumMap<>(factors));
    }

    /**
     * Factors keyed by wire name, in declaration order.
     */
    public Map<String, Double> factorsByName() {
        Map<String, Double> named = new LinkedHashMap<>();
        factors.forEach((factor, value) -> named.put(factor.wireName(), value));
        return named;
    }
}
