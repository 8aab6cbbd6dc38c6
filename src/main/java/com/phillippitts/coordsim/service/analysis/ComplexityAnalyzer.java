package com.phillippitts.coordsim.service.analysis;

import com.phillippitts.coordsim.domain.Coordinate;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Derives a single complexity score from five independent factors of a coordinate.
 *
 * <p>The analysis is a pure function: no I/O, no shared state, and the caller's coordinate is
 * never modified. Factors are always summed in declaration order so the score is reproducible
 * bit-for-bit for equal coordinates.
 *
 * <p>Factors:
 * <ul>
 *   <li><b>pillar complexity</b> - table lookup by pillar category, 0.5 for unknown pillars</li>
 *   <li><b>sector depth</b> - 0.8 for specialized sectors, 0.4 otherwise</li>
 *   <li><b>regulatory requirements</b> - share of compliance level, regulatory framework and
 *       audit requirements that are present and not "none"</li>
 *   <li><b>persona requirements</b> - 0.8 for complex roles, 0.4 otherwise</li>
 *   <li><b>cross-axis dependencies</b> - share of seven key axes holding a non-default value</li>
 * </ul>
 */
@Component
public class ComplexityAnalyzer {

    static final double UNKNOWN_PILLAR_COMPLEXITY = 0.5;
    static final double HIGH_DEMAND = 0.8;
    static final double LOW_DEMAND = 0.4;

    private static final String NONE = "none";
    private static final int CROSS_AXIS_COUNT = 7;

    private static final Map<String, Double> PILLAR_COMPLEXITY = Map.of(
            "foundational", 0.3,
            "organizational", 0.5,
            "technological", 0.7,
            "adaptive", 0.9
    );

    private static final Set<String> SPECIALIZED_SECTORS = Set.of("healthcare", "finance", "aerospace", "nuclear");
    private static final Set<String> COMPLEX_ROLES = Set.of("executive", "regulatory", "technical_lead");
    private static final Set<String> DEFAULT_VALUES = Set.of(NONE, "default", "unspecified");

    /**
     * Computes the factor breakdown and score for a coordinate.
     *
     * @param coordinate coordinate to assess
     * @return factors and their unweighted mean
     * @throws NullPointerException if coordinate is null
     */
    public ComplexityAssessment analyze(Coordinate coordinate) {
        Objects.requireNonNull(coordinate, "coordinate must not be null");

        Map<ComplexityFactor, Double> factors = new EnumMap<>(ComplexityFactor.class);
        factors.put(ComplexityFactor.PILLAR_COMPLEXITY, pillarComplexity(coordinate.pillar()));
        factors.put(ComplexityFactor.SECTOR_DEPTH, sectorDepth(coordinate.sector()));
        factors.put(ComplexityFactor.REGULATORY_REQUIREMENTS, regulatoryNeeds(coordinate));
        factors.put(ComplexityFactor.PERSONA_REQUIREMENTS, personaNeeds(coordinate.roleDefinition()));
        factors.put(ComplexityFactor.CROSS_AXIS_DEPENDENCIES, crossAxisDependencies(coordinate));

        double sum = 0.0;
        for (ComplexityFactor factor : ComplexityFactor.values()) {
            sum += factors.get(factor);
        }
        return new ComplexityAssessment(factors, sum / factors.size());
    }

    double pillarComplexity(String pillar) {
        return PILLAR_COMPLEXITY.getOrDefault(pillar, UNKNOWN_PILLAR_COMPLEXITY);
    }

    double sectorDepth(String sector) {
        return SPECIALIZED_SECTORS.contains(sector) ? HIGH_DEMAND : LOW_DEMAND;
    }

    double regulatoryNeeds(Coordinate coordinate) {
        long present = Stream.of(
                        coordinate.complianceLevel(),
                        coordinate.regulatoryFramework(),
                        coordinate.auditRequirements())
                .filter(v -> v != null && !v.isEmpty() && !NONE.equals(v))
                .count();
        return present / 3.0;
    }

    double personaNeeds(String roleDefinition) {
        return roleDefinition != null && COMPLEX_ROLES.contains(roleDefinition) ? HIGH_DEMAND : LOW_DEMAND;
    }

    double crossAxisDependencies(Coordinate coordinate) {
        long nonDefault = Stream.of(
                        coordinate.pillar(),
                        coordinate.sector(),
                        coordinate.location(),
                        coordinate.roleDefinition(),
                        coordinate.userAuthority(),
                        coordinate.complianceLevel(),
                        coordinate.regulatoryFramework())
                .filter(v -> v != null && !v.isEmpty() && !DEFAULT_VALUES.contains(v))
                .count();
        return Math.min((double) nonDefault / CROSS_AXIS_COUNT, 1.0);
    }
}
