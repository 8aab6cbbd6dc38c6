package com.phillippitts.coordsim.domain;

import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Immutable point in the multi-axis knowledge space.
 *
 * <p>{@code pillar} and {@code sector} are the anchor axes and are always present; every other
 * axis is optional. Numeric sector codes are carried as text. The honeycomb crosslink list is
 * copied on construction so callers cannot mutate a coordinate after it has been built.
 *
 * @param pillar              pillar level (e.g. "foundational", "PL12.1.0")
 * @param sector              sector or industry code
 * @param honeycomb           crosslink mappings
 * @param branch              branch system hierarchy
 * @param node                cross-sector node overlay
 * @param regulatory          regulatory framework code
 * @param compliance          compliance standard code
 * @param complianceLevel     compliance level (strict, moderate, basic, none)
 * @param auditRequirements   audit requirements level
 * @param regulatoryFramework regulatory framework name (e.g. "HIPAA")
 * @param roleKnowledge       knowledge domain role
 * @param roleSector          sector expert role
 * @param roleRegulatory      regulatory expert role
 * @param roleCompliance      compliance role
 * @param roleDefinition      primary role definition (e.g. "executive")
 * @param userAuthority       authority level of the acting user
 * @param location            geographic location (ISO 3166)
 * @param temporal            ISO-8601 date or date-time
 */
public record Coordinate(
        String pillar,
        String sector,
        List<String> honeycomb,
        String branch,
        String node,
        String regulatory,
        String compliance,
        String complianceLevel,
        String auditRequirements,
        String regulatoryFramework,
        String roleKnowledge,
        String roleSector,
        String roleRegulatory,
        String roleCompliance,
        String roleDefinition,
        String userAuthority,
        String location,
        String temporal
) {

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if an anchor axis is blank or temporal is not ISO-8601
     */
    public Coordinate {
        requireAnchor(pillar, "pillar");
        requireAnchor(sector, "sector");
        honeycomb = honeycomb == null ? null : List.copyOf(honeycomb);
        if (temporal != null && !isIsoTemporal(temporal)) {
            throw new IllegalArgumentException("Temporal must be valid ISO 8601 format, got: " + temporal);
        }
    }

    /**
     * Creates a coordinate holding only the two anchor axes.
     */
    public static Coordinate of(String pillar, String sector) {
        return builder(pillar, sector).build();
    }

    public static Builder builder(String pillar, String sector) {
        return new Builder(pillar, sector);
    }

    /**
     * Renders the canonical pipe-delimited form of this coordinate.
     *
     * <p>Axes appear in canonical order; absent axes render as empty strings and list values
     * are comma-joined.
     *
     * @return pipe-delimited coordinate string
     */
    public String nurembergNumber() {
        List<Object> values = new ArrayList<>();
        values.add(pillar);
        values.add(sector);
        values.add(honeycomb);
        values.add(branch);
        values.add(node);
        values.add(regulatory);
        values.add(compliance);
        values.add(complianceLevel);
        values.add(auditRequirements);
        values.add(regulatoryFramework);
        values.add(roleKnowledge);
        values.add(roleSector);
        values.add(roleRegulatory);
        values.add(roleCompliance);
        values.add(roleDefinition);
        values.add(userAuthority);
        values.add(location);
        values.add(temporal);
        return values.stream()
                .map(Coordinate::render)
                .collect(Collectors.joining("|"));
    }

    private static String render(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).collect(Collectors.joining(","));
        }
        return String.valueOf(value);
    }

    private static void requireAnchor(String value, String axis) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Anchor axis '" + axis + "' must be present");
        }
    }

    private static boolean isIsoTemporal(String value) {
        DateTimeFormatter format = value.indexOf('T') >= 0
                ? DateTimeFormatter.ISO_DATE_TIME
                : DateTimeFormatter.ISO_DATE;
        try {
            format.parse(value);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    /**
     * Fluent builder for coordinates with many optional axes.
     */
    public static final class Builder {
        private final String pillar;
        private final String sector;
        private List<String> honeycomb;
        private String branch;
        private String node;
        private String regulatory;
        private String compliance;
        private String complianceLevel;
        private String auditRequirements;
        private String regulatoryFramework;
        private String roleKnowledge;
        private String roleSector;
        private String roleRegulatory;
        private String roleCompliance;
        private String roleDefinition;
        private String userAuthority;
        private String location;
        private String temporal;

        private Builder(String pillar, String sector) {
            this.pillar = pillar;
            this.sector = sector;
        }

        public Builder honeycomb(List<String> honeycomb) {
            this.honeycomb = honeycomb;
            return this;
        }

        public Builder branch(String branch) {
            this.branch = branch;
            return this;
        }

        public Builder node(String node) {
            this.node = node;
            return this;
        }

        public Builder regulatory(String regulatory) {
            this.regulatory = regulatory;
            return this;
        }

        public Builder compliance(String compliance) {
            this.compliance = compliance;
            return this;
        }

        public Builder complianceLevel(String complianceLevel) {
            this.complianceLevel = complianceLevel;
            return this;
        }

        public Builder auditRequirements(String auditRequirements) {
            this.auditRequirements = auditRequirements;
            return this;
        }

        public Builder regulatoryFramework(String regulatoryFramework) {
            this.regulatoryFramework = regulatoryFramework;
            return this;
        }

        public Builder roleKnowledge(String roleKnowledge) {
            this.roleKnowledge = roleKnowledge;
            return this;
        }

        public Builder roleSector(String roleSector) {
            this.roleSector = roleSector;
            return this;
        }

        public Builder roleRegulatory(String roleRegulatory) {
            this.roleRegulatory = roleRegulatory;
            return this;
        }

        public Builder roleCompliance(String roleCompliance) {
            this.roleCompliance = roleCompliance;
            return this;
        }

        public Builder roleDefinition(String roleDefinition) {
            this.roleDefinition = roleDefinition;
            return this;
        }

        public Builder userAuthority(String userAuthority) {
            this.userAuthority = userAuthority;
            return this;
        }

        public Builder location(String location) {
            this.location = location;
            return this;
        }

        public Builder temporal(String temporal) {
            this.temporal = temporal;
            return this;
        }

        public Coordinate build() {
            return new Coordinate(pillar, sector, honeycomb, branch, node, regulatory, compliance,
                    complianceLevel, auditRequirements, regulatoryFramework, roleKnowledge, roleSector,
                    roleRegulatory, roleCompliance, roleDefinition, userAuthority, location, temporal);
        }
    }

    @Override
    public String toString() {
        return "Coordinate[" + nurembergNumber() + "]";
    }
}
