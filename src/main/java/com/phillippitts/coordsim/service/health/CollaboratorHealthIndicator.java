package com.phillippitts.coordsim.service.health;

import com.phillippitts.coordsim.service.collaborator.Collaborators;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Health indicator for workflow collaborators.
 *
 * <ul>
 *   <li>UP: all four collaborators are injected</li>
 *   <li>DEGRADED: at least one is missing; its stages run as no-ops</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health.
 */
@Component
public class CollaboratorHealthIndicator implements HealthIndicator {

    static final String DEGRADED = "DEGRADED";

    private final Collaborators collaborators;

    public CollaboratorHealthIndicator(Collaborators collaborators) {
        this.collaborators = collaborators;
    }

    @Override
    public Health health() {
        Map<String, Boolean> availability = collaborators.availability();
        long available = availability.values().stream().filter(Boolean::booleanValue).count();

        Health.Builder builder = new Health.Builder();
        if (available == availability.size()) {
            builder.up().withDetail("status", "All collaborators available");
        } else {
            builder.status(DEGRADED)
                    .withDetail("status", available + " of " + availability.size() + " collaborators available");
        }
        availability.forEach((name, present) -> builder.withDetail(name, present ? "available" : "missing"));
        return builder.build();
    }
}
