package com.phillippitts.coordsim.service.events;

import com.phillippitts.coordsim.service.orchestration.event.SessionsReapedEvent;
import com.phillippitts.coordsim.service.orchestration.event.SimulationCompletedEvent;
import com.phillippitts.coordsim.service.orchestration.event.SimulationFailedEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class SimulationEventsListenerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T00:00:00Z");

    @Test
    void throttlesRepeatedKeyWithinOneMinute() {
        SimulationEventsListener listener = new SimulationEventsListener();

        assertThat(listener.shouldLog("failure-simulation_execution-simulation-runner", T0)).isTrue();
        assertThat(listener.shouldLog("failure-simulation_execution-simulation-runner", T0.plusSeconds(30))).isFalse();
        assertThat(listener.shouldLog("failure-simulation_execution-simulation-runner", T0.plusSeconds(60))).isFalse();
        assertThat(listener.shouldLog("failure-simulation_execution-simulation-runner", T0.plusSeconds(61))).isTrue();
    }

    @Test
    void keysAreThrottledIndependently() {
        SimulationEventsListener listener = new SimulationEventsListener();

        assertThat(listener.shouldLog("failure-coordinate_analysis-coordinate-analyzer", T0)).isTrue();
        assertThat(listener.shouldLog("failure-simulation_execution-simulation-runner", T0)).isTrue();
    }

    @Test
    void repeatedFailureEventsAreThrottled() {
        SimulationEventsListener listener = new SimulationEventsListener();
        SimulationFailedEvent event = new SimulationFailedEvent("s-1", "simulation_execution",
                "simulation-runner", "boom", T0);

        listener.onSimulationFailed(event);

        assertThat(listener.shouldLog("failure-simulation_execution-simulation-runner", T0.plusSeconds(5))).isFalse();
    }

    @Test
    void handlesLifecycleEvents() {
        SimulationEventsListener listener = new SimulationEventsListener();

        assertThatCode(() -> {
            listener.onSimulationCompleted(new SimulationCompletedEvent("s-1", 0.85, 1, T0));
            listener.onSessionsReaped(new SessionsReapedEvent(3, T0));
        }).doesNotThrowAnyException();
    }
}
