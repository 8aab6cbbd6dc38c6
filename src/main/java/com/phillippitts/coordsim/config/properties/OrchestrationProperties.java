package com.phillippitts.coordsim.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Tunables for workflow execution and result compilation.
 *
 * <p>The confidence increment and the efficiency baseline are policy choices carried over as
 * configuration rather than fixed literals.
 */
@ConfigurationProperties(prefix = "coordsim.orchestration")
@Validated
public class OrchestrationProperties {

    /** Upper bound on a single collaborator call, in milliseconds. */
    @Positive(message = "Stage timeout must be positive")
    private long stageTimeoutMs = 30_000;

    /** Simulation stage duration above which a performance recommendation is emitted. */
    @Positive(message = "Slow simulation threshold must be positive")
    private long slowSimulationThresholdMs = 5_000;

    /** Confidence used when no stage reported one. */
    @DecimalMin(value = "0.0", message = "Default confidence must be at least 0.0")
    @DecimalMax(value = "1.0", message = "Default confidence must be at most 1.0")
    private double defaultConfidence = 0.75;

    /** Results below this confidence receive the enhancement increment. */
    @DecimalMin(value = "0.0", message = "Confidence threshold must be at least 0.0")
    @DecimalMax(value = "1.0", message = "Confidence threshold must be at most 1.0")
    private double confidenceThreshold = 0.8;

    /** Amount added to a low confidence during optimization, capped at 1.0. */
    @DecimalMin(value = "0.0", message = "Confidence increment must be at least 0.0")
    @DecimalMax(value = "1.0", message = "Confidence increment must be at most 1.0")
    private double confidenceIncrement = 0.1;

    /** Average completed-session duration at which workflow efficiency reaches zero, in seconds. */
    @Positive(message = "Efficiency baseline must be positive")
    private long efficiencyBaselineSeconds = 300;

    public long getStageTimeoutMs() {
        return stageTimeoutMs;
    }

    public void setStageTimeoutMs(long stageTimeoutMs) {
        this.stageTimeoutMs = stageTimeoutMs;
    }

    public long getSlowSimulationThresholdMs() {
        return slowSimulationThresholdMs;
    }

    public void setSlowSimulationThresholdMs(long slowSimulationThresholdMs) {
        this.slowSimulationThresholdMs = slowSimulationThresholdMs;
    }

    public double getDefaultConfidence() {
        return defaultConfidence;
    }

    public void setDefaultConfidence(double defaultConfidence) {
        this.defaultConfidence = defaultConfidence;
    }

    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }

    public void setConfidenceThreshold(double confidenceThreshold) {
        this.confidenceThreshold = confidenceThreshold;
    }

    public double getConfidenceIncrement() {
        return confidenceIncrement;
    }

    public void setConfidenceIncrement(double confidenceIncrement) {
        this.confidenceIncrement = confidenceIncrement;
    }

    public long getEfficiencyBaselineSeconds() {
        return efficiencyBaselineSeconds;
    }

    public void setEfficiencyBaselineSeconds(long efficiencyBaselineSeconds) {
        this.efficiencyBaselineSeconds = efficiencyBaselineSeconds;
    }
}
