package com.phillippitts.coordsim.config.properties;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for session retention and the background reaper.
 */
@ConfigurationProperties(prefix = "coordsim.session")
@Validated
public class SessionProperties {

    /** Inactivity after which a session becomes eligible for reaping. */
    @NotNull
    private Duration ttl = Duration.ofHours(24);

    /** Enable/disable the periodic reaper. */
    private boolean reaperEnabled = true;

    /** Interval between reaper runs, in milliseconds. */
    @Positive(message = "Reaper interval must be positive")
    private long reaperIntervalMs = 3_600_000;

    public Duration getTtl() {
        return ttl;
    }

    public void setTtl(Duration ttl) {
        this.ttl = ttl;
    }

    public boolean isReaperEnabled() {
        return reaperEnabled;
    }

    public void setReaperEnabled(boolean reaperEnabled) {
        this.reaperEnabled = reaperEnabled;
    }

    public long getReaperIntervalMs() {
        return reaperIntervalMs;
    }

    public void setReaperIntervalMs(long reaperIntervalMs) {
        this.reaperIntervalMs = reaperIntervalMs;
    }
}
