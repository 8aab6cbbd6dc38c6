package com.phillippitts.coordsim.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TimeUtilsTest {

    @Test
    void elapsedSinceIsNeverNegative() {
        long future = System.nanoTime() + Duration.ofSeconds(10).toNanos();

        assertThat(TimeUtils.elapsedSince(future)).isEqualTo(Duration.ZERO);
    }

    @Test
    void elapsedSinceMeasuresPastStart() {
        long start = System.nanoTime() - Duration.ofMillis(50).toNanos();

        assertThat(TimeUtils.elapsedSince(start)).isGreaterThanOrEqualTo(Duration.ofMillis(50));
        assertThat(TimeUtils.elapsedMillis(start)).isGreaterThanOrEqualTo(50);
    }

    @Test
    void toSecondsKeepsFraction() {
        assertThat(TimeUtils.toSeconds(Duration.ofMillis(1500))).isCloseTo(1.5, within(1e-9));
        assertThat(TimeUtils.toSeconds(null)).isZero();
    }
}
