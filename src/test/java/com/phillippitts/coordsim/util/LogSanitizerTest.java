package com.phillippitts.coordsim.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void shouldReturnEmptyStringForNullOrNonPositiveMax() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.truncate("hello world", 0)).isEmpty();
        assertThat(LogSanitizer.truncate("hello world", -1)).isEmpty();
    }

    @Test
    void shouldTruncateLongInput() {
        assertThat(LogSanitizer.truncate("hello world", 5)).isEqualTo("hello");
        assertThat(LogSanitizer.truncate("hello", 5)).isEqualTo("hello");
        assertThat(LogSanitizer.truncate("hi", 10)).isEqualTo("hi");
    }

    @Test
    void describeUsesMessageWhenPresent() {
        assertThat(LogSanitizer.describe(new IllegalStateException("engine exploded"), 100))
                .isEqualTo("engine exploded");
        assertThat(LogSanitizer.describe(new IllegalStateException("engine exploded"), 6))
                .isEqualTo("engine");
    }

    @Test
    void describeFallsBackToTypeName() {
        assertThat(LogSanitizer.describe(new NullPointerException(), 100)).isEqualTo("NullPointerException");
        assertThat(LogSanitizer.describe(new RuntimeException("  "), 100)).isEqualTo("RuntimeException");
        assertThat(LogSanitizer.describe(null, 100)).isEmpty();
    }
}
