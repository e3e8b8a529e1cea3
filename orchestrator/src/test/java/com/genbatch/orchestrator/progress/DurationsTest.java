package com.genbatch.orchestrator.progress;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class DurationsTest {

    @Test
    void format_underAnHour() {
        assertThat(Durations.format(Duration.ofSeconds(125))).isEqualTo("2m 05s");
    }

    @Test
    void format_withHours() {
        assertThat(Durations.format(Duration.ofSeconds(3723))).isEqualTo("1h 02m 03s");
    }

    @Test
    void format_negative_clampedToZero() {
        assertThat(Durations.format(Duration.ofSeconds(-5))).isEqualTo("0m 00s");
    }
}
