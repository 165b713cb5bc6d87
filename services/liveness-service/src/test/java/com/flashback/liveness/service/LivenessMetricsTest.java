package com.flashback.liveness.service;

import com.flashback.liveness.domain.LivenessState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LivenessMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final LivenessMetrics metrics = new LivenessMetrics(registry);

    @Test
    @DisplayName("Completed sessions are counted per outcome")
    void shouldTagCompletedByOutcome() {
        metrics.recordCompleted(LivenessState.PASSED);
        metrics.recordCompleted(LivenessState.PASSED);
        metrics.recordCompleted(LivenessState.TIMED_OUT);

        assertThat(registry.get("liveness.sessions.completed").tag("outcome", "passed").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("liveness.sessions.completed").tag("outcome", "timed_out").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Frame timer records the wrapped call and returns its value")
    void shouldTimeFrames() {
        String value = metrics.timeFrame(() -> "observed");

        assertThat(value).isEqualTo("observed");
        assertThat(registry.get("liveness.frame.processing").timer().count()).isEqualTo(1);
    }
}
