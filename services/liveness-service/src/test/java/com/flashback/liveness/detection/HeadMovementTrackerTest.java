package com.flashback.liveness.detection;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.flashback.liveness.LandmarkSamples.at;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class HeadMovementTrackerTest {

    private HeadMovementTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new HeadMovementTracker(LivenessThresholds.defaults());
    }

    @Test
    @DisplayName("First frame only records the baseline")
    void shouldNotLatchOnFirstFrame() {
        assertThat(tracker.update(0.9, at(0))).isFalse();
        assertThat(tracker.hasMoved()).isFalse();
        assertThat(tracker.getPreviousNoseX()).contains(0.9);
    }

    @Test
    @DisplayName("A jump above the threshold latches movement")
    void shouldLatchOnLargeDelta() {
        tracker.update(0.50, at(0));

        boolean latched = tracker.update(0.53, at(200));

        assertThat(latched).isTrue();
        assertThat(tracker.hasMoved()).isTrue();
        assertThat(tracker.getLastDelta()).isCloseTo(0.03, within(1e-9));
    }

    @Test
    @DisplayName("A jump below the threshold does not latch")
    void shouldIgnoreSmallDelta() {
        tracker.update(0.50, at(0));

        assertThat(tracker.update(0.51, at(200))).isFalse();
        assertThat(tracker.hasMoved()).isFalse();
    }

    @Test
    @DisplayName("Slow drift never accumulates into movement")
    void shouldCompareFrameToFrame() {
        double x = 0.50;
        for (int i = 0; i < 20; i++) {
            tracker.update(x, at(i * 200L));
            x += 0.015;
        }

        assertThat(tracker.hasMoved()).isFalse();
        assertThat(tracker.getPreviousNoseX()).hasValueSatisfying(v -> assertThat(v).isGreaterThan(0.75));
    }

    @Test
    @DisplayName("Movement stays latched and later movements respect the cooldown")
    void shouldStayLatched() {
        tracker.update(0.50, at(0));
        tracker.update(0.55, at(200));

        assertThat(tracker.update(0.50, at(400))).isFalse();
        assertThat(tracker.getMovementCount()).isEqualTo(1);

        assertThat(tracker.update(0.55, at(1400))).isFalse();
        assertThat(tracker.getMovementCount()).isEqualTo(2);
        assertThat(tracker.hasMoved()).isTrue();
    }

    @Test
    @DisplayName("Reset forgets the baseline")
    void shouldReset() {
        tracker.update(0.50, at(0));
        tracker.update(0.60, at(200));

        tracker.reset();

        assertThat(tracker.hasMoved()).isFalse();
        assertThat(tracker.getPreviousNoseX()).isEmpty();
        assertThat(tracker.update(0.9, at(400))).isFalse();
    }
}
