package com.flashback.liveness.detection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FacePresenceTrackerTest {

    private final FacePresenceTracker tracker = new FacePresenceTracker();

    @Test
    @DisplayName("Rate is zero before any frame")
    void shouldReportZeroRateWithoutFrames() {
        assertThat(tracker.detectionRate()).isZero();
        assertThat(tracker.getFramesTotal()).isZero();
    }

    @Test
    @DisplayName("Rate is frames with face over all frames")
    void shouldComputeDetectionRate() {
        for (int i = 0; i < 9; i++) {
            tracker.update(true);
        }
        tracker.update(false);

        assertThat(tracker.detectionRate()).isEqualTo(0.9);
        assertThat(tracker.getFramesWithFace()).isEqualTo(9);
        assertThat(tracker.getFramesTotal()).isEqualTo(10);
    }

    @Test
    @DisplayName("A face resets the consecutive miss counter")
    void shouldTrackConsecutiveMisses() {
        tracker.update(false);
        tracker.update(false);
        assertThat(tracker.getConsecutiveMisses()).isEqualTo(2);

        tracker.update(true);
        assertThat(tracker.getConsecutiveMisses()).isZero();

        tracker.update(false);
        assertThat(tracker.getConsecutiveMisses()).isEqualTo(1);
    }

    @Test
    @DisplayName("Reset clears all counters")
    void shouldReset() {
        tracker.update(true);
        tracker.update(false);

        tracker.reset();

        assertThat(tracker.getFramesTotal()).isZero();
        assertThat(tracker.getFramesWithFace()).isZero();
        assertThat(tracker.getConsecutiveMisses()).isZero();
    }
}
