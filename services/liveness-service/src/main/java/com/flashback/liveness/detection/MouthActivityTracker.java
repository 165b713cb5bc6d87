package com.flashback.liveness.detection;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Counts distinct mouth openings. The cooldown keeps one sustained opening that spans several
 * sampling ticks from being counted more than once.
 */
@Slf4j
public class MouthActivityTracker {

    private final double mouthThreshold;
    private final Duration cooldown;

    private int count;
    private Instant lastActivityAt;

    public MouthActivityTracker(LivenessThresholds thresholds) {
        this.mouthThreshold = thresholds.getMouthThreshold();
        this.cooldown = thresholds.getActivityCooldown();
    }

    /**
     * @return true if this frame was counted as a new mouth activity
     */
    public boolean update(double mouthDistance, Instant now) {
        if (mouthDistance <= mouthThreshold) {
            return false;
        }
        if (lastActivityAt != null && Duration.between(lastActivityAt, now).compareTo(cooldown) < 0) {
            return false;
        }
        count++;
        lastActivityAt = now;
        log.debug("Mouth activity #{} (opening={})", count, String.format("%.3f", mouthDistance));
        return true;
    }

    public int getCount() {
        return count;
    }

    public Optional<Instant> getLastActivityAt() {
        return Optional.ofNullable(lastActivityAt);
    }

    public void reset() {
        count = 0;
        lastActivityAt = null;
    }
}
