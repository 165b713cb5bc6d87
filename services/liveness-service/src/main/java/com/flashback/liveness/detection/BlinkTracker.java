package com.flashback.liveness.detection;

import com.flashback.liveness.events.BlinkEvent;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Counts blinks from per-frame eye aspect ratios using a hysteresis band and a cooldown.
 *
 * <h3>Rules</h3>
 * <ul>
 *   <li>A blink is registered when the averaged EAR drops below the closed threshold while no
 *       blink is in progress and the cooldown since the previous blink has elapsed.</li>
 *   <li>The in-progress flag clears only once the EAR is back at or above the open threshold.
 *       EAR values between the two thresholds change nothing, so jitter around a single
 *       cutoff cannot produce a second count.</li>
 *   <li>The count never decreases. A blink still in progress when the session ends stays
 *       counted.</li>
 * </ul>
 */
@Slf4j
public class BlinkTracker {

    private final double closedThreshold;
    private final double openThreshold;
    private final Duration cooldown;

    private boolean inProgress;
    private int count;
    private Instant lastBlinkAt;

    public BlinkTracker(LivenessThresholds thresholds) {
        this.closedThreshold = thresholds.getClosedThreshold();
        this.openThreshold = thresholds.getOpenThreshold();
        this.cooldown = thresholds.getBlinkCooldown();
    }

    /**
     * Feed one frame's eye aspect ratios.
     *
     * @param earLeft  left eye aspect ratio
     * @param earRight right eye aspect ratio
     * @param now      capture time of the frame; must not go backwards within a session
     * @return the blink registered by this frame, if any
     */
    public Optional<BlinkEvent> update(double earLeft, double earRight, Instant now) {
        double averageEar = (earLeft + earRight) / 2.0;

        if (averageEar >= openThreshold) {
            inProgress = false;
            return Optional.empty();
        }

        if (averageEar < closedThreshold && !inProgress && cooldownElapsed(now)) {
            count++;
            inProgress = true;
            lastBlinkAt = now;
            log.debug("Blink #{} registered (EAR={})", count, String.format("%.3f", averageEar));
            return Optional.of(new BlinkEvent(now, count, averageEar));
        }

        return Optional.empty();
    }

    private boolean cooldownElapsed(Instant now) {
        return lastBlinkAt == null || Duration.between(lastBlinkAt, now).compareTo(cooldown) >= 0;
    }

    public int getCount() {
        return count;
    }

    public boolean isInProgress() {
        return inProgress;
    }

    public Optional<Instant> getLastBlinkAt() {
        return Optional.ofNullable(lastBlinkAt);
    }

    public void reset() {
        inProgress = false;
        count = 0;
        lastBlinkAt = null;
    }
}
