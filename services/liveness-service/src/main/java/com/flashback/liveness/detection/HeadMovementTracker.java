package com.flashback.liveness.detection;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Latches head movement from the horizontal nose-tip position.
 *
 * <p>Movement is measured frame to frame, not against the first position: the previous value
 * is replaced on every call, so slow drift never accumulates into a trigger while a deliberate
 * head turn between two frames does. Once latched, {@link #hasMoved()} stays true until
 * {@link #reset()}.</p>
 */
@Slf4j
public class HeadMovementTracker {

    private final double movementThreshold;
    private final Duration cooldown;

    private Double previousNoseX;
    private boolean moved;
    private Instant lastMovementAt;
    private int movementCount;
    private double lastDelta;

    public HeadMovementTracker(LivenessThresholds thresholds) {
        this.movementThreshold = thresholds.getMovementThreshold();
        this.cooldown = thresholds.getMovementCooldown();
    }

    /**
     * Feed one frame's nose-tip x coordinate.
     *
     * @return true only on the call that latches movement for the first time; the first call
     *         of a session always returns false because it only records the baseline
     */
    public boolean update(double noseX, Instant now) {
        if (previousNoseX == null) {
            previousNoseX = noseX;
            return false;
        }

        double delta = Math.abs(noseX - previousNoseX);
        previousNoseX = noseX;

        if (delta <= movementThreshold || !cooldownElapsed(now)) {
            return false;
        }

        movementCount++;
        lastMovementAt = now;
        lastDelta = delta;

        if (moved) {
            return false;
        }
        moved = true;
        log.debug("Head movement latched (delta={})", String.format("%.3f", delta));
        return true;
    }

    private boolean cooldownElapsed(Instant now) {
        return lastMovementAt == null || Duration.between(lastMovementAt, now).compareTo(cooldown) >= 0;
    }

    public boolean hasMoved() {
        return moved;
    }

    public Optional<Double> getPreviousNoseX() {
        return Optional.ofNullable(previousNoseX);
    }

    /** @return movements above threshold that passed the cooldown, latched or not */
    public int getMovementCount() {
        return movementCount;
    }

    /** @return the displacement of the most recent counted movement */
    public double getLastDelta() {
        return lastDelta;
    }

    public void reset() {
        previousNoseX = null;
        moved = false;
        lastMovementAt = null;
        movementCount = 0;
        lastDelta = 0.0;
    }
}
