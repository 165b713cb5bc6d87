package com.flashback.liveness.detection;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * Immutable tuning constants for one liveness session.
 *
 * <p>The engine never reads Spring configuration directly; the service layer converts
 * {@code LivenessProperties} into an instance of this class. {@link #defaults()} gives the
 * stock values for library use and tests.</p>
 */
@Getter
@ToString
@Builder(toBuilder = true)
public final class LivenessThresholds {

    // ---- Blink ----
    @Builder.Default
    private final double closedThreshold = 0.20;
    @Builder.Default
    private final double openThreshold = 0.25;
    @Builder.Default
    private final Duration blinkCooldown = Duration.ofMillis(500);

    // ---- Head movement ----
    @Builder.Default
    private final double movementThreshold = 0.02;
    @Builder.Default
    private final Duration movementCooldown = Duration.ofMillis(1000);

    // ---- Mouth activity ----
    @Builder.Default
    private final double mouthThreshold = 0.04;
    @Builder.Default
    private final Duration activityCooldown = Duration.ofMillis(800);

    // ---- Verdict ----
    @Builder.Default
    private final int minBlinks = 1;
    @Builder.Default
    private final int minMouthActivity = 2;
    @Builder.Default
    private final double minFaceDetectionRate = 0.8;
    @Builder.Default
    private final int maxConsecutiveMisses = 10;

    // ---- Session ----
    @Builder.Default
    private final Duration sessionDuration = Duration.ofMillis(8000);
    @Builder.Default
    private final Duration frameInterval = Duration.ofMillis(200);
    @Builder.Default
    private final int expectedLandmarkCount = FaceMeshLandmarks.FACE_MESH_POINT_COUNT;
    @Builder.Default
    private final int historyCapacity = 10;

    public static LivenessThresholds defaults() {
        return LivenessThresholds.builder().build();
    }

    /**
     * Check internal consistency.
     *
     * @return this instance, for chaining
     * @throws IllegalArgumentException if any value is out of range
     */
    public LivenessThresholds validate() {
        require(closedThreshold > 0, "closedThreshold must be positive");
        require(openThreshold > closedThreshold, "openThreshold must be greater than closedThreshold");
        require(movementThreshold > 0, "movementThreshold must be positive");
        require(mouthThreshold > 0, "mouthThreshold must be positive");
        require(isNonNegative(blinkCooldown), "blinkCooldown must not be negative");
        require(isNonNegative(movementCooldown), "movementCooldown must not be negative");
        require(isNonNegative(activityCooldown), "activityCooldown must not be negative");
        require(minBlinks >= 1, "minBlinks must be at least 1");
        require(minMouthActivity >= 1, "minMouthActivity must be at least 1");
        require(minFaceDetectionRate > 0 && minFaceDetectionRate <= 1, "minFaceDetectionRate must be in (0,1]");
        require(maxConsecutiveMisses >= 0, "maxConsecutiveMisses must not be negative");
        require(sessionDuration != null && !sessionDuration.isZero() && !sessionDuration.isNegative(),
                "sessionDuration must be positive");
        require(frameInterval != null && !frameInterval.isZero() && !frameInterval.isNegative(),
                "frameInterval must be positive");
        require(expectedLandmarkCount > FaceMeshLandmarks.highestIndex(),
                "expectedLandmarkCount must cover every landmark index used");
        require(historyCapacity >= 1, "historyCapacity must be at least 1");
        return this;
    }

    private static boolean isNonNegative(Duration duration) {
        return duration != null && !duration.isNegative();
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }
}
