package com.flashback.liveness.config;

import com.flashback.liveness.detection.FaceMeshLandmarks;
import com.flashback.liveness.detection.LivenessThresholds;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Liveness engine and session hosting configuration
 *
 * CONFIGURATION:
 * flashback:
 *   liveness:
 *     session-duration: 8s
 *     frame-interval: 200ms
 *     blink:
 *       closed-threshold: 0.20
 *       open-threshold: 0.25
 *       cooldown: 500ms
 *     head-movement:
 *       threshold: 0.02
 *       cooldown: 1s
 *     mouth:
 *       threshold: 0.04
 *       cooldown: 800ms
 *     verdict:
 *       min-blinks: 1
 *       min-mouth-activity: 2
 *       min-face-detection-rate: 0.8
 *       max-consecutive-misses: 10
 *     hosting:
 *       session-ttl: 5m
 *       max-active-sessions: 1000
 *       eviction-interval: 30s
 */
@Data
@Validated
@ConfigurationProperties(prefix = "flashback.liveness")
public class LivenessProperties {

    /**
     * Length of the sampling window of one session
     */
    @NotNull
    private Duration sessionDuration = Duration.ofMillis(8000);

    /**
     * Expected gap between frames delivered by the capture loop
     */
    @NotNull
    private Duration frameInterval = Duration.ofMillis(200);

    /**
     * Landmark points per face-found sample
     */
    @Min(1)
    private int expectedLandmarkCount = FaceMeshLandmarks.FACE_MESH_POINT_COUNT;

    /**
     * Per-frame observations kept for diagnostics
     */
    @Min(1)
    private int historyCapacity = 10;

    @Valid
    private Blink blink = new Blink();

    @Valid
    private HeadMovement headMovement = new HeadMovement();

    @Valid
    private Mouth mouth = new Mouth();

    @Valid
    private Verdict verdict = new Verdict();

    @Valid
    private Hosting hosting = new Hosting();

    @Data
    public static class Blink {
        @DecimalMin("0.0")
        private double closedThreshold = 0.20;

        @DecimalMin("0.0")
        private double openThreshold = 0.25;

        @NotNull
        private Duration cooldown = Duration.ofMillis(500);
    }

    @Data
    public static class HeadMovement {
        @DecimalMin("0.0")
        private double threshold = 0.02;

        @NotNull
        private Duration cooldown = Duration.ofMillis(1000);
    }

    @Data
    public static class Mouth {
        @DecimalMin("0.0")
        private double threshold = 0.04;

        @NotNull
        private Duration cooldown = Duration.ofMillis(800);
    }

    @Data
    public static class Verdict {
        @Min(1)
        private int minBlinks = 1;

        @Min(1)
        private int minMouthActivity = 2;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double minFaceDetectionRate = 0.8;

        @Min(0)
        private int maxConsecutiveMisses = 10;
    }

    @Data
    public static class Hosting {
        /**
         * Sessions older than this are evicted whatever their state
         */
        @NotNull
        private Duration sessionTtl = Duration.ofMinutes(5);

        @Min(1)
        private int maxActiveSessions = 1000;

        @NotNull
        private Duration evictionInterval = Duration.ofSeconds(30);
    }

    public LivenessThresholds toThresholds() {
        return LivenessThresholds.builder()
                .closedThreshold(blink.getClosedThreshold())
                .openThreshold(blink.getOpenThreshold())
                .blinkCooldown(blink.getCooldown())
                .movementThreshold(headMovement.getThreshold())
                .movementCooldown(headMovement.getCooldown())
                .mouthThreshold(mouth.getThreshold())
                .activityCooldown(mouth.getCooldown())
                .minBlinks(verdict.getMinBlinks())
                .minMouthActivity(verdict.getMinMouthActivity())
                .minFaceDetectionRate(verdict.getMinFaceDetectionRate())
                .maxConsecutiveMisses(verdict.getMaxConsecutiveMisses())
                .sessionDuration(sessionDuration)
                .frameInterval(frameInterval)
                .expectedLandmarkCount(expectedLandmarkCount)
                .historyCapacity(historyCapacity)
                .build()
                .validate();
    }
}
