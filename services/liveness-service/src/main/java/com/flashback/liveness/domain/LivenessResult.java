package com.flashback.liveness.domain;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.time.Instant;
import java.util.List;

/**
 * Verdict of one liveness session. Produced exactly once per session and handed to the caller.
 *
 * <p>{@code live} is decided by the hard pass conditions alone; {@code confidence} is the mean
 * of the four per-factor confidences and is reported for display and telemetry only.</p>
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
public final class LivenessResult {

    private final boolean live;
    private final double confidence;
    private final int detectedBlinks;
    private final double faceDetectionRate;
    private final boolean headMoved;
    private final int mouthActivityCount;
    private final String reason;

    @Singular
    private final List<LivenessFactor> failedFactors;

    private final boolean faceDetected;
    private final FacePosition facePosition;
    private final LivenessState outcome;
    private final int framesTotal;
    private final int framesWithFace;
    private final Instant completedAt;

    public boolean hasFailed(LivenessFactor factor) {
        return failedFactors.contains(factor);
    }
}
