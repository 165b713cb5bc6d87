package com.flashback.liveness.domain;

import java.time.Instant;

/**
 * Signals derived from one ingested frame, kept in the session's diagnostic history.
 * Geometry fields are {@code NaN} for frames without a usable face.
 */
public record FrameObservation(
        Instant timestamp,
        boolean faceFound,
        double leftEar,
        double rightEar,
        double mouthOpening,
        double noseX,
        double noseY,
        boolean blinkRegistered,
        boolean movementLatched,
        boolean mouthActivityRegistered
) {

    public static FrameObservation missed(Instant timestamp) {
        return new FrameObservation(timestamp, false, Double.NaN, Double.NaN, Double.NaN,
                Double.NaN, Double.NaN, false, false, false);
    }

    public double averageEar() {
        return (leftEar + rightEar) / 2.0;
    }

    public FacePosition facePosition() {
        return faceFound ? FacePosition.classify(noseX, noseY) : FacePosition.UNKNOWN;
    }
}
