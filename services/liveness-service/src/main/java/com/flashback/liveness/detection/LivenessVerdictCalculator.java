package com.flashback.liveness.detection;

import com.flashback.liveness.domain.FacePosition;
import com.flashback.liveness.domain.LivenessFactor;
import com.flashback.liveness.domain.LivenessResult;
import com.flashback.liveness.domain.LivenessState;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Fuses the four tracker outputs into a {@link LivenessResult}.
 *
 * <p>The pass gate is the conjunction of the hard conditions: enough blinks, head movement,
 * enough mouth activity and a high enough face detection rate. Each factor also gets a
 * confidence in [0,1], normalized against its own requirement, and the reported confidence
 * is their mean. A strong score on three factors therefore never hides a miss on the fourth.</p>
 */
public class LivenessVerdictCalculator {

    /** Detection rates above this mark the face as detected overall. */
    private static final double FACE_DETECTED_RATE = 0.5;

    public enum CompletionCause {
        WINDOW_ELAPSED,
        FACE_LOST
    }

    private final LivenessThresholds thresholds;

    public LivenessVerdictCalculator(LivenessThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public LivenessResult evaluate(int blinks,
                                   boolean headMoved,
                                   int mouthActivity,
                                   FacePresenceTracker facePresence,
                                   FacePosition facePosition,
                                   CompletionCause cause,
                                   Instant completedAt) {
        double detectionRate = facePresence.detectionRate();

        List<LivenessFactor> failed = new ArrayList<>();
        if (blinks < thresholds.getMinBlinks()) {
            failed.add(LivenessFactor.BLINK);
        }
        if (!headMoved) {
            failed.add(LivenessFactor.HEAD_MOVEMENT);
        }
        if (mouthActivity < thresholds.getMinMouthActivity()) {
            failed.add(LivenessFactor.MOUTH_ACTIVITY);
        }
        if (detectionRate < thresholds.getMinFaceDetectionRate()) {
            failed.add(LivenessFactor.FACE_PRESENCE);
        }

        LivenessState outcome;
        String reason;
        if (cause == CompletionCause.FACE_LOST) {
            outcome = LivenessState.FAILED;
            reason = faceLostReason(facePresence, blinks, mouthActivity, detectionRate, failed);
        } else if (facePresence.getFramesTotal() == 0) {
            outcome = LivenessState.TIMED_OUT;
            reason = "No frames received before the session ended. Check that the camera is working and try again.";
        } else if (failed.isEmpty()) {
            outcome = LivenessState.PASSED;
            reason = passReason(blinks, mouthActivity, detectionRate);
        } else {
            outcome = LivenessState.FAILED;
            reason = "Liveness check failed: " + describe(failed, blinks, mouthActivity, detectionRate);
        }

        return LivenessResult.builder()
                .live(outcome == LivenessState.PASSED)
                .confidence(confidence(blinks, headMoved, mouthActivity, detectionRate))
                .detectedBlinks(blinks)
                .faceDetectionRate(detectionRate)
                .headMoved(headMoved)
                .mouthActivityCount(mouthActivity)
                .reason(reason)
                .failedFactors(failed)
                .faceDetected(detectionRate > FACE_DETECTED_RATE)
                .facePosition(facePosition)
                .outcome(outcome)
                .framesTotal(facePresence.getFramesTotal())
                .framesWithFace(facePresence.getFramesWithFace())
                .completedAt(completedAt)
                .build();
    }

    /**
     * Mean of the per-factor confidences: blinks and mouth activity relative to their minimum
     * counts, head movement as 0 or 1, face presence relative to the minimum detection rate.
     */
    public double confidence(int blinks, boolean headMoved, int mouthActivity, double detectionRate) {
        double blinkConfidence = Math.min((double) blinks / thresholds.getMinBlinks(), 1.0);
        double headConfidence = headMoved ? 1.0 : 0.0;
        double mouthConfidence = Math.min((double) mouthActivity / thresholds.getMinMouthActivity(), 1.0);
        double faceConfidence = Math.min(detectionRate / thresholds.getMinFaceDetectionRate(), 1.0);
        return (blinkConfidence + headConfidence + mouthConfidence + faceConfidence) / 4.0;
    }

    private String passReason(int blinks, int mouthActivity, double detectionRate) {
        return String.format(Locale.ROOT,
                "Liveness confirmed: %d blink(s), head movement, %d mouth movement(s) and %d%% face detection rate.",
                blinks, mouthActivity, percent(detectionRate));
    }

    private String faceLostReason(FacePresenceTracker facePresence, int blinks, int mouthActivity,
                                  double detectionRate, List<LivenessFactor> failed) {
        String reason = String.format(Locale.ROOT,
                "Face lost: no face detected in %d consecutive frames. Keep your whole face inside the frame.",
                facePresence.getConsecutiveMisses());
        if (failed.isEmpty()) {
            return reason;
        }
        return reason + " Also: " + describe(failed, blinks, mouthActivity, detectionRate);
    }

    private String describe(List<LivenessFactor> failed, int blinks, int mouthActivity, double detectionRate) {
        String problems = failed.stream()
                .map(factor -> factor.getFailureDescription() + " (" + detail(factor, blinks, mouthActivity, detectionRate) + ")")
                .collect(Collectors.joining("; "));
        String hints = failed.stream()
                .map(LivenessFactor::getRetryHint)
                .collect(Collectors.joining(". "));
        return problems + ". " + hints + ".";
    }

    private String detail(LivenessFactor factor, int blinks, int mouthActivity, double detectionRate) {
        switch (factor) {
            case BLINK:
                return String.format(Locale.ROOT, "%d of %d required", blinks, thresholds.getMinBlinks());
            case HEAD_MOVEMENT:
                return "head stayed still";
            case MOUTH_ACTIVITY:
                return String.format(Locale.ROOT, "%d of %d required", mouthActivity, thresholds.getMinMouthActivity());
            case FACE_PRESENCE:
                return String.format(Locale.ROOT, "%d%% of frames, %d%% required",
                        percent(detectionRate), percent(thresholds.getMinFaceDetectionRate()));
            default:
                throw new IllegalArgumentException("Unknown liveness factor: " + factor);
        }
    }

    private static long percent(double rate) {
        return Math.round(rate * 100);
    }
}
