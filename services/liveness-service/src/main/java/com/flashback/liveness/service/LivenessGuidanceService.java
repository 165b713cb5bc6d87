package com.flashback.liveness.service;

import com.flashback.liveness.domain.LivenessFactor;
import com.flashback.liveness.domain.LivenessResult;
import com.flashback.liveness.dto.LivenessGuidanceResponse;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * User-facing wording for the liveness check: what to do before it starts and what to change
 * after a failed attempt.
 */
@Service
public class LivenessGuidanceService {

    private static final List<String> INSTRUCTIONS = List.of(
            "Position your face in the center of the frame",
            "Ensure good lighting on your face",
            "Look directly at the camera",
            "Blink naturally during the check",
            "Turn your head slightly once",
            "Open and close your mouth a couple of times",
            "Keep your face clearly visible until the check ends"
    );

    private static final List<String> TIPS = List.of(
            "Find a well-lit environment",
            "Hold your device at arm's length",
            "Avoid backlighting or strong shadows",
            "Remove sunglasses, masks or hats",
            "Blink naturally, don't force it"
    );

    public LivenessGuidanceResponse getGuidance() {
        return LivenessGuidanceResponse.builder()
                .instructions(INSTRUCTIONS)
                .tips(TIPS)
                .build();
    }

    /**
     * Retry hints for every factor the attempt failed on, in factor order. A session that
     * ended because the face was lost always gets the face-presence hint first.
     */
    public List<String> retryHints(LivenessResult result) {
        if (result.isLive()) {
            return List.of();
        }
        List<LivenessFactor> factors = result.getFailedFactors();
        boolean faceLost = result.getReason() != null && result.getReason().startsWith("Face lost");
        if (faceLost) {
            return Stream.concat(
                            Stream.of(LivenessFactor.FACE_PRESENCE.getRetryHint()),
                            factors.stream()
                                    .filter(factor -> factor != LivenessFactor.FACE_PRESENCE)
                                    .map(LivenessFactor::getRetryHint))
                    .collect(Collectors.toList());
        }
        return factors.stream()
                .map(LivenessFactor::getRetryHint)
                .collect(Collectors.toList());
    }
}
