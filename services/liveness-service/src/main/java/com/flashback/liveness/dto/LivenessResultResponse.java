package com.flashback.liveness.dto;

import com.flashback.liveness.domain.FacePosition;
import com.flashback.liveness.domain.LivenessFactor;
import com.flashback.liveness.domain.LivenessState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Response DTO carrying the verdict of a finished session
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LivenessResultResponse {

    private UUID sessionId;
    private LivenessState outcome;
    private boolean live;
    private double confidence;
    private String reason;

    private int detectedBlinks;
    private boolean headMoved;
    private int mouthActivityCount;
    private double faceDetectionRate;
    private boolean faceDetected;
    private FacePosition facePosition;
    private int framesTotal;
    private int framesWithFace;

    private List<LivenessFactor> failedFactors;
    private List<String> retryHints;
    private Instant completedAt;
}
