package com.flashback.liveness.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flashback.liveness.domain.FrameObservation;
import com.flashback.liveness.domain.LivenessState;
import com.flashback.liveness.events.LivenessEvent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Snapshot of a hosted session. Mutating calls also carry the events drained by that call.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionStatusResponse {

    private UUID sessionId;
    private LivenessState state;
    private Instant startedAt;
    private Long durationMs;
    private Long frameIntervalMs;
    private int progressPercent;

    private int blinkCount;
    private boolean headMoved;
    private int headMovementCount;
    private int mouthActivityCount;
    private int framesTotal;
    private int framesWithFace;
    private int consecutiveMisses;
    private double faceDetectionRate;

    private boolean verdictAvailable;
    private String terminationReason;

    private FrameObservation lastFrame;
    private List<LivenessEvent> events;
}
