package com.flashback.liveness.events;

import java.time.Instant;

/**
 * The consecutive-miss ceiling was crossed; the session ends as FAILED right after this event.
 */
public record FaceLostEvent(Instant timestamp, int consecutiveMisses) implements LivenessEvent {

    @Override
    public LivenessEventType type() {
        return LivenessEventType.FACE_LOST;
    }
}
