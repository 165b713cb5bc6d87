package com.flashback.liveness.events;

import java.time.Instant;

/**
 * Head movement was latched for the session.
 *
 * @param noseDelta frame-to-frame horizontal nose displacement that triggered the latch
 */
public record MovementEvent(Instant timestamp, double noseDelta) implements LivenessEvent {

    @Override
    public LivenessEventType type() {
        return LivenessEventType.MOVEMENT;
    }
}
