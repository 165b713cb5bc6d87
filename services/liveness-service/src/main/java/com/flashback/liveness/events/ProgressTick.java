package com.flashback.liveness.events;

import java.time.Instant;

/**
 * Emitted on every cadence tick of a running session.
 *
 * @param elapsedMillis time since the session started
 * @param percent       elapsed share of the session duration, 0-100
 */
public record ProgressTick(Instant timestamp, long elapsedMillis, int percent) implements LivenessEvent {

    @Override
    public LivenessEventType type() {
        return LivenessEventType.PROGRESS;
    }
}
