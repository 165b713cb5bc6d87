package com.flashback.liveness.events;

import com.flashback.liveness.domain.LivenessState;

import java.time.Instant;

public record SessionCompletedEvent(Instant timestamp, LivenessState outcome, boolean live, String reason)
        implements LivenessEvent {

    @Override
    public LivenessEventType type() {
        return LivenessEventType.SESSION_COMPLETED;
    }
}
