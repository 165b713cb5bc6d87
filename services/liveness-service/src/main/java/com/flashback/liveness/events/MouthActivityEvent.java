package com.flashback.liveness.events;

import java.time.Instant;

public record MouthActivityEvent(Instant timestamp, int activityCount, double mouthOpening) implements LivenessEvent {

    @Override
    public LivenessEventType type() {
        return LivenessEventType.MOUTH_ACTIVITY;
    }
}
