package com.flashback.liveness.events;

import java.time.Instant;

/**
 * A blink was counted.
 *
 * @param blinkCount total blinks counted so far in the session, including this one
 * @param averageEar the averaged eye aspect ratio that crossed the closed threshold
 */
public record BlinkEvent(Instant timestamp, int blinkCount, double averageEar) implements LivenessEvent {

    @Override
    public LivenessEventType type() {
        return LivenessEventType.BLINK;
    }
}
