package com.flashback.liveness.events;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Discrete, typed notification queued by a liveness session while it processes frames.
 *
 * <p>The session never calls back into UI code. Callers drain the queued events after each
 * {@code ingest}/{@code tick} and render progress from them.</p>
 */
public interface LivenessEvent {

    Instant timestamp();

    @JsonProperty("type")
    LivenessEventType type();
}
