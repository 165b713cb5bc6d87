package com.flashback.liveness.events;

public enum LivenessEventType {
    BLINK,
    MOVEMENT,
    MOUTH_ACTIVITY,
    FACE_LOST,
    PROGRESS,
    SESSION_COMPLETED
}
