package com.flashback.liveness.domain;

/**
 * The four independent signals a liveness verdict is fused from, each with the wording used
 * when it is the reason a check failed.
 */
public enum LivenessFactor {

    BLINK("no blink detected", "Blink naturally a couple of times"),
    HEAD_MOVEMENT("no head movement detected", "Turn your head slightly to one side"),
    MOUTH_ACTIVITY("not enough mouth movement detected", "Open and close your mouth"),
    FACE_PRESENCE("face not visible often enough", "Keep your whole face inside the frame");

    private final String failureDescription;
    private final String retryHint;

    LivenessFactor(String failureDescription, String retryHint) {
        this.failureDescription = failureDescription;
        this.retryHint = retryHint;
    }

    public String getFailureDescription() {
        return failureDescription;
    }

    public String getRetryHint() {
        return retryHint;
    }
}
