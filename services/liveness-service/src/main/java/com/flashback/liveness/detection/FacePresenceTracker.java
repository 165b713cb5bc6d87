package com.flashback.liveness.detection;

/**
 * Frame counters for face presence. {@code framesWithFace <= framesTotal} holds at all times.
 */
public class FacePresenceTracker {

    private int framesTotal;
    private int framesWithFace;
    private int consecutiveMisses;

    public void update(boolean faceFound) {
        framesTotal++;
        if (faceFound) {
            framesWithFace++;
            consecutiveMisses = 0;
        } else {
            consecutiveMisses++;
        }
    }

    /**
     * @return share of frames with a face, in [0,1]; 0 before the first frame
     */
    public double detectionRate() {
        if (framesTotal == 0) {
            return 0.0;
        }
        return (double) framesWithFace / framesTotal;
    }

    public int getFramesTotal() {
        return framesTotal;
    }

    public int getFramesWithFace() {
        return framesWithFace;
    }

    public int getConsecutiveMisses() {
        return consecutiveMisses;
    }

    public void reset() {
        framesTotal = 0;
        framesWithFace = 0;
        consecutiveMisses = 0;
    }
}
