package com.flashback.liveness.domain;

/**
 * Where the face sat in the frame, judged from the nose tip.
 */
public enum FacePosition {
    CENTER,
    LEFT,
    RIGHT,
    TOP,
    BOTTOM,
    UNKNOWN;

    private static final double CENTER_BAND_LOW = 0.35;
    private static final double CENTER_BAND_HIGH = 0.65;

    /**
     * Classify a normalized nose position. Horizontal offsets win over vertical ones.
     */
    public static FacePosition classify(double noseX, double noseY) {
        if (!Double.isFinite(noseX) || !Double.isFinite(noseY)) {
            return UNKNOWN;
        }
        if (noseX < CENTER_BAND_LOW) {
            return LEFT;
        }
        if (noseX > CENTER_BAND_HIGH) {
            return RIGHT;
        }
        if (noseY < CENTER_BAND_LOW) {
            return TOP;
        }
        if (noseY > CENTER_BAND_HIGH) {
            return BOTTOM;
        }
        return CENTER;
    }
}
