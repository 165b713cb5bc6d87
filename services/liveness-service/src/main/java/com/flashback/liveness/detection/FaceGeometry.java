package com.flashback.liveness.detection;

import com.flashback.liveness.domain.LandmarkSample;
import com.flashback.liveness.domain.Point3D;

/**
 * Stateless landmark geometry. Safe to call from any number of sessions concurrently.
 */
public final class FaceGeometry {

    /** Horizontal eye spans at or below this are treated as a degenerate contour. */
    static final double MIN_EYE_WIDTH = 1e-6;

    private FaceGeometry() {
    }

    public static double distance(Point3D a, Point3D b) {
        double dx = a.x() - b.x();
        double dy = a.y() - b.y();
        double dz = a.z() - b.z();
        return Math.sqrt(dx * dx + dy * dy + dz * dz);
    }

    /**
     * Eye aspect ratio over six ordered contour points {@code [p0..p5]}:
     * {@code (|p1-p5| + |p2-p4|) / (2 * |p0-p3|)}.
     *
     * @throws IllegalArgumentException if the index array is not of length 6 or the
     *                                  horizontal span is degenerate
     */
    public static double eyeAspectRatio(LandmarkSample sample, int[] eye) {
        if (eye == null || eye.length != 6) {
            throw new IllegalArgumentException("Eye contour needs exactly 6 landmark indices");
        }
        double width = distance(sample.point(eye[0]), sample.point(eye[3]));
        if (width <= MIN_EYE_WIDTH) {
            throw new IllegalArgumentException("Degenerate eye contour: horizontal span is zero");
        }
        double vertical1 = distance(sample.point(eye[1]), sample.point(eye[5]));
        double vertical2 = distance(sample.point(eye[2]), sample.point(eye[4]));
        return (vertical1 + vertical2) / (2.0 * width);
    }

    /**
     * @return true if the eye's horizontal span is too small for an aspect ratio
     */
    public static boolean isDegenerateEye(LandmarkSample sample, int[] eye) {
        return distance(sample.point(eye[0]), sample.point(eye[3])) <= MIN_EYE_WIDTH;
    }

    /**
     * Vertical gap between the upper and lower lip landmarks. Horizontal and depth offsets are
     * ignored so a head turn does not read as an open mouth.
     */
    public static double mouthOpening(LandmarkSample sample, int topIndex, int bottomIndex) {
        return Math.abs(sample.point(bottomIndex).y() - sample.point(topIndex).y());
    }
}
