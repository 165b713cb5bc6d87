package com.flashback.liveness.detection;

import java.util.stream.IntStream;

/**
 * MediaPipe face-mesh landmark indices used by the liveness signals.
 *
 * <p>Eye contours hold the two eye corners at p0/p3, the upper lid at p1/p2 and the lower lid
 * at p4/p5, so that {@link FaceGeometry#eyeAspectRatio} measures p1/p5 and p2/p4 as vertical
 * spans.</p>
 */
public final class FaceMeshLandmarks {

    /** Point count of the MediaPipe face mesh without iris refinement. */
    public static final int FACE_MESH_POINT_COUNT = 468;

    public static final int[] LEFT_EYE = {362, 385, 387, 263, 373, 380};
    public static final int[] RIGHT_EYE = {33, 160, 158, 133, 153, 144};

    public static final int NOSE_TIP = 1;

    public static final int UPPER_INNER_LIP = 13;
    public static final int LOWER_INNER_LIP = 14;

    private FaceMeshLandmarks() {
    }

    static int highestIndex() {
        return IntStream.concat(IntStream.of(LEFT_EYE), IntStream.concat(IntStream.of(RIGHT_EYE),
                        IntStream.of(NOSE_TIP, UPPER_INNER_LIP, LOWER_INNER_LIP)))
                .max()
                .orElse(0);
    }
}
