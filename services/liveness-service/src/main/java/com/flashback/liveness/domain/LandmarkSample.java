package com.flashback.liveness.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One frame's worth of face-mesh output: the ordered landmark points, the capture time and
 * whether the landmark source found a face at all.
 *
 * <p>Instances are immutable. A sample without a face carries no points. Point content is not
 * validated here; the session rejects malformed samples when they are ingested.</p>
 */
@Getter
@EqualsAndHashCode
@ToString(exclude = "points")
public final class LandmarkSample {

    private final List<Point3D> points;
    private final Instant timestamp;
    private final boolean faceFound;

    public LandmarkSample(List<Point3D> points, Instant timestamp, boolean faceFound) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.points = points == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(points));
        this.faceFound = faceFound;
    }

    public static LandmarkSample withFace(List<Point3D> points, Instant timestamp) {
        return new LandmarkSample(points, timestamp, true);
    }

    public static LandmarkSample noFace(Instant timestamp) {
        return new LandmarkSample(List.of(), timestamp, false);
    }

    public Point3D point(int index) {
        return points.get(index);
    }

    public int size() {
        return points.size();
    }
}
