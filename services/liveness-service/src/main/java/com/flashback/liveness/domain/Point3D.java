package com.flashback.liveness.domain;

/**
 * One face-mesh landmark. x and y are normalized to the frame ([0,1]); z is relative depth.
 */
public record Point3D(double x, double y, double z) {

    public static Point3D of(double x, double y) {
        return new Point3D(x, y, 0.0);
    }

    public boolean isFinite() {
        return Double.isFinite(x) && Double.isFinite(y) && Double.isFinite(z);
    }
}
