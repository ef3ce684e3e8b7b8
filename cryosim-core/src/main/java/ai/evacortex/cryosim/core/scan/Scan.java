/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.scan;

import org.apache.commons.math3.geometry.euclidean.threed.Rotation;
import org.apache.commons.math3.geometry.euclidean.threed.RotationConvention;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered acquisition poses; frame {@code i} is simulated with {@code pose(i)}.
 */
public final class Scan {

    private final List<Pose> poses;
    private final Vector3D axis;
    private final double exposureTime;

    public Scan(List<Pose> poses, Vector3D axis, double exposureTime) {
        Objects.requireNonNull(poses, "poses must not be null");
        Objects.requireNonNull(axis, "axis must not be null");
        if (exposureTime < 0.0) {
            throw new IllegalArgumentException("Exposure time must be >= 0: " + exposureTime);
        }
        this.poses = List.copyOf(poses);
        this.axis = axis;
        this.exposureTime = exposureTime;
    }

    /**
     * Single-axis tilt series: frame {@code i} is rotated by {@code startAngle + i * stepAngle} degrees
     * about {@code axis} and translated by {@code i * stepPos} along it.
     */
    public static Scan singleAxis(Vector3D axis, double startAngle, double stepAngle, int numImages,
                                  double stepPos, double exposureTime) {
        if (numImages <= 0) {
            throw new IllegalArgumentException("Number of images must be > 0: " + numImages);
        }
        Vector3D unit = axis.normalize();
        List<Pose> poses = new ArrayList<>(numImages);
        for (int i = 0; i < numImages; i++) {
            double angle = startAngle + i * stepAngle;
            Rotation r = new Rotation(unit, Math.toRadians(angle), RotationConvention.VECTOR_OPERATOR);
            Vector3D offset = unit.scalarMultiply(i * stepPos);
            poses.add(new Pose(angle, offset, r, offset, unit));
        }
        return new Scan(poses, unit, exposureTime);
    }

    /** Translation per step that keeps a specimen of the given radius in view. */
    public static double autoStepPosition(double stepAngle, double radius) {
        return stepAngle * radius * Math.PI / 180.0;
    }

    public int size() {
        return poses.size();
    }

    public Pose pose(int index) {
        return poses.get(index);
    }

    public double angle(int index) {
        return poses.get(index).angle();
    }

    public Vector3D position(int index) {
        return poses.get(index).position();
    }

    public Rotation orientation(int index) {
        return poses.get(index).orientation();
    }

    public Vector3D shift(int index) {
        return poses.get(index).shift();
    }

    public Vector3D axis() {
        return axis;
    }

    public double exposureTime() {
        return exposureTime;
    }

    public double[] angles() {
        return poses.stream().mapToDouble(Pose::angle).toArray();
    }
}
