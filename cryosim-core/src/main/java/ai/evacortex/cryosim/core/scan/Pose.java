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
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

import java.util.Objects;

/**
 * Specimen pose for one frame.
 *
 * @param angle       tilt angle in degrees
 * @param position    scan-plane position of the frame
 * @param orientation rotation applied to the specimen about its centre
 * @param shift       translation subtracted after rotation
 * @param axis        rotation axis
 */
public record Pose(double angle, Vector3D position, Rotation orientation, Vector3D shift, Vector3D axis) {

    public Pose {
        Objects.requireNonNull(position, "position must not be null");
        Objects.requireNonNull(orientation, "orientation must not be null");
        Objects.requireNonNull(shift, "shift must not be null");
        Objects.requireNonNull(axis, "axis must not be null");
    }

    public static Pose identity() {
        return new Pose(0.0, Vector3D.ZERO, Rotation.IDENTITY, Vector3D.ZERO, Vector3D.PLUS_I);
    }
}
