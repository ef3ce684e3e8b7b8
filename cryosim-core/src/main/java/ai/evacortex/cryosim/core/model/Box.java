/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.model;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

import java.util.Collection;

/**
 * Axis-aligned 3-D box; bounds are inclusive.
 */
public record Box(double x0, double y0, double z0, double x1, double y1, double z1) {

    public Box {
        if (x0 > x1 || y0 > y1 || z0 > z1) {
            throw new IllegalArgumentException("Invalid box: [" + x0 + ", " + y0 + ", " + z0
                    + "] .. [" + x1 + ", " + y1 + ", " + z1 + "]");
        }
    }

    public static Box of(Vector3D lower, Vector3D upper) {
        return new Box(lower.getX(), lower.getY(), lower.getZ(), upper.getX(), upper.getY(), upper.getZ());
    }

    public static Box enclosing(Collection<AtomRecord> atoms) {
        if (atoms.isEmpty()) {
            return new Box(0, 0, 0, 0, 0, 0);
        }
        double x0 = Double.POSITIVE_INFINITY, y0 = Double.POSITIVE_INFINITY, z0 = Double.POSITIVE_INFINITY;
        double x1 = Double.NEGATIVE_INFINITY, y1 = Double.NEGATIVE_INFINITY, z1 = Double.NEGATIVE_INFINITY;
        for (AtomRecord a : atoms) {
            x0 = Math.min(x0, a.x());
            y0 = Math.min(y0, a.y());
            z0 = Math.min(z0, a.z());
            x1 = Math.max(x1, a.x());
            y1 = Math.max(y1, a.y());
            z1 = Math.max(z1, a.z());
        }
        return new Box(x0, y0, z0, x1, y1, z1);
    }

    public boolean contains(Box other) {
        return other.x0 >= x0 && other.x1 <= x1
                && other.y0 >= y0 && other.y1 <= y1
                && other.z0 >= z0 && other.z1 <= z1;
    }

    public Vector3D lower() {
        return new Vector3D(x0, y0, z0);
    }

    public Vector3D upper() {
        return new Vector3D(x1, y1, z1);
    }

    public Vector3D centre() {
        return new Vector3D((x0 + x1) / 2.0, (y0 + y1) / 2.0, (z0 + z1) / 2.0);
    }

    public double depth() {
        return z1 - z0;
    }
}
