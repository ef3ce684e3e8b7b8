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

/**
 * A single atom of the specimen.
 *
 * @param species   atomic number
 * @param x         x position (Å)
 * @param y         y position (Å)
 * @param z         z position (Å)
 * @param sigma     thermal displacement parameter
 * @param occupancy site occupancy in [0 .. 1]
 */
public record AtomRecord(int species, double x, double y, double z, double sigma, double occupancy) {

    public AtomRecord {
        if (species <= 0) {
            throw new IllegalArgumentException("Invalid atomic number: " + species);
        }
        if (occupancy < 0.0 || occupancy > 1.0) {
            throw new IllegalArgumentException("Occupancy out of range: " + occupancy);
        }
    }

    public static AtomRecord of(int species, double x, double y, double z) {
        return new AtomRecord(species, x, y, z, 0.085, 1.0);
    }

    public Vector3D position() {
        return new Vector3D(x, y, z);
    }

    public AtomRecord withPosition(Vector3D p) {
        return new AtomRecord(species, p.getX(), p.getY(), p.getZ(), sigma, occupancy);
    }

    public AtomRecord translate(double dx, double dy, double dz) {
        return new AtomRecord(species, x + dx, y + dy, z + dz, sigma, occupancy);
    }
}
