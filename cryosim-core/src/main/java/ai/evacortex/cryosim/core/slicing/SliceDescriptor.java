/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.slicing;

import ai.evacortex.cryosim.core.model.AtomRecord;

import java.util.List;

/**
 * One z-slab of a frame: atoms with {@code z0 <= z < z1}.
 *
 * @param index position of the slab in the nominal partition
 */
public record SliceDescriptor(int index, double z0, double z1, List<AtomRecord> atoms) {

    public SliceDescriptor {
        if (!(z0 < z1)) {
            throw new IllegalArgumentException("Invalid slab: [" + z0 + " .. " + z1 + ")");
        }
        atoms = List.copyOf(atoms);
    }

    public double thickness() {
        return z1 - z0;
    }

    public double centre() {
        return (z0 + z1) / 2.0;
    }

    public int size() {
        return atoms.size();
    }
}
