/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.sink;

/**
 * Per-frame stack of projected-potential planes, shape (depth, height, width).
 */
public interface PotentialVolume {

    int depth();

    int height();

    int width();

    /**
     * Adds {@code plane} (row-major [y][x]) into plane {@code z}. Several slabs may fall into the same
     * plane when the slab count differs from {@code depth}; their potentials sum.
     */
    void accumulatePlane(int z, float[][] plane);
}
