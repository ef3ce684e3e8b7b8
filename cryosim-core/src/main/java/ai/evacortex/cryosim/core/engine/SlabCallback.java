/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.engine;

@FunctionalInterface
public interface SlabCallback {

    /**
     * Receives the projected potential of the slab {@code [z0, z1)} on the padded grid, indexed [x][y].
     */
    void accept(double z0, double z1, double[][] potential);
}
