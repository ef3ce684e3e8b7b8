/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.engine;

public enum SimulationKind {
    /** Exit wave at the specimen's lower surface. */
    EXIT_WAVE,
    /** Exit wave propagated through the objective lens to the detector. */
    HRTEM,
    /** Per-slab projected potential; produces no image. */
    PROJECTED_POTENTIAL
}
