/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.job;

import ai.evacortex.cryosim.core.model.AtomRecord;
import ai.evacortex.cryosim.core.model.Box;

import java.util.List;

/**
 * Structural change applied to a frame's atoms before simulation, e.g. embedding them in vitreous ice.
 * Must be a pure function of its arguments.
 */
@FunctionalInterface
public interface AtomPerturbation {

    /**
     * @param atoms  atoms in the frame's padded coordinate system
     * @param bounds box the result has to stay inside
     */
    List<AtomRecord> apply(List<AtomRecord> atoms, Box bounds);

    static AtomPerturbation none() {
        return (atoms, bounds) -> atoms;
    }
}
