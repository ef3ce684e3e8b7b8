/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.job;

import ai.evacortex.cryosim.core.engine.SimulationEngine;

/**
 * Simulates one frame. The dispatcher runs the same strategy for every index of the scan.
 *
 * <p>Implementations hold no per-frame state, so one instance serves all workers concurrently.
 * Failures propagate as unchecked exceptions and are never retried.</p>
 */
@FunctionalInterface
public interface FrameSimulator {

    /**
     * @param context shared run state
     * @param engine  engine owned by the calling worker
     * @param index   frame index in {@code [0, context.numFrames())}
     * @param token   run-wide cancellation flag, checked before expensive steps
     * @throws ai.evacortex.cryosim.core.exceptions.FrameCancelledException if the run was cancelled
     */
    FrameResult simulate(SimulationContext context, SimulationEngine engine, int index, CancellationToken token);
}
