/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.dispatch;

import ai.evacortex.cryosim.core.job.FrameSimulator;
import ai.evacortex.cryosim.core.job.SimulationContext;
import ai.evacortex.cryosim.core.sink.ResultSink;

/**
 * Runs one {@link FrameSimulator} over every frame of a scan and writes each result to its own slot.
 *
 * <p>A dispatcher instance serves a single run.</p>
 */
public interface Dispatcher {

    /**
     * @return report of a successful run
     * @throws ai.evacortex.cryosim.core.exceptions.FrameSimulationException if any frame failed; all
     *         jobs have settled by the time it is thrown
     * @throws IllegalStateException if the dispatcher was already used
     */
    RunReport run(SimulationContext context, FrameSimulator simulator, ResultSink sink);

    RunState state();
}
