/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.dispatch;

import ai.evacortex.cryosim.core.engine.SimulationEngine;
import ai.evacortex.cryosim.core.exceptions.FrameSimulationException;
import ai.evacortex.cryosim.core.job.CancellationToken;
import ai.evacortex.cryosim.core.job.FrameResult;
import ai.evacortex.cryosim.core.job.FrameSimulator;
import ai.evacortex.cryosim.core.job.SimulationContext;
import ai.evacortex.cryosim.core.sink.ResultSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs frames one after another on the calling thread, in index order, with a single engine.
 */
public final class SequentialDispatcher implements Dispatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(SequentialDispatcher.class);

    private final AtomicReference<RunState> state = new AtomicReference<>(RunState.PENDING);

    @Override
    public RunReport run(SimulationContext context, FrameSimulator simulator, ResultSink sink) {
        if (!state.compareAndSet(RunState.PENDING, RunState.RUNNING)) {
            throw new IllegalStateException("Dispatcher already used, state=" + state.get());
        }
        try {
            return runFrames(context, simulator, sink);
        } finally {
            // an Error escaping a frame still ends the run FAILED
            state.compareAndSet(RunState.RUNNING, RunState.FAILED);
        }
    }

    private RunReport runFrames(SimulationContext context, FrameSimulator simulator, ResultSink sink) {
        long start = System.nanoTime();
        CancellationToken token = new CancellationToken();
        SimulationEngine engine = context.engineFactory().get();

        int n = context.numFrames();
        for (int i = 0; i < n; i++) {
            try {
                FrameResult result = simulator.simulate(context, engine, i, token);
                sink.write(i, result.angle(), result.position(), result.image());
            } catch (RuntimeException e) {
                state.set(RunState.FAILED);
                throw new FrameSimulationException(i, e);
            }
        }

        state.set(RunState.SUCCEEDED);
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        LOGGER.debug("Sequential run of {} frames finished in {} ms", n, elapsed.toMillis());
        return new RunReport(RunState.SUCCEEDED, n, 1, elapsed);
    }

    @Override
    public RunState state() {
        return state.get();
    }
}
