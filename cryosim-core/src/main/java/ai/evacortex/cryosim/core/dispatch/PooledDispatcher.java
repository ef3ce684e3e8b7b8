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
import ai.evacortex.cryosim.core.exceptions.FrameCancelledException;
import ai.evacortex.cryosim.core.exceptions.FrameSimulationException;
import ai.evacortex.cryosim.core.job.CancellationToken;
import ai.evacortex.cryosim.core.job.FrameResult;
import ai.evacortex.cryosim.core.job.FrameSimulator;
import ai.evacortex.cryosim.core.job.SimulationContext;
import ai.evacortex.cryosim.core.sink.ResultSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.IntFunction;

/**
 * Runs frames on a {@link WorkerPool} of {@code min(maxWorkers, numFrames)} workers.
 *
 * <p>The context is scattered to the pool once before any frame is submitted. Each worker thread
 * builds its own engine on first use. Results are written to the sink in completion order, each into
 * the slot of its frame index.</p>
 *
 * <p>The first failed frame cancels the run: the shared token is raised, queued frames are cancelled,
 * and the dispatcher waits for every job to settle before throwing {@link FrameSimulationException}.
 * Later failures are logged and dropped.</p>
 */
public final class PooledDispatcher implements Dispatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(PooledDispatcher.class);

    private final int maxWorkers;
    private final IntFunction<? extends WorkerPool<FrameResult>> poolFactory;
    private final AtomicReference<RunState> state = new AtomicReference<>(RunState.PENDING);

    public PooledDispatcher(int maxWorkers) {
        this(maxWorkers, LocalWorkerPool::new);
    }

    public PooledDispatcher(int maxWorkers, IntFunction<? extends WorkerPool<FrameResult>> poolFactory) {
        if (maxWorkers <= 0) {
            throw new IllegalArgumentException("maxWorkers must be > 0: " + maxWorkers);
        }
        this.maxWorkers = maxWorkers;
        this.poolFactory = poolFactory;
    }

    @Override
    public RunReport run(SimulationContext context, FrameSimulator simulator, ResultSink sink) {
        if (!state.compareAndSet(RunState.PENDING, RunState.RUNNING)) {
            throw new IllegalStateException("Dispatcher already used, state=" + state.get());
        }
        try {
            return runFrames(context, simulator, sink);
        } finally {
            state.compareAndSet(RunState.RUNNING, RunState.FAILED);
        }
    }

    private RunReport runFrames(SimulationContext context, FrameSimulator simulator, ResultSink sink) {
        long start = System.nanoTime();
        int n = context.numFrames();
        if (n == 0) {
            state.set(RunState.SUCCEEDED);
            return new RunReport(RunState.SUCCEEDED, 0, 0, Duration.ofNanos(System.nanoTime() - start));
        }
        int workers = Math.min(maxWorkers, n);
        CancellationToken token = new CancellationToken();
        Map<Future<FrameResult>, Integer> indices = new HashMap<>(n * 2);
        List<Integer> completionOrder = new ArrayList<>(n);
        FrameSimulationException failure = null;
        int written = 0;

        try (WorkerPool<FrameResult> pool = poolFactory.apply(workers)) {
            Broadcast<SimulationContext> shared = pool.scatter(context);
            ThreadLocal<SimulationEngine> engines =
                    ThreadLocal.withInitial(() -> shared.get().engineFactory().get());

            for (int i = 0; i < n; i++) {
                final int index = i;
                Future<FrameResult> future = pool.submit(
                        () -> simulator.simulate(shared.get(), engines.get(), index, token));
                indices.put(future, index);
            }

            try {
                for (int settled = 0; settled < n; settled++) {
                    Future<FrameResult> done = pool.take();
                    int index = indices.get(done);
                    try {
                        FrameResult result = done.get();
                        if (failure == null) {
                            sink.write(index, result.angle(), result.position(), result.image());
                            completionOrder.add(index);
                            written++;
                        }
                    } catch (CancellationException e) {
                        LOGGER.debug("Frame {} cancelled before it ran", index);
                    } catch (ExecutionException e) {
                        Throwable cause = e.getCause();
                        if (cause instanceof FrameCancelledException) {
                            LOGGER.debug("Frame {} stopped after cancellation", index);
                        } else if (failure == null) {
                            failure = fail(index, cause, token, indices.keySet());
                        } else {
                            LOGGER.warn("Frame {} also failed: {}", index, cause.toString());
                        }
                    } catch (RuntimeException e) {
                        if (failure == null) {
                            failure = fail(index, e, token, indices.keySet());
                        } else {
                            LOGGER.warn("Writing frame {} also failed: {}", index, e.toString());
                        }
                    }
                }
                // a cancelled future settles before its task returns
                pool.drain();
            } catch (InterruptedException e) {
                token.cancel();
                indices.keySet().forEach(f -> f.cancel(true));
                Thread.currentThread().interrupt();
                state.set(RunState.FAILED);
                throw new IllegalStateException("Interrupted while waiting for frames", e);
            }
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        if (failure != null) {
            state.set(RunState.FAILED);
            LOGGER.warn("Run failed on frame {} after {} of {} frames", failure.frameIndex(), written, n);
            throw failure;
        }
        state.set(RunState.SUCCEEDED);
        LOGGER.debug("Frames completed in order {}", completionOrder);
        LOGGER.debug("Pooled run of {} frames on {} workers finished in {} ms", n, workers, elapsed.toMillis());
        return new RunReport(RunState.SUCCEEDED, written, workers, elapsed);
    }

    private static FrameSimulationException fail(int index, Throwable cause, CancellationToken token,
                                                 Iterable<Future<FrameResult>> futures) {
        token.cancel();
        for (Future<FrameResult> f : futures) {
            f.cancel(false);
        }
        LOGGER.error("Frame {} failed, cancelling remaining frames", index, cause);
        return new FrameSimulationException(index, cause);
    }

    @Override
    public RunState state() {
        return state.get();
    }
}
