/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.dispatch;

import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link WorkerPool} backed by a fixed thread pool in this JVM.
 */
public final class LocalWorkerPool<R> implements WorkerPool<R> {

    private static final AtomicInteger POOL_SEQ = new AtomicInteger();

    private final int workers;
    private final ExecutorService executor;
    private final CompletionService<R> completion;

    public LocalWorkerPool(int workers) {
        if (workers <= 0) {
            throw new IllegalArgumentException("Worker count must be > 0: " + workers);
        }
        this.workers = workers;
        int poolId = POOL_SEQ.incrementAndGet();
        AtomicInteger threadSeq = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, "cryosim-" + poolId + "-worker-" + threadSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.completion = new ExecutorCompletionService<>(executor);
    }

    @Override
    public int workers() {
        return workers;
    }

    @Override
    public <T> Broadcast<T> scatter(T value) {
        return new Broadcast<>(value);
    }

    @Override
    public Future<R> submit(Callable<R> task) {
        return completion.submit(task);
    }

    @Override
    public Future<R> take() throws InterruptedException {
        return completion.take();
    }

    @Override
    public void drain() throws InterruptedException {
        executor.shutdown();
        boolean terminated = false;
        while (!terminated) {
            terminated = executor.awaitTermination(1, TimeUnit.SECONDS);
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) executor.shutdownNow();
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
