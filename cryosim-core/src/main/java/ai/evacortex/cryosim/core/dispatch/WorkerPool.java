/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.dispatch;

import java.io.Closeable;
import java.util.concurrent.Callable;
import java.util.concurrent.Future;

/**
 * Bounded set of workers with a completion channel.
 *
 * @param <R> result type of submitted tasks
 */
public interface WorkerPool<R> extends Closeable {

    int workers();

    /** Makes {@code value} available to all workers. Call once per value, before submitting tasks. */
    <T> Broadcast<T> scatter(T value);

    Future<R> submit(Callable<R> task);

    /** Blocks until some submitted task has settled (completed, failed or cancelled) and returns it. */
    Future<R> take() throws InterruptedException;

    /** Stops accepting tasks and waits until every submitted task has settled. */
    void drain() throws InterruptedException;

    @Override
    void close();
}
