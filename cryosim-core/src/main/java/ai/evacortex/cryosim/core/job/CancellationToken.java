/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.job;

import ai.evacortex.cryosim.core.exceptions.FrameCancelledException;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Run-wide stop flag shared by every frame job of one run.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled(int frameIndex) {
        if (cancelled.get()) {
            throw new FrameCancelledException(frameIndex);
        }
    }
}
