/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.dispatch;

import java.util.Objects;

/**
 * Handle to a value distributed to every worker of a pool. Tasks dereference the handle instead of
 * capturing the value, so the value is handed over once per pool rather than once per task.
 */
public final class Broadcast<T> {

    private final T value;

    Broadcast(T value) {
        this.value = Objects.requireNonNull(value, "broadcast value must not be null");
    }

    public T get() {
        return value;
    }
}
