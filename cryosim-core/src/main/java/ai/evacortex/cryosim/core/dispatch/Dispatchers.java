/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.dispatch;

import ai.evacortex.cryosim.core.config.ClusterParameters;

import java.util.Objects;

public final class Dispatchers {

    private Dispatchers() {
    }

    /** Returns a fresh dispatcher for one run. */
    public static Dispatcher create(ClusterParameters cluster) {
        Objects.requireNonNull(cluster, "cluster must not be null");
        if (cluster.method() == ClusterParameters.Method.SEQUENTIAL || cluster.maxWorkers() <= 1) {
            return new SequentialDispatcher();
        }
        return new PooledDispatcher(cluster.maxWorkers());
    }
}
