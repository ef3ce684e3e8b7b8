/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.config;

import ai.evacortex.cryosim.core.exceptions.ConfigurationException;

import java.util.Objects;

/**
 * How frames are spread over workers.
 */
public record ClusterParameters(Method method, int maxWorkers) {

    public enum Method {
        /** In-process loop over frames in index order. */
        SEQUENTIAL,
        /** Fixed pool of local worker threads. */
        LOCAL
    }

    public ClusterParameters {
        Objects.requireNonNull(method, "method must not be null");
        if (maxWorkers <= 0) {
            throw new ConfigurationException("max workers must be > 0, got " + maxWorkers);
        }
    }

    public static ClusterParameters sequential() {
        return new ClusterParameters(Method.SEQUENTIAL, 1);
    }

    public static ClusterParameters local(int maxWorkers) {
        return new ClusterParameters(Method.LOCAL, maxWorkers);
    }
}
