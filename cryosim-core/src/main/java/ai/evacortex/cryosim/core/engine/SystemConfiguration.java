/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.engine;

import java.util.Objects;

/**
 * Execution settings for the engine.
 */
public record SystemConfiguration(
        Device device,          // where the engine runs
        Precision precision     // arithmetic width used by the engine
) {
    public enum Precision { FLOAT, DOUBLE }

    public SystemConfiguration {
        Objects.requireNonNull(device, "device must not be null");
        Objects.requireNonNull(precision, "precision must not be null");
    }

    public static SystemConfiguration cpu() {
        return new SystemConfiguration(Device.CPU, Precision.FLOAT);
    }
}
