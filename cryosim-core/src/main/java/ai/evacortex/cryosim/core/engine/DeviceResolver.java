/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Picks the device a run executes on. A GPU request on a host without one degrades to the CPU.
 */
public final class DeviceResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(DeviceResolver.class);

    private DeviceResolver() {}

    public static SystemConfiguration resolve(SimulationEngine engine, Device requested) {
        return resolve(engine, requested, SystemConfiguration.Precision.FLOAT);
    }

    public static SystemConfiguration resolve(SimulationEngine engine, Device requested,
                                              SystemConfiguration.Precision precision) {
        Objects.requireNonNull(engine, "engine must not be null");
        Objects.requireNonNull(requested, "requested device must not be null");

        if (requested == Device.GPU && !engine.isDeviceAvailable(Device.GPU)) {
            LOGGER.warn("GPU not present, reverting to CPU");
            return new SystemConfiguration(Device.CPU, precision);
        }
        return new SystemConfiguration(requested, precision);
    }
}
