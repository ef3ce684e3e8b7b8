/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.engine;

import ai.evacortex.cryosim.core.slicing.SliceDescriptor;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DeviceResolverTest {

    private static final class GpuEngine implements SimulationEngine {
        @Override
        public EngineResult simulateWave(SystemConfiguration system, EngineInput input, SpecimenPayload payload) {
            throw new UnsupportedOperationException();
        }

        @Override
        public void simulateProjectedPotential(SystemConfiguration system, EngineInput input,
                                               List<SliceDescriptor> slabs, SlabCallback callback) {
            throw new UnsupportedOperationException();
        }

        @Override
        public boolean isDeviceAvailable(Device device) {
            return true;
        }
    }

    @Test
    void missingGpu_fallsBackToCpu() {
        SystemConfiguration sc = DeviceResolver.resolve(new ProjectionEngine(), Device.GPU);
        assertEquals(Device.CPU, sc.device());
        assertEquals(SystemConfiguration.Precision.FLOAT, sc.precision());
    }

    @Test
    void availableGpu_isKept() {
        SystemConfiguration sc = DeviceResolver.resolve(new GpuEngine(), Device.GPU, SystemConfiguration.Precision.DOUBLE);
        assertEquals(Device.GPU, sc.device());
        assertEquals(SystemConfiguration.Precision.DOUBLE, sc.precision());
    }

    @Test
    void cpuRequest_isUnchanged() {
        assertEquals(SystemConfiguration.cpu(), DeviceResolver.resolve(new ProjectionEngine(), Device.CPU));
    }
}
