/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.engine;

import ai.evacortex.cryosim.core.exceptions.EngineException;
import ai.evacortex.cryosim.core.slicing.ZSlicer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProjectionEngineTest extends SimulationEngineContractTest {

    private final ProjectionEngine engine = new ProjectionEngine();

    @Override
    protected SimulationEngine engine() {
        return engine;
    }

    @Test
    void atomsDarkenTheImage_nearTheirColumn() {
        EngineResult r = engine.simulateWave(SystemConfiguration.cpu(), input(SimulationKind.EXIT_WAVE),
                new SpecimenPayload.Flat(atoms()));
        double[][] intensity = r.intensity();
        assertTrue(intensity[4][3] < 1.0, "Atom column must absorb");
        assertEquals(1.0, intensity[NY - 1][0], 1e-12, "Empty region transmits fully");
        assertNotNull(r.wave());
    }

    @Test
    void flatAndSlabbedPayloads_agree() {
        EngineResult flat = engine.simulateWave(SystemConfiguration.cpu(), input(SimulationKind.EXIT_WAVE),
                new SpecimenPayload.Flat(atoms()));
        EngineResult slabs = engine.simulateWave(SystemConfiguration.cpu(), input(SimulationKind.EXIT_WAVE),
                new SpecimenPayload.Slabs(ZSlicer.slice(atoms(), 9.0, 3)));
        for (int y = 0; y < NY; y++) {
            assertArrayEquals(flat.intensity()[y], slabs.intensity()[y], 1e-6);
        }
    }

    @Test
    void gpuRequest_isRejected() {
        assertFalse(engine.isDeviceAvailable(Device.GPU));
        SystemConfiguration gpu = new SystemConfiguration(Device.GPU, SystemConfiguration.Precision.FLOAT);
        assertThrows(EngineException.class, () -> engine.simulateWave(gpu, input(SimulationKind.EXIT_WAVE),
                new SpecimenPayload.Flat(atoms())));
    }

    @Test
    void projectedPotentialKind_isNotAWave() {
        assertThrows(IllegalArgumentException.class, () -> engine.simulateWave(SystemConfiguration.cpu(),
                input(SimulationKind.PROJECTED_POTENTIAL), new SpecimenPayload.Flat(List.of())));
    }

    @Test
    void floatPrecision_roundsPotential() {
        double[][][] captured = new double[1][][];
        engine.simulateProjectedPotential(SystemConfiguration.cpu(), input(SimulationKind.PROJECTED_POTENTIAL),
                ZSlicer.slice(atoms(), 9.0, 1), (z0, z1, potential) -> captured[0] = potential);
        for (double[] column : captured[0]) {
            for (double v : column) assertEquals((float) v, v, 0.0);
        }
        assertTrue(captured[0][3][4] > 0.0, "Potential peaks at the atom column");
    }
}
