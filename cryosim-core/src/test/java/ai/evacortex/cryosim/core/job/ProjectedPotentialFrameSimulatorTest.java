/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.job;

import ai.evacortex.cryosim.core.engine.ProjectionEngine;
import ai.evacortex.cryosim.core.engine.SimulationKind;
import ai.evacortex.cryosim.core.engine.SystemConfiguration;
import ai.evacortex.cryosim.core.exceptions.FrameCancelledException;
import ai.evacortex.cryosim.core.model.AtomRecord;
import ai.evacortex.cryosim.core.model.Box;
import ai.evacortex.cryosim.core.sample.InMemorySample;
import ai.evacortex.cryosim.core.sink.InMemoryPotentialStore;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static ai.evacortex.cryosim.core.SimulationTestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class ProjectedPotentialFrameSimulatorTest {

    private static SimulationContext columnContext(double... zs) {
        return columnContext(3, zs);
    }

    private static SimulationContext columnContext(int numSlices, double... zs) {
        List<AtomRecord> atoms = new ArrayList<>();
        for (double z : zs) atoms.add(AtomRecord.of(6, 2.0, 1.0, z));
        InMemorySample sample = new InMemorySample(atoms, new Box(0, 0, 0, NX, NY, THICKNESS));
        return new SimulationContext(microscope(), sample, scenarioScan(1),
                scenarioParameters(SimulationKind.PROJECTED_POTENTIAL).withNumSlices(numSlices),
                SystemConfiguration.cpu(), null, ProjectionEngine::new);
    }

    private static int argMaxRow(float[][] plane) {
        int best = 0;
        float max = Float.NEGATIVE_INFINITY;
        for (int y = 0; y < plane.length; y++) {
            for (float v : plane[y]) {
                if (v > max) {
                    max = v;
                    best = y;
                }
            }
        }
        return best;
    }

    @Test
    void eachSlab_landsInThePlaneOfItsCentre() {
        InMemoryPotentialStore store = new InMemoryPotentialStore();
        ProjectedPotentialFrameSimulator simulator = new ProjectedPotentialFrameSimulator(store);

        FrameResult r = simulator.simulate(columnContext(5.0, 15.0, 29.999), new ProjectionEngine(), 0,
                new CancellationToken());

        assertNull(r.image(), "Projected potential frames carry no image");
        InMemoryPotentialStore.Volume volume = store.get(0);
        assertNotNull(volume);
        assertEquals(3, volume.depth());
        assertEquals(NY, volume.height());
        assertEquals(NX, volume.width());
        for (int z = 0; z < 3; z++) {
            float[][] plane = volume.plane(z);
            assertTrue(plane[1][2] > 0f, "Plane " + z + " must hold its slab");
            assertEquals(1, argMaxRow(plane), "Atom at y = 1 after cropping");
        }
    }

    @Test
    void moreSlabsThanPlanes_sumIntoSharedPlanes() {
        double[] zs = {2.5, 7.5, 12.5, 17.5, 22.5, 27.5};
        InMemoryPotentialStore fine = new InMemoryPotentialStore();
        InMemoryPotentialStore coarse = new InMemoryPotentialStore();

        new ProjectedPotentialFrameSimulator(fine)
                .simulate(columnContext(6, zs), new ProjectionEngine(), 0, new CancellationToken());
        new ProjectedPotentialFrameSimulator(coarse)
                .simulate(columnContext(3, zs), new ProjectionEngine(), 0, new CancellationToken());

        assertEquals(3, fine.get(0).depth(), "Depth follows the slice thickness, not the slab count");
        for (int z = 0; z < 3; z++) {
            float[][] a = fine.get(0).plane(z);
            float[][] b = coarse.get(0).plane(z);
            for (int y = 0; y < NY; y++) {
                assertArrayEquals(b[y], a[y], 1e-4f, "Plane " + z + " must hold both of its slabs");
            }
        }
        float total = 0f;
        for (int z = 0; z < 3; z++) total += fine.get(0).plane(z)[1][2];
        // a carbon atom centred on a pixel deposits Z = 6 there
        assertEquals(36f, total, 1e-3f, "All six atoms contribute to the column");
    }

    @Test
    void emptySlab_leavesItsPlaneZero() {
        InMemoryPotentialStore store = new InMemoryPotentialStore();
        new ProjectedPotentialFrameSimulator(store)
                .simulate(columnContext(5.0, 25.0), new ProjectionEngine(), 0, new CancellationToken());

        float[][] middle = store.get(0).plane(1);
        for (float[] row : middle) for (float v : row) assertEquals(0f, v);
        assertTrue(store.get(0).plane(2)[1][2] > 0f);
    }

    @Test
    void planeIsCroppedAndTransposed() {
        InMemoryPotentialStore store = new InMemoryPotentialStore();
        // stub potential of slab i is the constant i + 1 on the whole padded grid
        new ProjectedPotentialFrameSimulator(store)
                .simulate(columnContext(5.0, 15.0, 25.0), new StubEngine(in -> null), 0, new CancellationToken());
        for (int z = 0; z < 3; z++) {
            assertEquals(z + 1f, store.get(0).plane(z)[NY - 1][NX - 1]);
        }
    }

    @Test
    void cancellation_isObservedBeforeTheFirstSlab() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        InMemoryPotentialStore store = new InMemoryPotentialStore();
        assertThrows(FrameCancelledException.class, () -> new ProjectedPotentialFrameSimulator(store)
                .simulate(columnContext(5.0), new ProjectionEngine(), 0, token));
        assertNull(store.get(0), "No volume opened for a cancelled frame");
    }
}
