/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.job;

import ai.evacortex.cryosim.core.config.SimulationParameters;
import ai.evacortex.cryosim.core.engine.EngineResult;
import ai.evacortex.cryosim.core.engine.ProjectionEngine;
import ai.evacortex.cryosim.core.engine.SimulationKind;
import ai.evacortex.cryosim.core.exceptions.EngineException;
import ai.evacortex.cryosim.core.exceptions.FrameCancelledException;
import ai.evacortex.cryosim.core.model.WaveField;
import org.junit.jupiter.api.Test;

import static ai.evacortex.cryosim.core.SimulationTestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class ImageFrameSimulatorTest {

    private final ImageFrameSimulator simulator = new ImageFrameSimulator();

    @Test
    void prepare_windowsAndSlicesScenarioFrame() {
        FramePreparation.PreparedFrame frame = FramePreparation.prepare(scenarioContext(3), 1);
        assertEquals(NX * NY, frame.atoms().size(), "Every atom of the scenario is inside the padded window");
        assertEquals(3, frame.slabCount());
        assertEquals(3, frame.slabs().size());
        assertEquals(NX + 2 * MARGIN, frame.input().nx());
        assertEquals(NY + 2 * MARGIN, frame.input().ny());
        assertEquals(THICKNESS, frame.input().lz(), 0.0);
        assertEquals(90.0, frame.input().angle(), 0.0);
        assertTrue(frame.slabs().get(2).atoms().stream().anyMatch(a -> Math.abs(a.z() - 29.999) < 1e-9));
    }

    @Test
    void simulate_returnsCroppedImageWithPose() {
        SimulationContext ctx = scenarioContext(3);
        FrameResult r = simulator.simulate(ctx, new ProjectionEngine(), 2, new CancellationToken());

        assertEquals(2, r.index());
        assertEquals(180.0, r.angle(), 0.0);
        assertEquals(NY, r.image().length);
        assertEquals(NX, r.image()[0].length);
        float min = Float.MAX_VALUE;
        for (float[] row : r.image()) for (float v : row) min = Math.min(min, v);
        assertTrue(min < 1.0f, "Atoms must leave a trace in the image");
    }

    @Test
    void intensityIsCroppedFromPaddedGrid() {
        SimulationContext ctx = scenarioContext(1);
        StubEngine engine = new StubEngine(in -> {
            double[][] raw = StubEngine.filled(in.ny(), in.nx(), 9.0);
            for (int y = MARGIN; y < MARGIN + NY; y++) {
                for (int x = MARGIN; x < MARGIN + NX; x++) raw[y][x] = y * 10 + x;
            }
            return EngineResult.ofIntensity(raw);
        });
        FrameResult r = simulator.simulate(ctx, engine, 0, new CancellationToken());
        assertEquals(22f, r.image()[0][0]);
        assertEquals(55f, r.image()[3][3]);
    }

    @Test
    void waveOnlyResult_failsUnlessDerivationEnabled() {
        StubEngine waveOnly = new StubEngine(in -> EngineResult.ofWave(new WaveField(
                StubEngine.filled(in.ny(), in.nx(), 0.5), StubEngine.filled(in.ny(), in.nx(), 0.0))));

        SimulationContext strict = scenarioContext(1);
        assertThrows(EngineException.class, () -> simulator.simulate(strict, waveOnly, 0, new CancellationToken()));

        SimulationParameters derive = scenarioParameters(SimulationKind.EXIT_WAVE).withDeriveIntensityFromWave(true);
        SimulationContext lenient = scenarioContext(1, derive, ProjectionEngine::new);
        FrameResult r = simulator.simulate(lenient, waveOnly, 0, new CancellationToken());
        assertEquals(0.25f, r.image()[1][1]);
    }

    @Test
    void engineFailure_isWrappedInEngineException() {
        IllegalStateException boom = new IllegalStateException("boom");
        StubEngine failing = new StubEngine(in -> {
            throw boom;
        });
        EngineException e = assertThrows(EngineException.class,
                () -> simulator.simulate(scenarioContext(1), failing, 0, new CancellationToken()));
        assertSame(boom, e.getCause());
    }

    @Test
    void cancelledToken_stopsBeforeEngine() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        StubEngine mustNotRun = new StubEngine(in -> {
            throw new AssertionError("engine called after cancellation");
        });
        FrameCancelledException e = assertThrows(FrameCancelledException.class,
                () -> simulator.simulate(scenarioContext(2), mustNotRun, 1, token));
        assertEquals(1, e.frameIndex());
    }

    @Test
    void noise_isAppliedAfterCrop() {
        SimulationParameters noisy = scenarioParameters(SimulationKind.EXIT_WAVE).withNoise(1000.0, 3L);
        SimulationContext ctx = scenarioContext(1, noisy, ProjectionEngine::new);
        StubEngine flat = new StubEngine(in -> EngineResult.ofIntensity(StubEngine.filled(in.ny(), in.nx(), 1.0)));
        FrameResult r = simulator.simulate(ctx, flat, 0, new CancellationToken());
        for (float[] row : r.image()) {
            for (float v : row) assertTrue(v > 800f && v < 1200f, "Counts near the dose, got " + v);
        }
    }

    @Test
    void projectedPotentialKind_isRejected() {
        SimulationContext ctx = scenarioContext(1, scenarioParameters(SimulationKind.PROJECTED_POTENTIAL),
                ProjectionEngine::new);
        assertThrows(IllegalArgumentException.class,
                () -> simulator.simulate(ctx, new ProjectionEngine(), 0, new CancellationToken()));
    }
}
