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
import ai.evacortex.cryosim.core.engine.SimulationEngine;
import ai.evacortex.cryosim.core.engine.SimulationKind;
import ai.evacortex.cryosim.core.engine.SpecimenPayload;
import ai.evacortex.cryosim.core.exceptions.EngineException;
import ai.evacortex.cryosim.core.exceptions.FrameCancelledException;
import ai.evacortex.cryosim.core.model.Detector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exit-wave / image frames: one engine call per frame, then margin crop and noise.
 */
public final class ImageFrameSimulator implements FrameSimulator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ImageFrameSimulator.class);

    @Override
    public FrameResult simulate(SimulationContext context, SimulationEngine engine, int index,
                                CancellationToken token) {
        SimulationParameters params = context.parameters();
        if (params.kind() == SimulationKind.PROJECTED_POTENTIAL) {
            throw new IllegalArgumentException("Projected potential frames need ProjectedPotentialFrameSimulator");
        }
        token.throwIfCancelled(index);
        LOGGER.info("Simulating image {}", index + 1);

        FramePreparation.PreparedFrame frame = FramePreparation.prepare(context, index);
        SpecimenPayload payload = frame.slabCount() == 1
                ? new SpecimenPayload.Flat(frame.atoms())
                : new SpecimenPayload.Slabs(frame.slabs());

        token.throwIfCancelled(index);
        EngineResult result;
        try {
            result = engine.simulateWave(context.system(), frame.input(), payload);
        } catch (EngineException | FrameCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EngineException("Engine failed on frame " + index, e);
        }

        double[][] raw = rawField(result, params, index);
        Detector detector = context.microscope().detector();
        float[][] image = ImageCropper.crop(raw, params.margin(), detector.ny(), detector.nx());
        image = NoiseModel.from(params).apply(image, index);

        return new FrameResult(index, frame.pose().angle(), frame.pose().position(), image);
    }

    private static double[][] rawField(EngineResult result, SimulationParameters params, int index) {
        if (result == null) {
            throw new EngineException("Engine returned no result for frame " + index);
        }
        if (result.hasIntensity()) {
            return result.intensity();
        }
        if (result.wave() != null && params.deriveIntensityFromWave()) {
            return result.wave().intensity();
        }
        throw new EngineException("Engine returned no intensity for frame " + index);
    }
}
