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
import ai.evacortex.cryosim.core.engine.SimulationEngine;
import ai.evacortex.cryosim.core.exceptions.EngineException;
import ai.evacortex.cryosim.core.exceptions.FrameCancelledException;
import ai.evacortex.cryosim.core.exceptions.SliceInvariantException;
import ai.evacortex.cryosim.core.model.Box;
import ai.evacortex.cryosim.core.model.Detector;
import ai.evacortex.cryosim.core.sink.PotentialStore;
import ai.evacortex.cryosim.core.sink.PotentialVolume;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Writes the projected potential of every slab of a frame into that frame's {@link PotentialVolume}.
 *
 * <p>Plane index of a slab is {@code floor((zc − z0) / sliceThickness)}, capped at the last plane, with
 * {@code zc} the slab centre and {@code z0} the lower z of the sample's shape box. Slabs sharing a plane
 * are summed into it. The returned {@link FrameResult} has no image.</p>
 */
public final class ProjectedPotentialFrameSimulator implements FrameSimulator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProjectedPotentialFrameSimulator.class);

    private final PotentialStore store;

    public ProjectedPotentialFrameSimulator(PotentialStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    @Override
    public FrameResult simulate(SimulationContext context, SimulationEngine engine, int index,
                                CancellationToken token) {
        token.throwIfCancelled(index);
        LOGGER.info("Simulating projected potential {}", index + 1);

        SimulationParameters params = context.parameters();
        Detector detector = context.microscope().detector();
        FramePreparation.PreparedFrame frame = FramePreparation.prepare(context, index);

        Box shape = context.sample().shapeBox();
        double thickness = params.sliceThickness();
        int depth = Math.max(1, (int) Math.floor((shape.z1() - shape.z0()) / thickness));
        PotentialVolume volume = store.open(index, depth, detector.ny(), detector.nx(),
                detector.pixelSize(), thickness);

        token.throwIfCancelled(index);
        try {
            engine.simulateProjectedPotential(context.system(), frame.input(), frame.slabs(), (z0, z1, potential) -> {
                token.throwIfCancelled(index);
                double zc = (z0 + z1) / 2.0;
                if (zc < shape.z0() || zc > shape.z1()) {
                    throw new SliceInvariantException("Slab [" + z0 + ", " + z1 + ") centre outside shape box ["
                            + shape.z0() + ", " + shape.z1() + "]");
                }
                // the stretched top slab may land past the last whole plane
                int plane = Math.min(depth - 1, (int) Math.floor((zc - shape.z0()) / thickness));
                LOGGER.debug("Calculating potential for slice: {} -> {} (index: {})", z0, z1, plane);
                volume.accumulatePlane(plane, ImageCropper.cropTransposed(potential, params.margin(),
                        detector.ny(), detector.nx()));
            });
        } catch (EngineException | FrameCancelledException | SliceInvariantException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EngineException("Engine failed on frame " + index, e);
        }

        return new FrameResult(index, frame.pose().angle(), frame.pose().position(), null);
    }
}
