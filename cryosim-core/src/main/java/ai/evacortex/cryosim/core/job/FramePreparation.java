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
import ai.evacortex.cryosim.core.engine.EngineInput;
import ai.evacortex.cryosim.core.model.AtomRecord;
import ai.evacortex.cryosim.core.model.Box;
import ai.evacortex.cryosim.core.model.Detector;
import ai.evacortex.cryosim.core.scan.Pose;
import ai.evacortex.cryosim.core.selection.FieldOfView;
import ai.evacortex.cryosim.core.selection.FieldOfViewSelector;
import ai.evacortex.cryosim.core.slicing.SliceDescriptor;
import ai.evacortex.cryosim.core.slicing.ZSlicer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Steps every frame shares before the engine runs: window the sample, perturb, slice, build the input.
 */
public final class FramePreparation {

    private static final Logger LOGGER = LoggerFactory.getLogger(FramePreparation.class);

    /**
     * @param atoms     windowed atoms in padded frame coordinates
     * @param slabs     non-empty slabs of {@code atoms}, ascending z
     * @param slabCount nominal slab count the atoms were sliced with
     */
    public record PreparedFrame(int index, Pose pose, FieldOfView fov, List<AtomRecord> atoms,
                                List<SliceDescriptor> slabs, int slabCount, EngineInput input) {}

    private FramePreparation() {}

    public static PreparedFrame prepare(SimulationContext context, int index) {
        SimulationParameters params = context.parameters();
        Detector detector = context.microscope().detector();
        Pose pose = context.scan().pose(index);

        FieldOfView fov = FieldOfView.of(detector, params.margin());
        double lz = context.sample().containingBox().z1();

        List<AtomRecord> atoms = FieldOfViewSelector.select(context.sample(), fov, pose);
        Box bounds = new Box(0.0, 0.0, 0.0, fov.paddedWidth(), fov.paddedHeight(), lz);
        atoms = context.perturbation().apply(atoms, bounds);
        LOGGER.info("Simulating with {} atoms", atoms.size());

        int slabCount = ZSlicer.slabCount(lz, params.sliceThickness(), params.numSlices());
        List<SliceDescriptor> slabs = ZSlicer.slice(atoms, lz, slabCount);

        EngineInput input = new EngineInput(
                context.microscope(),
                detector.nx() + 2 * params.margin(),
                detector.ny() + 2 * params.margin(),
                detector.pixelSize(),
                fov.paddedWidth(),
                fov.paddedHeight(),
                lz,
                params.sliceThickness(),
                context.sample().centre().getZ(),
                params.kind(),
                pose.angle());

        return new PreparedFrame(index, pose, fov, atoms, slabs, slabCount, input);
    }
}
