/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core;

import ai.evacortex.cryosim.core.config.ClusterParameters;
import ai.evacortex.cryosim.core.dispatch.Dispatcher;
import ai.evacortex.cryosim.core.dispatch.Dispatchers;
import ai.evacortex.cryosim.core.dispatch.RunReport;
import ai.evacortex.cryosim.core.engine.SimulationKind;
import ai.evacortex.cryosim.core.job.FrameSimulator;
import ai.evacortex.cryosim.core.job.ImageFrameSimulator;
import ai.evacortex.cryosim.core.job.ProjectedPotentialFrameSimulator;
import ai.evacortex.cryosim.core.job.SimulationContext;
import ai.evacortex.cryosim.core.model.Detector;
import ai.evacortex.cryosim.core.sink.PotentialStore;
import ai.evacortex.cryosim.core.sink.ResultSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * One simulation over every pose of a scan.
 *
 * <p>All inputs arrive resolved: configuration translation and device selection happen before
 * construction. Each call to {@link #run(ResultSink)} uses a fresh dispatcher.</p>
 *
 * <pre>{@code
 * Simulation sim = Simulation.imaging(context, ClusterParameters.local(4));
 * int[] shape = sim.shape();
 * OutputVolume out = new OutputVolume(shape[0], shape[1], shape[2]);
 * sim.run(out);
 * }</pre>
 */
public final class Simulation {

    private static final Logger LOGGER = LoggerFactory.getLogger(Simulation.class);

    private final SimulationContext context;
    private final ClusterParameters cluster;
    private final FrameSimulator simulator;

    public Simulation(SimulationContext context, ClusterParameters cluster, FrameSimulator simulator) {
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.cluster = Objects.requireNonNull(cluster, "cluster must not be null");
        this.simulator = Objects.requireNonNull(simulator, "simulator must not be null");
    }

    /**
     * Exit-wave or image simulation, one cropped frame per pose.
     */
    public static Simulation imaging(SimulationContext context, ClusterParameters cluster) {
        if (context.parameters().kind() == SimulationKind.PROJECTED_POTENTIAL) {
            throw new IllegalArgumentException("Use projectedPotential(...) for projected potential runs");
        }
        return new Simulation(context, cluster, new ImageFrameSimulator());
    }

    /**
     * Projected potential simulation; planes go to {@code store}, the result sink only records angles
     * and positions.
     */
    public static Simulation projectedPotential(SimulationContext context, ClusterParameters cluster,
                                                PotentialStore store) {
        if (context.parameters().kind() != SimulationKind.PROJECTED_POTENTIAL) {
            throw new IllegalArgumentException("Expected kind PROJECTED_POTENTIAL, got " + context.parameters().kind());
        }
        return new Simulation(context, cluster, new ProjectedPotentialFrameSimulator(store));
    }

    /** @return {@code {numFrames, ny, nx}} */
    public int[] shape() {
        Detector detector = context.microscope().detector();
        return new int[]{context.numFrames(), detector.ny(), detector.nx()};
    }

    public SimulationContext context() {
        return context;
    }

    public RunReport run(ResultSink sink) {
        Objects.requireNonNull(sink, "sink must not be null");
        int[] shape = shape();
        ResultSink.requireShape(sink, shape[0], shape[1], shape[2]);

        Dispatcher dispatcher = Dispatchers.create(cluster);
        long start = System.nanoTime();
        RunReport report = dispatcher.run(context, simulator, sink);
        LOGGER.info("Time taken: {} seconds", String.format("%.2f", (System.nanoTime() - start) / 1e9));
        return report;
    }
}
