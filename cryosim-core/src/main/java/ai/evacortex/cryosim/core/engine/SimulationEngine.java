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

import java.util.List;

/**
 * {@code SimulationEngine} is the boundary to the electron-optics code that propagates a wave through
 * the specimen. The rest of the system treats it as a black box that turns a frame's atoms into a
 * 2-D field.
 *
 * <p>An engine instance is not required to be thread-safe: the dispatcher gives every worker its own
 * instance and calls it from that worker only. Implementations must be deterministic for identical
 * inputs, so that sequential and pooled runs agree bit for bit.</p>
 *
 * <p>Inputs are in the frame's padded coordinate system: the detector area starts at
 * {@code (margin * pixelSize, margin * pixelSize)} and the grid is {@code input.nx() x input.ny()}.</p>
 *
 * @see ProjectionEngine
 */
public interface SimulationEngine {

    /**
     * Simulates the wave (or image) of one frame.
     *
     * @param system  device and precision to run on
     * @param input   imaging parameters of the frame
     * @param payload a flat atom list or the frame's ordered z-slabs
     * @return raw field on the padded grid
     * @throws ai.evacortex.cryosim.core.exceptions.EngineException if the simulation fails
     * @throws NullPointerException if any argument is {@code null}
     */
    EngineResult simulateWave(SystemConfiguration system, EngineInput input, SpecimenPayload payload);

    /**
     * Computes the projected potential of every slab, calling {@code callback} once per slab in
     * ascending z.
     *
     * @param system   device and precision to run on
     * @param input    imaging parameters of the frame
     * @param slabs    ordered slabs of the frame
     * @param callback receives {@code (z0, z1, potential)} per slab
     * @throws ai.evacortex.cryosim.core.exceptions.EngineException if the computation fails
     */
    void simulateProjectedPotential(SystemConfiguration system, EngineInput input,
                                    List<SliceDescriptor> slabs, SlabCallback callback);

    /**
     * Reports whether the engine can run on {@code device} in this process.
     */
    boolean isDeviceAvailable(Device device);
}
