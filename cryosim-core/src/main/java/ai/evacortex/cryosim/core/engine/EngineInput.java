/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.engine;

import ai.evacortex.cryosim.core.model.Microscope;

import java.util.Objects;

/**
 * Per-frame imaging parameters handed to the engine.
 *
 * @param microscope     microscope and detector description
 * @param nx             simulated grid width including the margin on both sides
 * @param ny             simulated grid height including the margin on both sides
 * @param pixelSize      grid spacing in Å
 * @param lx             specimen extent along x (Å)
 * @param ly             specimen extent along y (Å)
 * @param lz             specimen thickness (Å)
 * @param sliceThickness nominal slab thickness (Å)
 * @param zCentre        z of the specimen's rotation centre
 * @param kind           what the engine is asked to produce
 * @param angle          tilt angle of the frame in degrees
 */
public record EngineInput(
        Microscope microscope,
        int nx,
        int ny,
        double pixelSize,
        double lx,
        double ly,
        double lz,
        double sliceThickness,
        double zCentre,
        SimulationKind kind,
        double angle
) {
    public EngineInput {
        Objects.requireNonNull(microscope, "microscope must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (nx <= 0 || ny <= 0) {
            throw new IllegalArgumentException("Grid size must be > 0: " + nx + "x" + ny);
        }
    }
}
