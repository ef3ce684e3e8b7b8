/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.model;

import java.util.Map;
import java.util.Objects;

/**
 * Resolved microscope parameters handed to the engine as plain data.
 *
 * @param detector    detector geometry
 * @param beamEnergy  accelerating voltage in keV
 * @param lens        objective lens parameters (defocus, Cs, ...) keyed by name
 */
public record Microscope(Detector detector, double beamEnergy, Map<String, Double> lens) {

    public Microscope {
        Objects.requireNonNull(detector, "detector must not be null");
        if (!(beamEnergy > 0.0)) {
            throw new IllegalArgumentException("Beam energy must be > 0: " + beamEnergy);
        }
        lens = lens == null ? Map.of() : Map.copyOf(lens);
    }

    public static Microscope of(Detector detector) {
        return new Microscope(detector, 300.0, Map.of());
    }
}
