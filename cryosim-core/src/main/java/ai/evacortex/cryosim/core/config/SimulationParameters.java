/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.config;

import ai.evacortex.cryosim.core.engine.SimulationKind;
import ai.evacortex.cryosim.core.exceptions.ConfigurationException;

import java.util.Objects;

/**
 * Static per-run simulation settings shared by every frame.
 *
 * @param margin                  border in pixels simulated around the detector and cropped afterwards
 * @param sliceThickness          nominal slab thickness in Å
 * @param numSlices               explicit slab count, or {@code null} to derive it from the thickness
 * @param kind                    what each frame produces
 * @param electronsPerPixel       dose for the Poisson noise model, or {@code null} for ideal images
 * @param noiseSeed               base seed of the noise generator; frame {@code i} uses {@code seed + i}
 * @param deriveIntensityFromWave use {@code |ψ|²} when the engine returns a wave but no intensity
 */
public record SimulationParameters(
        int margin,
        double sliceThickness,
        Integer numSlices,
        SimulationKind kind,
        Double electronsPerPixel,
        long noiseSeed,
        boolean deriveIntensityFromWave
) {
    public SimulationParameters {
        Objects.requireNonNull(kind, "kind must not be null");
        if (margin <= 0) {
            throw new ConfigurationException("margin must be > 0, got " + margin);
        }
        if (!(sliceThickness > 0.0)) {
            throw new ConfigurationException("slice thickness must be > 0, got " + sliceThickness);
        }
        if (numSlices != null && numSlices <= 0) {
            throw new ConfigurationException("slab count must be > 0, got " + numSlices);
        }
        if (electronsPerPixel != null && !(electronsPerPixel > 0.0)) {
            throw new ConfigurationException("electrons per pixel must be > 0, got " + electronsPerPixel);
        }
    }

    public static SimulationParameters of(int margin, double sliceThickness, SimulationKind kind) {
        return new SimulationParameters(margin, sliceThickness, null, kind, null, 0L, false);
    }

    public SimulationParameters withNumSlices(Integer n) {
        return new SimulationParameters(margin, sliceThickness, n, kind, electronsPerPixel, noiseSeed,
                deriveIntensityFromWave);
    }

    public SimulationParameters withNoise(Double rate, long seed) {
        return new SimulationParameters(margin, sliceThickness, numSlices, kind, rate, seed,
                deriveIntensityFromWave);
    }

    public SimulationParameters withDeriveIntensityFromWave(boolean derive) {
        return new SimulationParameters(margin, sliceThickness, numSlices, kind, electronsPerPixel, noiseSeed,
                derive);
    }
}
