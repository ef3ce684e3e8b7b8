/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.engine;

import ai.evacortex.cryosim.core.model.WaveField;

/**
 * Raw engine output for one frame, on the margin-padded grid. Either field may be absent.
 *
 * @param intensity detector intensity, row-major [y][x]
 * @param wave      complex wave at the detector plane
 */
public record EngineResult(double[][] intensity, WaveField wave) {

    public static EngineResult ofIntensity(double[][] intensity) {
        return new EngineResult(intensity, null);
    }

    public static EngineResult ofWave(WaveField wave) {
        return new EngineResult(null, wave);
    }

    public boolean hasIntensity() {
        return intensity != null && intensity.length > 0;
    }
}
