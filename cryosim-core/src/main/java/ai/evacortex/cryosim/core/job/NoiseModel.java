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

/**
 * Detector noise applied to a cropped ideal image.
 */
@FunctionalInterface
public interface NoiseModel {

    /**
     * @param ideal      cropped noiseless image; implementations must not modify it
     * @param frameIndex frame the image belongs to
     */
    float[][] apply(float[][] ideal, int frameIndex);

    static NoiseModel ideal() {
        return (image, frameIndex) -> image;
    }

    static NoiseModel poisson(double electronsPerPixel, long seed) {
        return new PoissonNoise(electronsPerPixel, seed);
    }

    static NoiseModel from(SimulationParameters parameters) {
        return parameters.electronsPerPixel() == null
                ? ideal()
                : poisson(parameters.electronsPerPixel(), parameters.noiseSeed());
    }
}
