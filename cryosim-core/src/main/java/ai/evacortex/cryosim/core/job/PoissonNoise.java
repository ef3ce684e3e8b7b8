/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.job;

import org.apache.commons.math3.distribution.PoissonDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

/**
 * Counts electrons per pixel: {@code Poisson(rate · ideal)}.
 *
 * <p>The generator of frame {@code i} is seeded with {@code seed + i}, so the noise of a frame does
 * not depend on the worker or the order in which frames run.</p>
 */
final class PoissonNoise implements NoiseModel {

    private final double electronsPerPixel;
    private final long seed;

    PoissonNoise(double electronsPerPixel, long seed) {
        if (!(electronsPerPixel > 0.0)) {
            throw new IllegalArgumentException("Electrons per pixel must be > 0: " + electronsPerPixel);
        }
        this.electronsPerPixel = electronsPerPixel;
        this.seed = seed;
    }

    @Override
    public float[][] apply(float[][] ideal, int frameIndex) {
        RandomGenerator rng = new Well19937c(seed + frameIndex);
        float[][] out = new float[ideal.length][];
        for (int y = 0; y < ideal.length; y++) {
            float[] row = ideal[y];
            out[y] = new float[row.length];
            for (int x = 0; x < row.length; x++) {
                double mean = electronsPerPixel * row[x];
                out[y][x] = mean > 0.0 ? sample(rng, mean) : 0.0f;
            }
        }
        return out;
    }

    private static float sample(RandomGenerator rng, double mean) {
        PoissonDistribution d = new PoissonDistribution(rng, mean,
                PoissonDistribution.DEFAULT_EPSILON, PoissonDistribution.DEFAULT_MAX_ITERATIONS);
        return d.sample();
    }
}
