/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.model;

/**
 * Complex 2-D wave field ψ(x, y) = A(x, y) · e^{iφ(x, y)}, stored row-major as [y][x].
 */
public record WaveField(double[][] amplitude, double[][] phase) {

    public WaveField {
        if (amplitude.length != phase.length) {
            throw new IllegalArgumentException("Amplitude / phase row mismatch: "
                    + amplitude.length + " vs " + phase.length);
        }
        for (int j = 0; j < amplitude.length; j++) {
            if (amplitude[j].length != phase[j].length) {
                throw new IllegalArgumentException("Amplitude / phase length mismatch in row " + j);
            }
        }
    }

    public int height() {
        return amplitude.length;
    }

    public int width() {
        return amplitude.length == 0 ? 0 : amplitude[0].length;
    }

    /** |ψ|² per pixel. */
    public double[][] intensity() {
        double[][] out = new double[amplitude.length][];
        for (int j = 0; j < amplitude.length; j++) {
            double[] row = amplitude[j];
            out[j] = new double[row.length];
            for (int i = 0; i < row.length; i++) {
                out[j][i] = row[i] * row[i];
            }
        }
        return out;
    }

    public double real(int y, int x) {
        return amplitude[y][x] * Math.cos(phase[y][x]);
    }

    public double imag(int y, int x) {
        return amplitude[y][x] * Math.sin(phase[y][x]);
    }
}
