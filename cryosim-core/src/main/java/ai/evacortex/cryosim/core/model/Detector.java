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
 * Detector geometry.
 *
 * @param nx        pixels along x
 * @param ny        pixels along y
 * @param pixelSize pixel size in Å
 */
public record Detector(int nx, int ny, double pixelSize) {

    public Detector {
        if (nx <= 0 || ny <= 0) {
            throw new IllegalArgumentException("Detector size must be > 0: " + nx + "x" + ny);
        }
        if (!(pixelSize > 0.0)) {
            throw new IllegalArgumentException("Pixel size must be > 0: " + pixelSize);
        }
    }

    public double fieldOfViewX() {
        return nx * pixelSize;
    }

    public double fieldOfViewY() {
        return ny * pixelSize;
    }
}
