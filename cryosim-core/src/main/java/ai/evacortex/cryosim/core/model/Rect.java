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
 * Axis-aligned rectangle in the xy plane, half-open on the upper edges.
 */
public record Rect(double x0, double y0, double x1, double y1) {

    public Rect {
        if (!(x0 < x1) || !(y0 < y1)) {
            throw new IllegalArgumentException("Invalid rectangle: " + "[" + x0 + ", " + y0 + "] .. [" + x1 + ", " + y1 + "]");
        }
    }

    public boolean contains(double x, double y) {
        return x >= x0 && x < x1 && y >= y0 && y < y1;
    }

    public boolean overlaps(Rect other) {
        return this.x0 < other.x1 && other.x0 < this.x1
                && this.y0 < other.y1 && other.y0 < this.y1;
    }

    public Rect grow(double margin) {
        return new Rect(x0 - margin, y0 - margin, x1 + margin, y1 + margin);
    }

    public double width() {
        return x1 - x0;
    }

    public double height() {
        return y1 - y0;
    }

    @Override
    public String toString() {
        return "[" + x0 + ", " + y0 + " .. " + x1 + ", " + y1 + "]";
    }
}
