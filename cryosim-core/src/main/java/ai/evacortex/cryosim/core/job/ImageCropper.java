/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.job;

import ai.evacortex.cryosim.core.exceptions.SliceInvariantException;

/**
 * Removes the simulated margin from raw engine fields.
 */
public final class ImageCropper {

    private ImageCropper() {}

    /**
     * Returns {@code raw[margin .. margin + height)[margin .. margin + width)} as float32.
     *
     * @param raw field indexed [y][x], at least {@code (height + 2·margin, width + 2·margin)}
     */
    public static float[][] crop(double[][] raw, int margin, int height, int width) {
        checkBounds(raw, margin, height, width);
        float[][] out = new float[height][width];
        for (int y = 0; y < height; y++) {
            double[] row = raw[margin + y];
            for (int x = 0; x < width; x++) {
                out[y][x] = (float) row[margin + x];
            }
        }
        return out;
    }

    /**
     * Same as {@link #crop} for a field indexed [x][y]; the result is indexed [y][x].
     */
    public static float[][] cropTransposed(double[][] rawXY, int margin, int height, int width) {
        checkBounds(rawXY, margin, width, height);
        float[][] out = new float[height][width];
        for (int x = 0; x < width; x++) {
            double[] column = rawXY[margin + x];
            for (int y = 0; y < height; y++) {
                out[y][x] = (float) column[margin + y];
            }
        }
        return out;
    }

    private static void checkBounds(double[][] raw, int margin, int rows, int cols) {
        if (margin < 0) {
            throw new SliceInvariantException("Margin must be >= 0, got " + margin);
        }
        if (rows <= 0 || cols <= 0) {
            throw new SliceInvariantException("Degenerate crop region " + rows + "x" + cols);
        }
        if (raw == null || raw.length < rows + 2 * margin) {
            throw new SliceInvariantException("Raw field has " + (raw == null ? 0 : raw.length)
                    + " rows, need " + (rows + 2 * margin));
        }
        for (int r = margin; r < margin + rows; r++) {
            if (raw[r].length < cols + 2 * margin) {
                throw new SliceInvariantException("Raw field row " + r + " has " + raw[r].length
                        + " columns, need " + (cols + 2 * margin));
            }
        }
    }
}
