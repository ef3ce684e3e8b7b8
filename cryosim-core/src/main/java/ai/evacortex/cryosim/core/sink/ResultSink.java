/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.sink;

import ai.evacortex.cryosim.core.exceptions.ConfigurationException;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

/**
 * Destination of finished frames. Slot {@code index} is owned by frame {@code index} and written once.
 */
public interface ResultSink {

    int frames();

    int height();

    int width();

    /**
     * Stores one frame.
     *
     * @param image cropped image of shape (height, width), or {@code null} when the simulation produced
     *              no image (only the angle and position are recorded)
     * @throws IllegalStateException if the slot was already written
     * @throws IndexOutOfBoundsException if {@code index} is outside {@code [0, frames)}
     */
    void write(int index, double angle, Vector3D position, float[][] image);

    /**
     * Fails unless the sink has exactly the shape {@code (frames, height, width)}.
     */
    static void requireShape(ResultSink sink, int frames, int height, int width) {
        if (sink.frames() != frames || sink.height() != height || sink.width() != width) {
            throw new ConfigurationException("sink shape (" + sink.frames() + ", " + sink.height() + ", "
                    + sink.width() + ") != expected (" + frames + ", " + height + ", " + width + ")");
        }
    }
}
