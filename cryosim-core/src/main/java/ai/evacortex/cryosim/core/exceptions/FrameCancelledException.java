/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.exceptions;

public class FrameCancelledException extends RuntimeException {

    private final int frameIndex;

    public FrameCancelledException(int frameIndex) {
        super("Frame " + frameIndex + " cancelled");
        this.frameIndex = frameIndex;
    }

    public int frameIndex() {
        return frameIndex;
    }
}
