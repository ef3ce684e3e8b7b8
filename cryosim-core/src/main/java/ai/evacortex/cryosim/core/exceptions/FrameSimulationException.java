/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.exceptions;

/**
 * A simulation run failed; carries the index of the frame that failed first.
 */
public class FrameSimulationException extends RuntimeException {

    private final int frameIndex;

    public FrameSimulationException(int frameIndex, Throwable cause) {
        super("Simulation of frame " + frameIndex + " failed: " + cause.getMessage(), cause);
        this.frameIndex = frameIndex;
    }

    public int frameIndex() {
        return frameIndex;
    }
}
