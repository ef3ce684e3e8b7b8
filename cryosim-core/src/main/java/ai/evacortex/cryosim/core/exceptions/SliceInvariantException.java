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
 * Specimen geometry does not fit the slab or crop layout derived from the configuration.
 */
public class SliceInvariantException extends RuntimeException {

    public SliceInvariantException(String message) {
        super(message);
    }
}
