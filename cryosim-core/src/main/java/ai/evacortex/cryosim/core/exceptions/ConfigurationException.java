/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.exceptions;

public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super("Invalid configuration: " + message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super("Invalid configuration: " + message, cause);
    }
}
