/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.job;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

/**
 * Output of one frame job.
 *
 * @param image cropped image, or {@code null} when the job writes its output elsewhere
 */
public record FrameResult(int index, double angle, Vector3D position, float[][] image) {
}
