/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.sink;

/**
 * Opens the projected-potential volume of a frame.
 */
@FunctionalInterface
public interface PotentialStore {

    /**
     * @param frameIndex     frame the volume belongs to
     * @param depth          number of planes
     * @param height         plane height in pixels
     * @param width          plane width in pixels
     * @param pixelSize      in-plane voxel size (Å)
     * @param sliceThickness voxel size along z (Å)
     */
    PotentialVolume open(int frameIndex, int depth, int height, int width, double pixelSize, double sliceThickness);
}
