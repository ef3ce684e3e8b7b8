/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.sample;

import ai.evacortex.cryosim.core.model.AtomRecord;
import ai.evacortex.cryosim.core.model.Box;
import ai.evacortex.cryosim.core.model.Rect;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

import java.util.List;

/**
 * Read-only view of a specimen model.
 *
 * <p>Implementations are shared by every frame of a run and must be safe for concurrent reads.</p>
 */
public interface Sample {

    /**
     * Returns the atoms whose (x, y) lies in {@code rect} (upper edges exclusive), regardless of z.
     * The returned list must not be modified by the caller.
     */
    List<AtomRecord> selectAtomsInRect(Rect rect);

    /** Tight bounds of the atoms. */
    Box boundingBox();

    /** Box the specimen lives in; its upper z bound is the thickness used for slicing. */
    Box containingBox();

    /** Rotation centre for scan poses. */
    Vector3D centre();

    /** Z extent covered by projected-potential volumes. */
    default Box shapeBox() {
        return containingBox();
    }

    int size();
}
