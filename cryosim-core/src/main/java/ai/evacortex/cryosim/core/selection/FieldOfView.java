/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.selection;

import ai.evacortex.cryosim.core.model.Detector;
import ai.evacortex.cryosim.core.model.Rect;

import java.util.Objects;

/**
 * Detector footprint in specimen coordinates plus the simulated border around it.
 *
 * @param detectorRect area imaged by the detector
 * @param offset       border width in Å ({@code margin * pixelSize})
 */
public record FieldOfView(Rect detectorRect, double offset) {

    public FieldOfView {
        Objects.requireNonNull(detectorRect, "detectorRect must not be null");
        if (offset < 0.0) {
            throw new IllegalArgumentException("Offset must be >= 0: " + offset);
        }
    }

    public static FieldOfView of(Detector detector, int margin) {
        Rect rect = new Rect(0.0, 0.0, detector.fieldOfViewX(), detector.fieldOfViewY());
        return new FieldOfView(rect, margin * detector.pixelSize());
    }

    /** Region to pull atoms from: the detector area grown by the offset on every side. */
    public Rect paddedRect() {
        return detectorRect.grow(offset);
    }

    public double paddedWidth() {
        return detectorRect.width() + 2 * offset;
    }

    public double paddedHeight() {
        return detectorRect.height() + 2 * offset;
    }
}
