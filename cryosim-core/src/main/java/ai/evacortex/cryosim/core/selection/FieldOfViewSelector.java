/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.selection;

import ai.evacortex.cryosim.core.model.AtomRecord;
import ai.evacortex.cryosim.core.sample.Sample;
import ai.evacortex.cryosim.core.scan.Pose;
import org.apache.commons.math3.geometry.euclidean.threed.Rotation;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Extracts the atoms visible in one frame and moves them into the frame's simulation coordinates.
 *
 * <p>For every atom {@code c} inside {@link FieldOfView#paddedRect()} (tested in sample coordinates):</p>
 * <pre>
 *     c' = R · (c − centre) + centre − shift + (offset − x0, offset − y0, 0)
 * </pre>
 * <p>where {@code R} and {@code shift} come from the pose and {@code (x0, y0)} is the lower corner of
 * the detector rectangle, which therefore lands at {@code (offset, offset)}.</p>
 */
public final class FieldOfViewSelector {

    private FieldOfViewSelector() {}

    public static List<AtomRecord> select(Sample sample, FieldOfView fov, Pose pose) {
        Objects.requireNonNull(sample, "sample must not be null");
        Objects.requireNonNull(fov, "fov must not be null");
        Objects.requireNonNull(pose, "pose must not be null");

        List<AtomRecord> visible = sample.selectAtomsInRect(fov.paddedRect());
        if (visible.isEmpty()) return List.of();

        Vector3D centre = sample.centre();
        Rotation rotation = pose.orientation();
        Vector3D shift = pose.shift();
        double dx = fov.offset() - fov.detectorRect().x0();
        double dy = fov.offset() - fov.detectorRect().y0();

        List<AtomRecord> out = new ArrayList<>(visible.size());
        for (AtomRecord atom : visible) {
            Vector3D p = rotation.applyTo(atom.position().subtract(centre))
                    .add(centre)
                    .subtract(shift);
            out.add(atom.withPosition(p).translate(dx, dy, 0.0));
        }
        return out;
    }
}
