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
import ai.evacortex.cryosim.core.model.Box;
import ai.evacortex.cryosim.core.model.Detector;
import ai.evacortex.cryosim.core.model.Rect;
import ai.evacortex.cryosim.core.sample.InMemorySample;
import ai.evacortex.cryosim.core.scan.Pose;
import org.apache.commons.math3.geometry.euclidean.threed.Rotation;
import org.apache.commons.math3.geometry.euclidean.threed.RotationConvention;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;
import java.util.ArrayList;

import static org.junit.jupiter.api.Assertions.*;

class FieldOfViewSelectorTest {

    private static final double EPS = 1e-9;

    @Test
    void paddedRect_growsDetectorAreaByOffset() {
        FieldOfView fov = FieldOfView.of(new Detector(10, 8, 0.5), 4);
        assertEquals(2.0, fov.offset(), EPS);
        Rect padded = fov.paddedRect();
        assertEquals(-2.0, padded.x0(), EPS);
        assertEquals(-2.0, padded.y0(), EPS);
        assertEquals(7.0, padded.x1(), EPS);
        assertEquals(6.0, padded.y1(), EPS);
        assertEquals(9.0, fov.paddedWidth(), EPS);
        assertEquals(8.0, fov.paddedHeight(), EPS);
    }

    @Test
    void identityPose_translatesByOffset_andHonoursHalfOpenEdges() {
        List<AtomRecord> atoms = List.of(
                AtomRecord.of(6, -2.0, -2.0, 1.0),   // lower corner, kept
                AtomRecord.of(6, 1.0, 1.0, 2.0),
                AtomRecord.of(6, 6.0, 1.0, 3.0),     // upper x edge, dropped
                AtomRecord.of(6, 1.0, 6.0, 3.0),     // upper y edge, dropped
                AtomRecord.of(6, 9.0, 9.0, 3.0));
        InMemorySample sample = new InMemorySample(atoms, new Box(-5, -5, 0, 10, 10, 5));
        FieldOfView fov = FieldOfView.of(new Detector(4, 4, 1.0), 2);

        List<AtomRecord> selected = FieldOfViewSelector.select(sample, fov, Pose.identity());

        assertEquals(2, selected.size());
        assertTrue(selected.stream().anyMatch(a -> Math.abs(a.x()) < EPS && Math.abs(a.y()) < EPS && a.z() == 1.0));
        assertTrue(selected.stream().anyMatch(a -> Math.abs(a.x() - 3.0) < EPS && Math.abs(a.y() - 3.0) < EPS));
    }

    @Test
    void everySelectedAtom_cameFromPaddedRect() {
        Random r = new Random(5);
        List<AtomRecord> atoms = new ArrayList<>();
        for (int i = 0; i < 2000; i++) {
            atoms.add(AtomRecord.of(6, r.nextDouble() * 40 - 10, r.nextDouble() * 40 - 10, r.nextDouble() * 5));
        }
        InMemorySample sample = new InMemorySample(atoms, new Box(-10, -10, 0, 30, 30, 5));
        FieldOfView fov = FieldOfView.of(new Detector(12, 9, 1.0), 3);
        Rect padded = fov.paddedRect();

        long expected = atoms.stream().filter(a -> padded.contains(a.x(), a.y())).count();
        List<AtomRecord> selected = FieldOfViewSelector.select(sample, fov, Pose.identity());

        assertEquals(expected, selected.size());
        for (AtomRecord a : selected) {
            assertTrue(a.x() >= 0.0 && a.x() < fov.paddedWidth() + EPS);
            assertTrue(a.y() >= 0.0 && a.y() < fov.paddedHeight() + EPS);
        }
    }

    @Test
    void rotationAboutCentre_thenShiftSubtracted() {
        AtomRecord atom = AtomRecord.of(6, 1.0, 1.0, 2.0);
        InMemorySample sample = new InMemorySample(List.of(atom), new Box(0, 0, 0, 4, 4, 4));
        FieldOfView fov = FieldOfView.of(new Detector(4, 4, 1.0), 1);
        Rotation halfTurn = new Rotation(Vector3D.PLUS_K, Math.PI, RotationConvention.VECTOR_OPERATOR);
        Vector3D shift = new Vector3D(0.5, 0.0, 0.0);
        Pose pose = new Pose(180.0, shift, halfTurn, shift, Vector3D.PLUS_K);

        List<AtomRecord> selected = FieldOfViewSelector.select(sample, fov, pose);

        assertEquals(1, selected.size());
        AtomRecord moved = selected.get(0);
        // centre (2, 2, 2): (1, 1) -> (3, 3), minus shift, plus offset 1
        assertEquals(3.0 - 0.5 + 1.0, moved.x(), 1e-9);
        assertEquals(3.0 + 1.0, moved.y(), 1e-9);
        assertEquals(2.0, moved.z(), 1e-9);
        assertEquals(atom.species(), moved.species());
    }

    @Test
    void emptyWindow_returnsEmptyList() {
        InMemorySample sample = new InMemorySample(List.of(AtomRecord.of(6, 50, 50, 1)), new Box(0, 0, 0, 60, 60, 2));
        FieldOfView fov = FieldOfView.of(new Detector(4, 4, 1.0), 2);
        assertTrue(FieldOfViewSelector.select(sample, fov, Pose.identity()).isEmpty());
    }
}
