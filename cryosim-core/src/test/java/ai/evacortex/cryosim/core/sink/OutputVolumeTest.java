/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.sink;

import ai.evacortex.cryosim.core.SimulationTestUtils;
import ai.evacortex.cryosim.core.exceptions.ConfigurationException;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OutputVolumeTest {

    @Test
    void write_storesImageAngleAndPosition() {
        OutputVolume volume = new OutputVolume(3, 2, 4);
        Vector3D pos = new Vector3D(1, 0, 0);
        volume.write(1, 15.0, pos, SimulationTestUtils.constantImage(2, 4, 0.5f));

        assertTrue(volume.isWritten(1));
        assertFalse(volume.isWritten(0));
        assertEquals(1, volume.writtenCount());
        assertEquals(15.0, volume.angle(1), 0.0);
        assertEquals(pos, volume.position(1));
        assertEquals(0.5f, volume.frame(1)[1][3]);
        assertEquals(0.0f, volume.frame(0)[0][0]);
    }

    @Test
    void secondWrite_toSameSlot_throws() {
        OutputVolume volume = new OutputVolume(2, 2, 2);
        volume.write(0, 0.0, Vector3D.ZERO, SimulationTestUtils.constantImage(2, 2, 1f));
        assertThrows(IllegalStateException.class,
                () -> volume.write(0, 0.0, Vector3D.ZERO, SimulationTestUtils.constantImage(2, 2, 2f)));
        assertEquals(1f, volume.frame(0)[0][0], "First write must survive");
    }

    @Test
    void invalidWrites_throw() {
        OutputVolume volume = new OutputVolume(2, 2, 2);
        assertThrows(IndexOutOfBoundsException.class,
                () -> volume.write(2, 0.0, Vector3D.ZERO, SimulationTestUtils.constantImage(2, 2, 1f)));
        assertThrows(IllegalArgumentException.class,
                () -> volume.write(0, 0.0, Vector3D.ZERO, SimulationTestUtils.constantImage(3, 2, 1f)));
        assertFalse(volume.isWritten(0), "Rejected write must not claim the slot");
    }

    @Test
    void raggedImage_isRejectedWithoutClaimingTheSlot() {
        OutputVolume volume = new OutputVolume(1, 2, 2);
        assertThrows(IllegalArgumentException.class,
                () -> volume.write(0, 0.0, Vector3D.ZERO, new float[][]{{1f, 2f}, {3f}}));
        assertFalse(volume.isWritten(0));

        volume.write(0, 0.0, Vector3D.ZERO, new float[][]{{1f, 2f}, {3f, 4f}});
        assertEquals(4f, volume.frame(0)[1][1], "Slot stays writable after a rejected image");
    }

    @Test
    void nullImage_recordsOnlyAngleAndPosition() {
        OutputVolume volume = new OutputVolume(1, 2, 2);
        volume.write(0, -30.0, Vector3D.PLUS_J, null);
        assertTrue(volume.isWritten(0));
        assertEquals(-30.0, volume.angle(0), 0.0);
        assertEquals(0f, volume.frame(0)[1][1]);
    }

    @Test
    void requireShape_rejectsMismatch() {
        OutputVolume volume = new OutputVolume(3, 4, 4);
        ResultSink.requireShape(volume, 3, 4, 4);
        assertThrows(ConfigurationException.class, () -> ResultSink.requireShape(volume, 3, 4, 5));
        assertThrows(ConfigurationException.class, () -> ResultSink.requireShape(volume, 2, 4, 4));
    }
}
