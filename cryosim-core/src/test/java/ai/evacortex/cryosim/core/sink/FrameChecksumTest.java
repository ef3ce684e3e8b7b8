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
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FrameChecksumTest {

    @Test
    void frameHash_isDeterministicAndContentSensitive() {
        float[][] a = SimulationTestUtils.constantImage(8, 8, 0.25f);
        float[][] b = SimulationTestUtils.constantImage(8, 8, 0.25f);
        assertEquals(FrameChecksum.of(a), FrameChecksum.of(b), "Equal frames must hash equally");

        b[7][7] = Math.nextUp(0.25f);
        assertNotEquals(FrameChecksum.of(a), FrameChecksum.of(b), "A one-ulp change must change the hash");
    }

    @Test
    void volumeHash_coversFramesAndAngles() {
        OutputVolume v1 = new OutputVolume(2, 2, 2);
        OutputVolume v2 = new OutputVolume(2, 2, 2);
        for (OutputVolume v : new OutputVolume[]{v1, v2}) {
            v.write(1, 10.0, Vector3D.ZERO, SimulationTestUtils.constantImage(2, 2, 3f));
            v.write(0, 0.0, Vector3D.ZERO, SimulationTestUtils.constantImage(2, 2, 1f));
        }
        assertEquals(v1.checksum(), v2.checksum(), "Write order must not matter");

        OutputVolume v3 = new OutputVolume(2, 2, 2);
        v3.write(0, 0.0, Vector3D.ZERO, SimulationTestUtils.constantImage(2, 2, 1f));
        v3.write(1, 12.0, Vector3D.ZERO, SimulationTestUtils.constantImage(2, 2, 3f));
        assertNotEquals(v1.checksum(), v3.checksum(), "Angles are part of the volume hash");
    }
}
