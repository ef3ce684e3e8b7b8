/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.sink;

import net.jpountz.xxhash.XXHashFactory;

import java.nio.ByteBuffer;

/**
 * xxHash64 fingerprints of frames, used to compare runs bit for bit.
 */
public final class FrameChecksum {

    private static final XXHashFactory XX_HASH = XXHashFactory.fastestInstance();
    private static final int SEED = 0x9747b28c;

    private FrameChecksum() {}

    public static long of(float[][] image) {
        byte[] bytes = toBytes(image);
        return XX_HASH.hash64().hash(bytes, 0, bytes.length, SEED);
    }

    /** Hash over every frame and angle in index order. */
    public static long ofVolume(OutputVolume volume) {
        ByteBuffer buf = ByteBuffer.allocate(volume.frames() * 2 * Long.BYTES);
        for (int i = 0; i < volume.frames(); i++) {
            buf.putLong(Double.doubleToLongBits(volume.angle(i)));
            buf.putLong(of(volume.frame(i)));
        }
        byte[] bytes = buf.array();
        return XX_HASH.hash64().hash(bytes, 0, bytes.length, SEED);
    }

    private static byte[] toBytes(float[][] image) {
        int count = 0;
        for (float[] row : image) count += row.length;
        ByteBuffer buf = ByteBuffer.allocate(count * Float.BYTES);
        for (float[] row : image) {
            for (float v : row) buf.putFloat(v);
        }
        return buf.array();
    }
}
