/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.sink;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

import java.util.concurrent.atomic.AtomicIntegerArray;

/**
 * Heap-backed float32 volume of shape (frames, height, width) with parallel angle and position arrays.
 *
 * <p>Each slot is written at most once; writers of distinct slots need no locking.</p>
 */
public final class OutputVolume implements ResultSink {

    private final int frames;
    private final int height;
    private final int width;
    private final float[][][] data;
    private final double[] angles;
    private final Vector3D[] positions;
    private final AtomicIntegerArray written;

    public OutputVolume(int frames, int height, int width) {
        if (frames <= 0 || height <= 0 || width <= 0) {
            throw new IllegalArgumentException("Invalid volume shape: (" + frames + ", " + height + ", " + width + ")");
        }
        this.frames = frames;
        this.height = height;
        this.width = width;
        this.data = new float[frames][height][width];
        this.angles = new double[frames];
        this.positions = new Vector3D[frames];
        this.written = new AtomicIntegerArray(frames);
    }

    @Override
    public void write(int index, double angle, Vector3D position, float[][] image) {
        if (index < 0 || index >= frames) {
            throw new IndexOutOfBoundsException("Frame index " + index + " outside [0, " + frames + ")");
        }
        if (image != null) {
            checkShape(image);
        }
        if (!written.compareAndSet(index, 0, 1)) {
            throw new IllegalStateException("Frame " + index + " already written");
        }
        if (image != null) {
            for (int y = 0; y < height; y++) {
                System.arraycopy(image[y], 0, data[index][y], 0, width);
            }
        }
        angles[index] = angle;
        positions[index] = position;
    }

    private void checkShape(float[][] image) {
        if (image.length != height) {
            throw new IllegalArgumentException("Image height " + image.length + " != " + height);
        }
        for (int y = 0; y < height; y++) {
            if (image[y] == null || image[y].length != width) {
                throw new IllegalArgumentException("Image row " + y + " has length "
                        + (image[y] == null ? "null" : image[y].length) + ", expected " + width);
            }
        }
    }

    @Override
    public int frames() {
        return frames;
    }

    @Override
    public int height() {
        return height;
    }

    @Override
    public int width() {
        return width;
    }

    public float[][] frame(int index) {
        return data[index];
    }

    public double angle(int index) {
        return angles[index];
    }

    public Vector3D position(int index) {
        return positions[index];
    }

    public boolean isWritten(int index) {
        return written.get(index) == 1;
    }

    public int writtenCount() {
        int n = 0;
        for (int i = 0; i < frames; i++) n += written.get(i);
        return n;
    }

    public long checksum() {
        return FrameChecksum.ofVolume(this);
    }
}
