/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.sink;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public final class InMemoryPotentialStore implements PotentialStore {

    private final ConcurrentMap<Integer, Volume> volumes = new ConcurrentHashMap<>();

    @Override
    public PotentialVolume open(int frameIndex, int depth, int height, int width,
                                double pixelSize, double sliceThickness) {
        Volume v = new Volume(depth, height, width, pixelSize, sliceThickness);
        if (volumes.putIfAbsent(frameIndex, v) != null) {
            throw new IllegalStateException("Potential volume for frame " + frameIndex + " already open");
        }
        return v;
    }

    public Volume get(int frameIndex) {
        return volumes.get(frameIndex);
    }

    public Map<Integer, Volume> all() {
        return Map.copyOf(volumes);
    }

    public static final class Volume implements PotentialVolume {
        private final float[][][] planes;
        private final int height;
        private final int width;
        private final double pixelSize;
        private final double sliceThickness;

        Volume(int depth, int height, int width, double pixelSize, double sliceThickness) {
            if (depth < 0 || height <= 0 || width <= 0) {
                throw new IllegalArgumentException("Invalid potential shape: (" + depth + ", " + height + ", " + width + ")");
            }
            this.planes = new float[depth][height][width];
            this.height = height;
            this.width = width;
            this.pixelSize = pixelSize;
            this.sliceThickness = sliceThickness;
        }

        @Override
        public int depth() {
            return planes.length;
        }

        @Override
        public int height() {
            return height;
        }

        @Override
        public int width() {
            return width;
        }

        @Override
        public void accumulatePlane(int z, float[][] plane) {
            if (z < 0 || z >= planes.length) {
                throw new IndexOutOfBoundsException("Plane " + z + " outside [0, " + planes.length + ")");
            }
            if (plane.length != height) {
                throw new IllegalArgumentException("Plane shape mismatch at z = " + z);
            }
            for (float[] row : plane) {
                if (row.length != width) {
                    throw new IllegalArgumentException("Plane shape mismatch at z = " + z);
                }
            }
            for (int y = 0; y < height; y++) {
                float[] target = planes[z][y];
                float[] source = plane[y];
                for (int x = 0; x < width; x++) target[x] += source[x];
            }
        }

        public float[][] plane(int z) {
            return planes[z];
        }

        public double pixelSize() {
            return pixelSize;
        }

        public double sliceThickness() {
            return sliceThickness;
        }
    }
}
