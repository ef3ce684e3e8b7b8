/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.slicing;

import ai.evacortex.cryosim.core.exceptions.ConfigurationException;
import ai.evacortex.cryosim.core.exceptions.SliceInvariantException;
import ai.evacortex.cryosim.core.model.AtomRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Partitions a frame's atoms into contiguous z-slabs for multislice propagation.
 *
 * <p>{@code [0, Lz)} is split into {@code N} slabs of width {@code Lz / N}. The last slab is stretched to
 * {@code max(Lz, max(z) + EPSILON)} so atoms sitting exactly on the upper bound are kept. Empty slabs
 * are dropped; the remaining ones are returned in ascending z.</p>
 */
public final class ZSlicer {

    static final double EPSILON = 1e-5;

    private ZSlicer() {}

    public static List<SliceDescriptor> slice(List<AtomRecord> atoms, double lz, int n) {
        if (!(lz > 0.0)) {
            throw new ConfigurationException("specimen thickness must be > 0, got " + lz);
        }
        if (n <= 0) {
            throw new ConfigurationException("slab count must be > 0, got " + n);
        }

        double maxZ = 0.0;
        for (AtomRecord a : atoms) {
            double z = a.z();
            if (!(z >= 0.0 && z <= lz)) {
                throw new SliceInvariantException("Atom z = " + z + " outside specimen [0, " + lz + "]");
            }
            maxZ = Math.max(maxZ, z);
        }
        if (atoms.isEmpty()) return List.of();

        double top = Math.max(lz, maxZ + EPSILON);
        if (n == 1) {
            return List.of(new SliceDescriptor(0, 0.0, top, atoms));
        }

        double width = lz / n;
        List<List<AtomRecord>> buckets = new ArrayList<>(n);
        for (int i = 0; i < n; i++) buckets.add(new ArrayList<>());

        for (AtomRecord a : atoms) {
            buckets.get(slabIndex(a.z(), width, n)).add(a);
        }

        List<SliceDescriptor> slabs = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            List<AtomRecord> bucket = buckets.get(i);
            if (bucket.isEmpty()) continue;
            double z0 = i * width;
            double z1 = (i == n - 1) ? top : (i + 1) * width;
            slabs.add(new SliceDescriptor(i, z0, z1, bucket));
        }
        return slabs;
    }

    /** Slab count: the explicit value when given, else {@code max(1, floor(Lz / thickness))}. */
    public static int slabCount(double lz, double sliceThickness, Integer numSlices) {
        if (numSlices != null) {
            if (numSlices <= 0) {
                throw new ConfigurationException("slab count must be > 0, got " + numSlices);
            }
            return numSlices;
        }
        if (!(sliceThickness > 0.0)) {
            throw new ConfigurationException("slice thickness must be > 0, got " + sliceThickness);
        }
        return Math.max(1, (int) Math.floor(lz / sliceThickness));
    }

    // floor() can land one slab off when z sits on a bound; settle against the exact bounds
    private static int slabIndex(double z, double width, int n) {
        int idx = Math.min(n - 1, (int) Math.floor(z / width));
        while (idx > 0 && z < idx * width) idx--;
        while (idx < n - 1 && z >= (idx + 1) * width) idx++;
        return idx;
    }
}
