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
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

import java.util.*;

/**
 * Heap-resident sample. Atoms are bucketed into square xy tiles so that a rectangle query only
 * touches the tiles it overlaps; finished queries are kept in a bounded cache because the frames
 * of a tilt series usually ask for the same rectangle.
 */
public final class InMemorySample implements Sample {

    private static final double DEFAULT_TILE_SIZE = 50.0;
    // keeps rotated coordinates inside the box despite rounding
    private static final double ROTATION_PAD = 1e-9;

    private final List<AtomRecord> atoms;
    private final Box boundingBox;
    private final Box containingBox;
    private final Vector3D centre;
    private final double tileSize;
    private final Map<Long, List<AtomRecord>> tiles = new HashMap<>();
    private final LoadingCache<Rect, List<AtomRecord>> queryCache;

    public InMemorySample(Collection<AtomRecord> atoms, Box containingBox, double tileSize) {
        Objects.requireNonNull(atoms, "atoms must not be null");
        Objects.requireNonNull(containingBox, "containingBox must not be null");
        if (!(tileSize > 0.0)) {
            throw new IllegalArgumentException("Tile size must be > 0: " + tileSize);
        }
        this.atoms = List.copyOf(atoms);
        this.boundingBox = Box.enclosing(this.atoms);
        if (!this.atoms.isEmpty() && !containingBox.contains(boundingBox)) {
            throw new IllegalArgumentException("Atoms " + boundingBox + " exceed containing box " + containingBox);
        }
        this.containingBox = containingBox;
        this.centre = containingBox.centre();
        this.tileSize = tileSize;

        for (AtomRecord a : this.atoms) {
            tiles.computeIfAbsent(tileKey(tileIndex(a.x()), tileIndex(a.y())), k -> new ArrayList<>()).add(a);
        }

        long maxWeight = Math.max(1024L, 4L * this.atoms.size());
        this.queryCache = Caffeine.newBuilder()
                .maximumWeight(maxWeight)
                .weigher((Rect r, List<AtomRecord> hit) -> Math.max(1, hit.size()))
                .build(this::scan);
    }

    public InMemorySample(Collection<AtomRecord> atoms, Box containingBox) {
        this(atoms, containingBox, DEFAULT_TILE_SIZE);
    }

    /**
     * Sample whose containing box is the cube of half-size {@code r} around the centre of the atoms,
     * {@code r} being half the diagonal of their bounding box. Any rotation about the centre keeps every
     * atom inside it. When the cube would reach below {@code z = 0} the atoms are lifted along z so that
     * it starts there; x and y are never moved.
     */
    public static InMemorySample of(Collection<AtomRecord> atoms) {
        Box b = Box.enclosing(atoms);
        Vector3D c = b.centre();
        double r = c.distance(b.upper()) * (1.0 + ROTATION_PAD) + ROTATION_PAD;
        double lift = Math.max(0.0, r - c.getZ());

        Collection<AtomRecord> placed = atoms;
        if (lift > 0.0) {
            List<AtomRecord> moved = new ArrayList<>(atoms.size());
            for (AtomRecord a : atoms) moved.add(a.translate(0.0, 0.0, lift));
            placed = moved;
        }
        double cz = c.getZ() + lift;
        Box containing = new Box(c.getX() - r, c.getY() - r, Math.max(0.0, cz - r),
                c.getX() + r, c.getY() + r, cz + r);
        return new InMemorySample(placed, containing);
    }

    @Override
    public List<AtomRecord> selectAtomsInRect(Rect rect) {
        Objects.requireNonNull(rect, "rect must not be null");
        return queryCache.get(rect);
    }

    private List<AtomRecord> scan(Rect rect) {
        if (atoms.isEmpty()) return List.of();

        // clamp to occupied tiles
        long tx0 = Math.max(tileIndex(rect.x0()), tileIndex(boundingBox.x0()));
        long tx1 = Math.min(tileIndex(rect.x1()), tileIndex(boundingBox.x1()));
        long ty0 = Math.max(tileIndex(rect.y0()), tileIndex(boundingBox.y0()));
        long ty1 = Math.min(tileIndex(rect.y1()), tileIndex(boundingBox.y1()));

        List<AtomRecord> hits = new ArrayList<>();
        for (long tx = tx0; tx <= tx1; tx++) {
            for (long ty = ty0; ty <= ty1; ty++) {
                List<AtomRecord> bucket = tiles.get(tileKey(tx, ty));
                if (bucket == null) continue;
                for (AtomRecord a : bucket) {
                    if (rect.contains(a.x(), a.y())) hits.add(a);
                }
            }
        }
        return Collections.unmodifiableList(hits);
    }

    private long tileIndex(double v) {
        return (long) Math.floor(v / tileSize);
    }

    private static long tileKey(long tx, long ty) {
        return (tx << 32) ^ (ty & 0xffffffffL);
    }

    @Override
    public Box boundingBox() {
        return boundingBox;
    }

    @Override
    public Box containingBox() {
        return containingBox;
    }

    @Override
    public Vector3D centre() {
        return centre;
    }

    @Override
    public int size() {
        return atoms.size();
    }

    public long cachedQueries() {
        queryCache.cleanUp();
        return queryCache.estimatedSize();
    }
}
