/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.engine;

import ai.evacortex.cryosim.core.exceptions.EngineException;
import ai.evacortex.cryosim.core.model.AtomRecord;
import ai.evacortex.cryosim.core.model.WaveField;
import ai.evacortex.cryosim.core.slicing.SliceDescriptor;

import java.util.List;
import java.util.Objects;

/**
 * Pure-Java engine for hosts without the native multislice library.
 *
 * <p>Each atom contributes a Gaussian blob {@code Z · occupancy · exp(-r² / 2s²)} with
 * {@code s = 0.5 Å + √sigma} to the projected potential {@code V}. The transmitted wave is</p>
 * <pre>
 *     ψ = exp(-μ·V) · e^{i·σ·V}
 * </pre>
 * <p>Lens transfer and Fresnel propagation between slabs are not modelled, so slabbed and flat payloads
 * give the same field up to summation order. Output is deterministic for identical input.</p>
 */
public final class ProjectionEngine implements SimulationEngine {

    private static final double ABSORPTION = 0.002;
    private static final double INTERACTION = 0.01;
    private static final double MIN_WIDTH = 0.5;

    @Override
    public EngineResult simulateWave(SystemConfiguration system, EngineInput input, SpecimenPayload payload) {
        Objects.requireNonNull(system, "system must not be null");
        Objects.requireNonNull(input, "input must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        requireCpu(system);

        if (input.kind() == SimulationKind.PROJECTED_POTENTIAL) {
            throw new IllegalArgumentException("Projected potential is computed by simulateProjectedPotential");
        }

        double[][] potential = new double[input.ny()][input.nx()];
        if (payload instanceof SpecimenPayload.Flat flat) {
            deposit(potential, flat.atoms(), input.pixelSize(), false);
        } else if (payload instanceof SpecimenPayload.Slabs slabs) {
            for (SliceDescriptor slab : slabs.slabs()) {
                deposit(potential, slab.atoms(), input.pixelSize(), false);
            }
        }

        double[][] amplitude = new double[input.ny()][input.nx()];
        double[][] phase = new double[input.ny()][input.nx()];
        for (int y = 0; y < input.ny(); y++) {
            for (int x = 0; x < input.nx(); x++) {
                double v = potential[y][x];
                amplitude[y][x] = round(system, Math.exp(-ABSORPTION * v));
                phase[y][x] = round(system, INTERACTION * v);
            }
        }
        WaveField wave = new WaveField(amplitude, phase);
        return new EngineResult(wave.intensity(), wave);
    }

    @Override
    public void simulateProjectedPotential(SystemConfiguration system, EngineInput input,
                                           List<SliceDescriptor> slabs, SlabCallback callback) {
        Objects.requireNonNull(system, "system must not be null");
        Objects.requireNonNull(input, "input must not be null");
        Objects.requireNonNull(slabs, "slabs must not be null");
        Objects.requireNonNull(callback, "callback must not be null");
        requireCpu(system);

        for (SliceDescriptor slab : slabs) {
            double[][] potential = new double[input.nx()][input.ny()];
            deposit(potential, slab.atoms(), input.pixelSize(), true);
            if (system.precision() == SystemConfiguration.Precision.FLOAT) {
                for (double[] column : potential) {
                    for (int j = 0; j < column.length; j++) column[j] = (float) column[j];
                }
            }
            callback.accept(slab.z0(), slab.z1(), potential);
        }
    }

    @Override
    public boolean isDeviceAvailable(Device device) {
        return device == Device.CPU;
    }

    private static void requireCpu(SystemConfiguration system) {
        if (system.device() != Device.CPU) {
            throw new EngineException("ProjectionEngine cannot run on " + system.device());
        }
    }

    private static double round(SystemConfiguration system, double v) {
        return system.precision() == SystemConfiguration.Precision.FLOAT ? (float) v : v;
    }

    /** Adds every atom's blob to {@code grid}, indexed [y][x] or, if {@code columnMajor}, [x][y]. */
    private static void deposit(double[][] grid, List<AtomRecord> atoms, double pixelSize, boolean columnMajor) {
        int rows = grid.length;
        int cols = rows == 0 ? 0 : grid[0].length;
        int width = columnMajor ? rows : cols;
        int height = columnMajor ? cols : rows;

        for (AtomRecord atom : atoms) {
            double s = MIN_WIDTH + Math.sqrt(Math.max(atom.sigma(), 0.0));
            double weight = atom.species() * atom.occupancy();
            double cx = atom.x() / pixelSize;
            double cy = atom.y() / pixelSize;
            int reach = (int) Math.ceil(3.0 * s / pixelSize);

            int x0 = Math.max(0, (int) Math.floor(cx) - reach);
            int x1 = Math.min(width - 1, (int) Math.floor(cx) + reach);
            int y0 = Math.max(0, (int) Math.floor(cy) - reach);
            int y1 = Math.min(height - 1, (int) Math.floor(cy) + reach);

            for (int y = y0; y <= y1; y++) {
                double dy = (y - cy) * pixelSize;
                for (int x = x0; x <= x1; x++) {
                    double dx = (x - cx) * pixelSize;
                    double v = weight * Math.exp(-(dx * dx + dy * dy) / (2.0 * s * s));
                    if (columnMajor) grid[x][y] += v;
                    else grid[y][x] += v;
                }
            }
        }
    }
}
