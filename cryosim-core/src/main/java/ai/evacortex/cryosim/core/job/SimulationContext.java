/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.job;

import ai.evacortex.cryosim.core.config.SimulationParameters;
import ai.evacortex.cryosim.core.engine.SimulationEngine;
import ai.evacortex.cryosim.core.engine.SystemConfiguration;
import ai.evacortex.cryosim.core.model.Microscope;
import ai.evacortex.cryosim.core.sample.Sample;
import ai.evacortex.cryosim.core.scan.Scan;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Read-only state shared by every frame of a run. Handed to workers once, before any frame is submitted.
 *
 * @param engineFactory creates one engine per worker; engines are never shared between workers
 */
public record SimulationContext(
        Microscope microscope,
        Sample sample,
        Scan scan,
        SimulationParameters parameters,
        SystemConfiguration system,
        AtomPerturbation perturbation,
        Supplier<? extends SimulationEngine> engineFactory
) {
    public SimulationContext {
        Objects.requireNonNull(microscope, "microscope must not be null");
        Objects.requireNonNull(sample, "sample must not be null");
        Objects.requireNonNull(scan, "scan must not be null");
        Objects.requireNonNull(parameters, "parameters must not be null");
        Objects.requireNonNull(system, "system must not be null");
        Objects.requireNonNull(engineFactory, "engineFactory must not be null");
        if (perturbation == null) perturbation = AtomPerturbation.none();
    }

    public int numFrames() {
        return scan.size();
    }
}
