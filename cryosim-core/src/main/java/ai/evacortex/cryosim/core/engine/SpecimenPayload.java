/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.engine;

import ai.evacortex.cryosim.core.model.AtomRecord;
import ai.evacortex.cryosim.core.slicing.SliceDescriptor;

import java.util.List;

/**
 * Atoms handed to the engine: either one flat list (single slab) or ordered z-slabs.
 */
public sealed interface SpecimenPayload permits SpecimenPayload.Flat, SpecimenPayload.Slabs {

    int atomCount();

    record Flat(List<AtomRecord> atoms) implements SpecimenPayload {
        public Flat {
            atoms = List.copyOf(atoms);
        }

        @Override
        public int atomCount() {
            return atoms.size();
        }
    }

    record Slabs(List<SliceDescriptor> slabs) implements SpecimenPayload {
        public Slabs {
            slabs = List.copyOf(slabs);
        }

        @Override
        public int atomCount() {
            return slabs.stream().mapToInt(SliceDescriptor::size).sum();
        }
    }
}
