/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.config;

import ai.evacortex.cryosim.core.exceptions.ConfigurationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a {@link SimulationConfig} from JSON and applies command-line style overrides.
 */
public final class SimulationConfigLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(SimulationConfigLoader.class);

    private final ObjectMapper mapper = new ObjectMapper();

    /** Loads {@code path}, or returns the defaults if {@code path} is {@code null}. */
    public SimulationConfig load(Path path) {
        if (path == null) {
            return new SimulationConfig();
        }
        if (!Files.exists(path)) {
            throw new ConfigurationException("config file not found: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        } catch (IOException e) {
            throw new ConfigurationException("failed to read " + path, e);
        }
    }

    public SimulationConfig read(InputStream in) throws IOException {
        SimulationConfig config = mapper.readValue(in, SimulationConfig.class);
        if (config == null) {
            throw new ConfigurationException("empty configuration");
        }
        return config;
    }

    /**
     * Overrides device and cluster settings; {@code null} arguments leave the loaded value in place.
     */
    public SimulationConfig withOverrides(SimulationConfig config, String device, Integer maxWorkers, String method) {
        if (device != null) config.device = device;
        if (maxWorkers != null) config.cluster.maxWorkers = maxWorkers;
        if (method != null) config.cluster.method = method;
        return config;
    }

    /** Logs the effective configuration. */
    public void show(SimulationConfig config) {
        if (!LOGGER.isInfoEnabled()) return;
        try {
            LOGGER.info("Configuration:\n{}", mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config));
        } catch (IOException e) {
            throw new ConfigurationException("failed to render configuration", e);
        }
    }
}
