/*
 * CryoSim — Cryo-EM Frame Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.cryosim.core.config;

import ai.evacortex.cryosim.core.engine.Device;
import ai.evacortex.cryosim.core.engine.SimulationKind;
import ai.evacortex.cryosim.core.exceptions.ConfigurationException;
import ai.evacortex.cryosim.core.model.Detector;
import ai.evacortex.cryosim.core.model.Microscope;
import ai.evacortex.cryosim.core.scan.Scan;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * JSON view of a simulation configuration. Only used to translate a file into resolved objects;
 * the simulation itself never sees this class.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SimulationConfig {

    public String device = "gpu";
    public MicroscopeSection microscope = new MicroscopeSection();
    public ScanSection scan = new ScanSection();
    public SimulationSection simulation = new SimulationSection();
    public ClusterSection cluster = new ClusterSection();

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class MicroscopeSection {
        @JsonAlias({"beam_energy", "energy"})
        public double beamEnergy = 300.0;
        public DetectorSection detector = new DetectorSection();
        public Map<String, Double> lens = new HashMap<>();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class DetectorSection {
        public int nx = 1000;
        public int ny = 1000;
        @JsonAlias({"pixel_size"})
        public double pixelSize = 1.0;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ScanSection {
        public double[] axis = {1.0, 0.0, 0.0};
        @JsonAlias({"start_angle"})
        public double startAngle = 0.0;
        @JsonAlias({"step_angle"})
        public double stepAngle = 0.0;
        @JsonAlias({"num_images"})
        public int numImages = 1;
        // number, or "auto"
        @JsonAlias({"step_pos"})
        public String stepPos = "0";
        @JsonAlias({"exposure_time"})
        public double exposureTime = 1.0;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class SimulationSection {
        public int margin = 100;
        @JsonAlias({"slice_thickness"})
        public double sliceThickness = 3.0;
        @JsonAlias({"num_slices"})
        public Integer numSlices;
        public String kind = "exit_wave";
        @JsonAlias({"electrons_per_pixel"})
        public Double electronsPerPixel;
        @JsonAlias({"noise_seed"})
        public long noiseSeed = 0L;
        @JsonAlias({"derive_intensity_from_wave"})
        public boolean deriveIntensityFromWave = false;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ClusterSection {
        public String method;
        @JsonAlias({"max_workers"})
        public int maxWorkers = 1;
    }

    public Device toDevice() {
        return parseEnum(Device.class, device, "device");
    }

    public Microscope toMicroscope() {
        try {
            DetectorSection d = microscope.detector;
            return new Microscope(new Detector(d.nx, d.ny, d.pixelSize), microscope.beamEnergy, microscope.lens);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("microscope: " + e.getMessage(), e);
        }
    }

    /**
     * @param sampleRadius radius of the specimen, used when {@code step_pos} is {@code "auto"}
     */
    public Scan toScan(double sampleRadius) {
        if (scan.axis == null || scan.axis.length != 3) {
            throw new ConfigurationException("scan axis must have 3 components");
        }
        double stepPos;
        if ("auto".equalsIgnoreCase(scan.stepPos)) {
            stepPos = Scan.autoStepPosition(scan.stepAngle, sampleRadius);
        } else {
            try {
                stepPos = Double.parseDouble(scan.stepPos);
            } catch (NumberFormatException | NullPointerException e) {
                throw new ConfigurationException("scan step_pos must be a number or \"auto\": " + scan.stepPos, e);
            }
        }
        try {
            return Scan.singleAxis(new Vector3D(scan.axis), scan.startAngle, scan.stepAngle, scan.numImages,
                    stepPos, scan.exposureTime);
        } catch (IllegalArgumentException | MathArithmeticException e) {
            throw new ConfigurationException("scan: " + e.getMessage(), e);
        }
    }

    public SimulationParameters toParameters() {
        SimulationSection s = simulation;
        return new SimulationParameters(s.margin, s.sliceThickness, s.numSlices,
                parseEnum(SimulationKind.class, s.kind, "simulation kind"),
                s.electronsPerPixel, s.noiseSeed, s.deriveIntensityFromWave);
    }

    public ClusterParameters toClusterParameters() {
        ClusterParameters.Method method = cluster.method == null
                ? (cluster.maxWorkers > 1 ? ClusterParameters.Method.LOCAL : ClusterParameters.Method.SEQUENTIAL)
                : parseEnum(ClusterParameters.Method.class, cluster.method, "cluster method");
        return new ClusterParameters(method, cluster.maxWorkers);
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, String what) {
        if (value == null) {
            throw new ConfigurationException(what + " must be set");
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("unknown " + what + ": " + value, e);
        }
    }
}
