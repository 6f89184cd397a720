/*
 * Copyright (c) 2026.  Brockmann Consult GmbH (info@brockmann-consult.de)
 *
 * This program is free software; you can redistribute it and/or modify it
 * under the terms of the GNU General Public License as published by the Free
 * Software Foundation; either version 3 of the License, or (at your option)
 * any later version.
 * This program is distributed in the hope that it will be useful, but WITHOUT
 * ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or
 * FITNESS FOR A PARTICULAR PURPOSE. See the GNU General Public License for
 * more details.
 *
 * You should have received a copy of the GNU General Public License along
 * with this program; if not, see http://www.gnu.org/licenses/
 *
 */

package org.esa.snap.orbitcorr.core.config;

import org.esa.snap.orbitcorr.core.OrbitCorrException;
import org.esa.snap.orbitcorr.core.util.OrbitCorrUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.util.Collections;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;

/**
 * Configuration of the orbital bias correction.
 * Defaults come from {@code orbitcorr.properties} on the classpath, overlaid by an optional user file
 * and by system properties with the same keys. Instances are immutable.
 */
public final class OrbitCorrConfig {

    public static final String DEFAULTS_RESOURCE = "orbitcorr.properties";
    public static final String PROJECT_METADATA_PREFIX = "metadata.project.";

    public static final String VELOCITY_DIR = "velocity.dir";
    public static final String VELOCITY_SUBDIR = "velocity.subdir";
    public static final String IMAGE_DIR = "image.dir";
    public static final String MASK_DIR = "mask.dir";
    public static final String AOI_FILE = "aoi.file";
    public static final String AOI_REGION_PROPERTY = "aoi.regionProperty";
    public static final String WORK_DIR = "work.dir";
    public static final String OUTPUT_NAME = "output.name";
    public static final String LOG_DIR = "log.dir";
    public static final String DATASET_VERSION = "dataset.version";
    public static final String START_DATE = "start.date";
    public static final String END_DATE = "end.date";
    public static final String MIN_PAIR_COUNT = "offset.minPairCount";
    public static final String MAX_FLOW_DIRECTION_DEVIATION = "filter.maxFlowDirectionDeviation";
    public static final String MIN_ICE_COVERAGE = "filter.minIceCoverage";
    public static final String DESPECKLE = "filter.despeckle";
    public static final String GRID_EPSG = "grid.epsg";
    public static final String DEM_SWITCH_DATE = "dem.switchDate";
    public static final String SPLIT_AROUND_DEM_SWITCH = "dem.splitAroundSwitch";
    public static final String BATCH_THREADS = "batch.threads";
    public static final String CORRECTION_THREADS = "correction.threads";
    public static final String REFERENCE_VMAX = "plot.referenceVmax";
    public static final String OFFSET_VMAX = "plot.offsetVmax";

    private final Properties properties;

    private final Path velocityDir;
    private final String velocitySubdir;
    private final Path imageDir;
    private final Path maskDir;
    private final Path aoiFile;
    private final String regionProperty;
    private final Path workDir;
    private final String outputName;
    private final Path logDir;
    private final String datasetVersion;
    private final DateRange dateRange;
    private final int minPairCount;
    private final double maxFlowDirectionDeviation;
    private final double minIceCoverage;
    private final boolean despeckle;
    private final int epsg;
    private final LocalDate demSwitchDate;
    private final boolean splitAroundDemSwitch;
    private final int batchThreads;
    private final int correctionThreads;
    private final double referenceVmax;
    private final double offsetVmax;
    private final Map<String, String> projectMetadata;

    private OrbitCorrConfig(Properties properties) {
        this.properties = properties;
        velocityDir = getPath(VELOCITY_DIR);
        velocitySubdir = getString(VELOCITY_SUBDIR);
        imageDir = getPath(IMAGE_DIR);
        maskDir = getPath(MASK_DIR);
        aoiFile = getPath(AOI_FILE);
        regionProperty = getString(AOI_REGION_PROPERTY);
        workDir = getPath(WORK_DIR);
        outputName = getString(OUTPUT_NAME);
        final String logDirValue = properties.getProperty(LOG_DIR, "").trim();
        logDir = logDirValue.isEmpty() ? workDir.resolve("logs") : Paths.get(logDirValue);
        datasetVersion = getString(DATASET_VERSION);
        dateRange = DateRange.parse(getString(START_DATE), getString(END_DATE));
        minPairCount = getInt(MIN_PAIR_COUNT);
        if (minPairCount < 1) {
            throw new OrbitCorrException(MIN_PAIR_COUNT + " must be at least 1, got " + minPairCount);
        }
        maxFlowDirectionDeviation = getDouble(MAX_FLOW_DIRECTION_DEVIATION);
        if (maxFlowDirectionDeviation < 0.0 || maxFlowDirectionDeviation > 180.0) {
            throw new OrbitCorrException(MAX_FLOW_DIRECTION_DEVIATION + " must be within [0, 180], got " +
                                                 maxFlowDirectionDeviation);
        }
        minIceCoverage = getDouble(MIN_ICE_COVERAGE);
        if (minIceCoverage < 0.0 || minIceCoverage > 1.0) {
            throw new OrbitCorrException(MIN_ICE_COVERAGE + " must be within [0, 1], got " + minIceCoverage);
        }
        despeckle = getBoolean(DESPECKLE);
        epsg = getInt(GRID_EPSG);
        demSwitchDate = DateRange.parseDay(getString(DEM_SWITCH_DATE));
        splitAroundDemSwitch = getBoolean(SPLIT_AROUND_DEM_SWITCH);
        final String batchThreadsValue = properties.getProperty(BATCH_THREADS, "").trim();
        batchThreads = batchThreadsValue.isEmpty() ? Runtime.getRuntime().availableProcessors() : getInt(BATCH_THREADS);
        correctionThreads = getInt(CORRECTION_THREADS);
        if (batchThreads < 1 || correctionThreads < 1) {
            throw new OrbitCorrException("Thread counts must be at least 1.");
        }
        referenceVmax = getDouble(REFERENCE_VMAX);
        offsetVmax = getDouble(OFFSET_VMAX);

        final Map<String, String> project = new TreeMap<>();
        for (String key : properties.stringPropertyNames()) {
            if (key.startsWith(PROJECT_METADATA_PREFIX)) {
                project.put(key.substring(PROJECT_METADATA_PREFIX.length()), properties.getProperty(key).trim());
            }
        }
        projectMetadata = Collections.unmodifiableMap(project);
    }

    /**
     * Loads the configuration: classpath defaults, then the user file (may be null), then system properties.
     */
    public static OrbitCorrConfig load(Path userFile) {
        final Properties properties = loadDefaults();
        if (userFile != null) {
            try (Reader r = Files.newBufferedReader(userFile, StandardCharsets.UTF_8)) {
                properties.load(r);
            } catch (IOException e) {
                throw new OrbitCorrException("Cannot read configuration file " + userFile, e);
            }
        }
        final Properties system = System.getProperties();
        for (String key : system.stringPropertyNames()) {
            if (properties.containsKey(key) || key.startsWith(PROJECT_METADATA_PREFIX)) {
                properties.setProperty(key, system.getProperty(key));
            }
        }
        OrbitCorrUtils.LOG.fine("Loaded configuration" + (userFile != null ? " from " + userFile : ""));
        return new OrbitCorrConfig(properties);
    }

    /**
     * Builds a configuration from the classpath defaults overlaid by the given properties only.
     */
    public static OrbitCorrConfig fromProperties(Properties overrides) {
        final Properties properties = loadDefaults();
        for (String key : overrides.stringPropertyNames()) {
            properties.setProperty(key, overrides.getProperty(key));
        }
        return new OrbitCorrConfig(properties);
    }

    /**
     * @return a copy for another date range, writing below the given work directory
     */
    public OrbitCorrConfig withDateRange(DateRange range, Path otherWorkDir) {
        final Properties copy = new Properties();
        copy.putAll(properties);
        copy.setProperty(START_DATE, DateRange.format(range.getStart()));
        copy.setProperty(END_DATE, DateRange.format(range.getEnd()));
        copy.setProperty(WORK_DIR, otherWorkDir.toString());
        copy.setProperty(LOG_DIR, logDir.toString());
        return new OrbitCorrConfig(copy);
    }

    private static Properties loadDefaults() {
        final Properties properties = new Properties();
        try (InputStream in = OrbitCorrConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new OrbitCorrException("Missing default configuration " + DEFAULTS_RESOURCE);
            }
            properties.load(in);
        } catch (IOException e) {
            throw new OrbitCorrException("Cannot read default configuration " + DEFAULTS_RESOURCE, e);
        }
        return properties;
    }

    private String getString(String key) {
        final String value = properties.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            throw new OrbitCorrException("Missing configuration value '" + key + "'");
        }
        return value.trim();
    }

    private Path getPath(String key) {
        return Paths.get(getString(key));
    }

    private int getInt(String key) {
        final String value = getString(key);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new OrbitCorrException("Configuration value '" + key + "' is not an integer: " + value, e);
        }
    }

    private double getDouble(String key) {
        final String value = getString(key);
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new OrbitCorrException("Configuration value '" + key + "' is not a number: " + value, e);
        }
    }

    private boolean getBoolean(String key) {
        final String value = getString(key);
        if (!"true".equalsIgnoreCase(value) && !"false".equalsIgnoreCase(value)) {
            throw new OrbitCorrException("Configuration value '" + key + "' is not a boolean: " + value);
        }
        return Boolean.parseBoolean(value);
    }

    public Path getVelocityDir() {
        return velocityDir;
    }

    public String getVelocitySubdir() {
        return velocitySubdir;
    }

    public Path getImageDir() {
        return imageDir;
    }

    public Path getMaskDir() {
        return maskDir;
    }

    public Path getAoiFile() {
        return aoiFile;
    }

    public String getRegionProperty() {
        return regionProperty;
    }

    public Path getWorkDir() {
        return workDir;
    }

    public String getOutputName() {
        return outputName;
    }

    public Path getLogDir() {
        return logDir;
    }

    public String getDatasetVersion() {
        return datasetVersion;
    }

    public DateRange getDateRange() {
        return dateRange;
    }

    public int getMinPairCount() {
        return minPairCount;
    }

    public double getMaxFlowDirectionDeviation() {
        return maxFlowDirectionDeviation;
    }

    public double getMinIceCoverage() {
        return minIceCoverage;
    }

    public boolean isDespeckle() {
        return despeckle;
    }

    public int getEpsg() {
        return epsg;
    }

    public LocalDate getDemSwitchDate() {
        return demSwitchDate;
    }

    public boolean isSplitAroundDemSwitch() {
        return splitAroundDemSwitch;
    }

    public int getBatchThreads() {
        return batchThreads;
    }

    public int getCorrectionThreads() {
        return correctionThreads;
    }

    public double getReferenceVmax() {
        return referenceVmax;
    }

    public double getOffsetVmax() {
        return offsetVmax;
    }

    /**
     * @return the {@code metadata.project.*} entries without prefix, sorted by key
     */
    public Map<String, String> getProjectMetadata() {
        return projectMetadata;
    }
}
