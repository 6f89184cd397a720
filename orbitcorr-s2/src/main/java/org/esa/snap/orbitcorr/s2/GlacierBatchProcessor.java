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

package org.esa.snap.orbitcorr.s2;

import org.apache.commons.lang3.StringUtils;
import org.esa.snap.orbitcorr.core.OrbitCorrConstants;
import org.esa.snap.orbitcorr.core.OrbitCorrException;
import org.esa.snap.orbitcorr.core.config.DateRange;
import org.esa.snap.orbitcorr.core.config.OrbitCorrConfig;
import org.esa.snap.orbitcorr.core.util.OrbitCorrUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.FileHandler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.SimpleFormatter;
import java.util.regex.Pattern;

/**
 * Processes many glaciers on a fixed-size worker pool. A failing glacier is logged and recorded in
 * {@code errored_glaciers.log}; the others continue. Date ranges spanning the DEM switch are processed
 * in two halves with separate work directories.
 */
public class GlacierBatchProcessor {

    static final String ERRORED_GLACIERS_LOG = "errored_glaciers.log";
    static final String PRE_DEM_SWITCH_SUFFIX = "_pre_dem_switch";
    static final String POST_DEM_SWITCH_SUFFIX = "_post_dem_switch";

    private static final Pattern GLACIER_DIR_PATTERN = Pattern.compile("^\\d{3}_.*");

    private final OrbitCorrConfig config;

    public GlacierBatchProcessor(OrbitCorrConfig config) {
        this.config = config;
    }

    public static void main(String[] args) {
        initLogging();
        final Path configFile = args.length > 0 && StringUtils.isNotBlank(args[0]) ? Paths.get(args[0]) : null;
        final OrbitCorrConfig config = OrbitCorrConfig.load(configFile);
        addFileHandler(config.getLogDir());

        final GlacierBatchProcessor processor = new GlacierBatchProcessor(config);
        final List<String> glaciers = args.length > 1 ? parseGlacierList(args[1])
                : findGlaciers(config.getImageDir());
        OrbitCorrUtils.info("Processing " + glaciers.size() + " glaciers: " + glaciers);
        final List<GlacierReport> reports = processor.run(glaciers);
        int failed = 0;
        for (GlacierReport report : reports) {
            if (report.isFailed()) {
                OrbitCorrUtils.logErrorMessage(report.getGlacier() + " [" + report.getRange() + "] failed: " +
                                                       report.getErrorMessage());
                failed++;
            }
        }
        OrbitCorrUtils.info("Done. " + (reports.size() - failed) + " succeeded, " + failed + " failed.");
        if (failed > 0) {
            System.exit(1);
        }
    }

    /**
     * Processes all glaciers, each for the configured range or both halves of it around the DEM switch.
     *
     * @return one report per glacier and range, in submission order
     */
    public List<GlacierReport> run(List<String> glaciers) {
        final List<OrbitCorrConfig> rangeConfigs = createRangeConfigs();
        final List<Callable<GlacierReport>> tasks = new ArrayList<>();
        for (String glacier : glaciers) {
            for (OrbitCorrConfig rangeConfig : rangeConfigs) {
                tasks.add(() -> processSafely(rangeConfig, glacier));
            }
        }
        if (tasks.isEmpty()) {
            return Collections.emptyList();
        }
        final ExecutorService executorService = Executors.newFixedThreadPool(Math.min(config.getBatchThreads(), tasks.size()));
        final List<GlacierReport> reports = new ArrayList<>();
        try {
            final List<Future<GlacierReport>> futures = new ArrayList<>();
            for (Callable<GlacierReport> task : tasks) {
                futures.add(executorService.submit(task));
            }
            for (Future<GlacierReport> future : futures) {
                reports.add(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OrbitCorrException("Interrupted while processing glaciers", e);
        } catch (ExecutionException e) {
            throw new OrbitCorrException("Error during glacier processing", e.getCause());
        } finally {
            executorService.shutdown();
        }
        return reports;
    }

    /**
     * @return one configuration per date range to process
     */
    List<OrbitCorrConfig> createRangeConfigs() {
        final DateRange range = config.getDateRange();
        if (!config.isSplitAroundDemSwitch()) {
            return Collections.singletonList(config);
        }
        final List<DateRange> halves = range.splitAround(config.getDemSwitchDate());
        if (halves.size() < 2) {
            return Collections.singletonList(config);
        }
        OrbitCorrUtils.info("Date range " + range + " spans the DEM switch on " +
                                    DateRange.format(config.getDemSwitchDate()) + ", processing " + halves.get(0) +
                                    " and " + halves.get(1) + " separately.");
        final Path workDir = config.getWorkDir();
        final List<OrbitCorrConfig> configs = new ArrayList<>();
        configs.add(config.withDateRange(halves.get(0), workDir.resolveSibling(workDir.getFileName() + PRE_DEM_SWITCH_SUFFIX)));
        configs.add(config.withDateRange(halves.get(1), workDir.resolveSibling(workDir.getFileName() + POST_DEM_SWITCH_SUFFIX)));
        return configs;
    }

    GlacierReport processSafely(OrbitCorrConfig rangeConfig, String glacier) {
        try {
            return createProcessor(rangeConfig).process(glacier);
        } catch (RuntimeException e) {
            final String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            OrbitCorrUtils.LOG.log(Level.SEVERE, "Processing of " + glacier + " [" + rangeConfig.getDateRange() +
                    "] failed: " + message, e);
            recordError(glacier, rangeConfig.getDateRange(), message);
            return GlacierReport.failed(glacier, rangeConfig.getDateRange(), message);
        }
    }

    GlacierProcessor createProcessor(OrbitCorrConfig rangeConfig) {
        return new GlacierProcessor(rangeConfig);
    }

    private synchronized void recordError(String glacier, DateRange range, String message) {
        final String line = "GLACIER: " + glacier + ", RANGE: " + DateRange.format(range.getStart()) + "-" +
                DateRange.format(range.getEnd()) + ", ERROR: " + message.replace('\n', ' ') + System.lineSeparator();
        try {
            final Path logDir = OrbitCorrUtils.ensureDirectory(config.getLogDir());
            Files.write(logDir.resolve(ERRORED_GLACIERS_LOG), line.getBytes(StandardCharsets.UTF_8),
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException | OrbitCorrException e) {
            OrbitCorrUtils.LOG.log(Level.WARNING, "Cannot record failure of " + glacier + " in " + ERRORED_GLACIERS_LOG, e);
        }
    }

    static List<String> parseGlacierList(String list) {
        final List<String> glaciers = new ArrayList<>();
        for (String glacier : StringUtils.split(list, ',')) {
            if (StringUtils.isNotBlank(glacier)) {
                glaciers.add(glacier.trim());
            }
        }
        return glaciers;
    }

    /**
     * @return sorted names of the {@code NNN_*} glacier directories holding clipped mosaics
     */
    static List<String> findGlaciers(Path imageDir) {
        final List<String> glaciers = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(imageDir)) {
            for (Path dir : stream) {
                final String name = dir.getFileName().toString();
                if (GLACIER_DIR_PATTERN.matcher(name).matches() && hasClippedImages(dir)) {
                    glaciers.add(name);
                } else if (Files.isDirectory(dir)) {
                    OrbitCorrUtils.LOG.fine("Excluding " + name + ": no clipped images");
                }
            }
        } catch (IOException e) {
            throw new OrbitCorrException("Cannot list glaciers in " + imageDir, e);
        }
        Collections.sort(glaciers);
        return glaciers;
    }

    private static boolean hasClippedImages(Path glacierDir) throws IOException {
        final Path clippedDir = glacierDir.resolve(OrbitCorrConstants.CLIPPED_DIR_NAME);
        if (!Files.isDirectory(clippedDir)) {
            return false;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(clippedDir, "*" + OrbitCorrConstants.TIF_EXTENSION)) {
            return stream.iterator().hasNext();
        }
    }

    private static void initLogging() {
        try (InputStream in = GlacierBatchProcessor.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            OrbitCorrUtils.LOG.log(Level.WARNING, "Cannot read logging configuration", e);
        }
    }

    private static void addFileHandler(Path logDir) {
        try {
            final FileHandler handler = new FileHandler(OrbitCorrUtils.ensureDirectory(logDir)
                                                                .resolve("orbitcorr.log").toString(), true);
            handler.setFormatter(new SimpleFormatter());
            OrbitCorrUtils.LOG.addHandler(handler);
        } catch (IOException e) {
            OrbitCorrUtils.LOG.log(Level.WARNING, "Cannot log to " + logDir, e);
        }
    }
}
