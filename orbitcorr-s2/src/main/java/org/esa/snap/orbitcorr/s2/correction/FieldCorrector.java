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

package org.esa.snap.orbitcorr.s2.correction;

import org.esa.snap.orbitcorr.core.OrbitCorrConstants;
import org.esa.snap.orbitcorr.core.OrbitCorrException;
import org.esa.snap.orbitcorr.core.config.OrbitCorrConfig;
import org.esa.snap.orbitcorr.core.mask.MaskSet;
import org.esa.snap.orbitcorr.core.plot.RasterQuicklook;
import org.esa.snap.orbitcorr.core.raster.FloatRaster;
import org.esa.snap.orbitcorr.core.raster.GeoTiffIO;
import org.esa.snap.orbitcorr.core.raster.RasterMath;
import org.esa.snap.orbitcorr.core.util.FlowDirectionUtils;
import org.esa.snap.orbitcorr.core.util.OrbitCorrUtils;
import org.esa.snap.orbitcorr.s2.orbits.OrbitPair;
import org.esa.snap.orbitcorr.s2.orbits.VelocityFieldRecord;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Applies the orbit pair offset to raw velocity fields: {@code corrected = raw + offset / day separation}.
 * Ice pixels whose corrected flow direction deviates too far from the reference are dropped, and fields
 * with too little valid ice area are not written.
 */
public class FieldCorrector {

    private static final DateTimeFormatter OUTPUT_ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss");

    private final String glacier;
    private final Path velocitiesDir;
    private final Path previewsDir;
    private final VelocityFieldLoader loader;
    private final ReferenceField reference;
    private final OffsetTable offsets;
    private final MaskSet masks;
    private final OrbitCorrConfig config;
    private final double previewVmax;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public FieldCorrector(String glacier, Path velocitiesDir, Path previewsDir, VelocityFieldLoader loader,
                          ReferenceField reference, OffsetTable offsets, MaskSet masks, OrbitCorrConfig config) {
        loader.getGrid().requireSameGrid(reference.getGrid());
        loader.getGrid().requireSameGrid(masks.getGrid());
        this.glacier = glacier;
        this.velocitiesDir = velocitiesDir;
        this.previewsDir = previewsDir;
        this.loader = loader;
        this.reference = reference;
        this.offsets = offsets;
        this.masks = masks;
        this.config = config;
        this.previewVmax = reference.getPreviewVmax();
    }

    /**
     * Corrects all records, on {@code correction.threads} workers.
     *
     * @return one outcome per record, in record order
     */
    public List<CorrectionOutcome> correctAll(List<VelocityFieldRecord> records) {
        final int threads = Math.min(config.getCorrectionThreads(), Math.max(1, records.size()));
        final List<CorrectionOutcome> outcomes = new ArrayList<>();
        if (threads <= 1) {
            for (VelocityFieldRecord record : records) {
                outcomes.add(correct(record));
            }
            return outcomes;
        }
        final ExecutorService executorService = Executors.newFixedThreadPool(threads);
        try {
            final List<Future<CorrectionOutcome>> futures = new ArrayList<>();
            for (VelocityFieldRecord record : records) {
                final Callable<CorrectionOutcome> task = () -> correct(record);
                futures.add(executorService.submit(task));
            }
            for (Future<CorrectionOutcome> future : futures) {
                outcomes.add(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OrbitCorrException("Interrupted while correcting velocity fields of " + glacier, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof OrbitCorrException) {
                throw (OrbitCorrException) e.getCause();
            }
            throw new OrbitCorrException("Error during correction of velocity fields of " + glacier, e.getCause());
        } finally {
            executorService.shutdownNow();
        }
        return outcomes;
    }

    /**
     * Corrects one record. Unreadable sources and missing offsets are reported as skips;
     * failures writing the outputs throw.
     */
    public CorrectionOutcome correct(VelocityFieldRecord record) {
        final String outputId = getOutputId(glacier, record);
        final OrbitPair pair = record.getOrbitPair();
        final Path outputDir = velocitiesDir.resolve(outputId);
        final Path vvFile = outputFile(outputDir, outputId, "vv");
        if (!inFlight.add(outputId)) {
            OrbitCorrUtils.info("Skipping -- " + outputId + " is being corrected by another worker");
            return new CorrectionOutcome(record.getId(), outputId, pair, CorrectionOutcome.Status.ALREADY_CORRECTED,
                                         "in progress");
        }
        try {
            if (Files.exists(vvFile)) {
                OrbitCorrUtils.info("Skipping -- " + outputId + " already exists");
                return new CorrectionOutcome(record.getId(), outputId, pair, CorrectionOutcome.Status.ALREADY_CORRECTED, null);
            }
            return doCorrect(record, outputId, outputDir, vvFile);
        } catch (IOException e) {
            throw new OrbitCorrException("Cannot write corrected field " + outputId + ": " + e.getMessage(), e);
        } finally {
            inFlight.remove(outputId);
        }
    }

    private CorrectionOutcome doCorrect(VelocityFieldRecord record, String outputId, Path outputDir, Path vvFile)
            throws IOException {
        final OrbitPair pair = record.getOrbitPair();
        final OffsetField offset = offsets.get(pair);
        if (offset == null) {
            return skip(record, outputId, CorrectionOutcome.Status.SKIPPED_NO_OFFSET,
                        "no offset for orbit pair " + pair.getKey());
        }

        final FloatRaster dx;
        final FloatRaster dy;
        try {
            dx = loader.load(record, OrbitCorrConstants.DX, false);
            dy = loader.load(record, OrbitCorrConstants.DY, false);
        } catch (NoOverlapException e) {
            return skip(record, outputId, CorrectionOutcome.Status.SKIPPED_NO_OVERLAP, e.getMessage());
        } catch (IOException e) {
            return skip(record, outputId, CorrectionOutcome.Status.SKIPPED_UNREADABLE_SOURCE,
                        "unreadable source raster: " + e.getMessage());
        }

        final double daySeparation = record.getDaySeparation();
        final FloatRaster dxCorrected = applyOffset(dx, offset.getDx(), daySeparation);
        final FloatRaster dyCorrected = applyOffset(dy, offset.getDy(), daySeparation);

        final CorrectedFieldMetadata metadata = CorrectedFieldMetadata.create(
                outputId, glacier, record, dxCorrected, dyCorrected, masks.getRock(),
                config.getProjectMetadata(), config.getDatasetVersion());

        filterFlowDirection(dxCorrected, dyCorrected);

        final double coverage = computeIceCoverage(dxCorrected);
        if (coverage <= 0.0 || coverage < config.getMinIceCoverage()) {
            return skip(record, outputId, CorrectionOutcome.Status.SKIPPED_INSUFFICIENT_COVERAGE,
                        String.format("valid ice coverage %.4f below %.4f", coverage, config.getMinIceCoverage()));
        }
        metadata.setIceCoverage(coverage);

        for (int i = 0; i < dxCorrected.size(); i++) {
            if (Float.isNaN(dxCorrected.get(i))) {
                dyCorrected.set(i, Float.NaN);
            }
        }
        final FloatRaster magnitude = RasterMath.magnitude(dxCorrected, dyCorrected);

        OrbitCorrUtils.ensureDirectory(outputDir);
        final String version = config.getDatasetVersion();
        GeoTiffIO.writeFloat(dxCorrected, outputFile(outputDir, outputId, "vx"));
        GeoTiffIO.writeFloat(dyCorrected, outputFile(outputDir, outputId, "vy"));
        metadata.write(outputDir.resolve(outputId + "_v" + version + "_metadata.json"));

        final String previewName = outputId + "_vv_v" + version + "_preview.jpg";
        final Path preview = outputDir.resolve(previewName);
        new RasterQuicklook(0.0, previewVmax, "Velocity [m/d]").write(magnitude, outputId, preview);
        OrbitCorrUtils.ensureDirectory(previewsDir);
        Files.copy(preview, previewsDir.resolve(previewName), StandardCopyOption.REPLACE_EXISTING);

        // vv marks a complete output, so it is written last
        GeoTiffIO.writeFloat(magnitude, vvFile);

        OrbitCorrUtils.info("Corrected " + record.getId() + " -> " + outputId);
        return new CorrectionOutcome(record.getId(), outputId, pair, CorrectionOutcome.Status.CORRECTED, null);
    }

    static FloatRaster applyOffset(FloatRaster raw, FloatRaster offset, double daySeparation) {
        raw.getGrid().requireSameGrid(offset.getGrid());
        final FloatRaster corrected = new FloatRaster(raw.getGrid());
        for (int i = 0; i < raw.size(); i++) {
            corrected.set(i, (float) (raw.get(i) + offset.get(i) / daySeparation));
        }
        return corrected;
    }

    /**
     * Sets dx to NaN over ice where the corrected flow direction deviates more than the configured maximum
     * from the reference flow direction.
     */
    void filterFlowDirection(FloatRaster dx, FloatRaster dy) {
        final FloatRaster referenceDirection = reference.getFlowDirection();
        final double maxDeviation = config.getMaxFlowDirectionDeviation();
        for (int i = 0; i < dx.size(); i++) {
            if (!masks.isIce(i)) {
                continue;
            }
            final double direction = FlowDirectionUtils.computeFlowDirection(dx.get(i), dy.get(i));
            final double difference = FlowDirectionUtils.computeAngularDifference(referenceDirection.get(i), direction);
            if (difference > maxDeviation) {
                dx.set(i, Float.NaN);
            }
        }
    }

    /**
     * @return share of ice pixels with a valid dx, 0 if there is no ice
     */
    double computeIceCoverage(FloatRaster dx) {
        final int icePixels = masks.countIce();
        if (icePixels == 0) {
            return 0.0;
        }
        int valid = 0;
        for (int i = 0; i < dx.size(); i++) {
            if (masks.isIce(i) && dx.isValid(i)) {
                valid++;
            }
        }
        return (double) valid / icePixels;
    }

    public static String getOutputId(String glacier, VelocityFieldRecord record) {
        return "S2_" + glacier + "_" + OUTPUT_ID_FORMAT.format(record.getDateTime1()) + "_" +
                OUTPUT_ID_FORMAT.format(record.getDateTime2());
    }

    private Path outputFile(Path outputDir, String outputId, String component) {
        return outputDir.resolve(outputId + "_" + component + "_v" + config.getDatasetVersion() + OrbitCorrConstants.TIF_EXTENSION);
    }

    private CorrectionOutcome skip(VelocityFieldRecord record, String outputId, CorrectionOutcome.Status status,
                                   String reason) {
        final CorrectionOutcome outcome = new CorrectionOutcome(record.getId(), outputId, record.getOrbitPair(), status, reason);
        OrbitCorrUtils.info("Skipping " + outcome);
        return outcome;
    }
}
