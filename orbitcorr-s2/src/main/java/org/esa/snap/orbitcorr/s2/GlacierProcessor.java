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

import org.esa.snap.orbitcorr.core.OrbitCorrConstants;
import org.esa.snap.orbitcorr.core.OrbitCorrException;
import org.esa.snap.orbitcorr.core.aoi.AoiReader;
import org.esa.snap.orbitcorr.core.config.OrbitCorrConfig;
import org.esa.snap.orbitcorr.core.mask.AoiMaskBuilder;
import org.esa.snap.orbitcorr.core.mask.MaskSet;
import org.esa.snap.orbitcorr.core.raster.GeoTiffIO;
import org.esa.snap.orbitcorr.core.raster.GridContext;
import org.esa.snap.orbitcorr.core.util.OrbitCorrUtils;
import org.esa.snap.orbitcorr.s2.correction.CorrectionOutcome;
import org.esa.snap.orbitcorr.s2.correction.FieldCorrector;
import org.esa.snap.orbitcorr.s2.correction.OffsetTable;
import org.esa.snap.orbitcorr.s2.correction.OffsetTableBuilder;
import org.esa.snap.orbitcorr.s2.correction.ReferenceField;
import org.esa.snap.orbitcorr.s2.correction.ReferenceFieldBuilder;
import org.esa.snap.orbitcorr.s2.correction.VelocityFieldLoader;
import org.esa.snap.orbitcorr.s2.orbits.OrbitCatalog;
import org.esa.snap.orbitcorr.s2.orbits.PairTable;
import org.locationtech.jts.geom.Envelope;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Runs the orbital bias correction chain for one glacier:
 * orbit catalog, pair table, masks, reference field, offsets and corrected fields.
 */
public class GlacierProcessor {

    private final OrbitCorrConfig config;

    public GlacierProcessor(OrbitCorrConfig config) {
        this.config = config;
    }

    /**
     * @throws OrbitCorrException on any condition that is fatal for the glacier
     */
    public GlacierReport process(String glacier) {
        OrbitCorrUtils.info("Processing " + glacier + " [" + config.getDateRange() + "]");
        final GlacierWorkspace workspace = new GlacierWorkspace(config, glacier);

        final Envelope aoiBounds = new AoiReader(config.getRegionProperty())
                .readAoi(config.getAoiFile(), glacier).getEnvelopeInternal();
        final GridContext grid = deriveGrid(workspace, aoiBounds);
        workspace.createDirectories();

        final OrbitCatalog catalog = OrbitCatalog.fromDirectory(workspace.getClippedDir(), config.getDateRange());
        final PairTable pairTable = PairTable.fromManifests(workspace.getVelocityDir(), catalog, config.getDateRange());
        try {
            catalog.writeCsv(workspace.getOrbitsDir().resolve(glacier + "_orbits.csv"));
            pairTable.writeCsv(workspace.getOrbitsDir().resolve(glacier + "_orbit_pairs.csv"));
            pairTable.writeBarChart(workspace.getOrbitsDir().resolve(glacier + "_orbit_pairs.png"));
        } catch (IOException e) {
            throw new OrbitCorrException("Cannot write orbit tables of " + glacier + ": " + e.getMessage(), e);
        }
        OrbitCorrUtils.info(glacier + ": " + catalog.size() + " scenes, " + pairTable.size() + " velocity fields");

        final MaskSet masks = new AoiMaskBuilder(config.getMaskDir())
                .provideMasks(aoiBounds, grid, workspace.getMasksDir());

        final VelocityFieldLoader loader = new VelocityFieldLoader(grid);
        final ReferenceField reference = new ReferenceFieldBuilder(glacier, workspace.getOrbitsDir(), loader,
                                                                   config.isDespeckle(), config.getReferenceVmax())
                .build(pairTable);
        final OffsetTable offsets = new OffsetTableBuilder(glacier, workspace.getOrbitsDir(), loader,
                                                           config.getMinPairCount(), config.isDespeckle(),
                                                           config.getOffsetVmax())
                .build(pairTable);

        final FieldCorrector corrector = new FieldCorrector(glacier, workspace.getVelocitiesDir(),
                                                            workspace.getPreviewsDir(), loader, reference,
                                                            offsets, masks, config);
        final List<CorrectionOutcome> outcomes = corrector.correctAll(pairTable.getRecords());
        final GlacierReport report = GlacierReport.succeeded(glacier, config.getDateRange(),
                                                             offsets.getOutcomes(), outcomes);
        OrbitCorrUtils.info("Finished " + report);
        return report;
    }

    /**
     * Working grid: AOI bounds at the pixel size of an example raw velocity magnitude raster.
     * Velocity and clipped image rasters must have square pixels.
     */
    GridContext deriveGrid(GlacierWorkspace workspace, Envelope aoiBounds) {
        try {
            final Path velocityExample = findExample(workspace.getVelocityDir(), OrbitCorrConstants.RAW_FIELD_DIR_PREFIX + "*",
                                                     "*" + OrbitCorrConstants.DMAG + OrbitCorrConstants.TIF_EXTENSION);
            final double pixelSize = GeoTiffIO.readGrid(velocityExample).requireSquarePixels("velocity field " + velocityExample);
            final Path imageExample = findFile(workspace.getClippedDir(), "*" + OrbitCorrConstants.TIF_EXTENSION);
            GeoTiffIO.readGrid(imageExample).requireSquarePixels("clipped image " + imageExample);
            return GridContext.fromBounds(aoiBounds, pixelSize, config.getEpsg());
        } catch (IOException e) {
            throw new OrbitCorrException("Cannot derive working grid of " + workspace.getGlacier() + ": " + e.getMessage(), e);
        }
    }

    private static Path findExample(Path dir, String subDirGlob, String fileGlob) throws IOException {
        final List<Path> subDirs = list(dir, subDirGlob);
        for (Path subDir : subDirs) {
            if (Files.isDirectory(subDir)) {
                final List<Path> files = list(subDir, fileGlob);
                if (!files.isEmpty()) {
                    return files.get(0);
                }
            }
        }
        throw new OrbitCorrException("No " + fileGlob + " in " + dir.resolve(subDirGlob));
    }

    private static Path findFile(Path dir, String glob) throws IOException {
        final List<Path> files = list(dir, glob);
        if (files.isEmpty()) {
            throw new OrbitCorrException("No " + glob + " in " + dir);
        }
        return files.get(0);
    }

    private static List<Path> list(Path dir, String glob) throws IOException {
        final List<Path> paths = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return paths;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, glob)) {
            for (Path path : stream) {
                paths.add(path);
            }
        }
        Collections.sort(paths);
        return paths;
    }
}
