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

package org.esa.snap.orbitcorr.core.mask;

import org.esa.snap.orbitcorr.core.OrbitCorrConstants;
import org.esa.snap.orbitcorr.core.OrbitCorrException;
import org.esa.snap.orbitcorr.core.raster.FloatRaster;
import org.esa.snap.orbitcorr.core.raster.GeoTiffIO;
import org.esa.snap.orbitcorr.core.raster.GridContext;
import org.esa.snap.orbitcorr.core.raster.Resampler;
import org.esa.snap.orbitcorr.core.raster.Resampling;
import org.esa.snap.orbitcorr.core.util.OrbitCorrUtils;
import org.locationtech.jts.geom.Envelope;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.regex.Matcher;

/**
 * Builds the rock, ice and ocean masks of one glacier from the tiled GIMP ice and ocean masks.
 * Tiles are named {@code GimpIceMask_15m_tile<row>_<col>.tif} and {@code GimpOceanMask_15m_tile<row>_<col>.tif}.
 * The masks are persisted once per glacier at tile resolution and resampled onto the working grid when loaded.
 */
public class AoiMaskBuilder {

    private final Path tileDir;

    public AoiMaskBuilder(Path tileDir) {
        this.tileDir = tileDir;
    }

    /**
     * Provides the masks of a glacier on its working grid, building and persisting them first if needed.
     *
     * @param aoiBounds   - bounds the persisted masks are cropped to
     * @param workingGrid - grid the returned masks are aligned to
     * @param outputDir   - directory holding the persisted masks
     * @return masks on the working grid
     * @throws OrbitCorrException if no tile intersects the working grid or a mask cannot be read or written
     */
    public MaskSet provideMasks(Envelope aoiBounds, GridContext workingGrid, Path outputDir) {
        final Path rockFile = outputDir.resolve(OrbitCorrConstants.ROCK_MASK_FILE_NAME);
        final Path iceFile = outputDir.resolve(OrbitCorrConstants.ICE_MASK_FILE_NAME);
        final Path oceanFile = outputDir.resolve(OrbitCorrConstants.OCEAN_MASK_FILE_NAME);
        try {
            if (Files.exists(rockFile) && Files.exists(iceFile) && Files.exists(oceanFile)) {
                OrbitCorrUtils.LOG.fine("Masks already exist in " + outputDir);
            } else {
                final MaskSet masks = buildMasks(aoiBounds, workingGrid);
                OrbitCorrUtils.ensureDirectory(outputDir);
                GeoTiffIO.writeByte(masks.getRock(), rockFile);
                GeoTiffIO.writeByte(masks.getIce(), iceFile);
                GeoTiffIO.writeByte(masks.getOcean(), oceanFile);
                OrbitCorrUtils.info("Wrote rock, ice and ocean masks to " + outputDir);
            }
            return new MaskSet(GeoTiffIO.read(rockFile), GeoTiffIO.read(iceFile), GeoTiffIO.read(oceanFile))
                    .onGrid(workingGrid);
        } catch (IOException e) {
            throw new OrbitCorrException("Cannot provide masks in " + outputDir + ": " + e.getMessage(), e);
        }
    }

    /**
     * Mosaics the intersecting tiles and crops them to the AOI bounds at tile resolution.
     */
    MaskSet buildMasks(Envelope aoiBounds, GridContext workingGrid) throws IOException {
        final List<FloatRaster> iceTiles = readIntersectingTiles(OrbitCorrConstants.ICE_MASK_TILE_PREFIX, workingGrid);
        final List<FloatRaster> oceanTiles = readIntersectingTiles(OrbitCorrConstants.OCEAN_MASK_TILE_PREFIX, workingGrid);
        if (iceTiles.isEmpty() || oceanTiles.isEmpty()) {
            throw new OrbitCorrException("No ice and ocean mask tiles in " + tileDir +
                                                 " intersect the area " + workingGrid.getBounds());
        }
        final GridContext tileGrid = iceTiles.get(0).getGrid();
        final GridContext maskGrid = GridContext.fromBounds(aoiBounds, tileGrid.getPixelSizeX(), workingGrid.getEpsg());
        final FloatRaster ice = Resampler.mosaic(iceTiles, maskGrid, Resampling.NEAREST);
        final FloatRaster ocean = Resampler.mosaic(oceanTiles, maskGrid, Resampling.NEAREST);
        return MaskSet.fromIceAndOcean(ice, ocean);
    }

    List<FloatRaster> readIntersectingTiles(String prefix, GridContext workingGrid) throws IOException {
        final Map<String, Path> tiles = new TreeMap<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(tileDir, prefix + "*" + OrbitCorrConstants.TIF_EXTENSION)) {
            for (Path tile : stream) {
                final Matcher matcher = OrbitCorrConstants.MASK_TILE_CODE_PATTERN.matcher(tile.getFileName().toString());
                if (matcher.find()) {
                    tiles.put(matcher.group(1), tile);
                }
            }
        }
        final List<FloatRaster> intersecting = new ArrayList<>();
        for (Map.Entry<String, Path> entry : tiles.entrySet()) {
            final GridContext tileGrid = GeoTiffIO.readGrid(entry.getValue());
            if (tileGrid.intersects(workingGrid)) {
                OrbitCorrUtils.LOG.log(Level.FINE, "Using mask tile " + entry.getKey() + ": " + entry.getValue());
                intersecting.add(GeoTiffIO.read(entry.getValue()));
            }
        }
        return intersecting;
    }
}
