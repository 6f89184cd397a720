package org.esa.snap.orbitcorr.s2.correction;

import org.esa.snap.orbitcorr.core.OrbitCorrConstants;
import org.esa.snap.orbitcorr.core.raster.FloatRaster;
import org.esa.snap.orbitcorr.core.raster.GeoTiffIO;
import org.esa.snap.orbitcorr.core.raster.GridContext;
import org.esa.snap.orbitcorr.core.raster.RasterMath;
import org.esa.snap.orbitcorr.core.raster.Resampler;
import org.esa.snap.orbitcorr.core.raster.Resampling;
import org.esa.snap.orbitcorr.s2.orbits.VelocityFieldRecord;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Loads raw velocity components of a record onto the working grid.
 * Values 0 and -9999 are no-data; components are resampled by cubic convolution,
 * the optional {@code <prefix>_mask.tif} by nearest neighbour, where mask value 0 invalidates a pixel.
 */
public class VelocityFieldLoader {

    private final GridContext grid;

    public VelocityFieldLoader(GridContext grid) {
        this.grid = grid;
    }

    public GridContext getGrid() {
        return grid;
    }

    /**
     * Loads one component of a velocity field.
     *
     * @param record    - the velocity field
     * @param component - {@code dx}, {@code dy} or {@code dmag}
     * @param despeckle - whether to apply the 3x3 median filter
     * @return the component on the working grid, invalid pixels NaN
     * @throws NoOverlapException if the raster does not overlap the working grid
     * @throws IOException        if the raster is missing or unreadable
     */
    public FloatRaster load(VelocityFieldRecord record, String component, boolean despeckle) throws IOException {
        final Path file = findComponentFile(record.getSourceDir(), component);
        final FloatRaster raw = readRaster(file, OrbitCorrConstants.RAW_NO_DATA_VALUES);
        if (!Resampler.overlaps(raw.getGrid(), grid)) {
            throw new NoOverlapException(file.getFileName() + " does not overlap the area of interest");
        }
        final FloatRaster resampled = Resampler.resample(raw, grid, Resampling.CUBIC);
        final Path maskFile = findMaskFile(file);
        if (Files.exists(maskFile)) {
            final FloatRaster mask = Resampler.resample(readRaster(maskFile), grid, Resampling.NEAREST);
            RasterMath.applyValidityMask(resampled, mask);
        }
        return despeckle ? RasterMath.medianFilter3x3(resampled) : resampled;
    }

    /**
     * Reads a raster from disk. Hook for tests counting the rasters read.
     */
    protected FloatRaster readRaster(Path file, double... noDataValues) throws IOException {
        return GeoTiffIO.read(file, noDataValues);
    }

    /**
     * @return the first file, in name order, ending with {@code <component>.tif}
     */
    static Path findComponentFile(Path sourceDir, String component) throws IOException {
        final List<Path> candidates = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(sourceDir, "*" + component + OrbitCorrConstants.TIF_EXTENSION)) {
            for (Path file : stream) {
                candidates.add(file);
            }
        }
        if (candidates.isEmpty()) {
            throw new NoSuchFileException(sourceDir.resolve("*" + component + OrbitCorrConstants.TIF_EXTENSION).toString());
        }
        Collections.sort(candidates);
        return candidates.get(0);
    }

    /**
     * @return {@code <prefix>_mask.tif}, prefix being the component file name up to its last underscore
     */
    static Path findMaskFile(Path componentFile) {
        final String name = componentFile.getFileName().toString();
        final int index = name.lastIndexOf('_');
        final String prefix = index < 0 ? name.substring(0, name.length() - OrbitCorrConstants.TIF_EXTENSION.length())
                : name.substring(0, index);
        return componentFile.resolveSibling(prefix + OrbitCorrConstants.VELOCITY_MASK_SUFFIX);
    }
}
