package org.esa.snap.orbitcorr.s2.correction;

import org.esa.snap.orbitcorr.core.OrbitCorrConstants;
import org.esa.snap.orbitcorr.core.raster.FloatRaster;
import org.esa.snap.orbitcorr.core.raster.GeoTiffIO;
import org.esa.snap.orbitcorr.core.raster.GridContext;
import org.esa.snap.orbitcorr.core.raster.RasterMath;
import org.esa.snap.orbitcorr.core.raster.Resampler;
import org.esa.snap.orbitcorr.core.raster.Resampling;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The a priori velocity field of a glacier: per-pixel median of all repeat-track fields, with its flow direction.
 */
public class ReferenceField {

    private static final double PREVIEW_PERCENTILE = 95.0;
    private static final double PREVIEW_STEP = 10.0;

    private final FloatRaster dx;
    private final FloatRaster dy;
    private final FloatRaster dmag;
    private final FloatRaster flowDirection;

    public ReferenceField(FloatRaster dx, FloatRaster dy, FloatRaster dmag, FloatRaster flowDirection) {
        dx.getGrid().requireSameGrid(dy.getGrid());
        dx.getGrid().requireSameGrid(dmag.getGrid());
        dx.getGrid().requireSameGrid(flowDirection.getGrid());
        this.dx = dx;
        this.dy = dy;
        this.dmag = dmag;
        this.flowDirection = flowDirection;
    }

    /**
     * Reads the persisted reference files onto the working grid. Velocities treat 0 and -9999 as no-data.
     */
    static ReferenceField read(Path dir, String glacier, GridContext grid) throws IOException {
        return new ReferenceField(readComponent(dir, glacier, OrbitCorrConstants.DX, grid),
                                  readComponent(dir, glacier, OrbitCorrConstants.DY, grid),
                                  readComponent(dir, glacier, OrbitCorrConstants.DMAG, grid),
                                  Resampler.resample(GeoTiffIO.read(file(dir, glacier, OrbitCorrConstants.FLOW_DIRECTION),
                                                                    OrbitCorrConstants.NO_DATA_VALUE),
                                                     grid, Resampling.NEAREST));
    }

    private static FloatRaster readComponent(Path dir, String glacier, String component, GridContext grid) throws IOException {
        final FloatRaster raster = GeoTiffIO.read(file(dir, glacier, component), OrbitCorrConstants.RAW_NO_DATA_VALUES);
        return Resampler.resample(raster, grid, Resampling.NEAREST);
    }

    static Path file(Path dir, String glacier, String component) {
        return dir.resolve(glacier + "_median_orbitmatch_" + component + OrbitCorrConstants.TIF_EXTENSION);
    }

    public FloatRaster getDx() {
        return dx;
    }

    public FloatRaster getDy() {
        return dy;
    }

    public FloatRaster getDmag() {
        return dmag;
    }

    public FloatRaster getFlowDirection() {
        return flowDirection;
    }

    /**
     * @param component - {@code dx} or {@code dy}
     */
    public FloatRaster getComponent(String component) {
        if (OrbitCorrConstants.DX.equals(component)) {
            return dx;
        } else if (OrbitCorrConstants.DY.equals(component)) {
            return dy;
        }
        throw new IllegalArgumentException("No reference component " + component);
    }

    public GridContext getGrid() {
        return dx.getGrid();
    }

    /**
     * @return upper end of the preview colour scale: the 95th percentile of the magnitude rounded up to the next 10
     */
    public double getPreviewVmax() {
        final double p95 = RasterMath.nanPercentile(dmag, PREVIEW_PERCENTILE);
        if (Double.isNaN(p95) || p95 <= 0.0) {
            return PREVIEW_STEP;
        }
        return Math.ceil(p95 / PREVIEW_STEP) * PREVIEW_STEP;
    }
}
