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

package org.esa.snap.orbitcorr.core.raster;

import java.util.List;

/**
 * Resamples rasters onto a target {@link GridContext}. Source and target must share the CRS.
 * NaN samples do not contribute, the weights of the remaining samples are renormalised.
 * Target pixels outside the source extent are NaN.
 */
public class Resampler {

    private static final double SNAP_EPS = 1.0e-9;
    private static final double MIN_WEIGHT_SUM = 1.0e-6;
    // Keys cubic convolution parameter, as used by GDAL
    private static final double CUBIC_A = -0.5;

    private Resampler() {
    }

    public static boolean overlaps(GridContext source, GridContext target) {
        return source.getBounds().intersects(target.getBounds()) &&
                source.getBounds().intersection(target.getBounds()).getArea() > 0.0;
    }

    public static FloatRaster resample(FloatRaster source, GridContext target, Resampling resampling) {
        if (source.getGrid().isSameGrid(target)) {
            return new FloatRaster(target, source.copy().getData());
        }
        final FloatRaster result = new FloatRaster(target);
        final GridContext sourceGrid = source.getGrid();
        for (int y = 0; y < target.getHeight(); y++) {
            final double py = snap(sourceGrid.toPixelY(target.pixelCenterY(y)));
            for (int x = 0; x < target.getWidth(); x++) {
                final double px = snap(sourceGrid.toPixelX(target.pixelCenterX(x)));
                if (px < 0.0 || py < 0.0 || px > sourceGrid.getWidth() || py > sourceGrid.getHeight()) {
                    continue;
                }
                result.set(x, y, (float) sample(source, px, py, resampling));
            }
        }
        return result;
    }

    /**
     * Mosaics tiles onto the target grid. Where tiles overlap, the first tile with a valid sample wins.
     */
    public static FloatRaster mosaic(List<FloatRaster> tiles, GridContext target, Resampling resampling) {
        final FloatRaster result = new FloatRaster(target);
        for (FloatRaster tile : tiles) {
            if (!overlaps(tile.getGrid(), target)) {
                continue;
            }
            final FloatRaster resampled = resample(tile, target, resampling);
            for (int i = 0; i < result.size(); i++) {
                if (!result.isValid(i) && resampled.isValid(i)) {
                    result.set(i, resampled.get(i));
                }
            }
        }
        return result;
    }

    static double sample(FloatRaster source, double px, double py, Resampling resampling) {
        switch (resampling) {
            case NEAREST:
                return nearest(source, px, py);
            case BILINEAR:
                return convolve(source, px, py, 1);
            case CUBIC:
                return convolve(source, px, py, 2);
            default:
                throw new IllegalArgumentException("Unsupported resampling: " + resampling);
        }
    }

    private static double nearest(FloatRaster source, double px, double py) {
        final int ix = Math.min((int) Math.floor(px), source.getWidth() - 1);
        final int iy = Math.min((int) Math.floor(py), source.getHeight() - 1);
        return source.get(ix, iy);
    }

    private static double convolve(FloatRaster source, double px, double py, int radius) {
        // pixel centre coordinates
        final double cx = px - 0.5;
        final double cy = py - 0.5;
        final int x0 = (int) Math.floor(cx);
        final int y0 = (int) Math.floor(cy);
        if (cx == x0 && cy == y0 && x0 >= 0 && y0 >= 0) {
            return source.get(x0, y0);
        }
        double sum = 0.0;
        double weightSum = 0.0;
        for (int j = y0 - radius + 1; j <= y0 + radius; j++) {
            if (j < 0 || j >= source.getHeight()) {
                continue;
            }
            final double wy = kernel(cy - j, radius);
            if (wy == 0.0) {
                continue;
            }
            for (int i = x0 - radius + 1; i <= x0 + radius; i++) {
                if (i < 0 || i >= source.getWidth()) {
                    continue;
                }
                final float v = source.get(i, j);
                if (Float.isNaN(v)) {
                    continue;
                }
                final double w = wy * kernel(cx - i, radius);
                sum += w * v;
                weightSum += w;
            }
        }
        if (Math.abs(weightSum) < MIN_WEIGHT_SUM) {
            return Double.NaN;
        }
        return sum / weightSum;
    }

    private static double kernel(double distance, int radius) {
        final double d = Math.abs(distance);
        if (radius == 1) {
            return d < 1.0 ? 1.0 - d : 0.0;
        }
        if (d < 1.0) {
            return (CUBIC_A + 2.0) * d * d * d - (CUBIC_A + 3.0) * d * d + 1.0;
        }
        if (d < 2.0) {
            return CUBIC_A * d * d * d - 5.0 * CUBIC_A * d * d + 8.0 * CUBIC_A * d - 4.0 * CUBIC_A;
        }
        return 0.0;
    }

    private static double snap(double coordinate) {
        final double rounded = Math.rint(coordinate * 2.0) / 2.0;
        return Math.abs(coordinate - rounded) < SNAP_EPS ? rounded : coordinate;
    }
}
