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

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.esa.snap.orbitcorr.core.OrbitCorrConstants;
import org.esa.snap.orbitcorr.core.OrbitCorrException;

import java.util.Arrays;
import java.util.List;

/**
 * NaN-aware per-pixel arithmetic and statistics on {@link FloatRaster}s.
 * NaN marks a missing value and never contributes to a statistic.
 */
public class RasterMath {

    private RasterMath() {
    }

    /**
     * Per-pixel median over a stack of rasters, ignoring NaN.
     * A pixel without any valid value in the stack is NaN.
     *
     * @param stack - rasters on one common grid
     * @return the median raster
     * @throws OrbitCorrException if the stack is empty or its rasters are not on the same grid
     */
    public static FloatRaster nanMedian(List<FloatRaster> stack) {
        if (stack.isEmpty()) {
            throw new OrbitCorrException("Cannot take the median of an empty raster stack.");
        }
        final GridContext grid = stack.get(0).getGrid();
        for (FloatRaster raster : stack) {
            grid.requireSameGrid(raster.getGrid());
        }
        final Median median = new Median();
        final FloatRaster result = new FloatRaster(grid);
        final double[] values = new double[stack.size()];
        for (int i = 0; i < result.size(); i++) {
            int n = 0;
            for (FloatRaster raster : stack) {
                final float v = raster.get(i);
                if (!Float.isNaN(v)) {
                    values[n++] = v;
                }
            }
            if (n > 0) {
                result.set(i, (float) median.evaluate(values, 0, n));
            }
        }
        return result;
    }

    /**
     * 3x3 median despeckle filter. The window is clipped at the raster border and NaN neighbours are ignored.
     * NaN pixels stay NaN.
     */
    public static FloatRaster medianFilter3x3(FloatRaster raster) {
        final int width = raster.getWidth();
        final int height = raster.getHeight();
        final FloatRaster result = new FloatRaster(raster.getGrid());
        final Median median = new Median();
        final double[] window = new double[9];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (Float.isNaN(raster.get(x, y))) {
                    continue;
                }
                int n = 0;
                for (int j = Math.max(0, y - 1); j <= Math.min(height - 1, y + 1); j++) {
                    for (int i = Math.max(0, x - 1); i <= Math.min(width - 1, x + 1); i++) {
                        final float v = raster.get(i, j);
                        if (!Float.isNaN(v)) {
                            window[n++] = v;
                        }
                    }
                }
                result.set(x, y, (float) median.evaluate(window, 0, n));
            }
        }
        return result;
    }

    public static FloatRaster subtract(FloatRaster a, FloatRaster b) {
        a.getGrid().requireSameGrid(b.getGrid());
        final FloatRaster result = new FloatRaster(a.getGrid());
        for (int i = 0; i < result.size(); i++) {
            result.set(i, a.get(i) - b.get(i));
        }
        return result;
    }

    public static FloatRaster multiply(FloatRaster raster, double factor) {
        final FloatRaster result = new FloatRaster(raster.getGrid());
        for (int i = 0; i < result.size(); i++) {
            result.set(i, (float) (raster.get(i) * factor));
        }
        return result;
    }

    public static FloatRaster magnitude(FloatRaster dx, FloatRaster dy) {
        dx.getGrid().requireSameGrid(dy.getGrid());
        final FloatRaster result = new FloatRaster(dx.getGrid());
        for (int i = 0; i < result.size(); i++) {
            final double x = dx.get(i);
            final double y = dy.get(i);
            result.set(i, (float) Math.sqrt(x * x + y * y));
        }
        return result;
    }

    /**
     * Sets pixels to NaN where the mask is 0 or NaN.
     */
    public static void applyValidityMask(FloatRaster raster, FloatRaster mask) {
        raster.getGrid().requireSameGrid(mask.getGrid());
        for (int i = 0; i < raster.size(); i++) {
            final float m = mask.get(i);
            if (Float.isNaN(m) || m == 0.0f) {
                raster.set(i, Float.NaN);
            }
        }
    }

    /**
     * Copy of the raster with every pixel outside the selection mask (mask != 1) set to NaN.
     */
    public static FloatRaster select(FloatRaster raster, FloatRaster selection) {
        raster.getGrid().requireSameGrid(selection.getGrid());
        final FloatRaster result = new FloatRaster(raster.getGrid());
        for (int i = 0; i < raster.size(); i++) {
            if (selection.get(i) == 1.0f) {
                result.set(i, raster.get(i));
            }
        }
        return result;
    }

    /**
     * @return the finite samples of the raster
     */
    public static double[] validValues(FloatRaster raster) {
        final double[] values = new double[raster.size()];
        int n = 0;
        for (int i = 0; i < raster.size(); i++) {
            final float v = raster.get(i);
            if (!Float.isNaN(v) && !Float.isInfinite(v)) {
                values[n++] = v;
            }
        }
        return Arrays.copyOf(values, n);
    }

    public static double nanMean(FloatRaster raster) {
        final double[] values = validValues(raster);
        return values.length == 0 ? Double.NaN : new Mean().evaluate(values);
    }

    /**
     * Population standard deviation of the valid samples.
     */
    public static double nanStd(FloatRaster raster) {
        final double[] values = validValues(raster);
        return values.length == 0 ? Double.NaN : new StandardDeviation(false).evaluate(values);
    }

    /**
     * Root mean square of the valid samples.
     */
    public static double nanRms(FloatRaster raster) {
        final double[] values = validValues(raster);
        if (values.length == 0) {
            return Double.NaN;
        }
        return Math.sqrt(StatUtils.sumSq(values) / values.length);
    }

    /**
     * Percentile of the valid samples, linearly interpolated between closest ranks.
     *
     * @param p - percentile in (0, 100]
     */
    public static double nanPercentile(FloatRaster raster, double p) {
        final double[] values = validValues(raster);
        if (values.length == 0) {
            return Double.NaN;
        }
        return new Percentile(p).withEstimationType(Percentile.EstimationType.R_7).evaluate(values);
    }

    public static FloatRaster withNoData(FloatRaster raster, double... noDataValues) {
        final FloatRaster result = raster.copy();
        for (int i = 0; i < result.size(); i++) {
            for (double noData : noDataValues) {
                if (result.get(i) == noData) {
                    result.set(i, Float.NaN);
                }
            }
        }
        return result;
    }

    public static FloatRaster withRawNoData(FloatRaster raster) {
        return withNoData(raster, OrbitCorrConstants.RAW_NO_DATA_VALUES);
    }
}
