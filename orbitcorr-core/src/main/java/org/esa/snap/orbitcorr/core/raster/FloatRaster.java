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

import java.util.Arrays;

/**
 * Single band float raster on a {@link GridContext}. Missing values are NaN.
 */
public class FloatRaster {

    private final GridContext grid;
    private final float[] data;

    public FloatRaster(GridContext grid) {
        this(grid, newFilled(grid.getPixelCount(), Float.NaN));
    }

    public FloatRaster(GridContext grid, float[] data) {
        if (data.length != grid.getPixelCount()) {
            throw new IllegalArgumentException("Data length " + data.length + " does not match grid size " +
                                                       grid.getWidth() + "x" + grid.getHeight());
        }
        this.grid = grid;
        this.data = data;
    }

    public static FloatRaster filled(GridContext grid, float value) {
        return new FloatRaster(grid, newFilled(grid.getPixelCount(), value));
    }

    public GridContext getGrid() {
        return grid;
    }

    public int getWidth() {
        return grid.getWidth();
    }

    public int getHeight() {
        return grid.getHeight();
    }

    public int size() {
        return data.length;
    }

    public float get(int index) {
        return data[index];
    }

    public float get(int x, int y) {
        return data[y * grid.getWidth() + x];
    }

    public void set(int index, float value) {
        data[index] = value;
    }

    public void set(int x, int y, float value) {
        data[y * grid.getWidth() + x] = value;
    }

    public boolean isValid(int index) {
        return !Float.isNaN(data[index]);
    }

    public int countValid() {
        int count = 0;
        for (float v : data) {
            if (!Float.isNaN(v)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Backing array, row major.
     */
    float[] getData() {
        return data;
    }

    public FloatRaster copy() {
        return new FloatRaster(grid, Arrays.copyOf(data, data.length));
    }

    private static float[] newFilled(int size, float value) {
        final float[] data = new float[size];
        Arrays.fill(data, value);
        return data;
    }
}
