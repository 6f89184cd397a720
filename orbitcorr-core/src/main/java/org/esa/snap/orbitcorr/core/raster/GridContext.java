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

import org.esa.snap.orbitcorr.core.OrbitCorrConstants;
import org.esa.snap.orbitcorr.core.OrbitCorrException;
import org.esa.snap.orbitcorr.core.util.OrbitCorrUtils;
import org.locationtech.jts.geom.Envelope;

import java.util.Objects;

/**
 * Immutable description of a north-up raster grid: upper-left origin, pixel size, dimensions and CRS code.
 * One instance is derived per glacier and passed into every component, so that all per-pixel arithmetic
 * happens on identical grids.
 */
public final class GridContext {

    private static final double GRID_TOLERANCE = 1.0e-6;

    private final double minX;
    private final double maxY;
    private final double pixelSizeX;
    private final double pixelSizeY;
    private final int width;
    private final int height;
    private final int epsg;

    public GridContext(double minX, double maxY, double pixelSizeX, double pixelSizeY, int width, int height, int epsg) {
        if (width <= 0 || height <= 0) {
            throw new OrbitCorrException("Grid dimensions must be positive: " + width + " x " + height);
        }
        if (!(pixelSizeX > 0) || !(pixelSizeY > 0)) {
            throw new OrbitCorrException("Pixel size must be positive: " + pixelSizeX + " x " + pixelSizeY);
        }
        this.minX = minX;
        this.maxY = maxY;
        this.pixelSizeX = pixelSizeX;
        this.pixelSizeY = pixelSizeY;
        this.width = width;
        this.height = height;
        this.epsg = epsg;
    }

    /**
     * Builds the grid covering the given bounds at a square pixel size.
     * Width and height are the rounded extent divided by the pixel size, the origin is the upper left bounds corner.
     *
     * @param bounds    - the area of interest bounds
     * @param pixelSize - the pixel size in CRS units
     * @param epsg      - CRS code
     * @return the grid
     */
    public static GridContext fromBounds(Envelope bounds, double pixelSize, int epsg) {
        if (bounds == null || bounds.isNull()) {
            throw new OrbitCorrException("Cannot derive a grid from empty bounds.");
        }
        final int width = (int) Math.round(bounds.getWidth() / pixelSize);
        final int height = (int) Math.round(bounds.getHeight() / pixelSize);
        return new GridContext(bounds.getMinX(), bounds.getMaxY(), pixelSize, pixelSize, width, height, epsg);
    }

    /**
     * Returns the pixel size rounded to two decimals, failing if it is not square after rounding.
     *
     * @param source - name of the raster the grid belongs to, for the error message
     * @return the isotropic pixel size
     */
    public double requireSquarePixels(String source) {
        final double resX = OrbitCorrUtils.round(pixelSizeX, OrbitCorrConstants.RESOLUTION_DECIMALS);
        final double resY = OrbitCorrUtils.round(pixelSizeY, OrbitCorrConstants.RESOLUTION_DECIMALS);
        if (resX != resY) {
            throw new OrbitCorrException("Pixel resolution of " + source + " is not square: x=" + resX + ", y=" + resY);
        }
        return resX;
    }

    public void requireSameGrid(GridContext other) {
        if (!isSameGrid(other)) {
            throw new OrbitCorrException(OrbitCorrConstants.INPUT_INCONSISTENCY_ERROR_MESSAGE +
                                                 " Expected " + this + " but got " + other);
        }
    }

    public boolean isSameGrid(GridContext other) {
        return other != null &&
                width == other.width && height == other.height &&
                Math.abs(minX - other.minX) < GRID_TOLERANCE &&
                Math.abs(maxY - other.maxY) < GRID_TOLERANCE &&
                Math.abs(pixelSizeX - other.pixelSizeX) < GRID_TOLERANCE &&
                Math.abs(pixelSizeY - other.pixelSizeY) < GRID_TOLERANCE;
    }

    public Envelope getBounds() {
        return new Envelope(minX, getMaxX(), getMinY(), maxY);
    }

    public boolean intersects(GridContext other) {
        return getBounds().intersects(other.getBounds());
    }

    /**
     * @return easting of the centre of pixel column x
     */
    public double pixelCenterX(int x) {
        return minX + (x + 0.5) * pixelSizeX;
    }

    /**
     * @return northing of the centre of pixel row y
     */
    public double pixelCenterY(int y) {
        return maxY - (y + 0.5) * pixelSizeY;
    }

    /**
     * @return fractional column coordinate of the easting, 0.0 being the left edge of the first pixel
     */
    public double toPixelX(double easting) {
        return (easting - minX) / pixelSizeX;
    }

    /**
     * @return fractional row coordinate of the northing, 0.0 being the top edge of the first row
     */
    public double toPixelY(double northing) {
        return (maxY - northing) / pixelSizeY;
    }

    public double getMinX() {
        return minX;
    }

    public double getMaxX() {
        return minX + width * pixelSizeX;
    }

    public double getMinY() {
        return maxY - height * pixelSizeY;
    }

    public double getMaxY() {
        return maxY;
    }

    public double getPixelSizeX() {
        return pixelSizeX;
    }

    public double getPixelSizeY() {
        return pixelSizeY;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getEpsg() {
        return epsg;
    }

    public int getPixelCount() {
        return width * height;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        GridContext that = (GridContext) o;
        return Double.compare(that.minX, minX) == 0 &&
                Double.compare(that.maxY, maxY) == 0 &&
                Double.compare(that.pixelSizeX, pixelSizeX) == 0 &&
                Double.compare(that.pixelSizeY, pixelSizeY) == 0 &&
                width == that.width && height == that.height && epsg == that.epsg;
    }

    @Override
    public int hashCode() {
        return Objects.hash(minX, maxY, pixelSizeX, pixelSizeY, width, height, epsg);
    }

    @Override
    public String toString() {
        return "GridContext[origin=(" + minX + ", " + maxY + "), pixelSize=(" + pixelSizeX + ", " + pixelSizeY +
                "), size=" + width + "x" + height + ", epsg=" + epsg + "]";
    }
}
