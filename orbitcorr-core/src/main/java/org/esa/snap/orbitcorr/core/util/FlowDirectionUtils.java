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

package org.esa.snap.orbitcorr.core.util;

import org.esa.snap.orbitcorr.core.raster.FloatRaster;

/**
 * Flow direction helpers. Directions are in degrees anti-clockwise from the x-axis, within (-180, 180].
 */
public class FlowDirectionUtils {

    private FlowDirectionUtils() {
    }

    /**
     * Computes the flow direction of a displacement vector.
     * The arc tangent of dy/dx is shifted by 180 degrees wherever dx is not positive
     * and the result is wrapped into (-180, 180].
     *
     * @param dx - x component
     * @param dy - y component
     * @return direction in degrees, NaN if either component is NaN or both are zero
     */
    public static double computeFlowDirection(double dx, double dy) {
        double angle = Math.toDegrees(Math.atan(dy / dx));
        if (!(dx > 0)) {
            angle += 180.0;
        }
        if (angle > 180.0) {
            angle -= 360.0;
        }
        return angle;
    }

    /**
     * Absolute angular difference of two directions, folded so that it never exceeds 180 degrees.
     * E.g. 179 and -179 differ by 2 degrees.
     *
     * @param reference - reference direction in degrees
     * @param direction - direction to compare
     * @return difference in [0, 180], NaN if either input is NaN
     */
    public static double computeAngularDifference(double reference, double direction) {
        double diff = Math.abs(reference - direction);
        if (diff > 180.0) {
            diff = 360.0 - diff;
        }
        return diff;
    }

    public static FloatRaster computeFlowDirection(FloatRaster dx, FloatRaster dy) {
        dx.getGrid().requireSameGrid(dy.getGrid());
        final FloatRaster direction = new FloatRaster(dx.getGrid());
        for (int i = 0; i < dx.size(); i++) {
            direction.set(i, (float) computeFlowDirection(dx.get(i), dy.get(i)));
        }
        return direction;
    }
}
