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

import org.esa.snap.orbitcorr.core.raster.FloatRaster;
import org.esa.snap.orbitcorr.core.raster.GridContext;
import org.esa.snap.orbitcorr.core.raster.Resampler;
import org.esa.snap.orbitcorr.core.raster.Resampling;

/**
 * Rock, ice and ocean masks on one grid. A pixel belongs to a class where its mask value is 1.
 */
public class MaskSet {

    private final FloatRaster rock;
    private final FloatRaster ice;
    private final FloatRaster ocean;

    public MaskSet(FloatRaster rock, FloatRaster ice, FloatRaster ocean) {
        rock.getGrid().requireSameGrid(ice.getGrid());
        rock.getGrid().requireSameGrid(ocean.getGrid());
        this.rock = rock;
        this.ice = ice;
        this.ocean = ocean;
    }

    /**
     * Derives the rock mask: pixels known to be neither ice nor ocean.
     */
    public static MaskSet fromIceAndOcean(FloatRaster ice, FloatRaster ocean) {
        ice.getGrid().requireSameGrid(ocean.getGrid());
        final FloatRaster rock = FloatRaster.filled(ice.getGrid(), 0.0f);
        for (int i = 0; i < rock.size(); i++) {
            if (ice.get(i) == 0.0f && ocean.get(i) == 0.0f) {
                rock.set(i, 1.0f);
            }
        }
        return new MaskSet(rock, binarize(ice), binarize(ocean));
    }

    /**
     * @return the masks resampled by nearest neighbour onto the given grid
     */
    public MaskSet onGrid(GridContext grid) {
        if (getGrid().isSameGrid(grid)) {
            return this;
        }
        return new MaskSet(binarize(Resampler.resample(rock, grid, Resampling.NEAREST)),
                           binarize(Resampler.resample(ice, grid, Resampling.NEAREST)),
                           binarize(Resampler.resample(ocean, grid, Resampling.NEAREST)));
    }

    public GridContext getGrid() {
        return ice.getGrid();
    }

    public boolean isRock(int index) {
        return rock.get(index) == 1.0f;
    }

    public boolean isIce(int index) {
        return ice.get(index) == 1.0f;
    }

    public int countIce() {
        int count = 0;
        for (int i = 0; i < ice.size(); i++) {
            if (isIce(i)) {
                count++;
            }
        }
        return count;
    }

    public FloatRaster getRock() {
        return rock;
    }

    public FloatRaster getIce() {
        return ice;
    }

    public FloatRaster getOcean() {
        return ocean;
    }

    private static FloatRaster binarize(FloatRaster mask) {
        final FloatRaster result = FloatRaster.filled(mask.getGrid(), 0.0f);
        for (int i = 0; i < mask.size(); i++) {
            if (mask.get(i) == 1.0f) {
                result.set(i, 1.0f);
            }
        }
        return result;
    }
}
