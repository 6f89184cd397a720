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

package org.esa.snap.orbitcorr.core;

import java.util.regex.Pattern;

/**
 * OrbitCorr constants
 */
public class OrbitCorrConstants {

    public static final float NO_DATA_VALUE = -9999.0f;
    public static final double[] RAW_NO_DATA_VALUES = {0.0, -9999.0};

    public static final String DX = "dx";
    public static final String DY = "dy";
    public static final String DMAG = "dmag";
    public static final String FLOW_DIRECTION = "flowdir";

    public static final String TIF_EXTENSION = ".tif";
    public static final String VELOCITY_MASK_SUFFIX = "_mask.tif";
    public static final String RAW_FIELD_DIR_PREFIX = "vmap";

    public static final String ORBITS_DIR_NAME = "orbits";
    public static final String VELOCITIES_DIR_NAME = "velocities";
    public static final String PREVIEWS_DIR_NAME = "previews";
    public static final String MASKS_DIR_NAME = "gimp_masks";
    public static final String CLIPPED_DIR_NAME = "clipped";

    public static final String ICE_MASK_TILE_PREFIX = "GimpIceMask_15m_tile";
    public static final String OCEAN_MASK_TILE_PREFIX = "GimpOceanMask_15m_tile";
    public static final Pattern MASK_TILE_CODE_PATTERN = Pattern.compile("tile(\\d+_\\d+)\\.tif$");

    public static final String ROCK_MASK_FILE_NAME = "mask_rock.tif";
    public static final String ICE_MASK_FILE_NAME = "mask_ice.tif";
    public static final String OCEAN_MASK_FILE_NAME = "mask_ocean.tif";

    /**
     * Accepted-quality manifests written by the feature tracking, one per year.
     */
    public static final Pattern QA_MANIFEST_PATTERN = Pattern.compile("list_good_20\\d\\d\\.txt");

    /**
     * Date-hour token YYYYMMDDTHH not embedded in a longer digit run.
     */
    public static final Pattern DATE_HOUR_PATTERN = Pattern.compile("(?<!\\d)(\\d{8}\\D\\d{2})(?!\\d)");

    public static final int RESOLUTION_DECIMALS = 2;

    public static final String INPUT_INCONSISTENCY_ERROR_MESSAGE =
            "Selected input is not consistent with the working grid.";

    private OrbitCorrConstants() {
    }
}
