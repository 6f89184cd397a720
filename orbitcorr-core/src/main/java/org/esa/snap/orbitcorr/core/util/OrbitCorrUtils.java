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

import org.esa.snap.orbitcorr.core.OrbitCorrException;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Logging and file system helpers shared by the OrbitCorr processors.
 */
public class OrbitCorrUtils {

    public static final Logger LOG = Logger.getLogger("orbitcorr");

    private OrbitCorrUtils() {
    }

    public static void info(final String msg) {
        LOG.info(msg);
        System.out.println(msg);
    }

    public static void logErrorMessage(String msg) {
        LOG.log(Level.SEVERE, msg);
        System.err.println(msg);
    }

    /**
     * Creates the directory and its parents if not yet present.
     *
     * @param dir - the directory
     * @return the same directory
     */
    public static Path ensureDirectory(Path dir) {
        try {
            return Files.createDirectories(dir);
        } catch (IOException e) {
            throw new OrbitCorrException("Cannot create directory " + dir + ": " + e.getMessage(), e);
        }
    }

    /**
     * Rounds half-up to the given number of decimals, NaN and infinities unchanged.
     */
    public static double round(double value, int decimals) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(decimals, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * @return the value, or null if it is not a finite number (JSON has no NaN)
     */
    public static Double finiteOrNull(double value) {
        return Double.isNaN(value) || Double.isInfinite(value) ? null : value;
    }
}
