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

/**
 * Signals a condition that makes further processing of the current glacier impossible:
 * an empty catalog, no usable QA manifest, no repeat-track record, an inconsistent raster
 * stack or an invalid configuration.
 */
public class OrbitCorrException extends RuntimeException {

    public OrbitCorrException(String message) {
        super(message);
    }

    public OrbitCorrException(String message, Throwable cause) {
        super(message, cause);
    }
}
