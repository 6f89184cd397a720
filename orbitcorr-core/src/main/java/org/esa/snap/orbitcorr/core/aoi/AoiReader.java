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

package org.esa.snap.orbitcorr.core.aoi;

import org.esa.snap.orbitcorr.core.OrbitCorrException;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.JSONValue;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.geojson.GeoJsonReader;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Reads the area of interest of one glacier from a GeoJSON FeatureCollection holding all regions.
 * Coordinates are expected in the projected working CRS.
 */
public class AoiReader {

    private final String regionProperty;

    public AoiReader(String regionProperty) {
        this.regionProperty = regionProperty;
    }

    /**
     * @param aoiFile - the FeatureCollection
     * @param glacier - value of the region property identifying the feature
     * @return the polygon of the matching feature
     * @throws OrbitCorrException if the file cannot be read or holds no matching feature
     */
    public Geometry readAoi(Path aoiFile, String glacier) {
        final Object parsed;
        try (Reader r = Files.newBufferedReader(aoiFile, StandardCharsets.UTF_8)) {
            parsed = JSONValue.parse(r);
        } catch (IOException e) {
            throw new OrbitCorrException("Cannot read AOI file " + aoiFile, e);
        }
        if (!(parsed instanceof JSONObject)) {
            throw new OrbitCorrException("AOI file " + aoiFile + " is not a GeoJSON object.");
        }
        final Map<?, ?> collection = (JSONObject) parsed;
        final Object features = collection.get("features");
        if (!(features instanceof JSONArray)) {
            throw new OrbitCorrException("AOI file " + aoiFile + " is not a GeoJSON FeatureCollection.");
        }
        for (Object feature : (JSONArray) features) {
            final Map<?, ?> f = (JSONObject) feature;
            final Map<?, ?> properties = (JSONObject) f.get("properties");
            if (properties != null && glacier.equals(String.valueOf(properties.get(regionProperty)))) {
                return toGeometry((JSONObject) f.get("geometry"), aoiFile);
            }
        }
        throw new OrbitCorrException("No AOI feature with " + regionProperty + " '" + glacier + "' in " + aoiFile);
    }

    private static Geometry toGeometry(JSONObject geometry, Path aoiFile) {
        if (geometry == null) {
            throw new OrbitCorrException("AOI feature in " + aoiFile + " has no geometry.");
        }
        try {
            final Geometry aoi = new GeoJsonReader().read(geometry.toJSONString());
            if (aoi.isEmpty()) {
                throw new OrbitCorrException("AOI geometry in " + aoiFile + " is empty.");
            }
            return aoi;
        } catch (ParseException e) {
            throw new OrbitCorrException("Invalid AOI geometry in " + aoiFile + ": " + e.getMessage(), e);
        }
    }
}
