package org.esa.snap.orbitcorr.s2.correction;

import org.apache.commons.lang3.StringUtils;
import org.esa.snap.orbitcorr.core.OrbitCorrConstants;
import org.esa.snap.orbitcorr.core.raster.FloatRaster;
import org.esa.snap.orbitcorr.core.raster.GridContext;
import org.esa.snap.orbitcorr.core.raster.RasterMath;
import org.esa.snap.orbitcorr.core.util.OrbitCorrUtils;
import org.esa.snap.orbitcorr.s2.orbits.VelocityFieldRecord;
import org.json.simple.JSONObject;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Metadata document of a corrected velocity field. Off-ice statistics are taken over rock pixels only,
 * in velocity units and multiplied by the day separation in displacement units.
 */
public class CorrectedFieldMetadata {

    static final String FIELD_INFO = "field_info";
    static final String ERROR_UNITS_VELOCITY = "error_units_velocity";
    static final String ERROR_UNITS_DISPLACEMENT = "error_units_displacement";
    static final String GEOSPATIAL_INFO = "geospatial_info";
    static final String PROJECT_INFO = "project_info";
    static final String PERCENT_ICE_AREA_NOTNULL = "percent_ice_area_notnull";

    private static final DateTimeFormatter METADATA_DATE_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd 'T'HH:mm:ss");
    private static final int POLAR_STEREOGRAPHIC_NORTH_EPSG = 3413;

    private final Map<String, Object> document = new LinkedHashMap<>();
    private final Map<String, Object> fieldInfo = new LinkedHashMap<>();

    private CorrectedFieldMetadata() {
    }

    /**
     * @param outputId  - id of the corrected field
     * @param glacier   - glacier name
     * @param record    - source velocity field
     * @param dx        - corrected dx, before the flow direction filter
     * @param dy        - corrected dy
     * @param rockMask  - 1 over rock
     * @param project   - configured project entries
     * @param version   - dataset version
     */
    static CorrectedFieldMetadata create(String outputId, String glacier, VelocityFieldRecord record,
                                         FloatRaster dx, FloatRaster dy, FloatRaster rockMask,
                                         Map<String, String> project, String version) {
        final CorrectedFieldMetadata metadata = new CorrectedFieldMetadata();
        final double daySeparation = record.getDaySeparation();

        final FloatRaster dxRock = RasterMath.select(dx, rockMask);
        final FloatRaster dyRock = RasterMath.select(dy, rockMask);
        final FloatRaster magRock = RasterMath.magnitude(dxRock, dyRock);

        final Map<String, Object> fieldInfo = metadata.fieldInfo;
        fieldInfo.put("id", outputId);
        fieldInfo.put("glacier_id", glacier);
        fieldInfo.put("data", "ice surface velocity");
        fieldInfo.put("units", "m d^{-1}");
        fieldInfo.put("source_product", record.getSourceProduct());
        fieldInfo.put("scene_1_satellite", record.getSatellite1());
        fieldInfo.put("scene_2_satellite", record.getSatellite2());
        fieldInfo.put("scene_1_datetime", METADATA_DATE_TIME_FORMAT.format(record.getDateTime1()));
        fieldInfo.put("scene_2_datetime", METADATA_DATE_TIME_FORMAT.format(record.getDateTime2()));
        fieldInfo.put("midpoint_datetime", METADATA_DATE_TIME_FORMAT.format(record.getMidpoint()));
        fieldInfo.put("baseline_days", OrbitCorrUtils.round(record.getBaseline(), OrbitCorrConstants.RESOLUTION_DECIMALS));
        fieldInfo.put("scene_1_orbit", orbitValue(record.getOrbitPair().getOrbit1()));
        fieldInfo.put("scene_2_orbit", orbitValue(record.getOrbitPair().getOrbit2()));
        fieldInfo.put("scene_1_processing_baseline", record.getProcessingBaseline1());
        fieldInfo.put("scene_2_processing_baseline", record.getProcessingBaseline2());
        metadata.document.put(FIELD_INFO, fieldInfo);

        final Map<String, Object> velocityErrors = new LinkedHashMap<>();
        velocityErrors.put("mag_rmse", statistic(RasterMath.nanRms(magRock)));
        velocityErrors.put("dx_mean", statistic(RasterMath.nanMean(dxRock)));
        velocityErrors.put("dx_sd", statistic(RasterMath.nanStd(dxRock)));
        velocityErrors.put("dy_mean", statistic(RasterMath.nanMean(dyRock)));
        velocityErrors.put("dy_sd", statistic(RasterMath.nanStd(dyRock)));
        metadata.document.put(ERROR_UNITS_VELOCITY, velocityErrors);

        final FloatRaster dxRockDisplacement = RasterMath.multiply(dxRock, daySeparation);
        final FloatRaster dyRockDisplacement = RasterMath.multiply(dyRock, daySeparation);
        final Map<String, Object> displacementErrors = new LinkedHashMap<>();
        displacementErrors.put("mag_displacement_rmse",
                               statistic(RasterMath.nanRms(RasterMath.multiply(magRock, daySeparation))));
        displacementErrors.put("dx_displacement_mean", statistic(RasterMath.nanMean(dxRockDisplacement)));
        displacementErrors.put("dx_displacement_sd", statistic(RasterMath.nanStd(dxRockDisplacement)));
        displacementErrors.put("dy_displacement_mean", statistic(RasterMath.nanMean(dyRockDisplacement)));
        displacementErrors.put("dy_displacement_sd", statistic(RasterMath.nanStd(dyRockDisplacement)));
        metadata.document.put(ERROR_UNITS_DISPLACEMENT, displacementErrors);

        final GridContext grid = dx.getGrid();
        final Map<String, Object> geospatialInfo = new LinkedHashMap<>();
        geospatialInfo.put("projection", projectionName(grid.getEpsg()));
        geospatialInfo.put("epsg", String.valueOf(grid.getEpsg()));
        geospatialInfo.put("coordinate_unit", "m");
        geospatialInfo.put("data_format", "GeoTiff");
        geospatialInfo.put("x_resolution", grid.getPixelSizeX());
        geospatialInfo.put("y_resolution", grid.getPixelSizeY());
        final Map<String, Object> extent = new LinkedHashMap<>();
        extent.put("xmin", grid.getMinX());
        extent.put("ymin", grid.getMinY());
        extent.put("xmax", grid.getMaxX());
        extent.put("ymax", grid.getMaxY());
        geospatialInfo.put("extent", extent);
        metadata.document.put(GEOSPATIAL_INFO, geospatialInfo);

        final Map<String, Object> projectInfo = new LinkedHashMap<>(project);
        projectInfo.put("version", version);
        projectInfo.put("data_acknowledgement",
                        "Contains modified Copernicus Sentinel data [" + record.getMidpoint().getYear() + "].");
        metadata.document.put(PROJECT_INFO, projectInfo);
        return metadata;
    }

    /**
     * @param fraction - valid share of the ice area, in [0, 1]
     */
    void setIceCoverage(double fraction) {
        fieldInfo.put(PERCENT_ICE_AREA_NOTNULL,
                      OrbitCorrUtils.round(fraction * 100.0, OrbitCorrConstants.RESOLUTION_DECIMALS));
    }

    public String toJSONString() {
        return JSONObject.toJSONString(document);
    }

    public void write(Path file) throws IOException {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            JSONObject.writeJSONString(document, writer);
        }
    }

    private static Double statistic(double value) {
        return OrbitCorrUtils.finiteOrNull(OrbitCorrUtils.round(value, OrbitCorrConstants.RESOLUTION_DECIMALS));
    }

    private static Object orbitValue(String orbit) {
        if (StringUtils.isNumeric(orbit)) {
            return Integer.valueOf(orbit);
        }
        return orbit;
    }

    private static String projectionName(int epsg) {
        if (epsg == POLAR_STEREOGRAPHIC_NORTH_EPSG) {
            return "WGS 84 / NSIDC Sea Ice Polar Stereographic North";
        }
        return "EPSG:" + epsg;
    }
}
