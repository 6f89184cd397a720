package org.esa.snap.orbitcorr.s2;

import org.esa.snap.orbitcorr.core.OrbitCorrConstants;
import org.esa.snap.orbitcorr.core.OrbitCorrException;
import org.esa.snap.orbitcorr.core.config.OrbitCorrConfig;
import org.esa.snap.orbitcorr.core.raster.FloatRaster;
import org.esa.snap.orbitcorr.core.raster.GeoTiffIO;
import org.esa.snap.orbitcorr.core.raster.GridContext;
import org.esa.snap.orbitcorr.s2.correction.CorrectionOutcome;
import org.esa.snap.orbitcorr.s2.correction.OffsetOutcome;
import org.esa.snap.orbitcorr.s2.orbits.OrbitPair;
import org.esa.snap.orbitcorr.s2.orbits.VelocityFieldRecord;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Properties;

import static org.junit.Assert.*;

public class GlacierProcessorTest {

    static final String GLACIER = "001_test";

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    private OrbitCorrConfig config;

    @Before
    public void setUp() throws Exception {
        config = createInputs(temporaryFolder.getRoot().toPath(), GLACIER);
    }

    @Test
    public void testProcess() throws Exception {
        final GlacierReport report = new GlacierProcessor(config).process(GLACIER);

        assertFalse(report.isFailed());
        assertEquals(OffsetOutcome.COMPUTED, report.getOffsetOutcomes().get(OrbitPair.parse("R096_R053")));
        assertEquals(OffsetOutcome.COMPUTED, report.getOffsetOutcomes().get(OrbitPair.parse("R096_R096")));
        assertEquals(11, report.getCorrectionOutcomes().size());
        assertEquals(Integer.valueOf(11), report.countByStatus().get(CorrectionOutcome.Status.CORRECTED));

        final GlacierWorkspace workspace = new GlacierWorkspace(config, GLACIER);
        assertEquals(temporaryFolder.getRoot().toPath().resolve("work").resolve("nsidic_v01.1").resolve(GLACIER),
                     workspace.getOutputDir());
        assertTrue(Files.exists(workspace.getOrbitsDir().resolve(GLACIER + "_orbits.csv")));
        assertTrue(Files.exists(workspace.getOrbitsDir().resolve(GLACIER + "_orbit_pairs.csv")));
        assertTrue(Files.exists(workspace.getOrbitsDir().resolve(GLACIER + "_orbit_pairs.png")));
        assertTrue(Files.exists(workspace.getOrbitsDir().resolve(GLACIER + "_median_orbitmatch_flowdir.tif")));
        assertTrue(Files.exists(workspace.getMasksDir().resolve(OrbitCorrConstants.ROCK_MASK_FILE_NAME)));

        // the corrected cross-track field matches the repeat-track reference
        final String id = "S2_001_test_20200801T160000_20200811T150000";
        final FloatRaster vx = GeoTiffIO.read(workspace.getVelocitiesDir().resolve(id).resolve(id + "_vx_v01.1.tif"),
                                              OrbitCorrConstants.NO_DATA_VALUE);
        assertEquals(4, vx.getWidth());
        assertEquals(3, vx.getHeight());
        assertEquals(3.0f, vx.get(1, 1), 1e-4f);
    }

    @Test
    public void testSecondRunIsResumed() {
        new GlacierProcessor(config).process(GLACIER);
        final GlacierReport second = new GlacierProcessor(config).process(GLACIER);

        assertEquals(OffsetOutcome.LOADED, second.getOffsetOutcomes().get(OrbitPair.parse("R096_R053")));
        assertEquals(Integer.valueOf(11), second.countByStatus().get(CorrectionOutcome.Status.ALREADY_CORRECTED));
    }

    @Test
    public void testUnknownGlacierIsFatal() {
        try {
            new GlacierProcessor(config).process("999_unknown");
            fail("OrbitCorrException expected");
        } catch (OrbitCorrException expected) {
            assertTrue(expected.getMessage().contains("999_unknown"));
        }
    }

    @Test
    public void testNonSquareImagePixelsAreFatal() throws Exception {
        final Path clipped = config.getImageDir().resolve(GLACIER).resolve("clipped");
        // sorts before the other images and is used as the example
        GeoTiffIO.writeFloat(FloatRaster.filled(new GridContext(-200000.0, -2000000.0, 10.0, 20.0, 2, 2, 3413), 1.0f),
                             clipped.resolve("S2A_MSIL2A_20200601T000000_N0214_R096_T22WEB.tif"));
        try {
            new GlacierProcessor(config).process(GLACIER);
            fail("OrbitCorrException expected");
        } catch (OrbitCorrException expected) {
            assertTrue(expected.getMessage().contains("not square"));
        }
    }

    /**
     * Writes the inputs of one glacier below the root: six repeat-track fields on orbit 096 with dx 3 and dy 1,
     * five cross-track fields 096/053 with dx 2 and dy 0.5, masks with rock in the first grid column.
     *
     * @return configuration reading the inputs
     */
    static OrbitCorrConfig createInputs(Path root, String glacier) throws IOException {
        final GridContext grid = S2TestData.grid(4, 3);
        final Path velocityDir = Files.createDirectories(root.resolve("vel").resolve(glacier).resolve("SETSM_SDM_100_new"));
        final Path clippedDir = Files.createDirectories(root.resolve("img").resolve(glacier).resolve("clipped"));
        final Path maskDir = Files.createDirectories(root.resolve("masks"));

        final StringBuilder manifest = new StringBuilder();
        for (int i = 0; i < 6; i++) {
            final LocalDateTime start = LocalDateTime.of(2020, 7, 1 + i, 16, 0);
            addField(manifest, velocityDir, clippedDir, grid, start, "096", start.plusDays(10), "096", 3.0f, 1.0f);
        }
        for (int i = 0; i < 5; i++) {
            final LocalDateTime start = LocalDateTime.of(2020, 8, 1 + i, 16, 0);
            addField(manifest, velocityDir, clippedDir, grid, start, "096", start.plusDays(10).minusHours(1), "053", 2.0f, 0.5f);
        }
        Files.write(velocityDir.resolve("list_good_2020.txt"), manifest.toString().getBytes(StandardCharsets.UTF_8));
        Files.write(velocityDir.resolve("list_good_2021.txt"), new byte[0]);

        final GridContext tileGrid = new GridContext(-200000.0, -2000000.0, 50.0, 50.0, 8, 6, 3413);
        final FloatRaster ice = FloatRaster.filled(tileGrid, 1.0f);
        for (int y = 0; y < tileGrid.getHeight(); y++) {
            ice.set(0, y, 0.0f);
            ice.set(1, y, 0.0f);
        }
        GeoTiffIO.writeFloat(ice, maskDir.resolve("GimpIceMask_15m_tile0_0.tif"));
        GeoTiffIO.writeFloat(FloatRaster.filled(tileGrid, 0.0f), maskDir.resolve("GimpOceanMask_15m_tile0_0.tif"));

        final Path aoiFile = root.resolve("regions.geojson");
        final String aoi = "{\"type\":\"FeatureCollection\",\"features\":[{\"type\":\"Feature\"," +
                "\"properties\":{\"region\":\"" + glacier + "\"},\"geometry\":{\"type\":\"Polygon\",\"coordinates\":" +
                "[[[-200000.0,-2000300.0],[-199600.0,-2000300.0],[-199600.0,-2000000.0],[-200000.0,-2000000.0]," +
                "[-200000.0,-2000300.0]]]}}]}";
        Files.write(aoiFile, aoi.getBytes(StandardCharsets.UTF_8));

        final Properties properties = new Properties();
        properties.setProperty("velocity.dir", root.resolve("vel").toString());
        properties.setProperty("image.dir", root.resolve("img").toString());
        properties.setProperty("mask.dir", maskDir.toString());
        properties.setProperty("aoi.file", aoiFile.toString());
        properties.setProperty("work.dir", root.resolve("work").toString());
        properties.setProperty("start.date", "20200101");
        properties.setProperty("end.date", "20201231");
        return OrbitCorrConfig.fromProperties(properties);
    }

    private static void addField(StringBuilder manifest, Path velocityDir, Path clippedDir, GridContext grid,
                                 LocalDateTime start, String orbit1, LocalDateTime end, String orbit2,
                                 float dx, float dy) throws IOException {
        writeImage(clippedDir, S2TestData.imageName("S2A", start, orbit1));
        writeImage(clippedDir, S2TestData.imageName("S2B", end, orbit2));
        final VelocityFieldRecord record = S2TestData.record(velocityDir, start, orbit1, end, orbit2);
        S2TestData.writeField(record, grid, dx, dy);
        manifest.append(record.getId()).append("\t0.95\t0.90\n");
    }

    private static void writeImage(Path clippedDir, String name) throws IOException {
        final Path file = clippedDir.resolve(name);
        if (!Files.exists(file)) {
            GeoTiffIO.writeFloat(FloatRaster.filled(new GridContext(-200000.0, -2000000.0, 10.0, 10.0, 2, 2, 3413), 1.0f), file);
        }
    }
}
