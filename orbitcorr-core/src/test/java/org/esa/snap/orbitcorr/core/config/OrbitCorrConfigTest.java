package org.esa.snap.orbitcorr.core.config;

import org.esa.snap.orbitcorr.core.OrbitCorrException;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.util.Properties;

import static org.junit.Assert.*;

public class OrbitCorrConfigTest {

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    @Test
    public void testDefaults() {
        final OrbitCorrConfig config = OrbitCorrConfig.fromProperties(minimalProperties());
        assertEquals("SETSM_SDM_100_new", config.getVelocitySubdir());
        assertEquals("region", config.getRegionProperty());
        assertEquals("nsidic_v01.1", config.getOutputName());
        assertEquals("01.1", config.getDatasetVersion());
        assertEquals(5, config.getMinPairCount());
        assertEquals(20.0, config.getMaxFlowDirectionDeviation(), 0.0);
        assertEquals(0.01, config.getMinIceCoverage(), 0.0);
        assertTrue(config.isDespeckle());
        assertEquals(3413, config.getEpsg());
        assertEquals(LocalDate.of(2021, 8, 23), config.getDemSwitchDate());
        assertTrue(config.isSplitAroundDemSwitch());
        assertEquals(Runtime.getRuntime().availableProcessors(), config.getBatchThreads());
        assertEquals(1, config.getCorrectionThreads());
        assertEquals(30.0, config.getReferenceVmax(), 0.0);
        assertEquals(70.0, config.getOffsetVmax(), 0.0);
        assertEquals(Paths.get("/data/work").resolve("logs"), config.getLogDir());
        assertEquals(LocalDate.of(2020, 1, 1), config.getDateRange().getStart());
        assertEquals(LocalDate.of(2022, 12, 31), config.getDateRange().getEnd());
        assertTrue(config.getProjectMetadata().containsKey("project"));
    }

    @Test
    public void testUserFileOverridesDefaults() throws Exception {
        final Path file = temporaryFolder.getRoot().toPath().resolve("user.properties");
        final String content = "velocity.dir = /data/vel\nimage.dir = /data/img\nmask.dir = /data/masks\n" +
                "aoi.file = /data/regions.geojson\nwork.dir = /data/work\nstart.date = 20200101\n" +
                "end.date = 20201231\noffset.minPairCount = 3\nfilter.despeckle = false\n" +
                "metadata.project.institution = Somewhere\n";
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        final OrbitCorrConfig config = OrbitCorrConfig.load(file);
        assertEquals(3, config.getMinPairCount());
        assertFalse(config.isDespeckle());
        assertEquals(Paths.get("/data/vel"), config.getVelocityDir());
        assertEquals("Somewhere", config.getProjectMetadata().get("institution"));
    }

    @Test
    public void testWithDateRange() {
        final OrbitCorrConfig config = OrbitCorrConfig.fromProperties(minimalProperties());
        final OrbitCorrConfig pre = config.withDateRange(DateRange.parse("20200101", "20210822"),
                                                         Paths.get("/data/work_pre_dem_switch"));
        assertEquals(Paths.get("/data/work_pre_dem_switch"), pre.getWorkDir());
        assertEquals(config.getLogDir(), pre.getLogDir());
        assertEquals(LocalDate.of(2021, 8, 22), pre.getDateRange().getEnd());
        assertEquals(config.getMinPairCount(), pre.getMinPairCount());
    }

    @Test
    public void testInvalidValues() {
        assertInvalid("offset.minPairCount", "five");
        assertInvalid("offset.minPairCount", "0");
        assertInvalid("filter.minIceCoverage", "1.5");
        assertInvalid("filter.maxFlowDirectionDeviation", "-1");
        assertInvalid("filter.despeckle", "maybe");
        assertInvalid("end.date", "20191231");
        assertInvalid("start.date", "2020-01-01");
    }

    @Test(expected = OrbitCorrException.class)
    public void testMissingRequiredValue() {
        final Properties properties = minimalProperties();
        properties.remove("velocity.dir");
        OrbitCorrConfig.fromProperties(properties);
    }

    private static void assertInvalid(String key, String value) {
        final Properties properties = minimalProperties();
        properties.setProperty(key, value);
        try {
            OrbitCorrConfig.fromProperties(properties);
            fail("accepted " + key + " = " + value);
        } catch (OrbitCorrException expected) {
            // ok
        }
    }

    static Properties minimalProperties() {
        final Properties properties = new Properties();
        properties.setProperty("velocity.dir", "/data/vel");
        properties.setProperty("image.dir", "/data/img");
        properties.setProperty("mask.dir", "/data/masks");
        properties.setProperty("aoi.file", "/data/regions.geojson");
        properties.setProperty("work.dir", "/data/work");
        properties.setProperty("start.date", "20200101");
        properties.setProperty("end.date", "20221231");
        return properties;
    }
}
