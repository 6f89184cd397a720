package org.esa.snap.orbitcorr.s2.orbits;

import org.esa.snap.orbitcorr.core.OrbitCorrException;
import org.esa.snap.orbitcorr.core.config.DateRange;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class PairTableTest {

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    private static final DateRange RANGE = DateRange.parse("20200101", "20201231");

    private Path velocityDir;
    private OrbitCatalog catalog;

    @Before
    public void setUp() throws Exception {
        velocityDir = temporaryFolder.newFolder("SETSM_SDM_100_new").toPath();
        catalog = OrbitCatalog.fromFileNames(Arrays.asList(
                "S2A_MSIL2A_20200706T160901_N0214_R096_T22WEB.tif",
                "S2B_MSIL2A_20200716T160901_N0214_R096_T22WEB.tif",
                "S2A_MSIL2A_20200726T150901_N0214_R053_T22WEB.tif",
                "S2A_MSIL2A_20200805T160901_N0300_R096_T22WEB.tif"), RANGE);
    }

    @Test
    public void testFromManifests() throws Exception {
        writeManifest("list_good_2020.txt",
                      "vmap_S2A_MSIL2A_20200706T16_S2B_MSIL2A_20200716T16\t0.9\t0.8\n" +
                              "vmap_S2B_MSIL2A_20200716T16_S2A_MSIL2A_20200726T15\t0.9\t0.8\n" +
                              // second scene not in the catalog
                              "vmap_S2A_MSIL2A_20200716T16_S2A_MSIL2A_20200720T16\t0.9\t0.8\n" +
                              // outside the date range
                              "vmap_S2A_MSIL2A_20191230T16_S2B_MSIL2A_20200716T16\t0.9\t0.8\n");
        // duplicate id in another year's manifest, kept once
        writeManifest("list_good_2021.txt", "vmap_S2A_MSIL2A_20200706T16_S2B_MSIL2A_20200716T16\t0.7\t0.6\n");
        writeManifest("list_good_2022.txt", "");

        final PairTable table = PairTable.fromManifests(velocityDir, catalog, RANGE);
        assertEquals(2, table.size());

        final VelocityFieldRecord first = table.getRecords().get(0);
        assertEquals("vmap_S2A_MSIL2A_20200706T16_S2B_MSIL2A_20200716T16", first.getId());
        assertEquals(velocityDir.resolve(first.getId()), first.getSourceDir());
        assertEquals(10.0, first.getDaySeparation(), 1e-9);
        assertEquals(10.0, first.getBaseline(), 1e-9);
        assertEquals(5.0, first.getHalfBaseline(), 1e-9);
        assertEquals(LocalDateTime.of(2020, 7, 11, 16, 9, 1), first.getMidpoint());
        assertEquals(2020, first.getYear());
        assertEquals("S2A", first.getSatellite1());
        assertEquals("MSIL2A", first.getSourceProduct());
        assertEquals("S2B", first.getSatellite2());
        assertTrue(first.isRepeatTrack());
        assertEquals(new OrbitPair("096", "096"), first.getOrbitPair());

        final VelocityFieldRecord second = table.getRecords().get(1);
        assertFalse(second.isRepeatTrack());
        assertEquals("R096_R053", second.getOrbitPair().getKey());
        assertEquals(9.0 + 23.0 / 24.0, second.getDaySeparation(), 1e-9);

        assertEquals(1, table.getRepeatTrackRecords().size());
        assertEquals(1, table.getRecords(new OrbitPair("096", "053")).size());
        assertEquals(2, table.getDefinedOrbitPairs().size());
        final Map<String, Integer> counts = table.countByOrbitPair();
        assertEquals(Integer.valueOf(1), counts.get("R096_R096"));
        assertEquals(Integer.valueOf(1), counts.get("R096_R053"));
    }

    @Test
    public void testNoUsableManifestIsFatal() throws Exception {
        writeManifest("list_good_2020.txt", "");
        writeManifest("list_all_2020.txt", "vmap_S2A_MSIL2A_20200706T16_S2B_MSIL2A_20200716T16\t0.9\t0.8\n");
        try {
            PairTable.fromManifests(velocityDir, catalog, RANGE);
            fail("OrbitCorrException expected");
        } catch (OrbitCorrException expected) {
            assertTrue(expected.getMessage().contains("No non-empty QA manifest"));
        }
    }

    @Test
    public void testIdsWithoutTwoDateHoursAreSkipped() throws Exception {
        writeManifest("list_good_2020.txt", "vmap_broken_20200706T16\t0.9\t0.8\n" +
                "vmap_S2A_MSIL2A_20200706T16_S2B_MSIL2A_20200716T16\t0.9\t0.8\n");
        assertEquals(1, PairTable.fromManifests(velocityDir, catalog, RANGE).size());
    }

    @Test
    public void testWriteCsvAndChart() throws Exception {
        writeManifest("list_good_2020.txt", "vmap_S2B_MSIL2A_20200716T16_S2A_MSIL2A_20200726T15\t0.9\t0.8\n");
        final PairTable table = PairTable.fromManifests(velocityDir, catalog, RANGE);

        final Path csv = temporaryFolder.getRoot().toPath().resolve("pairs.csv");
        table.writeCsv(csv);
        final List<String> lines = Files.readAllLines(csv, StandardCharsets.UTF_8);
        assertEquals(2, lines.size());
        assertEquals(PairTable.CSV_HEADER, lines.get(0));
        final String[] columns = lines.get(1).split(",");
        assertEquals(17, columns.length);
        assertEquals("20200716T16", columns[2]);
        assertEquals("2020-07-16 16:09:01", columns[4]);
        assertEquals("096", columns[11]);
        assertEquals("053", columns[13]);
        assertEquals("R096_R053", columns[15]);
        assertEquals("0", columns[16]);

        final Path chart = temporaryFolder.getRoot().toPath().resolve("pairs.png");
        table.writeBarChart(chart);
        assertTrue(Files.size(chart) > 0);
    }

    private void writeManifest(String name, String content) throws Exception {
        Files.write(velocityDir.resolve(name), content.getBytes(StandardCharsets.UTF_8));
    }
}
