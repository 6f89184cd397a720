package org.esa.snap.orbitcorr.s2.orbits;

import org.esa.snap.orbitcorr.core.OrbitCorrException;
import org.esa.snap.orbitcorr.core.config.DateRange;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

public class OrbitCatalogTest {

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    private static final DateRange RANGE = DateRange.parse("20200101", "20201231");

    @Test
    public void testFromFileNames() {
        final OrbitCatalog catalog = OrbitCatalog.fromFileNames(Arrays.asList(
                "S2B_MSIL2A_20200726T151809_N0214_R068_T24XWR.tif",
                "S2A_MSIL2A_20200716T160901_N0214_R140_T22WEB.tif"), RANGE);

        assertEquals(2, catalog.size());
        // sorted by acquisition time
        assertEquals("20200716T16", catalog.getRecords().get(0).getDateHour());
        assertTrue(catalog.contains("20200726T15"));
        assertFalse(catalog.contains("20200726T16"));
        assertEquals("068", catalog.get("20200726T15").getOrbit());
        assertNull(catalog.get("20200101T00"));
    }

    @Test
    public void testDateFilterExcludesRangeEnds() {
        final OrbitCatalog catalog = OrbitCatalog.fromFileNames(Arrays.asList(
                "S2A_MSIL2A_20200101T160901_N0214_R140_T22WEB.tif",
                "S2A_MSIL2A_20200102T160901_N0214_R140_T22WEB.tif",
                "S2A_MSIL2A_20201231T160901_N0214_R140_T22WEB.tif"), RANGE);
        assertEquals(1, catalog.size());
        assertTrue(catalog.contains("20200102T16"));
    }

    @Test
    public void testEmptyCatalogIsFatal() {
        final List<String> outside = Collections.singletonList("S2A_MSIL2A_20190716T160901_N0214_R140_T22WEB.tif");
        try {
            OrbitCatalog.fromFileNames(outside, RANGE);
            fail("OrbitCorrException expected");
        } catch (OrbitCorrException expected) {
            assertTrue(expected.getMessage().contains("No clipped mosaic"));
        }
    }

    @Test
    public void testFromDirectoryAndCsv() throws Exception {
        final Path clipped = temporaryFolder.newFolder("clipped").toPath();
        Files.createFile(clipped.resolve("S2A_MSIL2A_20200716T160901_N0214_R140_T22WEB.tif"));
        Files.createFile(clipped.resolve("S2B_MSIL2A_20200726T151809_N0214_R068_T24XWR.tif"));
        Files.createFile(clipped.resolve("readme.txt"));

        final OrbitCatalog catalog = OrbitCatalog.fromDirectory(clipped, RANGE);
        assertEquals(2, catalog.size());

        final Path csv = temporaryFolder.getRoot().toPath().resolve("orbits.csv");
        catalog.writeCsv(csv);
        final List<String> lines = Files.readAllLines(csv, StandardCharsets.UTF_8);
        assertEquals(3, lines.size());
        assertEquals("datetime,datehour,satellite,orbits,processing_baselines", lines.get(0));
        assertEquals("20200716T160901,20200716T16,S2A,140,0214", lines.get(1));
    }
}
