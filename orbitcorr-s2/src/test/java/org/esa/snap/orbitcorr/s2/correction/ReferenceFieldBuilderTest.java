package org.esa.snap.orbitcorr.s2.correction;

import org.esa.snap.orbitcorr.core.OrbitCorrConstants;
import org.esa.snap.orbitcorr.core.OrbitCorrException;
import org.esa.snap.orbitcorr.core.raster.FloatRaster;
import org.esa.snap.orbitcorr.core.raster.GridContext;
import org.esa.snap.orbitcorr.s2.S2TestData;
import org.esa.snap.orbitcorr.s2.orbits.PairTable;
import org.esa.snap.orbitcorr.s2.orbits.VelocityFieldRecord;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

public class ReferenceFieldBuilderTest {

    private static final String GLACIER = "001_alison";

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    private GridContext grid;
    private Path velocityDir;
    private Path orbitsDir;

    @Before
    public void setUp() throws Exception {
        grid = S2TestData.grid(4, 3);
        velocityDir = temporaryFolder.newFolder("velocities").toPath();
        orbitsDir = temporaryFolder.getRoot().toPath().resolve("orbits");
    }

    @Test
    public void testBuildFromRepeatTrackRecords() throws Exception {
        final PairTable table = createTable();
        final ReferenceField reference = new ReferenceFieldBuilder(GLACIER, orbitsDir, new VelocityFieldLoader(grid),
                                                                   false, 30.0).build(table);

        // dx of the six repeat-track fields is 1..6, the cross-track field is ignored
        assertEquals(3.5f, reference.getDx().get(0), 1e-5f);
        assertEquals(2.0f, reference.getDy().get(11), 1e-5f);
        final double expectedDmag = (Math.hypot(3.0, 2.0) + Math.hypot(4.0, 2.0)) / 2.0;
        assertEquals(expectedDmag, reference.getDmag().get(5), 1e-4);
        assertEquals(Math.toDegrees(Math.atan(2.0 / 3.5)), reference.getFlowDirection().get(3), 1e-4);
        assertEquals(10.0, reference.getPreviewVmax(), 0.0);

        for (String component : new String[]{"dx", "dy", "dmag", "flowdir"}) {
            assertTrue(Files.exists(ReferenceField.file(orbitsDir, GLACIER, component)));
        }
        assertTrue(Files.exists(orbitsDir.resolve(GLACIER + "_median_orbitmatch_map.png")));
    }

    @Test
    public void testExistingReferenceIsNotRecomputed() throws Exception {
        final PairTable table = createTable();
        new ReferenceFieldBuilder(GLACIER, orbitsDir, new VelocityFieldLoader(grid), false, 30.0).build(table);
        final List<byte[]> before = readOutputs();

        final CountingLoader countingLoader = new CountingLoader(grid);
        final ReferenceFieldBuilder builder = new ReferenceFieldBuilder(GLACIER, orbitsDir, countingLoader, false, 30.0);
        assertTrue(builder.isComplete());
        final ReferenceField reference = builder.build(table);

        assertEquals(0, countingLoader.reads);
        assertEquals(3.5f, reference.getDx().get(0), 1e-5f);
        final List<byte[]> after = readOutputs();
        for (int i = 0; i < before.size(); i++) {
            assertArrayEquals(before.get(i), after.get(i));
        }
    }

    @Test
    public void testNoRepeatTrackRecordIsFatal() throws Exception {
        final VelocityFieldRecord crossTrack = S2TestData.record(velocityDir, LocalDateTime.of(2020, 7, 6, 16, 0), "096",
                                                                 LocalDateTime.of(2020, 7, 16, 15, 0), "053");
        S2TestData.writeField(crossTrack, grid, 1.0f, 1.0f);
        final PairTable table = new PairTable(Collections.singletonList(crossTrack));
        try {
            new ReferenceFieldBuilder(GLACIER, orbitsDir, new VelocityFieldLoader(grid), false, 30.0).build(table);
            fail("OrbitCorrException expected");
        } catch (OrbitCorrException expected) {
            assertTrue(expected.getMessage().contains("No repeat-track"));
        }
        assertFalse(Files.exists(ReferenceField.file(orbitsDir, GLACIER, OrbitCorrConstants.DX)));
    }

    @Test
    public void testUnreadableRecordIsSkipped() throws Exception {
        final List<VelocityFieldRecord> records = new ArrayList<>(createTable().getRecords());
        final VelocityFieldRecord missing = S2TestData.record(velocityDir, LocalDateTime.of(2020, 9, 1, 16, 0), "096",
                                                              LocalDateTime.of(2020, 9, 11, 16, 0), "096");
        records.add(missing);
        final ReferenceField reference = new ReferenceFieldBuilder(GLACIER, orbitsDir, new VelocityFieldLoader(grid),
                                                                   false, 30.0).build(new PairTable(records));
        assertEquals(3.5f, reference.getDx().get(0), 1e-5f);
    }

    private PairTable createTable() throws IOException {
        final List<VelocityFieldRecord> records = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            final LocalDateTime start = LocalDateTime.of(2020, 7, 1 + i, 16, 0);
            final VelocityFieldRecord record = S2TestData.record(velocityDir, start, "096", start.plusDays(10), "096");
            S2TestData.writeField(record, grid, i + 1.0f, 2.0f);
            records.add(record);
        }
        final LocalDateTime start = LocalDateTime.of(2020, 8, 1, 16, 0);
        final VelocityFieldRecord crossTrack = S2TestData.record(velocityDir, start, "096", start.plusDays(10), "053");
        S2TestData.writeField(crossTrack, grid, 100.0f, 100.0f);
        records.add(crossTrack);
        return new PairTable(records);
    }

    private List<byte[]> readOutputs() throws IOException {
        final List<byte[]> contents = new ArrayList<>();
        for (String component : new String[]{"dx", "dy", "dmag", "flowdir"}) {
            contents.add(Files.readAllBytes(ReferenceField.file(orbitsDir, GLACIER, component)));
        }
        return contents;
    }

    private static class CountingLoader extends VelocityFieldLoader {

        private int reads;

        CountingLoader(GridContext grid) {
            super(grid);
        }

        @Override
        protected FloatRaster readRaster(Path file, double... noDataValues) throws IOException {
            reads++;
            return super.readRaster(file, noDataValues);
        }
    }
}
