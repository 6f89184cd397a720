package org.esa.snap.orbitcorr.s2.correction;

import org.esa.snap.orbitcorr.core.OrbitCorrConstants;
import org.esa.snap.orbitcorr.core.raster.FloatRaster;
import org.esa.snap.orbitcorr.core.raster.GeoTiffIO;
import org.esa.snap.orbitcorr.core.raster.GridContext;
import org.esa.snap.orbitcorr.s2.S2TestData;
import org.esa.snap.orbitcorr.s2.orbits.VelocityFieldRecord;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;

import static org.junit.Assert.*;

public class VelocityFieldLoaderTest {

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    private GridContext grid;
    private VelocityFieldRecord record;

    @Before
    public void setUp() throws Exception {
        grid = S2TestData.grid(3, 3);
        final Path velocityDir = temporaryFolder.newFolder("velocities").toPath();
        record = S2TestData.record(velocityDir, LocalDateTime.of(2020, 7, 6, 16, 0), "096",
                                   LocalDateTime.of(2020, 7, 16, 16, 0), "096");
    }

    @Test
    public void testLoadTreatsZeroAsNoData() throws Exception {
        final FloatRaster dx = FloatRaster.filled(grid, 1.5f);
        dx.set(4, 0.0f);
        dx.set(5, -9999.0f);
        S2TestData.writeField(record, dx, FloatRaster.filled(grid, 2.0f));

        final FloatRaster loaded = new VelocityFieldLoader(grid).load(record, OrbitCorrConstants.DX, false);
        assertTrue(grid.isSameGrid(loaded.getGrid()));
        assertEquals(1.5f, loaded.get(0), 1e-6f);
        assertTrue(Float.isNaN(loaded.get(4)));
        assertTrue(Float.isNaN(loaded.get(5)));
        assertEquals(7, loaded.countValid());
    }

    @Test
    public void testLoadAppliesValidityMask() throws Exception {
        S2TestData.writeField(record, grid, 1.5f, 2.0f);
        final FloatRaster mask = FloatRaster.filled(grid, 1.0f);
        mask.set(0, 0.0f);
        GeoTiffIO.writeFloat(mask, record.getSourceDir().resolve(record.getId() + "_mask.tif"));

        final VelocityFieldLoader loader = new VelocityFieldLoader(grid);
        assertTrue(Float.isNaN(loader.load(record, OrbitCorrConstants.DX, false).get(0)));
        assertTrue(Float.isNaN(loader.load(record, OrbitCorrConstants.DY, false).get(0)));
        assertEquals(2.0f, loader.load(record, OrbitCorrConstants.DY, false).get(1), 1e-6f);
    }

    @Test
    public void testDespeckle() throws Exception {
        final FloatRaster dx = FloatRaster.filled(grid, 1.0f);
        dx.set(4, 50.0f);
        S2TestData.writeField(record, dx, FloatRaster.filled(grid, 1.0f));

        final VelocityFieldLoader loader = new VelocityFieldLoader(grid);
        assertEquals(50.0f, loader.load(record, OrbitCorrConstants.DX, false).get(4), 1e-6f);
        assertEquals(1.0f, loader.load(record, OrbitCorrConstants.DX, true).get(4), 1e-6f);
    }

    @Test(expected = NoOverlapException.class)
    public void testNoOverlap() throws Exception {
        S2TestData.writeField(record, grid, 1.5f, 2.0f);
        final GridContext elsewhere = new GridContext(500000.0, 0.0, 100.0, 100.0, 3, 3, S2TestData.EPSG);
        new VelocityFieldLoader(elsewhere).load(record, OrbitCorrConstants.DX, false);
    }

    @Test(expected = NoSuchFileException.class)
    public void testMissingComponent() throws Exception {
        S2TestData.writeField(record, grid, 1.5f, 2.0f);
        VelocityFieldLoader.findComponentFile(record.getSourceDir(), "vx");
    }

    @Test
    public void testFindMaskFile() {
        assertEquals(Paths.get("dir", "vmap_a_b_mask.tif"), VelocityFieldLoader.findMaskFile(Paths.get("dir", "vmap_a_b_dx.tif")));
        assertEquals(Paths.get("dir", "dx_mask.tif"), VelocityFieldLoader.findMaskFile(Paths.get("dir", "dx.tif")));
    }
}
