package org.esa.snap.orbitcorr.core.raster;

import org.esa.snap.orbitcorr.core.OrbitCorrConstants;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.*;

public class GeoTiffIOTest {

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    private final GridContext grid = new GridContext(-200000.0, -2100000.0, 100.0, 100.0, 3, 2, 3413);

    @Test
    public void testWriteAndReadFloat() throws Exception {
        final FloatRaster raster = new FloatRaster(grid, new float[]{1.5f, -2.25f, Float.NaN, 0.0f, 4.0f, 100.0f});
        final Path file = temporaryFolder.getRoot().toPath().resolve("sub").resolve("field_dx.tif");
        GeoTiffIO.writeFloat(raster, file);
        assertTrue(Files.isRegularFile(file));

        final FloatRaster plain = GeoTiffIO.read(file);
        assertTrue(grid.isSameGrid(plain.getGrid()));
        assertEquals(3413, plain.getGrid().getEpsg());
        assertEquals(1.5f, plain.get(0, 0), 0.0f);
        assertEquals(-2.25f, plain.get(1, 0), 0.0f);
        assertEquals(OrbitCorrConstants.NO_DATA_VALUE, plain.get(2, 0), 0.0f);
        assertEquals(100.0f, plain.get(2, 1), 0.0f);

        final FloatRaster withNoData = GeoTiffIO.read(file, OrbitCorrConstants.RAW_NO_DATA_VALUES);
        assertTrue(Float.isNaN(withNoData.get(2, 0)));
        assertTrue(Float.isNaN(withNoData.get(0, 1)));
        assertEquals(4.0f, withNoData.get(1, 1), 0.0f);
    }

    @Test
    public void testWriteAndReadByte() throws Exception {
        final FloatRaster mask = new FloatRaster(grid, new float[]{1, 0, 1, Float.NaN, 1, 0});
        final Path file = temporaryFolder.getRoot().toPath().resolve("mask_ice.tif");
        GeoTiffIO.writeByte(mask, file);

        final FloatRaster read = GeoTiffIO.read(file);
        assertArrayEquals(new float[]{1, 0, 1, 0, 1, 0}, read.getData(), 0.0f);
        assertTrue(grid.isSameGrid(GeoTiffIO.readGrid(file)));
    }

    @Test(expected = IOException.class)
    public void testReadMissingFile() throws Exception {
        GeoTiffIO.read(temporaryFolder.getRoot().toPath().resolve("missing.tif"));
    }

    @Test(expected = IOException.class)
    public void testReadCorruptFile() throws Exception {
        final Path file = temporaryFolder.newFile("corrupt.tif").toPath();
        Files.write(file, "not a tiff".getBytes());
        GeoTiffIO.read(file);
    }
}
