package org.esa.snap.orbitcorr.core.raster;

import org.junit.Test;

import java.lang.reflect.Modifier;

import static org.junit.Assert.*;

public class FloatRasterTest {

    private static final GridContext GRID = new GridContext(0.0, 30.0, 10.0, 10.0, 3, 3, 3413);

    @Test
    public void testCopyIsIndependent() {
        final FloatRaster raster = FloatRaster.filled(GRID, 2.0f);
        final FloatRaster copy = raster.copy();
        raster.set(1, 1, 5.0f);

        assertEquals(5.0f, raster.get(4), 0.0f);
        assertEquals(2.0f, copy.get(4), 0.0f);
        assertNotSame(raster.getData(), copy.getData());
    }

    @Test
    public void testBackingArrayIsNotPublic() throws Exception {
        assertFalse(Modifier.isPublic(FloatRaster.class.getDeclaredMethod("getData").getModifiers()));
    }

    @Test
    public void testCountValid() {
        final FloatRaster raster = new FloatRaster(GRID);
        assertEquals(0, raster.countValid());
        raster.set(0, 1.0f);
        raster.set(8, -9999.0f);
        assertEquals(2, raster.countValid());
        assertTrue(raster.isValid(8));
        assertFalse(raster.isValid(4));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDataLengthMustMatchGrid() {
        new FloatRaster(GRID, new float[8]);
    }
}
