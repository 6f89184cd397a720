package org.esa.snap.orbitcorr.core.plot;

import org.esa.snap.orbitcorr.core.raster.FloatRaster;
import org.esa.snap.orbitcorr.core.raster.GridContext;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.Assert.*;

public class RasterQuicklookTest {

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    @Test
    public void testWritePngAndJpg() throws Exception {
        final GridContext grid = new GridContext(0.0, 100.0, 10.0, 10.0, 10, 10, 3413);
        final FloatRaster raster = new FloatRaster(grid);
        for (int i = 0; i < raster.size(); i++) {
            raster.set(i, i % 7 == 0 ? Float.NaN : i * 0.3f);
        }
        final RasterQuicklook quicklook = new RasterQuicklook(0.0, 30.0, "Velocity [m/d]");
        final Path png = temporaryFolder.getRoot().toPath().resolve("map.png");
        final Path jpg = temporaryFolder.getRoot().toPath().resolve("previews").resolve("map.jpg");
        quicklook.write(raster, "S2_001_alison", png);
        quicklook.write(raster, "S2_001_alison", jpg);

        final BufferedImage image = ImageIO.read(png.toFile());
        assertNotNull(image);
        assertTrue(image.getWidth() > 200);
        assertNotNull(ImageIO.read(jpg.toFile()));
    }

    @Test
    public void testTurboEnds() {
        final int low = RasterQuicklook.turbo(0.1);
        final int high = RasterQuicklook.turbo(1.0);
        // blue at the low end, red at the high end
        assertTrue((low & 0xff) > ((low >> 16) & 0xff));
        assertTrue(((high >> 16) & 0xff) > (high & 0xff));
        assertEquals(RasterQuicklook.turbo(0.0), RasterQuicklook.turbo(-5.0));
        assertEquals(high, RasterQuicklook.turbo(3.0));
    }

    @Test
    public void testBarChart() throws Exception {
        final Map<String, Integer> counts = new LinkedHashMap<>();
        counts.put("R025_R025", 12);
        counts.put("R068_R025", 3);
        final Path file = temporaryFolder.getRoot().toPath().resolve("orbits.png");
        new BarChart("Orbit pairs", "Count").write(counts, file);
        assertNotNull(ImageIO.read(file.toFile()));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidRange() {
        new RasterQuicklook(10.0, 10.0, "");
    }
}
