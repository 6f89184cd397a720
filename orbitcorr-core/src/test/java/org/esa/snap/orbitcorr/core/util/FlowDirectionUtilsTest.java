package org.esa.snap.orbitcorr.core.util;

import org.esa.snap.orbitcorr.core.raster.FloatRaster;
import org.esa.snap.orbitcorr.core.raster.GridContext;
import org.junit.Test;

import static org.junit.Assert.*;

public class FlowDirectionUtilsTest {

    @Test
    public void testComputeFlowDirectionQuadrants() {
        assertEquals(45.0, FlowDirectionUtils.computeFlowDirection(1.0, 1.0), 1.0e-9);
        assertEquals(-45.0, FlowDirectionUtils.computeFlowDirection(1.0, -1.0), 1.0e-9);
        assertEquals(135.0, FlowDirectionUtils.computeFlowDirection(-1.0, 1.0), 1.0e-9);
        assertEquals(-135.0, FlowDirectionUtils.computeFlowDirection(-1.0, -1.0), 1.0e-9);
        assertEquals(0.0, FlowDirectionUtils.computeFlowDirection(2.0, 0.0), 1.0e-9);
        assertEquals(180.0, FlowDirectionUtils.computeFlowDirection(-2.0, 0.0), 1.0e-9);
    }

    @Test
    public void testComputeFlowDirectionIsWithinHalfOpenRange() {
        for (double a = -179.5; a <= 180.0; a += 0.5) {
            final double rad = Math.toRadians(a);
            final double direction = FlowDirectionUtils.computeFlowDirection(Math.cos(rad), Math.sin(rad));
            assertTrue(direction > -180.0 && direction <= 180.0);
            assertEquals(a, direction, 1.0e-6);
        }
    }

    @Test
    public void testComputeFlowDirectionNaN() {
        assertTrue(Double.isNaN(FlowDirectionUtils.computeFlowDirection(Double.NaN, 1.0)));
        assertTrue(Double.isNaN(FlowDirectionUtils.computeFlowDirection(1.0, Double.NaN)));
        assertTrue(Double.isNaN(FlowDirectionUtils.computeFlowDirection(0.0, 0.0)));
    }

    @Test
    public void testComputeAngularDifferenceWrapsAround() {
        assertEquals(2.0, FlowDirectionUtils.computeAngularDifference(179.0, -179.0), 1.0e-9);
        assertEquals(2.0, FlowDirectionUtils.computeAngularDifference(-179.0, 179.0), 1.0e-9);
        assertEquals(30.0, FlowDirectionUtils.computeAngularDifference(10.0, -20.0), 1.0e-9);
        assertEquals(180.0, FlowDirectionUtils.computeAngularDifference(90.0, -90.0), 1.0e-9);
        assertTrue(Double.isNaN(FlowDirectionUtils.computeAngularDifference(Double.NaN, 10.0)));
    }

    @Test
    public void testComputeFlowDirectionRaster() {
        final GridContext grid = new GridContext(0.0, 20.0, 10.0, 10.0, 2, 1, 3413);
        final FloatRaster dx = new FloatRaster(grid, new float[]{1.0f, -1.0f});
        final FloatRaster dy = new FloatRaster(grid, new float[]{0.0f, -1.0f});
        final FloatRaster direction = FlowDirectionUtils.computeFlowDirection(dx, dy);
        assertEquals(0.0f, direction.get(0), 1.0e-5f);
        assertEquals(-135.0f, direction.get(1), 1.0e-5f);
    }
}
