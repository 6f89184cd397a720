package org.esa.snap.orbitcorr.s2.correction;

import org.esa.snap.orbitcorr.core.OrbitCorrConstants;
import org.esa.snap.orbitcorr.core.raster.FloatRaster;
import org.esa.snap.orbitcorr.s2.orbits.OrbitPair;

/**
 * Displacement-equivalent offset of one orbit pair relative to the reference field, per component.
 */
public class OffsetField {

    private final OrbitPair orbitPair;
    private final FloatRaster dx;
    private final FloatRaster dy;

    public OffsetField(OrbitPair orbitPair, FloatRaster dx, FloatRaster dy) {
        dx.getGrid().requireSameGrid(dy.getGrid());
        this.orbitPair = orbitPair;
        this.dx = dx;
        this.dy = dy;
    }

    public OrbitPair getOrbitPair() {
        return orbitPair;
    }

    public FloatRaster getDx() {
        return dx;
    }

    public FloatRaster getDy() {
        return dy;
    }

    public FloatRaster getComponent(String component) {
        if (OrbitCorrConstants.DX.equals(component)) {
            return dx;
        } else if (OrbitCorrConstants.DY.equals(component)) {
            return dy;
        }
        throw new IllegalArgumentException("No offset component " + component);
    }
}
