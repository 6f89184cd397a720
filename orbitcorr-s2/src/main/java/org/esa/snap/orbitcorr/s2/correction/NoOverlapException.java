package org.esa.snap.orbitcorr.s2.correction;

import java.io.IOException;

/**
 * Thrown when a source raster does not overlap the working grid of a glacier.
 */
public class NoOverlapException extends IOException {

    public NoOverlapException(String message) {
        super(message);
    }
}
