package org.esa.snap.orbitcorr.s2.correction;

/**
 * What happened to one orbit pair while building the {@link OffsetTable}.
 */
public enum OffsetOutcome {
    COMPUTED,
    LOADED,
    SKIPPED_BELOW_THRESHOLD,
    SKIPPED_NO_DATA;

    public boolean hasOffset() {
        return this == COMPUTED || this == LOADED;
    }
}
