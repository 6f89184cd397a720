package org.esa.snap.orbitcorr.s2.correction;

import org.esa.snap.orbitcorr.s2.orbits.OrbitPair;

/**
 * Terminal state of one velocity field record in the {@link FieldCorrector}.
 */
public class CorrectionOutcome {

    public enum Status {
        CORRECTED,
        ALREADY_CORRECTED,
        SKIPPED_NO_OFFSET,
        SKIPPED_INSUFFICIENT_COVERAGE,
        SKIPPED_UNREADABLE_SOURCE,
        SKIPPED_NO_OVERLAP
    }

    private final String recordId;
    private final String outputId;
    private final OrbitPair orbitPair;
    private final Status status;
    private final String reason;

    CorrectionOutcome(String recordId, String outputId, OrbitPair orbitPair, Status status, String reason) {
        this.recordId = recordId;
        this.outputId = outputId;
        this.orbitPair = orbitPair;
        this.status = status;
        this.reason = reason;
    }

    public String getRecordId() {
        return recordId;
    }

    public String getOutputId() {
        return outputId;
    }

    public OrbitPair getOrbitPair() {
        return orbitPair;
    }

    public Status getStatus() {
        return status;
    }

    public String getReason() {
        return reason;
    }

    public boolean isSkipped() {
        return status != Status.CORRECTED && status != Status.ALREADY_CORRECTED;
    }

    @Override
    public String toString() {
        return recordId + " (" + orbitPair.getKey() + "): " + status + (reason != null ? " - " + reason : "");
    }
}
