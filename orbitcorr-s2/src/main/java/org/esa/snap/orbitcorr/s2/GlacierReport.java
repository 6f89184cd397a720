package org.esa.snap.orbitcorr.s2;

import org.esa.snap.orbitcorr.core.config.DateRange;
import org.esa.snap.orbitcorr.s2.correction.CorrectionOutcome;
import org.esa.snap.orbitcorr.s2.correction.OffsetOutcome;
import org.esa.snap.orbitcorr.s2.orbits.OrbitPair;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Result of processing one glacier over one date range.
 */
public class GlacierReport {

    private final String glacier;
    private final DateRange range;
    private final Map<OrbitPair, OffsetOutcome> offsetOutcomes;
    private final List<CorrectionOutcome> correctionOutcomes;
    private final String errorMessage;

    private GlacierReport(String glacier, DateRange range, Map<OrbitPair, OffsetOutcome> offsetOutcomes,
                          List<CorrectionOutcome> correctionOutcomes, String errorMessage) {
        this.glacier = glacier;
        this.range = range;
        this.offsetOutcomes = offsetOutcomes;
        this.correctionOutcomes = correctionOutcomes;
        this.errorMessage = errorMessage;
    }

    static GlacierReport succeeded(String glacier, DateRange range, Map<OrbitPair, OffsetOutcome> offsetOutcomes,
                                   List<CorrectionOutcome> correctionOutcomes) {
        return new GlacierReport(glacier, range, offsetOutcomes, correctionOutcomes, null);
    }

    static GlacierReport failed(String glacier, DateRange range, String errorMessage) {
        return new GlacierReport(glacier, range, Collections.<OrbitPair, OffsetOutcome>emptyMap(),
                                 Collections.<CorrectionOutcome>emptyList(), errorMessage);
    }

    public String getGlacier() {
        return glacier;
    }

    public DateRange getRange() {
        return range;
    }

    public boolean isFailed() {
        return errorMessage != null;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Map<OrbitPair, OffsetOutcome> getOffsetOutcomes() {
        return offsetOutcomes;
    }

    public List<CorrectionOutcome> getCorrectionOutcomes() {
        return correctionOutcomes;
    }

    public Map<CorrectionOutcome.Status, Integer> countByStatus() {
        final Map<CorrectionOutcome.Status, Integer> counts = new EnumMap<>(CorrectionOutcome.Status.class);
        for (CorrectionOutcome outcome : correctionOutcomes) {
            counts.merge(outcome.getStatus(), 1, Integer::sum);
        }
        return counts;
    }

    @Override
    public String toString() {
        if (isFailed()) {
            return glacier + " [" + range + "]: FAILED - " + errorMessage;
        }
        return glacier + " [" + range + "]: " + countByStatus();
    }
}
