package org.esa.snap.orbitcorr.s2.correction;

import org.esa.snap.orbitcorr.s2.orbits.OrbitPair;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Offsets per orbit pair together with the outcome of every pair that was considered.
 * A pair without offset is uncorrectable.
 */
public class OffsetTable {

    private final Map<OrbitPair, OffsetField> offsets = new TreeMap<>();
    private final Map<OrbitPair, OffsetOutcome> outcomes = new TreeMap<>();

    void put(OrbitPair pair, OffsetOutcome outcome, OffsetField offset) {
        outcomes.put(pair, outcome);
        if (offset != null) {
            offsets.put(pair, offset);
        }
    }

    public OffsetField get(OrbitPair pair) {
        return offsets.get(pair);
    }

    public boolean contains(OrbitPair pair) {
        return offsets.containsKey(pair);
    }

    public OffsetOutcome getOutcome(OrbitPair pair) {
        return outcomes.get(pair);
    }

    public Map<OrbitPair, OffsetOutcome> getOutcomes() {
        return Collections.unmodifiableMap(outcomes);
    }

    public int size() {
        return offsets.size();
    }
}
