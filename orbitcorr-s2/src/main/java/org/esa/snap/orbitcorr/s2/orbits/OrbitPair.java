package org.esa.snap.orbitcorr.s2.orbits;

import org.apache.commons.lang3.StringUtils;

import java.util.Objects;

/**
 * Ordered pair of the relative orbits of the two scenes of a velocity field, e.g. R096_R053.
 * An orbit that could not be resolved is null, making the pair undefined.
 */
public final class OrbitPair implements Comparable<OrbitPair> {

    private static final String UNDEFINED = "nan";

    private final String orbit1;
    private final String orbit2;

    public OrbitPair(String orbit1, String orbit2) {
        this.orbit1 = normalize(orbit1);
        this.orbit2 = normalize(orbit2);
    }

    /**
     * @param key - a key as returned by {@link #getKey()}
     */
    public static OrbitPair parse(String key) {
        final String[] parts = StringUtils.split(key, '_');
        if (parts == null || parts.length != 2 || !parts[0].startsWith("R") || !parts[1].startsWith("R")) {
            throw new IllegalArgumentException("Not an orbit pair key: '" + key + "'");
        }
        return new OrbitPair(parts[0].substring(1), parts[1].substring(1));
    }

    public String getOrbit1() {
        return orbit1;
    }

    public String getOrbit2() {
        return orbit2;
    }

    public boolean isDefined() {
        return orbit1 != null && orbit2 != null;
    }

    /**
     * @return true if both scenes were acquired from the same relative orbit
     */
    public boolean isRepeatTrack() {
        return isDefined() && orbit1.equals(orbit2);
    }

    public String getKey() {
        return "R" + (orbit1 == null ? UNDEFINED : orbit1) + "_R" + (orbit2 == null ? UNDEFINED : orbit2);
    }

    private static String normalize(String orbit) {
        if (StringUtils.isBlank(orbit) || UNDEFINED.equalsIgnoreCase(orbit.trim())) {
            return null;
        }
        return orbit.trim();
    }

    @Override
    public int compareTo(OrbitPair other) {
        return getKey().compareTo(other.getKey());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        OrbitPair that = (OrbitPair) o;
        return Objects.equals(orbit1, that.orbit1) && Objects.equals(orbit2, that.orbit2);
    }

    @Override
    public int hashCode() {
        return Objects.hash(orbit1, orbit2);
    }

    @Override
    public String toString() {
        return getKey();
    }
}
