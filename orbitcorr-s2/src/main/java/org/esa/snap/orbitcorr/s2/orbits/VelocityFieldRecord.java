package org.esa.snap.orbitcorr.s2.orbits;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * One quality-accepted velocity field joined with the orbit metadata of its two scenes.
 * Ids look like {@code vmap_S2A_MSIL2A_20200716T16_S2B_MSIL2A_20200726T16}.
 */
public final class VelocityFieldRecord {

    private static final double SECONDS_PER_DAY = 86400.0;

    private final String id;
    private final Path sourceDir;
    private final String dateHour1;
    private final String dateHour2;
    private final LocalDateTime dateTime1;
    private final LocalDateTime dateTime2;
    private final String satellite1;
    private final String satellite2;
    private final String sourceProduct;
    private final OrbitPair orbitPair;
    private final String processingBaseline1;
    private final String processingBaseline2;

    public VelocityFieldRecord(String id, Path sourceDir, OrbitRecord scene1, OrbitRecord scene2) {
        this.id = id;
        this.sourceDir = sourceDir;
        this.dateHour1 = scene1.getDateHour();
        this.dateHour2 = scene2.getDateHour();
        this.dateTime1 = scene1.getDateTime();
        this.dateTime2 = scene2.getDateTime();
        final String[] idParts = id.split("_");
        this.satellite1 = idParts.length > 1 ? idParts[1] : scene1.getSatellite();
        this.sourceProduct = idParts.length > 2 ? idParts[2] : "";
        this.satellite2 = idParts.length > 4 ? idParts[4] : scene2.getSatellite();
        this.orbitPair = new OrbitPair(scene1.getOrbit(), scene2.getOrbit());
        this.processingBaseline1 = scene1.getProcessingBaseline();
        this.processingBaseline2 = scene2.getProcessingBaseline();
    }

    public String getId() {
        return id;
    }

    public Path getSourceDir() {
        return sourceDir;
    }

    public String getDateHour1() {
        return dateHour1;
    }

    public String getDateHour2() {
        return dateHour2;
    }

    public LocalDateTime getDateTime1() {
        return dateTime1;
    }

    public LocalDateTime getDateTime2() {
        return dateTime2;
    }

    /**
     * @return signed time from the first to the second scene, in fractional days
     */
    public double getDaySeparation() {
        return Duration.between(dateTime1, dateTime2).getSeconds() / SECONDS_PER_DAY;
    }

    public LocalDateTime getMidpoint() {
        return dateTime1.plusSeconds(Duration.between(dateTime1, dateTime2).getSeconds() / 2);
    }

    /**
     * @return temporal baseline in days
     */
    public double getBaseline() {
        return Math.abs(getDaySeparation());
    }

    /**
     * @return days from the midpoint to the second scene
     */
    public double getHalfBaseline() {
        return Duration.between(getMidpoint(), dateTime2).getSeconds() / SECONDS_PER_DAY;
    }

    public int getYear() {
        return Integer.parseInt(dateHour1.substring(0, 4));
    }

    public String getSatellite1() {
        return satellite1;
    }

    public String getSatellite2() {
        return satellite2;
    }

    public String getSourceProduct() {
        return sourceProduct;
    }

    public OrbitPair getOrbitPair() {
        return orbitPair;
    }

    public boolean isRepeatTrack() {
        return orbitPair.isRepeatTrack();
    }

    public String getProcessingBaseline1() {
        return processingBaseline1;
    }

    public String getProcessingBaseline2() {
        return processingBaseline2;
    }

    @Override
    public String toString() {
        return id + " (" + orbitPair + ")";
    }
}
