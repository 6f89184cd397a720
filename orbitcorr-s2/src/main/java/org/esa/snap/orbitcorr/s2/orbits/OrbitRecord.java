package org.esa.snap.orbitcorr.s2.orbits;

import org.esa.snap.orbitcorr.core.OrbitCorrException;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Orbit metadata of one clipped Sentinel-2 mosaic, parsed from a file name like
 * {@code S2B_MSIL2A_20200716T162839_N0214_R083.tif}.
 */
public final class OrbitRecord {

    static final DateTimeFormatter DATE_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss");

    private static final Pattern DATE_TIME_PATTERN = Pattern.compile("(\\d{8}\\D\\d{6})");
    private static final String ORBIT_MARKER = "_R";
    private static final String BASELINE_MARKER = "_N";
    private static final int ORBIT_LENGTH = 3;
    private static final int BASELINE_LENGTH = 4;

    private final String dateHour;
    private final LocalDateTime dateTime;
    private final String satellite;
    private final String orbit;
    private final String processingBaseline;

    public OrbitRecord(String dateHour, LocalDateTime dateTime, String satellite, String orbit,
                       String processingBaseline) {
        this.dateHour = dateHour;
        this.dateTime = dateTime;
        this.satellite = satellite;
        this.orbit = orbit;
        this.processingBaseline = processingBaseline;
    }

    /**
     * Parses the orbit metadata from a mosaic file name.
     *
     * @param fileName - the file name, without directory
     * @return the record
     * @throws OrbitCorrException if the name does not follow the naming convention
     */
    public static OrbitRecord parse(String fileName) {
        final Matcher matcher = DATE_TIME_PATTERN.matcher(fileName);
        if (fileName.length() < 3 || !matcher.find()) {
            throw new OrbitCorrException("Cannot parse acquisition time from image name '" + fileName + "'");
        }
        final String dateTimeString = matcher.group(1);
        final LocalDateTime dateTime;
        try {
            dateTime = LocalDateTime.parse(dateTimeString.substring(0, 8) + "T" + dateTimeString.substring(9),
                                           DATE_TIME_FORMAT);
        } catch (DateTimeParseException e) {
            throw new OrbitCorrException("Invalid acquisition time in image name '" + fileName + "'", e);
        }
        return new OrbitRecord(dateTimeString.substring(0, 11), dateTime, fileName.substring(0, 3),
                               tokenAfter(fileName, ORBIT_MARKER, ORBIT_LENGTH),
                               tokenAfter(fileName, BASELINE_MARKER, BASELINE_LENGTH));
    }

    private static String tokenAfter(String fileName, String marker, int length) {
        final int index = fileName.indexOf(marker);
        if (index < 0 || index + marker.length() + length > fileName.length()) {
            throw new OrbitCorrException("Cannot find '" + marker + "' token in image name '" + fileName + "'");
        }
        return fileName.substring(index + marker.length(), index + marker.length() + length);
    }

    /**
     * @return acquisition date and hour, YYYYMMDDTHH
     */
    public String getDateHour() {
        return dateHour;
    }

    public LocalDateTime getDateTime() {
        return dateTime;
    }

    public String getSatellite() {
        return satellite;
    }

    /**
     * @return the relative orbit, e.g. 083
     */
    public String getOrbit() {
        return orbit;
    }

    /**
     * @return the PDGS processing baseline, e.g. 0214
     */
    public String getProcessingBaseline() {
        return processingBaseline;
    }

    @Override
    public String toString() {
        return satellite + " " + dateTime.format(DATE_TIME_FORMAT) + " R" + orbit + " N" + processingBaseline;
    }
}
