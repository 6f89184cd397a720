package org.esa.snap.orbitcorr.s2.orbits;

import org.esa.snap.orbitcorr.core.OrbitCorrConstants;
import org.esa.snap.orbitcorr.core.OrbitCorrException;
import org.esa.snap.orbitcorr.core.config.DateRange;
import org.esa.snap.orbitcorr.core.plot.BarChart;
import org.esa.snap.orbitcorr.core.util.OrbitCorrUtils;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.StringTokenizer;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.regex.Matcher;

/**
 * Velocity field records of one glacier: the ids listed in the yearly QA manifests ({@code list_good_20YY.txt},
 * tab separated id and two filter ratios) joined with the {@link OrbitCatalog}.
 */
public class PairTable {

    static final String CSV_HEADER = "id,dir,date1,date2,datetime_1,datetime_2,day_sep,year,midpoint,baseline," +
            "halfbaseline,orbit1,processingbaseline1,orbit2,processingbaseline2,orbit_pair,orbit_match";

    private static final DateTimeFormatter CSV_DATE_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final DateTimeFormatter DATE_HOUR_FORMAT = DateTimeFormatter.ofPattern("yyyyMMddHH");

    private final List<VelocityFieldRecord> records;

    public PairTable(List<VelocityFieldRecord> records) {
        this.records = Collections.unmodifiableList(records);
    }

    /**
     * Builds the table from the manifests in the velocity directory of a glacier.
     * Velocity fields are expected in sub directories named by their id.
     *
     * @param velocityDir - directory holding the manifests and velocity field directories
     * @param catalog     - orbit metadata of the glacier's mosaics
     * @param range       - fields with a first scene before the start or a second scene after the end are dropped
     * @return the table
     * @throws OrbitCorrException if there is no non-empty manifest
     */
    public static PairTable fromManifests(Path velocityDir, OrbitCatalog catalog, DateRange range) {
        final Set<String> ids = readManifestIds(velocityDir);
        final List<VelocityFieldRecord> records = new ArrayList<>();
        int outOfRange = 0;
        int notInCatalog = 0;
        for (String id : ids) {
            final Matcher matcher = OrbitCorrConstants.DATE_HOUR_PATTERN.matcher(id);
            final List<String> dateHours = new ArrayList<>();
            while (matcher.find()) {
                dateHours.add(matcher.group(1));
            }
            if (dateHours.size() < 2) {
                OrbitCorrUtils.LOG.warning("Skipping velocity field " + id + ": cannot find two acquisition date-hours");
                continue;
            }
            final LocalDate day1 = parseDateHour(dateHours.get(0)).toLocalDate();
            final LocalDate day2 = parseDateHour(dateHours.get(1)).toLocalDate();
            if (day1.isBefore(range.getStart()) || day2.isAfter(range.getEnd())) {
                outOfRange++;
                continue;
            }
            final String dateHour1 = catalogKey(dateHours.get(0));
            final String dateHour2 = catalogKey(dateHours.get(1));
            if (!catalog.contains(dateHour1) || !catalog.contains(dateHour2)) {
                notInCatalog++;
                continue;
            }
            records.add(new VelocityFieldRecord(id, velocityDir.resolve(id),
                                                catalog.get(dateHour1), catalog.get(dateHour2)));
        }
        records.sort(Comparator.comparing(VelocityFieldRecord::getDateTime1).thenComparing(VelocityFieldRecord::getId));
        OrbitCorrUtils.info("Pair table: " + records.size() + " of " + ids.size() + " accepted velocity fields, " +
                                    outOfRange + " outside " + range + ", " + notInCatalog + " without catalog scene");
        return new PairTable(records);
    }

    /**
     * Reads the velocity field ids of all non-empty manifests, each id once.
     */
    static Set<String> readManifestIds(Path velocityDir) {
        final List<Path> manifests = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(velocityDir, "list_good_20*.txt")) {
            for (Path manifest : stream) {
                if (OrbitCorrConstants.QA_MANIFEST_PATTERN.matcher(manifest.getFileName().toString()).matches()) {
                    manifests.add(manifest);
                }
            }
        } catch (IOException e) {
            throw new OrbitCorrException("Cannot list QA manifests in " + velocityDir, e);
        }
        Collections.sort(manifests);

        final Set<String> ids = new LinkedHashSet<>();
        int usable = 0;
        for (Path manifest : manifests) {
            final List<String> manifestIds;
            try {
                manifestIds = readManifest(manifest);
            } catch (IOException e) {
                OrbitCorrUtils.LOG.log(Level.WARNING, "Skipping unreadable QA manifest " + manifest, e);
                continue;
            }
            if (manifestIds.isEmpty()) {
                OrbitCorrUtils.LOG.info("Skipping empty QA manifest " + manifest);
                continue;
            }
            usable++;
            ids.addAll(manifestIds);
        }
        if (usable == 0) {
            throw new OrbitCorrException("No non-empty QA manifest in " + velocityDir);
        }
        return ids;
    }

    private static List<String> readManifest(Path manifest) throws IOException {
        final List<String> ids = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(manifest, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                final StringTokenizer st = new StringTokenizer(line, "\t");
                if (st.hasMoreTokens()) {
                    final String id = st.nextToken().trim();
                    if (!id.isEmpty()) {
                        ids.add(id);
                    }
                }
            }
        }
        return ids;
    }

    private static String catalogKey(String dateHour) {
        return dateHour.substring(0, 8) + "T" + dateHour.substring(9, 11);
    }

    private static LocalDateTime parseDateHour(String dateHour) {
        return LocalDateTime.parse(dateHour.substring(0, 8) + dateHour.substring(9, 11), DATE_HOUR_FORMAT);
    }

    public List<VelocityFieldRecord> getRecords() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public List<VelocityFieldRecord> getRepeatTrackRecords() {
        final List<VelocityFieldRecord> repeatTrack = new ArrayList<>();
        for (VelocityFieldRecord record : records) {
            if (record.isRepeatTrack()) {
                repeatTrack.add(record);
            }
        }
        return repeatTrack;
    }

    public List<VelocityFieldRecord> getRecords(OrbitPair pair) {
        final List<VelocityFieldRecord> pairRecords = new ArrayList<>();
        for (VelocityFieldRecord record : records) {
            if (record.getOrbitPair().equals(pair)) {
                pairRecords.add(record);
            }
        }
        return pairRecords;
    }

    /**
     * @return the distinct orbit pairs with both orbits resolved, sorted by key
     */
    public Set<OrbitPair> getDefinedOrbitPairs() {
        final Set<OrbitPair> pairs = new TreeSet<>();
        for (VelocityFieldRecord record : records) {
            if (record.getOrbitPair().isDefined()) {
                pairs.add(record.getOrbitPair());
            }
        }
        return pairs;
    }

    /**
     * @return number of records per orbit pair key, sorted by key
     */
    public Map<String, Integer> countByOrbitPair() {
        final Map<String, Integer> counts = new TreeMap<>();
        for (VelocityFieldRecord record : records) {
            counts.merge(record.getOrbitPair().getKey(), 1, Integer::sum);
        }
        return counts;
    }

    public void writeCsv(Path file) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writer.write(CSV_HEADER);
            writer.newLine();
            for (VelocityFieldRecord r : records) {
                writer.write(String.join(",",
                                         r.getId(),
                                         r.getSourceDir().toString(),
                                         r.getDateHour1(),
                                         r.getDateHour2(),
                                         r.getDateTime1().format(CSV_DATE_TIME_FORMAT),
                                         r.getDateTime2().format(CSV_DATE_TIME_FORMAT),
                                         formatDays(r.getDaySeparation()),
                                         String.valueOf(r.getYear()),
                                         r.getMidpoint().format(CSV_DATE_TIME_FORMAT),
                                         formatDays(r.getBaseline()),
                                         formatDays(r.getHalfBaseline()),
                                         nullToEmpty(r.getOrbitPair().getOrbit1()),
                                         r.getProcessingBaseline1(),
                                         nullToEmpty(r.getOrbitPair().getOrbit2()),
                                         r.getProcessingBaseline2(),
                                         r.getOrbitPair().getKey(),
                                         r.isRepeatTrack() ? "1" : "0"));
                writer.newLine();
            }
        }
    }

    public void writeBarChart(Path file) throws IOException {
        new BarChart("Orbital pairing", "Count").write(countByOrbitPair(), file);
    }

    private static String formatDays(double days) {
        return String.format(Locale.ENGLISH, "%.6f", days);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
