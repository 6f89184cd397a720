package org.esa.snap.orbitcorr.s2.orbits;

import org.esa.snap.orbitcorr.core.OrbitCorrException;
import org.esa.snap.orbitcorr.core.config.DateRange;
import org.esa.snap.orbitcorr.core.util.OrbitCorrUtils;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Orbit metadata of all clipped mosaics of a glacier within a date range, keyed by acquisition date-hour.
 */
public class OrbitCatalog {

    static final String CSV_HEADER = "datetime,datehour,satellite,orbits,processing_baselines";

    private final List<OrbitRecord> records;
    private final Map<String, OrbitRecord> byDateHour;

    OrbitCatalog(List<OrbitRecord> records) {
        this.records = Collections.unmodifiableList(records);
        this.byDateHour = new LinkedHashMap<>();
        for (OrbitRecord record : records) {
            // several mosaics within one hour share the orbit, the first one is kept
            byDateHour.putIfAbsent(record.getDateHour(), record);
        }
    }

    /**
     * Builds the catalog from the {@code S2*.tif} mosaics of a directory.
     *
     * @param clippedDir - directory of the clipped mosaics
     * @param range      - only days strictly after its start and strictly before its end are kept
     * @return the catalog, sorted by acquisition time
     * @throws OrbitCorrException if a file name cannot be parsed, the directory cannot be listed or no mosaic is in range
     */
    public static OrbitCatalog fromDirectory(Path clippedDir, DateRange range) {
        final List<String> fileNames = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(clippedDir, "S2*.tif")) {
            for (Path file : stream) {
                fileNames.add(file.getFileName().toString());
            }
        } catch (IOException e) {
            throw new OrbitCorrException("Cannot list clipped mosaics in " + clippedDir, e);
        }
        return fromFileNames(fileNames, range);
    }

    public static OrbitCatalog fromFileNames(List<String> fileNames, DateRange range) {
        final List<OrbitRecord> records = new ArrayList<>();
        for (String fileName : fileNames) {
            final OrbitRecord record = OrbitRecord.parse(fileName);
            final LocalDate day = record.getDateTime().toLocalDate();
            if (day.isAfter(range.getStart()) && day.isBefore(range.getEnd())) {
                records.add(record);
            }
        }
        if (records.isEmpty()) {
            throw new OrbitCorrException("No clipped mosaic within " + range + " (" + fileNames.size() + " images found)");
        }
        records.sort(Comparator.comparing(OrbitRecord::getDateTime));
        OrbitCorrUtils.info("Orbit catalog: " + records.size() + " of " + fileNames.size() + " images within " + range);
        return new OrbitCatalog(records);
    }

    /**
     * @return the record of the given date-hour, or null if no mosaic of that hour is in the catalog
     */
    public OrbitRecord get(String dateHour) {
        return byDateHour.get(dateHour);
    }

    public boolean contains(String dateHour) {
        return byDateHour.containsKey(dateHour);
    }

    public List<OrbitRecord> getRecords() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public void writeCsv(Path file) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writer.write(CSV_HEADER);
            writer.newLine();
            for (OrbitRecord record : records) {
                writer.write(String.join(",",
                                         record.getDateTime().format(OrbitRecord.DATE_TIME_FORMAT),
                                         record.getDateHour(),
                                         record.getSatellite(),
                                         record.getOrbit(),
                                         record.getProcessingBaseline()));
                writer.newLine();
            }
        }
    }
}
