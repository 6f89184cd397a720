package org.esa.snap.orbitcorr.s2.correction;

import org.esa.snap.orbitcorr.core.OrbitCorrConstants;
import org.esa.snap.orbitcorr.core.OrbitCorrException;
import org.esa.snap.orbitcorr.core.plot.RasterQuicklook;
import org.esa.snap.orbitcorr.core.raster.FloatRaster;
import org.esa.snap.orbitcorr.core.raster.GeoTiffIO;
import org.esa.snap.orbitcorr.core.raster.GridContext;
import org.esa.snap.orbitcorr.core.raster.RasterMath;
import org.esa.snap.orbitcorr.core.raster.Resampler;
import org.esa.snap.orbitcorr.core.raster.Resampling;
import org.esa.snap.orbitcorr.core.util.OrbitCorrUtils;
import org.esa.snap.orbitcorr.s2.orbits.OrbitPair;
import org.esa.snap.orbitcorr.s2.orbits.PairTable;
import org.esa.snap.orbitcorr.s2.orbits.VelocityFieldRecord;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Computes per orbit pair the median of {@code (reference - raw) * day separation} for dx and dy and persists
 * it as {@code <glacier>_median_offset_<pair>_{dx,dy}.tif}. Pairs with fewer records than the threshold get no offset.
 */
public class OffsetTableBuilder {

    private static final String[] COMPONENTS = {OrbitCorrConstants.DX, OrbitCorrConstants.DY};

    private final String glacier;
    private final Path outputDir;
    private final VelocityFieldLoader loader;
    private final int minPairCount;
    private final boolean despeckle;
    private final double quicklookVmax;

    public OffsetTableBuilder(String glacier, Path outputDir, VelocityFieldLoader loader,
                              int minPairCount, boolean despeckle, double quicklookVmax) {
        this.glacier = glacier;
        this.outputDir = outputDir;
        this.loader = loader;
        this.minPairCount = minPairCount;
        this.despeckle = despeckle;
        this.quicklookVmax = quicklookVmax;
    }

    public OffsetTable build(PairTable pairTable) {
        final OffsetTable table = new OffsetTable();
        final FloatRaster[] reference = readReference();
        for (OrbitPair pair : pairTable.getDefinedOrbitPairs()) {
            final List<VelocityFieldRecord> records = pairTable.getRecords(pair);
            if (records.size() < minPairCount) {
                OrbitCorrUtils.info("Insufficient velocity fields to construct median. " + pair.getKey() + " has " +
                                            records.size() + " pairs, threshold set to " + minPairCount + ".");
                table.put(pair, OffsetOutcome.SKIPPED_BELOW_THRESHOLD, null);
                continue;
            }
            try {
                if (exists(pair)) {
                    OrbitCorrUtils.info("Offset of " + pair.getKey() + " already exists. Loading.");
                    table.put(pair, OffsetOutcome.LOADED, read(pair));
                    continue;
                }
                final OffsetField offset = compute(pair, records, reference);
                if (offset == null) {
                    table.put(pair, OffsetOutcome.SKIPPED_NO_DATA, null);
                } else {
                    table.put(pair, OffsetOutcome.COMPUTED, offset);
                }
            } catch (IOException e) {
                throw new OrbitCorrException("Cannot provide offset of " + pair.getKey() + " for " + glacier +
                                                     ": " + e.getMessage(), e);
            }
        }
        return table;
    }

    static Path file(Path dir, String glacier, OrbitPair pair, String component) {
        return dir.resolve(glacier + "_median_offset_" + pair.getKey() + "_" + component + OrbitCorrConstants.TIF_EXTENSION);
    }

    private boolean exists(OrbitPair pair) {
        for (String component : COMPONENTS) {
            if (!Files.exists(file(outputDir, glacier, pair, component))) {
                return false;
            }
        }
        return true;
    }

    private OffsetField read(OrbitPair pair) throws IOException {
        final GridContext grid = loader.getGrid();
        final FloatRaster dx = GeoTiffIO.read(file(outputDir, glacier, pair, OrbitCorrConstants.DX),
                                              OrbitCorrConstants.NO_DATA_VALUE);
        final FloatRaster dy = GeoTiffIO.read(file(outputDir, glacier, pair, OrbitCorrConstants.DY),
                                              OrbitCorrConstants.NO_DATA_VALUE);
        return new OffsetField(pair, Resampler.resample(dx, grid, Resampling.NEAREST),
                               Resampler.resample(dy, grid, Resampling.NEAREST));
    }

    private FloatRaster[] readReference() {
        final FloatRaster[] reference = new FloatRaster[COMPONENTS.length];
        for (int i = 0; i < COMPONENTS.length; i++) {
            final Path file = ReferenceField.file(outputDir, glacier, COMPONENTS[i]);
            try {
                reference[i] = Resampler.resample(GeoTiffIO.read(file, OrbitCorrConstants.RAW_NO_DATA_VALUES),
                                                  loader.getGrid(), Resampling.NEAREST);
            } catch (IOException e) {
                throw new OrbitCorrException("Reference field " + file.getFileName() + " of " + glacier +
                                                     " is not readable: " + e.getMessage(), e);
            }
        }
        return reference;
    }

    private OffsetField compute(OrbitPair pair, List<VelocityFieldRecord> records, FloatRaster[] reference)
            throws IOException {
        final FloatRaster[] medians = new FloatRaster[COMPONENTS.length];
        for (int i = 0; i < COMPONENTS.length; i++) {
            final List<FloatRaster> stack = new ArrayList<>();
            for (VelocityFieldRecord record : records) {
                try {
                    final FloatRaster raw = loader.load(record, COMPONENTS[i], despeckle);
                    stack.add(RasterMath.multiply(RasterMath.subtract(reference[i], raw), record.getDaySeparation()));
                } catch (NoOverlapException e) {
                    OrbitCorrUtils.LOG.warning("Skipping " + record.getId() + " in offset of " + pair.getKey() +
                                                       ": " + e.getMessage());
                } catch (IOException e) {
                    OrbitCorrUtils.LOG.warning("Skipping unreadable " + COMPONENTS[i] + " of " + record.getId() +
                                                       " in offset of " + pair.getKey() + ": " + e.getMessage());
                }
            }
            if (stack.isEmpty()) {
                OrbitCorrUtils.LOG.warning("No usable " + COMPONENTS[i] + " raster for orbit pair " + pair.getKey() +
                                                   ", no offset produced.");
                return null;
            }
            OrbitCorrUtils.info("Merging " + stack.size() + " " + COMPONENTS[i] + " offsets of " + pair.getKey());
            medians[i] = RasterMath.nanMedian(stack);
        }
        OrbitCorrUtils.ensureDirectory(outputDir);
        for (int i = 0; i < COMPONENTS.length; i++) {
            GeoTiffIO.writeFloat(medians[i], file(outputDir, glacier, pair, COMPONENTS[i]));
        }
        new RasterQuicklook(0.0, quicklookVmax, "Offset [m]")
                .write(RasterMath.magnitude(medians[0], medians[1]), glacier + " offset " + pair.getKey(),
                       outputDir.resolve(glacier + "_median_offset_" + pair.getKey() + "_map.png"));
        return new OffsetField(pair, medians[0], medians[1]);
    }
}
