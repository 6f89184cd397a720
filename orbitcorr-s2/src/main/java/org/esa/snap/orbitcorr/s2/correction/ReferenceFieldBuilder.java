package org.esa.snap.orbitcorr.s2.correction;

import org.esa.snap.orbitcorr.core.OrbitCorrConstants;
import org.esa.snap.orbitcorr.core.OrbitCorrException;
import org.esa.snap.orbitcorr.core.plot.RasterQuicklook;
import org.esa.snap.orbitcorr.core.raster.FloatRaster;
import org.esa.snap.orbitcorr.core.raster.GeoTiffIO;
import org.esa.snap.orbitcorr.core.raster.RasterMath;
import org.esa.snap.orbitcorr.core.util.FlowDirectionUtils;
import org.esa.snap.orbitcorr.core.util.OrbitCorrUtils;
import org.esa.snap.orbitcorr.s2.orbits.PairTable;
import org.esa.snap.orbitcorr.s2.orbits.VelocityFieldRecord;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;

/**
 * Builds the {@link ReferenceField} of a glacier from its repeat-track velocity fields and persists it as
 * {@code <glacier>_median_orbitmatch_{dmag,dx,dy,flowdir}.tif}. Existing files are not recomputed.
 */
public class ReferenceFieldBuilder {

    private static final String[] COMPONENTS = {OrbitCorrConstants.DMAG, OrbitCorrConstants.DX, OrbitCorrConstants.DY};

    private final String glacier;
    private final Path outputDir;
    private final VelocityFieldLoader loader;
    private final boolean despeckle;
    private final double quicklookVmax;

    public ReferenceFieldBuilder(String glacier, Path outputDir, VelocityFieldLoader loader,
                                 boolean despeckle, double quicklookVmax) {
        this.glacier = glacier;
        this.outputDir = outputDir;
        this.loader = loader;
        this.despeckle = despeckle;
        this.quicklookVmax = quicklookVmax;
    }

    /**
     * Provides the reference field, computing and persisting missing components first.
     *
     * @param pairTable - the glacier's velocity field records
     * @return the reference field on the loader's grid
     * @throws OrbitCorrException if a component must be computed but no repeat-track field is usable
     */
    public ReferenceField build(PairTable pairTable) {
        try {
            if (!isComplete()) {
                compute(pairTable);
            } else {
                OrbitCorrUtils.info("Reference field of " + glacier + " already exists, skipping computation.");
            }
            return ReferenceField.read(outputDir, glacier, loader.getGrid());
        } catch (IOException e) {
            throw new OrbitCorrException("Cannot provide reference field of " + glacier + ": " + e.getMessage(), e);
        }
    }

    public boolean isComplete() {
        for (String component : COMPONENTS) {
            if (!Files.exists(ReferenceField.file(outputDir, glacier, component))) {
                return false;
            }
        }
        return Files.exists(ReferenceField.file(outputDir, glacier, OrbitCorrConstants.FLOW_DIRECTION));
    }

    private void compute(PairTable pairTable) throws IOException {
        final List<VelocityFieldRecord> repeatTrack = pairTable.getRepeatTrackRecords();
        if (repeatTrack.isEmpty()) {
            throw new OrbitCorrException("No repeat-track velocity field for " + glacier +
                                                 ", cannot build a reference field.");
        }
        OrbitCorrUtils.ensureDirectory(outputDir);
        for (String component : COMPONENTS) {
            final Path file = ReferenceField.file(outputDir, glacier, component);
            if (Files.exists(file)) {
                OrbitCorrUtils.info(file.getFileName() + " already exists. Skipping.");
                continue;
            }
            OrbitCorrUtils.info("Merging " + repeatTrack.size() + " repeat-track " + component + " rasters");
            FloatRaster median = RasterMath.nanMedian(loadStack(repeatTrack, component));
            if (despeckle) {
                median = RasterMath.medianFilter3x3(median);
            }
            GeoTiffIO.writeFloat(median, file);
            if (OrbitCorrConstants.DMAG.equals(component)) {
                new RasterQuicklook(0.0, quicklookVmax, "Velocity [m/d]")
                        .write(median, glacier + " repeat-track median",
                               outputDir.resolve(glacier + "_median_orbitmatch_map.png"));
            }
        }
        final Path flowDirectionFile = ReferenceField.file(outputDir, glacier, OrbitCorrConstants.FLOW_DIRECTION);
        if (!Files.exists(flowDirectionFile)) {
            final FloatRaster dx = GeoTiffIO.read(ReferenceField.file(outputDir, glacier, OrbitCorrConstants.DX),
                                                  OrbitCorrConstants.NO_DATA_VALUE);
            final FloatRaster dy = GeoTiffIO.read(ReferenceField.file(outputDir, glacier, OrbitCorrConstants.DY),
                                                  OrbitCorrConstants.NO_DATA_VALUE);
            GeoTiffIO.writeFloat(FlowDirectionUtils.computeFlowDirection(dx, dy), flowDirectionFile);
        }
    }

    private List<FloatRaster> loadStack(List<VelocityFieldRecord> records, String component) {
        final List<FloatRaster> stack = new ArrayList<>();
        for (VelocityFieldRecord record : records) {
            try {
                stack.add(loader.load(record, component, despeckle));
            } catch (NoOverlapException e) {
                OrbitCorrUtils.LOG.warning("Skipping " + record.getId() + " in reference field: " + e.getMessage());
            } catch (IOException e) {
                OrbitCorrUtils.LOG.log(Level.WARNING, "Skipping unreadable " + component + " of " + record.getId() +
                        " in reference field: " + e.getMessage());
            }
        }
        if (stack.isEmpty()) {
            throw new OrbitCorrException("None of the " + records.size() + " repeat-track " + component +
                                                 " rasters of " + glacier + " is usable.");
        }
        return stack;
    }
}
