package org.esa.snap.orbitcorr.s2;

import org.esa.snap.orbitcorr.core.OrbitCorrConstants;
import org.esa.snap.orbitcorr.core.config.OrbitCorrConfig;
import org.esa.snap.orbitcorr.core.util.OrbitCorrUtils;

import java.nio.file.Path;

/**
 * Input and output locations of one glacier. Outputs live below {@code <work>/<output>/<glacier>/}.
 */
public class GlacierWorkspace {

    private final String glacier;
    private final Path velocityDir;
    private final Path clippedDir;
    private final Path outputDir;

    public GlacierWorkspace(OrbitCorrConfig config, String glacier) {
        this.glacier = glacier;
        this.velocityDir = config.getVelocityDir().resolve(glacier).resolve(config.getVelocitySubdir());
        this.clippedDir = config.getImageDir().resolve(glacier).resolve(OrbitCorrConstants.CLIPPED_DIR_NAME);
        this.outputDir = config.getWorkDir().resolve(config.getOutputName()).resolve(glacier);
    }

    public String getGlacier() {
        return glacier;
    }

    /**
     * @return directory with the QA manifests and one {@code vmap*} directory per velocity field
     */
    public Path getVelocityDir() {
        return velocityDir;
    }

    public Path getClippedDir() {
        return clippedDir;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    public Path getOrbitsDir() {
        return outputDir.resolve(OrbitCorrConstants.ORBITS_DIR_NAME);
    }

    public Path getVelocitiesDir() {
        return outputDir.resolve(OrbitCorrConstants.VELOCITIES_DIR_NAME);
    }

    public Path getPreviewsDir() {
        return getVelocitiesDir().resolve(OrbitCorrConstants.PREVIEWS_DIR_NAME);
    }

    public Path getMasksDir() {
        return outputDir.resolve(OrbitCorrConstants.MASKS_DIR_NAME);
    }

    public void createDirectories() {
        OrbitCorrUtils.ensureDirectory(getOrbitsDir());
        OrbitCorrUtils.ensureDirectory(getPreviewsDir());
        OrbitCorrUtils.ensureDirectory(getMasksDir());
    }
}
