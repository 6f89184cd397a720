/*
 * Copyright (c) 2026.  Brockmann Consult GmbH (info@brockmann-consult.de)
 *
 * This program is free software; you can redistribute it and/or modify it
 * under the terms of the GNU General Public License as published by the Free
 * Software Foundation; either version 3 of the License, or (at your option)
 * any later version.
 * This program is distributed in the hope that it will be useful, but WITHOUT
 * ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or
 * FITNESS FOR A PARTICULAR PURPOSE. See the GNU General Public License for
 * more details.
 *
 * You should have received a copy of the GNU General Public License along
 * with this program; if not, see http://www.gnu.org/licenses/
 *
 */

package org.esa.snap.orbitcorr.core.raster;

import mil.nga.tiff.FieldTagType;
import mil.nga.tiff.FieldType;
import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.FileDirectoryEntry;
import mil.nga.tiff.Rasters;
import mil.nga.tiff.TIFFImage;
import mil.nga.tiff.TiffReader;
import mil.nga.tiff.TiffWriter;
import mil.nga.tiff.util.TiffConstants;
import mil.nga.tiff.util.TiffException;
import org.esa.snap.orbitcorr.core.OrbitCorrConstants;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads and writes single band, north-up GeoTIFFs.
 * Georeferencing is taken from the ModelPixelScale and ModelTiepoint tags (or ModelTransformation),
 * the CRS code from the GeoKeyDirectory.
 */
public class GeoTiffIO {

    private static final int GEO_KEY_PROJECTED_CS_TYPE = 3072;
    private static final int GEO_KEY_GEOGRAPHIC_TYPE = 2048;

    private GeoTiffIO() {
    }

    /**
     * Reads the first band of a GeoTIFF into a float raster on its native grid.
     *
     * @param file          - the GeoTIFF
     * @param noDataValues  - sample values to be replaced by NaN
     * @return the raster
     * @throws IOException if the file cannot be read or is not georeferenced
     */
    public static FloatRaster read(Path file, double... noDataValues) throws IOException {
        final FileDirectory directory = readDirectory(file);
        final GridContext grid = readGrid(directory, file);
        final Rasters rasters;
        try {
            rasters = directory.readRasters();
        } catch (TiffException e) {
            throw new IOException("Cannot decode raster data of " + file + ": " + e.getMessage(), e);
        }
        final float[] data = new float[grid.getPixelCount()];
        int index = 0;
        for (int y = 0; y < grid.getHeight(); y++) {
            for (int x = 0; x < grid.getWidth(); x++) {
                final Number sample = rasters.getFirstPixelSample(x, y);
                data[index++] = toFloat(sample, noDataValues);
            }
        }
        return new FloatRaster(grid, data);
    }

    /**
     * Reads only the grid of a GeoTIFF, without decoding its samples.
     */
    public static GridContext readGrid(Path file) throws IOException {
        return readGrid(readDirectory(file), file);
    }

    /**
     * Writes a float32 GeoTIFF. NaN samples are written as {@link OrbitCorrConstants#NO_DATA_VALUE}.
     */
    public static void writeFloat(FloatRaster raster, Path file) throws IOException {
        final GridContext grid = raster.getGrid();
        final Rasters rasters = new Rasters(grid.getWidth(), grid.getHeight(), 1, FieldType.FLOAT);
        for (int y = 0; y < grid.getHeight(); y++) {
            for (int x = 0; x < grid.getWidth(); x++) {
                final float v = raster.get(x, y);
                rasters.setFirstPixelSample(x, y, Float.isNaN(v) ? OrbitCorrConstants.NO_DATA_VALUE : v);
            }
        }
        write(rasters, FieldType.FLOAT, TiffConstants.SAMPLE_FORMAT_FLOAT, grid, file);
    }

    /**
     * Writes an unsigned 8 bit GeoTIFF, e.g. a categorical mask. NaN samples are written as 0.
     */
    public static void writeByte(FloatRaster raster, Path file) throws IOException {
        final GridContext grid = raster.getGrid();
        final Rasters rasters = new Rasters(grid.getWidth(), grid.getHeight(), 1, FieldType.BYTE);
        for (int y = 0; y < grid.getHeight(); y++) {
            for (int x = 0; x < grid.getWidth(); x++) {
                final float v = raster.get(x, y);
                final short value = Float.isNaN(v) ? 0 : (short) Math.max(0, Math.min(255, Math.round(v)));
                rasters.setFirstPixelSample(x, y, value);
            }
        }
        write(rasters, FieldType.BYTE, TiffConstants.SAMPLE_FORMAT_UNSIGNED_INT, grid, file);
    }

    private static void write(Rasters rasters, FieldType fieldType, int sampleFormat,
                              GridContext grid, Path file) throws IOException {
        final int rowsPerStrip = rasters.calculateRowsPerStrip(TiffConstants.PLANAR_CONFIGURATION_CHUNKY);

        final FileDirectory directory = new FileDirectory();
        directory.setImageWidth(grid.getWidth());
        directory.setImageHeight(grid.getHeight());
        directory.setBitsPerSample(fieldType.getBits());
        directory.setCompression(TiffConstants.COMPRESSION_NO);
        directory.setPhotometricInterpretation(TiffConstants.PHOTOMETRIC_INTERPRETATION_BLACK_IS_ZERO);
        directory.setSamplesPerPixel(1);
        directory.setRowsPerStrip(rowsPerStrip);
        directory.setPlanarConfiguration(TiffConstants.PLANAR_CONFIGURATION_CHUNKY);
        directory.setSampleFormat(sampleFormat);
        directory.setWriteRasters(rasters);

        final List<Double> pixelScale = Arrays.asList(grid.getPixelSizeX(), grid.getPixelSizeY(), 0.0);
        directory.addEntry(new FileDirectoryEntry(FieldTagType.ModelPixelScale, FieldType.DOUBLE,
                                                  pixelScale.size(), pixelScale));
        final List<Double> tiepoint = Arrays.asList(0.0, 0.0, 0.0, grid.getMinX(), grid.getMaxY(), 0.0);
        directory.addEntry(new FileDirectoryEntry(FieldTagType.ModelTiepoint, FieldType.DOUBLE,
                                                  tiepoint.size(), tiepoint));
        // version 1.1.0, 3 keys: projected model, pixel-is-area, projected CRS
        final List<Integer> geoKeys = Arrays.asList(1, 1, 0, 3,
                                                    1024, 0, 1, 1,
                                                    1025, 0, 1, 1,
                                                    GEO_KEY_PROJECTED_CS_TYPE, 0, 1, grid.getEpsg());
        directory.addEntry(new FileDirectoryEntry(FieldTagType.GeoKeyDirectory, FieldType.SHORT,
                                                  geoKeys.size(), geoKeys));

        final TIFFImage tiffImage = new TIFFImage();
        tiffImage.add(directory);
        final Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        TiffWriter.writeTiff(file.toFile(), tiffImage);
    }

    private static FileDirectory readDirectory(Path file) throws IOException {
        final File tiffFile = file.toFile();
        if (!tiffFile.isFile()) {
            throw new IOException("No such GeoTIFF: " + file);
        }
        final TIFFImage tiffImage;
        try {
            tiffImage = TiffReader.readTiff(tiffFile);
        } catch (TiffException e) {
            throw new IOException("Cannot read GeoTIFF " + file + ": " + e.getMessage(), e);
        }
        final List<FileDirectory> directories = tiffImage.getFileDirectories();
        if (directories == null || directories.isEmpty()) {
            throw new IOException("GeoTIFF " + file + " has no image directory.");
        }
        return directories.get(0);
    }

    private static GridContext readGrid(FileDirectory directory, Path file) throws IOException {
        final int width = directory.getImageWidth().intValue();
        final int height = directory.getImageHeight().intValue();

        double[] pixelScale = null;
        double[] tiepoint = null;
        double[] transformation = null;
        int epsg = 0;
        for (FileDirectoryEntry entry : directory.getEntries()) {
            final FieldTagType tag = entry.getFieldTag();
            if (tag == FieldTagType.ModelPixelScale) {
                pixelScale = toDoubles(entry.getValues());
            } else if (tag == FieldTagType.ModelTiepoint) {
                tiepoint = toDoubles(entry.getValues());
            } else if (tag == FieldTagType.ModelTransformation) {
                transformation = toDoubles(entry.getValues());
            } else if (tag == FieldTagType.GeoKeyDirectory) {
                epsg = parseEpsg(toDoubles(entry.getValues()));
            }
        }

        if (pixelScale != null && pixelScale.length >= 2 && tiepoint != null && tiepoint.length >= 6) {
            final double sx = pixelScale[0];
            final double sy = pixelScale[1];
            final double minX = tiepoint[3] - tiepoint[0] * sx;
            final double maxY = tiepoint[4] + tiepoint[1] * sy;
            return new GridContext(minX, maxY, sx, sy, width, height, epsg);
        }
        if (transformation != null && transformation.length >= 16) {
            if (transformation[1] != 0.0 || transformation[4] != 0.0) {
                throw new IOException("Rotated GeoTIFF not supported: " + file);
            }
            return new GridContext(transformation[3], transformation[7], transformation[0], -transformation[5],
                                   width, height, epsg);
        }
        throw new IOException("GeoTIFF " + file + " carries no georeferencing.");
    }

    private static int parseEpsg(double[] keys) {
        if (keys == null || keys.length < 4) {
            return 0;
        }
        final int numKeys = (int) keys[3];
        int geographic = 0;
        for (int k = 0, idx = 4; k < numKeys && idx + 3 < keys.length; k++, idx += 4) {
            final int keyId = (int) keys[idx];
            final int location = (int) keys[idx + 1];
            if (location != 0) {
                continue;
            }
            if (keyId == GEO_KEY_PROJECTED_CS_TYPE) {
                return (int) keys[idx + 3];
            }
            if (keyId == GEO_KEY_GEOGRAPHIC_TYPE) {
                geographic = (int) keys[idx + 3];
            }
        }
        return geographic;
    }

    private static double[] toDoubles(Object values) {
        if (values instanceof Number) {
            return new double[]{((Number) values).doubleValue()};
        }
        if (values instanceof List) {
            final List<?> list = (List<?>) values;
            final List<Double> numbers = new ArrayList<>(list.size());
            for (Object o : list) {
                if (o instanceof Number) {
                    numbers.add(((Number) o).doubleValue());
                }
            }
            final double[] result = new double[numbers.size()];
            for (int i = 0; i < result.length; i++) {
                result[i] = numbers.get(i);
            }
            return result;
        }
        if (values instanceof double[]) {
            return (double[]) values;
        }
        return null;
    }

    private static float toFloat(Number sample, double[] noDataValues) {
        if (sample == null) {
            return Float.NaN;
        }
        final double value = sample.doubleValue();
        if (Double.isNaN(value)) {
            return Float.NaN;
        }
        for (double noData : noDataValues) {
            if (value == noData) {
                return Float.NaN;
            }
        }
        return (float) value;
    }
}
