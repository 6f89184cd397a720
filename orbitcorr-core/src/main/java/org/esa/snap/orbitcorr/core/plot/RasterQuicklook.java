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

package org.esa.snap.orbitcorr.core.plot;

import org.apache.commons.lang3.StringUtils;
import org.esa.snap.orbitcorr.core.raster.FloatRaster;

import javax.imageio.ImageIO;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renders a raster as a quicklook image with title and colour bar, using a turbo colour map.
 * The image format (png or jpg) follows the file extension. NaN pixels are drawn white.
 */
public class RasterQuicklook {

    private static final int MARGIN = 40;
    private static final int COLORBAR_WIDTH = 20;
    private static final int COLORBAR_SPACE = 110;
    private static final int MAX_IMAGE_SIZE = 1200;
    private static final int MIN_IMAGE_SIZE = 200;

    private final double vmin;
    private final double vmax;
    private final String colorbarLabel;

    public RasterQuicklook(double vmin, double vmax, String colorbarLabel) {
        if (!(vmax > vmin)) {
            throw new IllegalArgumentException("Colour range must be increasing: " + vmin + " - " + vmax);
        }
        this.vmin = vmin;
        this.vmax = vmax;
        this.colorbarLabel = colorbarLabel;
    }

    public void write(FloatRaster raster, String title, Path file) throws IOException {
        final int width = raster.getWidth();
        final int height = raster.getHeight();
        final double scale = computeScale(width, height);
        final int plotWidth = Math.max(1, (int) Math.round(width * scale));
        final int plotHeight = Math.max(1, (int) Math.round(height * scale));

        final BufferedImage image = new BufferedImage(plotWidth + 2 * MARGIN + COLORBAR_SPACE,
                                                      plotHeight + 2 * MARGIN, BufferedImage.TYPE_INT_RGB);
        final Graphics2D g = image.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, image.getWidth(), image.getHeight());

            for (int py = 0; py < plotHeight; py++) {
                final int y = Math.min(height - 1, (int) (py / scale));
                for (int px = 0; px < plotWidth; px++) {
                    final int x = Math.min(width - 1, (int) (px / scale));
                    final float v = raster.get(x, y);
                    if (!Float.isNaN(v)) {
                        image.setRGB(MARGIN + px, MARGIN + py, turbo((v - vmin) / (vmax - vmin)));
                    }
                }
            }
            g.setColor(Color.BLACK);
            g.setStroke(new BasicStroke(1.0f));
            g.drawRect(MARGIN - 1, MARGIN - 1, plotWidth + 1, plotHeight + 1);
            g.setFont(new Font(Font.SANS_SERIF, Font.BOLD, 13));
            if (StringUtils.isNotBlank(title)) {
                g.drawString(title, MARGIN, MARGIN - 12);
            }
            drawColorbar(g, MARGIN + plotWidth + 20, MARGIN, plotHeight);
        } finally {
            g.dispose();
        }
        writeImage(image, file);
    }

    private void drawColorbar(Graphics2D g, int x0, int y0, int barHeight) {
        for (int j = 0; j < barHeight; j++) {
            final double fraction = 1.0 - (double) j / Math.max(1, barHeight - 1);
            g.setColor(new Color(turbo(fraction)));
            g.drawLine(x0, y0 + j, x0 + COLORBAR_WIDTH, y0 + j);
        }
        g.setColor(Color.BLACK);
        g.drawRect(x0, y0, COLORBAR_WIDTH, barHeight);
        g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, 10));
        final FontMetrics fm = g.getFontMetrics();
        final int ticks = 5;
        for (int t = 0; t <= ticks; t++) {
            final double value = vmin + (vmax - vmin) * t / ticks;
            final int y = y0 + barHeight - (int) Math.round((double) barHeight * t / ticks);
            g.drawLine(x0 + COLORBAR_WIDTH, y, x0 + COLORBAR_WIDTH + 4, y);
            g.drawString(formatTick(value), x0 + COLORBAR_WIDTH + 6, y + fm.getAscent() / 2);
        }
        if (StringUtils.isNotBlank(colorbarLabel)) {
            final Graphics2D rotated = (Graphics2D) g.create();
            try {
                rotated.rotate(-Math.PI / 2.0);
                rotated.drawString(colorbarLabel, -(y0 + barHeight / 2 + fm.stringWidth(colorbarLabel) / 2),
                                   x0 + COLORBAR_WIDTH + 60);
            } finally {
                rotated.dispose();
            }
        }
    }

    static void writeImage(BufferedImage image, Path file) throws IOException {
        final String name = file.getFileName().toString();
        final String format = StringUtils.substringAfterLast(name, ".").toLowerCase();
        final String formatName = "jpg".equals(format) || "jpeg".equals(format) ? "jpg" : "png";
        final Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        if (!ImageIO.write(image, formatName, file.toFile())) {
            throw new IOException("No image writer for format " + formatName);
        }
    }

    /**
     * Polynomial approximation of the turbo colour map.
     *
     * @param fraction - position in the colour map, clamped to [0, 1]
     * @return packed RGB
     */
    static int turbo(double fraction) {
        final double t = Math.max(0.0, Math.min(1.0, fraction));
        final double r = 0.13572138 + t * (4.61539260 + t * (-42.66032258 + t * (132.13108234 + t * (-152.94239396 + t * 59.28637943))));
        final double gr = 0.09140261 + t * (2.19418839 + t * (4.84296658 + t * (-14.18503333 + t * (4.27729857 + t * 2.82956604))));
        final double b = 0.10667330 + t * (12.64194608 + t * (-60.58204836 + t * (110.36276771 + t * (-89.90310912 + t * 27.34824973))));
        return (channel(r) << 16) | (channel(gr) << 8) | channel(b);
    }

    private static int channel(double v) {
        return (int) Math.round(Math.max(0.0, Math.min(1.0, v)) * 255.0);
    }

    private static double computeScale(int width, int height) {
        final int largest = Math.max(width, height);
        if (largest > MAX_IMAGE_SIZE) {
            return (double) MAX_IMAGE_SIZE / largest;
        }
        if (largest < MIN_IMAGE_SIZE) {
            return (double) MIN_IMAGE_SIZE / largest;
        }
        return 1.0;
    }

    private static String formatTick(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.format("%.1f", value);
    }
}
