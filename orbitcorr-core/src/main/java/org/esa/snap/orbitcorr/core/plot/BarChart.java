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

import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Simple vertical bar chart of counts per category, bars in map iteration order.
 */
public class BarChart {

    private static final int BAR_WIDTH = 28;
    private static final int BAR_GAP = 10;
    private static final int PLOT_HEIGHT = 300;
    private static final int LEFT = 60;
    private static final int TOP = 40;
    private static final int BOTTOM = 110;

    private final String title;
    private final String yLabel;

    public BarChart(String title, String yLabel) {
        this.title = title;
        this.yLabel = yLabel;
    }

    public void write(Map<String, Integer> counts, Path file) throws IOException {
        final List<String> keys = new ArrayList<>(counts.keySet());
        int max = 1;
        for (int count : counts.values()) {
            max = Math.max(max, count);
        }
        final int plotWidth = Math.max(200, keys.size() * (BAR_WIDTH + BAR_GAP) + BAR_GAP);
        final BufferedImage image = new BufferedImage(LEFT + plotWidth + 20, TOP + PLOT_HEIGHT + BOTTOM,
                                                      BufferedImage.TYPE_INT_RGB);
        final Graphics2D g = image.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, image.getWidth(), image.getHeight());
            g.setColor(Color.BLACK);
            g.setFont(new Font(Font.SANS_SERIF, Font.BOLD, 13));
            if (StringUtils.isNotBlank(title)) {
                g.drawString(title, LEFT, TOP - 15);
            }
            g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, 10));
            final FontMetrics fm = g.getFontMetrics();
            g.drawLine(LEFT, TOP, LEFT, TOP + PLOT_HEIGHT);
            g.drawLine(LEFT, TOP + PLOT_HEIGHT, LEFT + plotWidth, TOP + PLOT_HEIGHT);
            g.drawString(String.valueOf(max), LEFT - 8 - fm.stringWidth(String.valueOf(max)), TOP + fm.getAscent() / 2);
            g.drawString("0", LEFT - 8 - fm.stringWidth("0"), TOP + PLOT_HEIGHT);

            for (int k = 0; k < keys.size(); k++) {
                final int count = counts.get(keys.get(k));
                final int barHeight = (int) Math.round((double) PLOT_HEIGHT * count / max);
                final int x = LEFT + BAR_GAP + k * (BAR_WIDTH + BAR_GAP);
                g.setColor(new Color(RasterQuicklook.turbo(0.15)));
                g.fillRect(x, TOP + PLOT_HEIGHT - barHeight, BAR_WIDTH, barHeight);
                g.setColor(Color.BLACK);
                g.drawString(String.valueOf(count), x + (BAR_WIDTH - fm.stringWidth(String.valueOf(count))) / 2,
                             TOP + PLOT_HEIGHT - barHeight - 3);
                final Graphics2D rotated = (Graphics2D) g.create();
                try {
                    rotated.translate(x + BAR_WIDTH / 2 + fm.getAscent() / 2, TOP + PLOT_HEIGHT + 6);
                    rotated.rotate(Math.PI / 2.0);
                    rotated.drawString(keys.get(k), 0, 0);
                } finally {
                    rotated.dispose();
                }
            }
            if (StringUtils.isNotBlank(yLabel)) {
                final Graphics2D rotated = (Graphics2D) g.create();
                try {
                    rotated.rotate(-Math.PI / 2.0);
                    rotated.drawString(yLabel, -(TOP + PLOT_HEIGHT / 2 + fm.stringWidth(yLabel) / 2), 20);
                } finally {
                    rotated.dispose();
                }
            }
        } finally {
            g.dispose();
        }
        RasterQuicklook.writeImage(image, file);
    }
}
