package com.nassikit.render;

import com.nassikit.layout.TextWidthEstimator;

import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * Measures text with the metrics of a real AWT font, so the layout matches what gets drawn.
 */
public class FontMetricsWidthEstimator implements TextWidthEstimator {

    private final FontMetrics metrics;

    public FontMetricsWidthEstimator(Font font) {
        BufferedImage scratch = new BufferedImage(1, 1, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = scratch.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            this.metrics = g.getFontMetrics(font);
        } finally {
            g.dispose();
        }
    }

    public static FontMetricsWidthEstimator forTheme(Theme theme) {
        return new FontMetricsWidthEstimator(theme.font());
    }

    @Override
    public double estimate(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return metrics.stringWidth(text);
    }
}
