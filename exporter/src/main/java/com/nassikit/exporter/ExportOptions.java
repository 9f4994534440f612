package com.nassikit.exporter;

import com.nassikit.layout.TextWidthEstimator;
import com.nassikit.render.FontMetricsWidthEstimator;
import com.nassikit.render.Theme;

/**
 * Settings for one export run.
 *
 * @param monochrome  draw without header tints
 * @param scale       pixels per layout unit in the PNG
 * @param charWidth   fixed per-character width for text measurement, or 0 for the default
 * @param fontMetrics measure text with the drawing font instead of a per-character estimate
 */
public record ExportOptions(boolean monochrome, int scale, double charWidth, boolean fontMetrics) {

    public static final int DEFAULT_SCALE = 2;

    public Theme theme() {
        Theme base = monochrome ? Theme.monochrome() : Theme.colored();
        return base.withExportScale(scale);
    }

    public TextWidthEstimator estimator() {
        if (fontMetrics) {
            return FontMetricsWidthEstimator.forTheme(theme());
        }
        return charWidth > 0 ? TextWidthEstimator.perCharacter(charWidth) : TextWidthEstimator.DEFAULT;
    }

    public static ExportOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean monochrome;
        private int scale = DEFAULT_SCALE;
        private double charWidth;
        private boolean fontMetrics;

        public Builder monochrome(boolean monochrome) {
            this.monochrome = monochrome;
            return this;
        }

        public Builder scale(int scale) {
            if (scale < 1) {
                throw new IllegalArgumentException("Scale must be at least 1: " + scale);
            }
            this.scale = scale;
            return this;
        }

        public Builder charWidth(double charWidth) {
            if (!(charWidth > 0)) {
                throw new IllegalArgumentException("Character width must be positive: " + charWidth);
            }
            this.charWidth = charWidth;
            return this;
        }

        public Builder fontMetrics(boolean fontMetrics) {
            this.fontMetrics = fontMetrics;
            return this;
        }

        public ExportOptions build() {
            return new ExportOptions(monochrome, scale, charWidth, fontMetrics);
        }
    }
}
