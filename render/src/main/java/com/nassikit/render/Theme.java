package com.nassikit.render;

import java.awt.Color;
import java.awt.Font;

/**
 * Colors and sizes used when drawing a structogram.
 */
public record Theme(
    Color border,
    Color text,
    Color mutedText,
    Color body,
    Color loopHeader,
    Color ifHeader,
    Color switchHeader,
    Color tryWrapper,
    Color condition,
    Color branch,
    Color section,
    String fontFamily,
    int fontSize,
    int canvasPadding,
    float strokeWidth,
    int exportScale,
    int baselineOffset,
    int labelOffsetY,
    int declarationTopPadding,
    int declarationBottomPadding
) {

    private static final Color BORDER = new Color(45, 45, 48);
    private static final Color TEXT = new Color(17, 17, 17);
    private static final Color MUTED_TEXT = new Color(107, 114, 128);
    private static final Color WHITE = new Color(255, 255, 255);

    /**
     * Default palette with a tinted header per block type.
     */
    public static Theme colored() {
        return new Theme(
            BORDER, TEXT, MUTED_TEXT, WHITE,
            new Color(0xd2ebd3),   // loop
            new Color(0xcec1eb),   // if
            new Color(0xd6e1ee),   // switch
            new Color(0xf3e2c2),   // try
            new Color(0xe4e8f0),
            new Color(0xf7f7f9),
            new Color(0xeff0f3),
            Font.SANS_SERIF, 12, 12, 1f, 2, 8, 6, 10, 10);
    }

    /**
     * Black on white, every fill is the background color.
     */
    public static Theme monochrome() {
        return new Theme(
            BORDER, TEXT, MUTED_TEXT, WHITE,
            WHITE, WHITE, WHITE, WHITE, WHITE, WHITE, WHITE,
            Font.SANS_SERIF, 12, 12, 1f, 2, 8, 6, 10, 10);
    }

    public Theme withExportScale(int scale) {
        return new Theme(border, text, mutedText, body, loopHeader, ifHeader, switchHeader, tryWrapper,
            condition, branch, section, fontFamily, fontSize, canvasPadding, strokeWidth, Math.max(1, scale),
            baselineOffset, labelOffsetY, declarationTopPadding, declarationBottomPadding);
    }

    public Font font() {
        return new Font(fontFamily, Font.PLAIN, fontSize);
    }

    public Font declarationFont() {
        return new Font(fontFamily, Font.BOLD, fontSize + 2);
    }

    /**
     * Height of the band holding the method declaration above the chart.
     */
    public int declarationBandHeight() {
        return declarationTopPadding + fontSize + 2 + declarationBottomPadding;
    }
}
