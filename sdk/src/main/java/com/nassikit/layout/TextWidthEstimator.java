package com.nassikit.layout;

/**
 * Estimates the rendered width of a single line of text, in pixels.
 * Implementations must be pure: the same text always yields the same width.
 */
@FunctionalInterface
public interface TextWidthEstimator {

    /**
     * Per-character heuristic: every UTF-16 char counts as {@link StructogramConstants#CHAR_WIDTH} pixels.
     */
    TextWidthEstimator DEFAULT = text -> text.length() * (double) StructogramConstants.CHAR_WIDTH;

    double estimate(String text);

    /**
     * Fixed width per character.
     */
    static TextWidthEstimator perCharacter(double charWidth) {
        return text -> text.length() * charWidth;
    }
}
