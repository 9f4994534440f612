package com.nassikit.layout;

/**
 * Turns estimated text widths into padded integer cell widths.
 */
public final class TextMeasure {

    private final TextWidthEstimator estimator;

    public TextMeasure(TextWidthEstimator estimator) {
        this.estimator = estimator != null ? estimator : TextWidthEstimator.DEFAULT;
    }

    public TextWidthEstimator estimator() {
        return estimator;
    }

    /**
     * Width of the text plus horizontal padding on both sides.
     */
    public int inlineWidth(String text) {
        double estimated = estimator.estimate(text == null ? "" : text);
        if (Double.isNaN(estimated) || estimated < 0) {
            estimated = 0;
        }
        return (int) Math.ceil(estimated) + StructogramConstants.TEXT_PADDING_X * 2;
    }

    /**
     * Width of a cell holding the text: the padded width, never below the minimum content width.
     */
    public int boxWidth(String text) {
        return Math.max(StructogramConstants.MIN_CONTENT_WIDTH, inlineWidth(text));
    }
}
