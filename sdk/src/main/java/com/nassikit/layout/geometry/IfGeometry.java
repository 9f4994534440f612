package com.nassikit.layout.geometry;

import com.nassikit.layout.LayoutNode;
import com.nassikit.layout.TextMeasure;

import static com.nassikit.layout.StructogramConstants.FONT_SIZE;
import static com.nassikit.layout.StructogramConstants.IF_CONDITION_LINE_CLEARANCE;
import static com.nassikit.layout.StructogramConstants.IF_CONDITION_SIDE_CLEARANCE;
import static com.nassikit.layout.StructogramConstants.IF_CONDITION_TOP_PADDING;
import static com.nassikit.layout.StructogramConstants.IF_HEADER_BASE_HEIGHT;
import static com.nassikit.layout.StructogramConstants.IF_HEADER_MAX_HEIGHT;

/**
 * Column widths and header height of an if box.
 * <p>
 * The header is drawn as two diagonals from the top corners down to the split point between
 * the columns, with the condition centered over the split point. The condition must sit above
 * the diagonals: at the label's outer edge (half its width from the split point) the diagonal
 * has to be lower than the label's bottom.
 */
public record IfGeometry(int leftWidth, int rightWidth, int width, int headerHeight) {

    /**
     * Vertical space the condition needs below the top edge.
     */
    public static final int CONDITION_BOTTOM_Y = IF_CONDITION_TOP_PADDING + FONT_SIZE + IF_CONDITION_LINE_CLEARANCE;

    /**
     * Solve the geometry for a condition of the given (padded) width.
     *
     * @param conditionWidth      padded width of the condition label
     * @param preferredLeftWidth  width the then branch wants
     * @param preferredRightWidth width the else branch wants
     */
    public static IfGeometry fit(int conditionWidth, int preferredLeftWidth, int preferredRightWidth) {
        double conditionHalfWidth = conditionWidth / 2.0;
        double requiredSideWidth = conditionHalfWidth + IF_CONDITION_SIDE_CLEARANCE;

        double leftWidth = Math.max(preferredLeftWidth, requiredSideWidth);
        double rightWidth = Math.max(preferredRightWidth, requiredSideWidth);

        double minRatioAtMaxHeader = (double) CONDITION_BOTTOM_Y / IF_HEADER_MAX_HEIGHT;
        if (minRatioAtMaxHeader > 0 && minRatioAtMaxHeader < 1) {
            // similar triangles: side run at which the label just clears the diagonal at max height
            double ratioSafeSideWidth = conditionHalfWidth / (1 - minRatioAtMaxHeader);
            leftWidth = Math.max(leftWidth, ratioSafeSideWidth);
            rightWidth = Math.max(rightWidth, ratioSafeSideWidth);
        }

        int left = (int) Math.ceil(leftWidth);
        int right = (int) Math.ceil(rightWidth);
        int width = Math.max(left + right, conditionWidth);
        if (width > left + right) {
            right = width - left;
        }

        int headerHeight = headerHeight(conditionHalfWidth, left, right,
            CONDITION_BOTTOM_Y, IF_HEADER_BASE_HEIGHT, IF_HEADER_MAX_HEIGHT);
        return new IfGeometry(left, right, width, headerHeight);
    }

    /**
     * Lay out an if box around already laid-out branches.
     */
    public static LayoutNode.If build(String condition, LayoutNode thenBranch, LayoutNode elseBranch,
                                      TextMeasure measure) {
        IfGeometry geometry = fit(measure.inlineWidth(condition), thenBranch.width(), elseBranch.width());
        int branchHeight = Math.max(thenBranch.height(), elseBranch.height());
        return new LayoutNode.If(
            condition,
            thenBranch,
            elseBranch,
            geometry.leftWidth(),
            geometry.rightWidth(),
            geometry.headerHeight(),
            branchHeight,
            geometry.width(),
            geometry.headerHeight() + branchHeight
        );
    }

    /**
     * Header height needed so both diagonals pass below the label, clamped to [base, max].
     * A side with no room left of the label (ratio not positive) takes the maximum height.
     */
    static int headerHeight(double labelHalfWidth, double leftRun, double rightRun,
                            int labelBottomY, int baseHeight, int maxHeight) {
        double leftRatio = leftRun > 0 ? (leftRun - labelHalfWidth) / leftRun : 0;
        double rightRatio = rightRun > 0 ? (rightRun - labelHalfWidth) / rightRun : 0;
        double minRatio = Math.max(0, Math.min(leftRatio, rightRatio));
        int required = minRatio > 0 ? (int) Math.ceil(labelBottomY / minRatio) : maxHeight;
        return Math.max(baseHeight, Math.min(maxHeight, required));
    }
}
