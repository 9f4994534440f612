package com.nassikit.layout.geometry;

import com.nassikit.layout.LayoutNode;
import com.nassikit.layout.TextMeasure;

import java.util.ArrayList;
import java.util.List;

import static com.nassikit.layout.StructogramConstants.FONT_SIZE;
import static com.nassikit.layout.StructogramConstants.SECTION_HEADER_HEIGHT;
import static com.nassikit.layout.StructogramConstants.SWITCH_CONDITION_LINE_CLEARANCE;
import static com.nassikit.layout.StructogramConstants.SWITCH_CONDITION_SIDE_CLEARANCE;
import static com.nassikit.layout.StructogramConstants.SWITCH_CONDITION_TOP_PADDING;
import static com.nassikit.layout.StructogramConstants.SWITCH_SELECTOR_BASE_HEIGHT;
import static com.nassikit.layout.StructogramConstants.SWITCH_SELECTOR_MAX_HEIGHT;

/**
 * Column widths and band heights of a switch box.
 * <p>
 * The last column is the default column. One diagonal runs from the top-left corner down to the
 * top of the default column (the left run, covering all other columns), a second from the
 * top-right corner to the same point (the right run). The selector expression is centered over
 * that point and both runs must leave it clear, the same way an if header does.
 */
public record SwitchGeometry(int[] caseWidths, int width, int selectorBandHeight, int labelBandHeight) {

    public static final int CONDITION_BOTTOM_Y =
        SWITCH_CONDITION_TOP_PADDING + FONT_SIZE + SWITCH_CONDITION_LINE_CLEARANCE;

    /**
     * Case to lay out: its label, laid-out body and the width it asks for.
     */
    public record CaseInput(String label, LayoutNode body, int minWidth) {
    }

    /**
     * Widen the preferred case widths until the selector clears both diagonals,
     * then pick the selector band height.
     *
     * @param expressionWidth     padded width of the selector expression
     * @param preferredCaseWidths content-driven width of each column, default column last
     */
    public static SwitchGeometry fit(int expressionWidth, int[] preferredCaseWidths) {
        double halfWidth = expressionWidth / 2.0;
        int[] caseWidths = preferredCaseWidths.clone();

        caseWidths = ensureMinimumRuns(caseWidths, halfWidth + SWITCH_CONDITION_SIDE_CLEARANCE);

        double minRatioAtMaxSelector = (double) CONDITION_BOTTOM_Y / SWITCH_SELECTOR_MAX_HEIGHT;
        if (minRatioAtMaxSelector > 0 && minRatioAtMaxSelector < 1) {
            caseWidths = ensureMinimumRuns(caseWidths, halfWidth / (1 - minRatioAtMaxSelector));
        }

        int totalWidth = (int) ColumnWidths.sum(caseWidths);
        boolean hasDefaultColumn = caseWidths.length >= 2;
        double rightRun = hasDefaultColumn ? caseWidths[caseWidths.length - 1] : totalWidth / 2.0;
        double leftRun = hasDefaultColumn ? totalWidth - rightRun : totalWidth / 2.0;

        int selectorBandHeight = IfGeometry.headerHeight(halfWidth, leftRun, rightRun,
            CONDITION_BOTTOM_Y, SWITCH_SELECTOR_BASE_HEIGHT, SWITCH_SELECTOR_MAX_HEIGHT);
        return new SwitchGeometry(caseWidths, totalWidth, selectorBandHeight, SECTION_HEADER_HEIGHT);
    }

    /**
     * Lay out a switch box from its (already merged) cases.
     */
    public static LayoutNode.Switch build(String expression, List<CaseInput> cases, int branchHeight,
                                          TextMeasure measure) {
        int[] initialWidths = new int[cases.size()];
        for (int i = 0; i < cases.size(); i++) {
            CaseInput entry = cases.get(i);
            initialWidths[i] = Math.max(entry.minWidth(), measure.boxWidth(entry.label()));
        }
        int[] caseWidths = ColumnWidths.distributeToTarget(initialWidths, measure.boxWidth(expression));
        SwitchGeometry geometry = fit(measure.inlineWidth(expression), caseWidths);

        List<LayoutNode.Switch.Case> resolved = new ArrayList<>(cases.size());
        for (int i = 0; i < cases.size(); i++) {
            CaseInput entry = cases.get(i);
            resolved.add(new LayoutNode.Switch.Case(entry.label(), entry.body(), geometry.caseWidths()[i]));
        }

        return new LayoutNode.Switch(
            expression,
            resolved,
            geometry.selectorBandHeight(),
            geometry.labelBandHeight(),
            branchHeight,
            geometry.width(),
            geometry.selectorBandHeight() + geometry.labelBandHeight() + branchHeight
        );
    }

    private static int[] ensureMinimumRuns(int[] caseWidths, double minimumRun) {
        if (caseWidths.length == 0) {
            return caseWidths;
        }

        if (caseWidths.length == 1) {
            // no default split: the single column carries both runs
            int requiredTotalWidth = (int) Math.ceil(minimumRun * 2);
            if (caseWidths[0] < requiredTotalWidth) {
                return new int[] {requiredTotalWidth};
            }
            return caseWidths;
        }

        int defaultIndex = caseWidths.length - 1;
        int[] leftIndices = new int[defaultIndex];
        for (int i = 0; i < defaultIndex; i++) {
            leftIndices[i] = i;
        }
        int[] rightIndices = {defaultIndex};

        int[] widths = caseWidths;
        long leftRun = ColumnWidths.sum(widths) - widths[defaultIndex];
        if (leftRun < minimumRun) {
            widths = ColumnWidths.distributeExtraWidth(widths, leftIndices, (int) Math.ceil(minimumRun - leftRun));
        }
        int rightRun = widths[defaultIndex];
        if (rightRun < minimumRun) {
            widths = ColumnWidths.distributeExtraWidth(widths, rightIndices, (int) Math.ceil(minimumRun - rightRun));
        }
        return widths;
    }
}
