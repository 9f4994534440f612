package com.nassikit.render;

import com.nassikit.layout.LayoutNode;
import com.nassikit.layout.LayoutStretcher;
import com.nassikit.layout.StructogramConstants;
import com.nassikit.layout.geometry.ColumnWidths;
import com.nassikit.layout.geometry.TryGeometry;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.util.ArrayList;
import java.util.List;

import static com.nassikit.layout.StructogramConstants.FINALLY_HEADER_LABEL;
import static com.nassikit.layout.StructogramConstants.HEADER_HEIGHT;
import static com.nassikit.layout.StructogramConstants.IF_CONDITION_TOP_PADDING;
import static com.nassikit.layout.StructogramConstants.SECTION_HEADER_HEIGHT;
import static com.nassikit.layout.StructogramConstants.SWITCH_CONDITION_TOP_PADDING;
import static com.nassikit.layout.StructogramConstants.TEXT_PADDING_X;
import static com.nassikit.layout.StructogramConstants.TRY_FRAME_SIDE_WIDTH;
import static com.nassikit.layout.StructogramConstants.TRY_HEADER_LABEL;

/**
 * Draws a layout tree onto a {@link Graphics2D}.
 * <p>
 * Nodes are drawn at the width they are given, which may be wider than their own layout width;
 * side-by-side columns are rescaled with {@link ColumnWidths#fitColumnWidths} to fill it.
 * Short branches are stretched or padded so every column reaches the bottom of its box.
 */
public class StructogramRenderer {

    private final Theme theme;

    public StructogramRenderer(Theme theme) {
        this.theme = theme;
    }

    /**
     * Set up strokes, font and antialiasing on a fresh graphics context.
     */
    public void prepare(Graphics2D g) {
        g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
        g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
        g.setRenderingHint(RenderingHints.KEY_STROKE_CONTROL, RenderingHints.VALUE_STROKE_PURE);
        g.setStroke(new BasicStroke(theme.strokeWidth()));
        g.setFont(theme.font());
    }

    /**
     * Draw {@code node} with its top-left corner at (x, y), stretched to {@code width}.
     */
    public void render(Graphics2D g, LayoutNode node, int x, int y, int width) {
        if (node instanceof LayoutNode.Statement statement) {
            renderStatement(g, statement, x, y, width);
        } else if (node instanceof LayoutNode.Sequence sequence) {
            int offsetY = y;
            for (LayoutNode child : sequence.children()) {
                render(g, child, x, offsetY, width);
                offsetY += child.height();
            }
        } else if (node instanceof LayoutNode.If ifNode) {
            renderIf(g, ifNode, x, y, width);
        } else if (node instanceof LayoutNode.Loop loop) {
            renderLoop(g, loop, x, y, width);
        } else if (node instanceof LayoutNode.Switch switchNode) {
            renderSwitch(g, switchNode, x, y, width);
        } else if (node instanceof LayoutNode.Try tryNode) {
            renderTry(g, tryNode, x, y, width);
        }
    }

    private void renderStatement(Graphics2D g, LayoutNode.Statement node, int x, int y, int width) {
        box(g, theme.body(), x, y, width, node.height());
        if (StructogramConstants.isNoElsePlaceholder(node.text())) {
            centeredText(g, node.text(), x, y, width, node.height(), theme.text());
        } else {
            leftAlignedText(g, node.text(), x, y, node.height(), theme.text());
        }
    }

    private void renderIf(Graphics2D g, LayoutNode.If node, int x, int y, int width) {
        LayoutNode thenBranch = LayoutStretcher.stretchLastStatement(node.thenBranch(), node.branchHeight());
        LayoutNode elseBranch = LayoutStretcher.stretchLastStatement(node.elseBranch(), node.branchHeight());

        int branchTop = y + node.headerHeight();
        int[] columns = ColumnWidths.fitColumnWidths(new int[] {node.leftWidth(), node.rightWidth()}, width);
        int leftWidth = columns[0];
        int rightWidth = columns[1];
        int splitX = x + leftWidth;

        box(g, theme.body(), x, y, width, node.height());
        box(g, theme.ifHeader(), x, y, width, node.headerHeight());
        line(g, x, y, splitX, branchTop);
        line(g, x + width, y, splitX, branchTop);
        line(g, splitX, branchTop, splitX, y + node.height());
        line(g, x, branchTop, x + width, branchTop);

        g.setColor(theme.text());
        drawCentered(g, node.condition(), splitX, y + theme.fontSize() + IF_CONDITION_TOP_PADDING);

        g.setColor(theme.mutedText());
        int labelY = branchTop - theme.labelOffsetY();
        g.drawString("T", x + TEXT_PADDING_X, labelY);
        g.drawString("F", x + width - TEXT_PADDING_X - g.getFontMetrics().stringWidth("F"), labelY);

        box(g, theme.branch(), x, branchTop, leftWidth, node.branchHeight());
        box(g, theme.branch(), splitX, branchTop, rightWidth, node.branchHeight());

        render(g, thenBranch, x, branchTop, leftWidth);
        paddedRemainder(g, x, branchTop, leftWidth, thenBranch.height(), node.branchHeight());
        render(g, elseBranch, splitX, branchTop, rightWidth);
        paddedRemainder(g, splitX, branchTop, rightWidth, elseBranch.height(), node.branchHeight());
    }

    private void renderLoop(Graphics2D g, LayoutNode.Loop node, int x, int y, int width) {
        int footerHeight = node.hasFooter() ? HEADER_HEIGHT : 0;
        int bodyHeight = node.height() - HEADER_HEIGHT - footerHeight;
        LayoutNode body = LayoutStretcher.stretchLastStatement(node.body(), bodyHeight);

        int bodyY = y + HEADER_HEIGHT;
        int footerY = bodyY + bodyHeight;
        boolean inset = node.bodyInsetWidth() > 0;
        int contentX = x + node.bodyInsetWidth();
        int contentWidth = width - node.bodyInsetWidth();

        box(g, theme.body(), x, y, width, node.height());
        if (inset) {
            fill(g, theme.loopHeader(), x, y, width, HEADER_HEIGHT);
        } else {
            box(g, theme.condition(), x, y, width, HEADER_HEIGHT);
        }
        leftAlignedText(g, node.header(), x, y, HEADER_HEIGHT, theme.text());

        if (inset) {
            fill(g, theme.branch(), x, bodyY, width, bodyHeight);
            fill(g, theme.loopHeader(), x, bodyY, node.bodyInsetWidth(), bodyHeight);
            line(g, contentX, bodyY, x + width, bodyY);
            line(g, contentX, bodyY, contentX, footerY);
            // the fills cover the outer frame on the inset side
            line(g, x, y, x, y + node.height());
        }

        render(g, body, contentX, bodyY, contentWidth);
        paddedRemainder(g, contentX, bodyY, contentWidth, body.height(), bodyHeight);

        if (node.hasFooter()) {
            box(g, theme.condition(), x, footerY, width, HEADER_HEIGHT);
            leftAlignedText(g, node.footer(), x, footerY, HEADER_HEIGHT, theme.text());
        }
    }

    private void renderSwitch(Graphics2D g, LayoutNode.Switch node, int x, int y, int width) {
        List<LayoutNode.Switch.Case> cases = new ArrayList<>(node.cases().size());
        for (LayoutNode.Switch.Case entry : node.cases()) {
            LayoutNode body = LayoutStretcher.stretchLoopBody(entry.body(), node.branchHeight());
            cases.add(body == entry.body() ? entry : entry.withBody(body));
        }

        int headerBottom = y + node.headerHeight();
        int[] baseWidths = new int[cases.size()];
        for (int i = 0; i < baseWidths.length; i++) {
            baseWidths[i] = cases.get(i).width();
        }
        int[] columnWidths = ColumnWidths.fitColumnWidths(baseWidths, width);
        int[] columnStarts = new int[columnWidths.length];
        int cumulativeX = x;
        for (int i = 0; i < columnWidths.length; i++) {
            columnStarts[i] = cumulativeX;
            cumulativeX += columnWidths[i];
        }

        boolean multipleColumns = columnWidths.length >= 2;
        int defaultColumnX = multipleColumns ? columnStarts[columnStarts.length - 1] : x + width / 2;
        int diagonalRun = Math.max(defaultColumnX - x, 1);
        int apexY = y + node.selectorBandHeight();

        box(g, theme.body(), x, y, width, node.height());
        box(g, theme.switchHeader(), x, y, width, node.headerHeight());
        line(g, x, y, defaultColumnX, apexY);
        line(g, x + width, y, defaultColumnX, apexY);
        line(g, defaultColumnX, apexY, defaultColumnX, headerBottom);
        if (multipleColumns) {
            // drop lines for the inner columns start where they cross the left diagonal
            for (int i = 1; i < columnStarts.length - 1; i++) {
                int columnX = columnStarts[i];
                int diagonalY = y + (int) Math.round((double) (columnX - x) * (apexY - y) / diagonalRun);
                line(g, columnX, diagonalY, columnX, headerBottom);
            }
        }

        g.setColor(theme.text());
        drawCentered(g, node.expression(), defaultColumnX, y + theme.fontSize() + SWITCH_CONDITION_TOP_PADDING);

        for (int i = 0; i < cases.size(); i++) {
            LayoutNode.Switch.Case entry = cases.get(i);
            int columnX = columnStarts[i];
            int columnWidth = columnWidths[i];

            centeredText(g, entry.label(), columnX, apexY, columnWidth, node.labelBandHeight(), theme.text());
            box(g, theme.branch(), columnX, headerBottom, columnWidth, node.branchHeight());
            render(g, entry.body(), columnX, headerBottom, columnWidth);
            paddedRemainder(g, columnX, headerBottom, columnWidth, entry.body().height(), node.branchHeight());
            if (i > 0) {
                line(g, columnX, headerBottom, columnX, y + node.height());
            }
        }
    }

    private void renderTry(Graphics2D g, LayoutNode.Try node, int x, int y, int width) {
        int sideWidth = Math.min(TRY_FRAME_SIDE_WIDTH, Math.max(1, width / 3));
        int contentX = x + sideWidth;
        int contentWidth = Math.max(1, width - sideWidth);

        box(g, theme.body(), x, y, width, node.height());
        sectionHeader(g, TRY_HEADER_LABEL, theme.tryWrapper(), x, y, width, HEADER_HEIGHT, sideWidth, true);
        int offsetY = y + HEADER_HEIGHT;

        framedBody(g, x, offsetY, width, node.body().height(), sideWidth);
        render(g, node.body(), contentX, offsetY, contentWidth);
        offsetY += node.body().height();

        for (LayoutNode.Try.Catch entry : node.catches()) {
            sectionHeader(g, TryGeometry.catchHeader(entry.exception()), theme.section(), x, offsetY, width,
                SECTION_HEADER_HEIGHT, sideWidth, false);
            offsetY += SECTION_HEADER_HEIGHT;
            framedBody(g, x, offsetY, width, entry.body().height(), sideWidth);
            render(g, entry.body(), contentX, offsetY, contentWidth);
            offsetY += entry.body().height();
        }

        if (node.hasFinally()) {
            sectionHeader(g, FINALLY_HEADER_LABEL, theme.section(), x, offsetY, width,
                SECTION_HEADER_HEIGHT, sideWidth, false);
            offsetY += SECTION_HEADER_HEIGHT;
            framedBody(g, x, offsetY, width, node.finallyBranch().height(), sideWidth);
            render(g, node.finallyBranch(), contentX, offsetY, contentWidth);
        }

        g.setColor(theme.border());
        g.drawRect(x, y, width, node.height());
    }

    private void sectionHeader(Graphics2D g, String label, Color fill, int x, int y, int width, int height,
                               int sideWidth, boolean fullTopBorder) {
        fill(g, fill, x, y, width, height);
        if (fullTopBorder) {
            line(g, x, y, x + width, y);
        } else {
            divider(g, x, y, width, sideWidth);
        }
        divider(g, x, y + height, width, sideWidth);
        leftAlignedText(g, label, x, y, height, theme.text());
    }

    private void framedBody(Graphics2D g, int x, int y, int width, int height, int sideWidth) {
        fill(g, theme.tryWrapper(), x, y, sideWidth, height);
        divider(g, x, y, width, sideWidth);
        divider(g, x, y + height, width, sideWidth);
        line(g, x + sideWidth, y, x + sideWidth, y + height);
    }

    // the part over the side band takes the wrapper color so the frame reads as one shape
    private void divider(Graphics2D g, int x, int y, int width, int sideWidth) {
        g.setColor(theme.tryWrapper());
        g.drawLine(x, y, x + sideWidth, y);
        line(g, x + sideWidth, y, x + width, y);
    }

    private void paddedRemainder(Graphics2D g, int x, int y, int width, int contentHeight, int fullHeight) {
        if (contentHeight >= fullHeight) {
            return;
        }
        box(g, theme.body(), x, y + contentHeight, width, fullHeight - contentHeight);
    }

    private void box(Graphics2D g, Color fill, int x, int y, int width, int height) {
        fill(g, fill, x, y, width, height);
        g.setColor(theme.border());
        g.drawRect(x, y, width, height);
    }

    private static void fill(Graphics2D g, Color fill, int x, int y, int width, int height) {
        g.setColor(fill);
        g.fillRect(x, y, width, height);
    }

    private void line(Graphics2D g, int x1, int y1, int x2, int y2) {
        g.setColor(theme.border());
        g.drawLine(x1, y1, x2, y2);
    }

    private int baseline(int top, int rowHeight) {
        return top + rowHeight / 2 + theme.baselineOffset() / 2;
    }

    private void leftAlignedText(Graphics2D g, String value, int x, int y, int rowHeight, Color color) {
        g.setColor(color);
        g.drawString(value, x + TEXT_PADDING_X, baseline(y, rowHeight));
    }

    private void centeredText(Graphics2D g, String value, int x, int y, int width, int rowHeight, Color color) {
        g.setColor(color);
        drawCentered(g, value, x + width / 2, baseline(y, rowHeight));
    }

    private static void drawCentered(Graphics2D g, String value, int centerX, int baselineY) {
        FontMetrics metrics = g.getFontMetrics();
        g.drawString(value, centerX - metrics.stringWidth(value) / 2, baselineY);
    }
}
