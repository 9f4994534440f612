package com.nassikit.layout;

import java.util.List;

/**
 * Sealed interface for the boxes of a laid-out structogram.
 * Every node knows its own pixel size; nodes are immutable and may be shared between trees.
 */
public sealed interface LayoutNode permits
        LayoutNode.Statement,
        LayoutNode.Sequence,
        LayoutNode.If,
        LayoutNode.Loop,
        LayoutNode.Switch,
        LayoutNode.Try {

    int width();

    int height();

    /**
     * Single row of text.
     */
    record Statement(String text, int width, int height) implements LayoutNode {
        public Statement withHeight(int newHeight) {
            return new Statement(text, width, newHeight);
        }
    }

    /**
     * Children stacked top to bottom; height is the sum of theirs, width the widest.
     */
    record Sequence(List<LayoutNode> children, int width, int height) implements LayoutNode {
        public Sequence {
            children = List.copyOf(children);
        }

        public static Sequence of(List<LayoutNode> children) {
            int width = 0;
            int height = 0;
            for (LayoutNode child : children) {
                width = Math.max(width, child.width());
                height += child.height();
            }
            return new Sequence(children, width, height);
        }

        public boolean isEmpty() {
            return children.isEmpty();
        }

        public LayoutNode lastChild() {
            return children.isEmpty() ? null : children.get(children.size() - 1);
        }
    }

    /**
     * Binary decision: triangular header over a then column (left) and an else column (right).
     */
    record If(
        String condition,
        LayoutNode thenBranch,
        LayoutNode elseBranch,
        int leftWidth,
        int rightWidth,
        int headerHeight,
        int branchHeight,
        int width,
        int height
    ) implements LayoutNode {
    }

    /**
     * Loop box. Pre-test loops have a header and a left inset; post-test loops
     * have a header, the body at full width and a footer.
     */
    record Loop(String header, String footer, int bodyInsetWidth, LayoutNode body, int width, int height)
            implements LayoutNode {

        public boolean hasFooter() {
            return footer != null;
        }

        public Loop withHeight(int newHeight) {
            return new Loop(header, footer, bodyInsetWidth, body, width, newHeight);
        }

        public Loop withBody(LayoutNode newBody) {
            return new Loop(header, footer, bodyInsetWidth, newBody, width, height);
        }
    }

    /**
     * Case selection: selector band with the diagonal, a band of case labels, then one column per case.
     * The last column is the default column.
     */
    record Switch(
        String expression,
        List<Case> cases,
        int selectorBandHeight,
        int labelBandHeight,
        int branchHeight,
        int width,
        int height
    ) implements LayoutNode {
        public Switch {
            cases = List.copyOf(cases);
        }

        public Switch withCases(List<Case> newCases) {
            return new Switch(expression, newCases, selectorBandHeight, labelBandHeight, branchHeight, width, height);
        }

        public int headerHeight() {
            return selectorBandHeight + labelBandHeight;
        }

        public record Case(String label, LayoutNode body, int width) {
            public Case withBody(LayoutNode newBody) {
                return new Case(label, newBody, width);
            }
        }
    }

    /**
     * Try box: framed body followed by catch sections and an optional finally section.
     * {@code finallyBranch} is null when there is no finally block.
     */
    record Try(LayoutNode body, List<Catch> catches, LayoutNode finallyBranch, int width, int height)
            implements LayoutNode {
        public Try {
            catches = List.copyOf(catches);
        }

        public boolean hasFinally() {
            return finallyBranch != null;
        }

        public record Catch(String exception, LayoutNode body) {
        }
    }
}
