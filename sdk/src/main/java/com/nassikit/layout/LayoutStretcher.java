package com.nassikit.layout;

import java.util.ArrayList;
import java.util.List;

/**
 * Height adjustments applied before drawing, so a short branch fills its column
 * instead of leaving a blank remainder.
 * <p>
 * Nodes are never changed in place: the nodes on the path to the stretched one are copied,
 * every other subtree is shared with the input. When nothing needs to change the input
 * instance itself is returned, so callers can test with {@code ==}.
 */
public final class LayoutStretcher {

    private LayoutStretcher() {
    }

    /**
     * Grow a statement, or the last statement of a sequence, to make the node {@code targetHeight} tall.
     */
    public static LayoutNode stretchLastStatement(LayoutNode node, int targetHeight) {
        if (node.height() >= targetHeight) {
            return node;
        }
        if (node instanceof LayoutNode.Statement statement) {
            return statement.withHeight(targetHeight);
        }
        if (node instanceof LayoutNode.Sequence sequence
                && sequence.lastChild() instanceof LayoutNode.Statement last) {
            int delta = targetHeight - sequence.height();
            return replaceLast(sequence, last.withHeight(last.height() + delta), targetHeight);
        }
        return node;
    }

    /**
     * Grow a pre-test loop, or a sequence ending in one, to {@code targetHeight}.
     * Post-test loops keep their height because their footer has to stay at the bottom of the body.
     */
    public static LayoutNode stretchLoopBody(LayoutNode node, int targetHeight) {
        if (node.height() >= targetHeight) {
            return node;
        }
        if (node instanceof LayoutNode.Loop loop && !loop.hasFooter()) {
            return loop.withHeight(targetHeight);
        }
        if (node instanceof LayoutNode.Sequence sequence
                && sequence.lastChild() instanceof LayoutNode.Loop last
                && !last.hasFooter()) {
            int delta = targetHeight - sequence.height();
            return replaceLast(sequence, last.withHeight(last.height() + delta), targetHeight);
        }
        return node;
    }

    private static LayoutNode.Sequence replaceLast(LayoutNode.Sequence sequence, LayoutNode replacement,
                                                   int newHeight) {
        List<LayoutNode> children = new ArrayList<>(sequence.children());
        children.set(children.size() - 1, replacement);
        return new LayoutNode.Sequence(children, sequence.width(), newHeight);
    }
}
