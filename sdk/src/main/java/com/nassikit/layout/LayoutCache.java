package com.nassikit.layout;

import com.nassikit.tree.ControlNode;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Remembers the most recent layout and hands it out again while the tree and the estimator
 * are the very same instances. Control-flow trees are immutable, so identity is enough.
 */
public class LayoutCache {

    private record Entry(ControlNode tree, TextWidthEstimator estimator, Optional<LayoutNode> layout) {
    }

    private volatile Entry last;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    /**
     * Layout of {@code tree} as produced by {@code builder}, reusing the previous result when possible.
     */
    public Optional<LayoutNode> layout(ControlNode tree, LayoutBuilder builder) {
        Entry entry = last;
        if (entry != null && entry.tree() == tree && entry.estimator() == builder.estimator()) {
            hits.incrementAndGet();
            return entry.layout();
        }
        misses.incrementAndGet();
        Optional<LayoutNode> layout = builder.build(tree);
        last = new Entry(tree, builder.estimator(), layout);
        return layout;
    }

    public void clear() {
        last = null;
    }

    public long getHits() {
        return hits.get();
    }

    public long getMisses() {
        return misses.get();
    }
}
