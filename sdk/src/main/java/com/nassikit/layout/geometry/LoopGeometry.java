package com.nassikit.layout.geometry;

import com.nassikit.layout.LayoutNode;
import com.nassikit.layout.StructogramConstants;
import com.nassikit.layout.TextMeasure;
import com.nassikit.tree.ControlNode;

import static com.nassikit.layout.StructogramConstants.HEADER_HEIGHT;
import static com.nassikit.layout.StructogramConstants.LOOP_BODY_INSET_WIDTH;
import static com.nassikit.layout.StructogramConstants.ROW_HEIGHT;

/**
 * Loop boxes.
 * <p>
 * Pre-test loops ({@code while}, {@code for}, {@code foreach}) get a header row and the body
 * indented by a left band. Post-test loops ({@code doWhile}) get a {@code do} header, the body
 * at full width and a {@code while (...)} footer.
 */
public final class LoopGeometry {

    private LoopGeometry() {
    }

    /**
     * Header and optional footer text for a loop kind; {@code footer} is null for pre-test loops.
     */
    public record Labels(String header, String footer) {
    }

    public static Labels labels(String loopKind, String condition) {
        String kind = loopKind == null || loopKind.isBlank()
            ? StructogramConstants.LOOP_KIND_FALLBACK
            : loopKind.trim();
        if (ControlNode.Loop.isPostTestKind(kind)) {
            return new Labels("do", "while (" + condition + ")");
        }
        return new Labels(kind + " (" + condition + ")", null);
    }

    public static LayoutNode.Loop build(String loopKind, String condition, LayoutNode body, TextMeasure measure) {
        Labels labels = labels(loopKind, condition);

        if (labels.footer() != null) {
            int width = Math.max(
                Math.max(measure.boxWidth(labels.header()), measure.boxWidth(labels.footer())),
                body.width());
            int height = HEADER_HEIGHT + body.height() + HEADER_HEIGHT;
            return new LayoutNode.Loop(labels.header(), labels.footer(), 0, body, width, height);
        }

        int width = Math.max(measure.boxWidth(labels.header()), body.width() + LOOP_BODY_INSET_WIDTH);
        int height = Math.max(ROW_HEIGHT * 2, body.height());
        return new LayoutNode.Loop(labels.header(), null, LOOP_BODY_INSET_WIDTH, body, width, height);
    }
}
