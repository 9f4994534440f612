package com.nassikit.layout.geometry;

import com.nassikit.layout.LayoutNode;
import com.nassikit.layout.TextMeasure;

import java.util.List;

import static com.nassikit.layout.StructogramConstants.FINALLY_HEADER_LABEL;
import static com.nassikit.layout.StructogramConstants.HEADER_HEIGHT;
import static com.nassikit.layout.StructogramConstants.SECTION_HEADER_HEIGHT;
import static com.nassikit.layout.StructogramConstants.TRY_FRAME_SIDE_WIDTH;
import static com.nassikit.layout.StructogramConstants.TRY_HEADER_LABEL;

/**
 * Try boxes: a {@code try} header over the framed body, then a header and framed body
 * per catch clause and for the finally block.
 */
public final class TryGeometry {

    private TryGeometry() {
    }

    public static String catchHeader(String exception) {
        return "catch (" + exception + ")";
    }

    /**
     * @param finallyBranch laid-out finally block, or null if there is none
     */
    public static LayoutNode.Try build(LayoutNode body, List<LayoutNode.Try.Catch> catches,
                                       LayoutNode finallyBranch, TextMeasure measure) {
        int width = Math.max(measure.boxWidth(TRY_HEADER_LABEL), framed(body));
        int height = HEADER_HEIGHT + body.height();

        for (LayoutNode.Try.Catch entry : catches) {
            width = Math.max(width, Math.max(measure.boxWidth(catchHeader(entry.exception())), framed(entry.body())));
            height += SECTION_HEADER_HEIGHT + entry.body().height();
        }

        if (finallyBranch != null) {
            width = Math.max(width, Math.max(measure.boxWidth(FINALLY_HEADER_LABEL), framed(finallyBranch)));
            height += SECTION_HEADER_HEIGHT + finallyBranch.height();
        }

        return new LayoutNode.Try(body, catches, finallyBranch, width, height);
    }

    // bodies sit right of the frame's side band
    private static int framed(LayoutNode section) {
        return section.width() + TRY_FRAME_SIDE_WIDTH;
    }
}
