package com.nassikit.layout;

/**
 * Fixed sizes of the structogram notation, in pixels.
 * These drive layout decisions; colors and render-only offsets live in the renderer's theme.
 */
public final class StructogramConstants {

    private StructogramConstants() {
    }

    // Text
    public static final int FONT_SIZE = 12;
    public static final int CHAR_WIDTH = 7;
    public static final int TEXT_PADDING_X = 10;
    public static final int MIN_CONTENT_WIDTH = Math.max(64, TEXT_PADDING_X * 2 + CHAR_WIDTH * 4);

    // Rows and bands
    public static final int ROW_HEIGHT = 30;
    public static final int HEADER_HEIGHT = 30;
    public static final int SECTION_HEADER_HEIGHT = 24;

    // Loops
    public static final int LOOP_BODY_INSET_WIDTH = 28;

    // Try/catch/finally
    public static final int TRY_FRAME_SIDE_WIDTH = 28;
    public static final String TRY_HEADER_LABEL = "try";
    public static final String FINALLY_HEADER_LABEL = "finally";

    // If header
    public static final int IF_HEADER_BASE_HEIGHT = HEADER_HEIGHT + 10;
    public static final int IF_HEADER_MAX_HEIGHT = ROW_HEIGHT * 2;
    public static final int IF_CONDITION_TOP_PADDING = 5;
    public static final int IF_CONDITION_SIDE_CLEARANCE = 10;
    public static final int IF_CONDITION_LINE_CLEARANCE = 4;

    // Switch header
    public static final int SWITCH_SELECTOR_BASE_HEIGHT = HEADER_HEIGHT;
    public static final int SWITCH_SELECTOR_MAX_HEIGHT = ROW_HEIGHT * 2;
    public static final int SWITCH_CONDITION_TOP_PADDING = 5;
    public static final int SWITCH_CONDITION_SIDE_CLEARANCE = 10;
    public static final int SWITCH_CONDITION_LINE_CLEARANCE = 4;

    // Placeholder and fallback labels
    public static final String EMPTY_BODY_LABEL = "(empty)";
    public static final String NO_ELSE_LABEL = "∅";
    public static final String LEGACY_NO_ELSE_LABEL = "(no else)";
    public static final String CONDITION_FALLBACK = "condition";
    public static final String SELECTOR_FALLBACK = "selector";
    public static final String CATCH_FALLBACK = "catch";
    public static final String DEFAULT_CASE_LABEL = "default";
    public static final String LOOP_KIND_FALLBACK = "loop";

    /**
     * Whether a statement text is the no-else sentinel, which is drawn centered.
     */
    public static boolean isNoElsePlaceholder(String text) {
        if (text == null) {
            return false;
        }
        String trimmed = text.trim();
        return trimmed.equals(NO_ELSE_LABEL) || trimmed.equalsIgnoreCase(LEGACY_NO_ELSE_LABEL);
    }
}
