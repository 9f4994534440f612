package com.nassikit.text;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cleans statement and label text for display in a structogram.
 * <p>
 * All rewrites are syntactic: they look at the cleaned text only and can misread
 * unusual code, e.g. {@code return a == b} is taken for an assignment to {@code a}.
 */
public final class StatementText {

    public static final String ASSIGNMENT_SYMBOL = "←";

    private static final Pattern BLOCK_COMMENT = Pattern.compile("/\\*.*?\\*/", Pattern.DOTALL);
    private static final Pattern LINE_COMMENT = Pattern.compile("//.*$", Pattern.MULTILINE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TRAILING_SEMICOLONS = Pattern.compile(";+$");

    // [modifiers] type... name = expr
    private static final Pattern DECLARATION_ASSIGNMENT = Pattern.compile(
        "^(?:(?:final|volatile|transient|static)\\s+)*(?:[^\\s=]+\\s+)+([A-Za-z_$][\\w$]*)\\s*=\\s*(.+)$");

    // target = expr, target may use .member and [index] access
    private static final Pattern PLAIN_ASSIGNMENT = Pattern.compile(
        "^([A-Za-z_$][\\w$]*(?:\\.[A-Za-z_$][\\w$]*|\\[[^\\]]+\\])*)\\s*=\\s*(.+)$");

    private static final Set<String> TERMINATORS = Set.of("break", "return", "throw", "continue", "yield");

    private StatementText() {
    }

    /**
     * Replace block and line comments with a single space each.
     */
    public static String stripComments(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        String withoutBlocks = BLOCK_COMMENT.matcher(value).replaceAll(" ");
        return LINE_COMMENT.matcher(withoutBlocks).replaceAll(" ");
    }

    /**
     * Strip comments, collapse whitespace and trim.
     */
    public static String clean(String value) {
        return WHITESPACE.matcher(stripComments(value)).replaceAll(" ").trim();
    }

    /**
     * Clean a label, substituting the fallback when nothing is left.
     */
    public static String normalizeLabel(String value, String fallback) {
        String cleaned = clean(value);
        return cleaned.isEmpty() ? fallback : cleaned;
    }

    /**
     * Normalize a statement for display.
     *
     * @return the display text, or null if the statement has no visible content
     */
    public static String normalizeStatementText(String value) {
        String withoutSemicolon = TRAILING_SEMICOLONS.matcher(clean(value)).replaceAll("").trim();
        if (withoutSemicolon.isEmpty()) {
            return null;
        }

        Matcher declaration = DECLARATION_ASSIGNMENT.matcher(withoutSemicolon);
        if (declaration.matches()) {
            return assignment(declaration.group(1), declaration.group(2));
        }

        Matcher plain = PLAIN_ASSIGNMENT.matcher(withoutSemicolon);
        if (plain.matches()) {
            return assignment(plain.group(1), plain.group(2));
        }

        return withoutSemicolon;
    }

    /**
     * Whether a normalized statement ends the flow of its block
     * (first word is break, return, throw, continue or yield).
     */
    public static boolean isTerminatingStatement(String normalized) {
        if (normalized == null) {
            return false;
        }
        String trimmed = normalized.trim();
        if (trimmed.isEmpty()) {
            return false;
        }
        String keyword = WHITESPACE.split(trimmed, 2)[0].toLowerCase(Locale.ROOT);
        return TERMINATORS.contains(keyword);
    }

    private static String assignment(String target, String expression) {
        return target + " " + ASSIGNMENT_SYMBOL + " " + expression.trim();
    }
}
