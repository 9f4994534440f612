package com.nassikit.layout.geometry;

import java.util.Arrays;

/**
 * Integer width distribution over side-by-side columns.
 * None of these methods modify the arrays passed in.
 */
public final class ColumnWidths {

    private ColumnWidths() {
    }

    /**
     * Scale column widths proportionally so they sum to exactly {@code targetWidth}.
     * <p>
     * Widths already within half a pixel of the target are returned as is (the same array).
     * A non-positive target also returns the input; columns that sum to zero share the target evenly.
     */
    public static int[] fitColumnWidths(int[] baseWidths, int targetWidth) {
        if (baseWidths.length == 0) {
            return new int[0];
        }
        if (targetWidth <= 0) {
            return baseWidths;
        }
        long baseTotal = sum(baseWidths);
        if (Math.abs(baseTotal - targetWidth) < 0.5) {
            return baseWidths;
        }
        if (baseTotal <= 0) {
            return distributeToTarget(new int[baseWidths.length], targetWidth);
        }

        int[] widths = new int[baseWidths.length];
        for (int i = 0; i < baseWidths.length; i++) {
            widths[i] = (int) Math.floor(((double) baseWidths[i] / baseTotal) * targetWidth);
        }

        long remainder = targetWidth - sum(widths);
        int index = 0;
        while (remainder > 0) {
            widths[index % widths.length] += 1;
            remainder--;
            index++;
        }

        long used = sum(widths);
        if (used != targetWidth) {
            widths[widths.length - 1] += (int) (targetWidth - used);
        }
        return widths;
    }

    /**
     * Add {@code extra} pixels spread evenly over the given column indices;
     * the leftover pixels go one each to the first indices.
     */
    public static int[] distributeExtraWidth(int[] widths, int[] indices, int extra) {
        if (extra <= 0 || indices.length == 0) {
            return widths;
        }
        int[] next = Arrays.copyOf(widths, widths.length);
        int baseIncrement = extra / indices.length;
        int remainder = extra % indices.length;
        for (int index : indices) {
            next[index] += baseIncrement + (remainder > 0 ? 1 : 0);
            if (remainder > 0) {
                remainder--;
            }
        }
        return next;
    }

    /**
     * Grow all columns evenly until they sum to at least {@code targetWidth}.
     * Columns that are already wide enough are returned unchanged.
     */
    public static int[] distributeToTarget(int[] widths, int targetWidth) {
        long current = sum(widths);
        if (widths.length == 0 || current >= targetWidth) {
            return widths;
        }
        int[] all = new int[widths.length];
        for (int i = 0; i < all.length; i++) {
            all[i] = i;
        }
        return distributeExtraWidth(widths, all, (int) (targetWidth - current));
    }

    public static long sum(int[] widths) {
        long total = 0;
        for (int width : widths) {
            total += width;
        }
        return total;
    }
}
