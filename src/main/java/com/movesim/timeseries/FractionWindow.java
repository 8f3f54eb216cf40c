package com.movesim.timeseries;

import java.util.ArrayList;
import java.util.List;

/**
 * Selects a contiguous sub-range of an ordered list by relative position.
 *
 * <p>For {@code n} elements the window is the half-open index range
 * {@code [floor(min * n), floor(max * n))}. Fractions are clamped rather than rejected:
 * NaN becomes the full range bound, values are forced into [0, 1], and a lower bound above the
 * upper bound is lowered to it, which yields an empty window.
 *
 * @param minFraction clamped lower fraction
 * @param maxFraction clamped upper fraction
 */
public record FractionWindow(double minFraction, double maxFraction) {

    public static final FractionWindow ALL = new FractionWindow(0.0, 1.0);

    public FractionWindow {
        double max = Double.isNaN(maxFraction) ? 1.0 : clamp(maxFraction);
        double min = Double.isNaN(minFraction) ? 0.0 : clamp(minFraction);
        minFraction = Math.min(min, max);
        maxFraction = max;
    }

    public int startIndex(int size) {
        return Math.min(index(minFraction, size), endIndex(size));
    }

    public int endIndex(int size) {
        return index(maxFraction, size);
    }

    /**
     * Copies the window's elements out of {@code ordered}. The source list is not retained.
     */
    public <T> List<T> apply(List<T> ordered) {
        int size = ordered.size();
        if (size == 0) {
            return new ArrayList<>();
        }
        return new ArrayList<>(ordered.subList(startIndex(size), endIndex(size)));
    }

    private static int index(double fraction, int size) {
        long index = (long) Math.floor(fraction * size);
        return (int) Math.max(0, Math.min(size, index));
    }

    private static double clamp(double fraction) {
        return Math.max(0.0, Math.min(1.0, fraction));
    }
}
