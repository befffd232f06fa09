package com.mimecast.phishguard.signals.detect;

import java.util.Collection;

/**
 * Colour distance checks.
 *
 * <p>Distance is Euclidean in RGB space; two colours match when the distance is strictly below the threshold.
 */
public final class ColorMatcher {

    /**
     * Default match threshold.
     */
    public static final double DEFAULT_THRESHOLD = 30;

    /**
     * Private constructor.
     */
    private ColorMatcher() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Euclidean distance between two colours.
     *
     * @param a First colour.
     * @param b Second colour.
     * @return Distance.
     */
    public static double distance(Rgb a, Rgb b) {
        int dr = a.getRed() - b.getRed();
        int dg = a.getGreen() - b.getGreen();
        int db = a.getBlue() - b.getBlue();
        return Math.sqrt(dr * dr + dg * dg + db * db);
    }

    /**
     * Checks if a colour matches any palette entry.
     *
     * @param color     Colour to check.
     * @param palette   Palette entries.
     * @param threshold Distance threshold.
     * @return Boolean.
     */
    public static boolean matchesAny(Rgb color, Collection<Rgb> palette, double threshold) {
        if (color == null || palette == null) {
            return false;
        }

        for (Rgb entry : palette) {
            if (distance(color, entry) < threshold) {
                return true;
            }
        }
        return false;
    }

    /**
     * Checks if any of the colours matches any palette entry.
     *
     * @param colors    Colours to check.
     * @param palette   Palette entries.
     * @param threshold Distance threshold.
     * @return Boolean.
     */
    public static boolean anyMatches(Collection<Rgb> colors, Collection<Rgb> palette, double threshold) {
        if (colors == null) {
            return false;
        }

        for (Rgb color : colors) {
            if (matchesAny(color, palette, threshold)) {
                return true;
            }
        }
        return false;
    }
}
