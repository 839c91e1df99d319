package com.tennis.tracker.export;

import java.util.Locale;

/**
 * Formatting helpers for statistics ratios.
 */
public final class Ratios {

    private Ratios() {}

    /**
     * One decimal place percentage, or {@code --} when the denominator is zero.
     */
    public static String percent(int numerator, int denominator) {
        if (denominator <= 0) {
            return "--";
        }
        return String.format(Locale.ROOT, "%.1f%%", 100.0 * numerator / denominator);
    }

    public static String ratio(int numerator, int denominator) {
        return numerator + "/" + denominator;
    }

    /**
     * {@code n/d (p%)}.
     */
    public static String ratioWithPercent(int numerator, int denominator) {
        return ratio(numerator, denominator) + " (" + percent(numerator, denominator) + ")";
    }
}
