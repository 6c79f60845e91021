package com.dtinsight.analysis.model;

import java.util.Locale;

/**
 * Which default metric set an entity comparison is built for.
 */
public enum ComparisonChart {
    RADAR,
    BAR;

    public static ComparisonChart fromRaw(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return ComparisonChart.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
