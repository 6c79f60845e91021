package com.dtinsight.analysis.model;

import java.util.Locale;

public enum RankDirection {
    DESCENDING,
    ASCENDING;

    /**
     * Accepts {@code desc}/{@code asc} as well as the full names. Returns {@code null} for anything else.
     */
    public static RankDirection fromRaw(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        return switch (normalized) {
            case "DESC", "DESCENDING" -> DESCENDING;
            case "ASC", "ASCENDING" -> ASCENDING;
            default -> null;
        };
    }
}
