package com.dtinsight.analysis.model;

import java.util.Locale;

public enum LookupField {
    IDENTIFIER,
    NAME;

    public static LookupField fromRaw(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        return switch (normalized) {
            case "IDENTIFIER", "ID", "CODE" -> IDENTIFIER;
            case "NAME" -> NAME;
            default -> null;
        };
    }
}
