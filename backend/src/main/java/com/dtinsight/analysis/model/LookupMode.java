package com.dtinsight.analysis.model;

import java.util.Locale;

public enum LookupMode {
    EXACT,
    FUZZY;

    public static LookupMode fromRaw(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return LookupMode.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
