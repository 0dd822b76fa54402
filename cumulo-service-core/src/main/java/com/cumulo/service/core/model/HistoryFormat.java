package com.cumulo.service.core.model;

import java.util.Locale;

/** Storage form used for newly created activity histories. */
public enum HistoryFormat {
    DATE_LIST,
    BITSET;

    public static HistoryFormat fromConfigValue(String value) {
        if (value == null || value.isBlank()) {
            return DATE_LIST;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return switch (normalized) {
            case "DATE_LIST", "DATES", "LIST" -> DATE_LIST;
            case "BITSET", "DATELIST_INT", "BITS" -> BITSET;
            default -> throw new IllegalArgumentException("Unsupported history format: " + value);
        };
    }
}
