package com.demographics.anomaly.model;

public enum Sex {
    MALE,
    FEMALE;

    /**
     * Parses the labels fetchers write ("Male", "female", "M", "F").
     * Returns null for anything else, including totals.
     */
    public static Sex parse(String label) {
        if (label == null) return null;
        String normalized = label.trim().toUpperCase();
        if (normalized.equals("MALE") || normalized.equals("M")) return MALE;
        if (normalized.equals("FEMALE") || normalized.equals("F")) return FEMALE;
        return null;
    }
}
