package com.eainde.loganalyzer.model;

import java.util.Locale;
import java.util.Optional;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /** Lenient parse of a model-supplied severity; anything unrecognised yields empty. */
    public static Optional<Severity> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String v = value.trim().toUpperCase(Locale.ROOT);
        return switch (v) {
            case "LOW", "MINOR" -> Optional.of(LOW);
            case "MEDIUM", "MODERATE" -> Optional.of(MEDIUM);
            case "HIGH", "MAJOR" -> Optional.of(HIGH);
            case "CRITICAL", "BLOCKER" -> Optional.of(CRITICAL);
            default -> Optional.empty();
        };
    }
}
