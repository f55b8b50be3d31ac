package com.eainde.loganalyzer.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Severity level of a parsed log line. Vendor spellings are folded onto the five canonical values.
 */
public enum LogLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR,
    UNKNOWN;

    /**
     * Maps a level keyword as it appears in a log line (any case, optionally bracketed)
     * to its canonical level.
     */
    public static Optional<LogLevel> fromKeyword(String keyword) {
        if (keyword == null || keyword.isBlank()) {
            return Optional.empty();
        }
        String k = keyword.trim().toUpperCase(Locale.ROOT);
        return switch (k) {
            case "TRACE", "DEBUG", "FINE", "FINER", "FINEST" -> Optional.of(DEBUG);
            case "INFO", "NOTICE" -> Optional.of(INFO);
            case "WARN", "WARNING" -> Optional.of(WARN);
            case "ERROR", "ERR", "FATAL", "SEVERE", "CRITICAL" -> Optional.of(ERROR);
            default -> Optional.empty();
        };
    }
}
