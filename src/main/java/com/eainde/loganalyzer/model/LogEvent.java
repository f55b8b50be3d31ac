package com.eainde.loganalyzer.model;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * One structured log line.
 *
 * @param timestamp parsed timestamp prefix, or null when the line carried none
 * @param level     canonical level, {@link LogLevel#UNKNOWN} when no keyword was found
 * @param message   text after the timestamp and level tokens
 * @param rawLine   the line exactly as read
 */
public record LogEvent(
        LocalDateTime timestamp,
        LogLevel level,
        String message,
        String rawLine
) {
    public LogEvent {
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(rawLine, "rawLine");
    }

    public Optional<LocalDateTime> timestampIfPresent() {
        return Optional.ofNullable(timestamp);
    }
}
