package com.eainde.loganalyzer.parse;

import com.eainde.loganalyzer.model.LogEvent;
import com.eainde.loganalyzer.model.LogLevel;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heuristic line parser: timestamp prefix, then the first level keyword, then the message.
 *
 * <p>A line is kept when it has a timestamp or a level keyword and a non-blank message.
 * Anything else (blank lines, stack frames, banners) is skipped by returning empty.</p>
 *
 * <p>Pure logic, no Spring dependencies.</p>
 */
public class EventParser {

    /** Level keywords are only looked for in this many leading characters after the timestamp. */
    static final int LEVEL_SEARCH_WINDOW = 64;

    private static final List<TimestampFormat> TIMESTAMP_FORMATS = List.of(
            // 2024-01-01 10:00:00,123 | 2024-01-01T10:00:00.123Z | [2024-01-01 10:00:00]
            new TimestampFormat(
                    Pattern.compile("^\\[?(\\d{4}-\\d{2}-\\d{2})[T ](\\d{2}:\\d{2}:\\d{2})(?:[.,](\\d{1,9}))?(?:Z|[+-]\\d{2}:?\\d{2})?\\]?"),
                    DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")),
            // 2024/01/01 10:00:00
            new TimestampFormat(
                    Pattern.compile("^\\[?(\\d{4}/\\d{2}/\\d{2}) (\\d{2}:\\d{2}:\\d{2})(?:[.,](\\d{1,9}))?\\]?"),
                    DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss")),
            // 01/01/2024 10:00:00
            new TimestampFormat(
                    Pattern.compile("^\\[?(\\d{2}/\\d{2}/\\d{4}) (\\d{2}:\\d{2}:\\d{2})(?:[.,](\\d{1,9}))?\\]?"),
                    DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm:ss"))
    );

    private static final Pattern LEVEL_TOKEN = Pattern.compile(
            "(?i)(?<![\\w.])\\[?(FINEST|FINER|FINE|TRACE|DEBUG|INFO|NOTICE|WARN|WARNING|ERROR|ERR|FATAL|SEVERE|CRITICAL)\\]?(?![\\w.])");

    // [main], (worker-3), 12345, com.acme.Foo, separators
    private static final Pattern METADATA_PREFIX = Pattern.compile(
            "(?:\\s*+(?:\\[[^\\]]*+\\]|\\([^)]*+\\)|[\\w$]++(?:\\.[\\w$]++)++|\\d++|[|:\\-]++))*+\\s*+");

    private static final Pattern LEADING_SEPARATORS = Pattern.compile("^[\\s:|>\\-\\]]+");

    /**
     * @param line one raw line, may be null
     * @return the event, or empty when the line is not parsable
     */
    public Optional<LogEvent> parse(String line) {
        if (line == null || line.isBlank()) {
            return Optional.empty();
        }
        String rawLine = stripLineTerminator(line);
        String rest = rawLine.strip();

        LocalDateTime timestamp = null;
        for (TimestampFormat format : TIMESTAMP_FORMATS) {
            Matcher m = format.pattern().matcher(rest);
            if (m.find()) {
                timestamp = format.parse(m).orElse(null);
                if (timestamp != null) {
                    rest = rest.substring(m.end());
                    break;
                }
            }
        }

        LogLevel level = LogLevel.UNKNOWN;
        String window = rest.length() > LEVEL_SEARCH_WINDOW ? rest.substring(0, LEVEL_SEARCH_WINDOW) : rest;
        Matcher levelMatcher = LEVEL_TOKEN.matcher(window);
        boolean levelFound = false;
        while (levelMatcher.find()) {
            if (!isLevelToken(window, levelMatcher)) {
                continue;
            }
            Optional<LogLevel> parsed = LogLevel.fromKeyword(levelMatcher.group(1));
            if (parsed.isPresent()) {
                level = parsed.get();
                levelFound = true;
                rest = rest.substring(levelMatcher.end());
                break;
            }
        }

        if (timestamp == null && !levelFound) {
            return Optional.empty();
        }

        String message = LEADING_SEPARATORS.matcher(rest).replaceFirst("").strip();
        if (message.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new LogEvent(timestamp, level, message, rawLine));
    }

    /**
     * A keyword leading the line counts in any case, and a bracketed one counts anywhere in the
     * search window. An upper-case keyword further in only counts when everything before it is
     * thread, pid or logger metadata, so "gateway returned ERROR 502" stays part of the message.
     */
    private static boolean isLevelToken(String window, Matcher m) {
        if (m.group().startsWith("[")) {
            return true;
        }
        String prefix = window.substring(0, m.start());
        if (prefix.isBlank()) {
            return true;
        }
        String keyword = m.group(1);
        return keyword.equals(keyword.toUpperCase(Locale.ROOT)) && METADATA_PREFIX.matcher(prefix).matches();
    }

    private static String stripLineTerminator(String line) {
        int end = line.length();
        while (end > 0 && (line.charAt(end - 1) == '\n' || line.charAt(end - 1) == '\r')) {
            end--;
        }
        return line.substring(0, end);
    }

    private record TimestampFormat(Pattern pattern, DateTimeFormatter formatter) {

        Optional<LocalDateTime> parse(Matcher m) {
            try {
                LocalDateTime ts = LocalDateTime.parse(m.group(1) + " " + m.group(2), formatter);
                String fraction = m.group(3);
                if (fraction != null) {
                    String nanos = (fraction + "000000000").substring(0, 9);
                    ts = ts.withNano(Integer.parseInt(nanos));
                }
                return Optional.of(ts);
            } catch (DateTimeParseException e) {
                return Optional.empty();
            }
        }
    }
}
