package com.eainde.loganalyzer.parse;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls exception evidence out of a log message: capitalized type names ending in a
 * recognised error suffix ({@code NullPointerException}, {@code OutOfMemoryError},
 * {@code SoapFault}), and the text following a {@code Caused by:} or {@code Exception:} marker.
 *
 * <p>Package qualifiers are dropped, so {@code java.io.IOException} yields {@code IOException}.
 * Marker text goes through a {@link SignatureNormalizer}, so {@code user 17 not found} and
 * {@code user 18 not found} yield the same token. Never throws; returns an empty set when
 * nothing is found.</p>
 */
public class ExceptionExtractor {

    /** Marker tails are cut to this length before normalization. */
    static final int MAX_MARKER_TEXT = 120;

    private static final Pattern TYPE_TOKEN = Pattern.compile(
            "(?<![\\w$])(?:[a-z_$][\\w$]*\\.)*([A-Z][\\w$]*(?:Exception|Error|Throwable|Fault))(?![\\w$])");

    private static final Pattern MARKER = Pattern.compile(
            "(?i)(?:caused by|exception)\\s*:\\s*([^\\r\\n]+)");

    private final SignatureNormalizer tailNormalizer;

    public ExceptionExtractor() {
        this(SignatureNormalizer.defaults());
    }

    public ExceptionExtractor(SignatureNormalizer tailNormalizer) {
        this.tailNormalizer = tailNormalizer;
    }

    public Set<String> extract(String message) {
        if (message == null || message.isBlank()) {
            return Collections.emptySet();
        }
        Set<String> tokens = new LinkedHashSet<>();

        Matcher typeMatcher = TYPE_TOKEN.matcher(message);
        while (typeMatcher.find()) {
            tokens.add(typeMatcher.group(1));
        }

        Matcher markerMatcher = MARKER.matcher(message);
        while (markerMatcher.find()) {
            String tail = markerMatcher.group(1);
            if (tail.length() > MAX_MARKER_TEXT) {
                tail = tail.substring(0, MAX_MARKER_TEXT);
            }
            String normalized = tailNormalizer.normalize(tail);
            if (!SignatureNormalizer.BLANK_SIGNATURE.equals(normalized)) {
                tokens.add(normalized);
            }
        }
        return tokens;
    }
}
