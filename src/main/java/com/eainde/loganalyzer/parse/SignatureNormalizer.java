package com.eainde.loganalyzer.parse;

import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Maps a free-text log message to a short canonical grouping key.
 *
 * <h3>Steps, in order:</h3>
 * <ol>
 *   <li>timestamps → {@code <ts>}</li>
 *   <li>path-like substrings (containing {@code /} or {@code \}) → {@code <path>}</li>
 *   <li>source locations such as {@code Foo.java:42} → {@code <loc>}</li>
 *   <li>hex ids and UUIDs → {@code <id>}</li>
 *   <li>digit runs → {@code <num>}</li>
 *   <li>lower-case, drop everything but letters, combining marks, digits and {@code <>},
 *       collapse whitespace</li>
 *   <li>keep the first {@code maxTokens} tokens, then cut at {@code maxLength} characters</li>
 * </ol>
 *
 * <p>Letters of any script survive, so {@code Übertragung fehlgeschlagen} and CJK messages keep
 * their own signatures. The output holds only lower-case letters, marks, digits and {@code <>}, separated
 * by single spaces. Timestamps, paths and code locations need separators that are gone by then.
 * Digits remain only when number stripping is off, and then neither numbers nor
 * identifiers are rewritten on a second pass, so {@code normalize(normalize(x)).equals(normalize(x))}.</p>
 *
 * <p>How aggressive the stripping is can be tuned with {@link Builder}; over-aggressive settings
 * merge unrelated error types into one group.</p>
 */
public class SignatureNormalizer {

    /** Signature used when nothing survives normalization. */
    public static final String BLANK_SIGNATURE = "<blank>";

    private static final Pattern TIMESTAMP = Pattern.compile(
            "\\d{4}[-/]\\d{2}[-/]\\d{2}(?:[T ]\\d{2}:\\d{2}:\\d{2}(?:[.,]\\d+)?(?:Z|[+-]\\d{2}:?\\d{2})?)?"
                    + "|\\b\\d{2}:\\d{2}:\\d{2}(?:[.,]\\d+)?\\b");
    private static final Pattern PATH = Pattern.compile(
            "(?:[A-Za-z]:)?[\\w.~$-]*(?:[/\\\\][\\w.~$-]+)+[/\\\\]?");
    private static final Pattern CODE_LOCATION = Pattern.compile(
            "\\b[A-Za-z_$][\\w$.]*\\.(?:java|kt|scala|groovy|py|js|ts|go|rb|cs|cpp|c|h)(?::\\d+)?\\b");
    private static final Pattern IDENTIFIER = Pattern.compile(
            "\\b[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}\\b"
                    + "|\\b0x[0-9a-fA-F]+\\b"
                    + "|\\b(?=[0-9a-fA-F]*\\d)(?=[0-9a-fA-F]*[a-fA-F])[0-9a-fA-F]{8,}\\b");
    private static final Pattern NUMBER = Pattern.compile("\\d+");
    private static final Pattern NON_SIGNATURE_CHARS = Pattern.compile("[^\\p{L}\\p{M}\\p{N}<>\\s]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final int maxTokens;
    private final int maxLength;
    private final boolean stripPaths;
    private final boolean stripCodeLocations;
    private final boolean stripIdentifiers;
    private final boolean stripNumbers;

    private SignatureNormalizer(Builder builder) {
        if (builder.maxTokens < 1) {
            throw new IllegalArgumentException("maxTokens must be >= 1");
        }
        if (builder.maxLength < BLANK_SIGNATURE.length()) {
            throw new IllegalArgumentException("maxLength must be >= " + BLANK_SIGNATURE.length());
        }
        this.maxTokens = builder.maxTokens;
        this.maxLength = builder.maxLength;
        this.stripPaths = builder.stripPaths;
        this.stripCodeLocations = builder.stripCodeLocations;
        this.stripIdentifiers = builder.stripIdentifiers;
        this.stripNumbers = builder.stripNumbers;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Normalizer with the default tuning. */
    public static SignatureNormalizer defaults() {
        return builder().build();
    }

    /**
     * @param message free-text message, may be null
     * @return canonical signature, never blank
     */
    public String normalize(String message) {
        if (message == null || message.isBlank()) {
            return BLANK_SIGNATURE;
        }
        String s = TIMESTAMP.matcher(message).replaceAll(" <ts> ");
        if (stripPaths) {
            s = PATH.matcher(s).replaceAll(" <path> ");
        }
        if (stripCodeLocations) {
            s = CODE_LOCATION.matcher(s).replaceAll(" <loc> ");
        }
        if (stripIdentifiers) {
            s = IDENTIFIER.matcher(s).replaceAll(" <id> ");
        }
        if (stripNumbers) {
            s = NUMBER.matcher(s).replaceAll(" <num> ");
        }
        s = s.toLowerCase(Locale.ROOT);
        s = NON_SIGNATURE_CHARS.matcher(s).replaceAll(" ");
        s = WHITESPACE.matcher(s).replaceAll(" ").strip();
        if (s.isEmpty()) {
            return BLANK_SIGNATURE;
        }

        String[] tokens = s.split(" ");
        if (tokens.length > maxTokens) {
            s = Arrays.stream(tokens).limit(maxTokens).collect(Collectors.joining(" "));
        }
        if (s.length() > maxLength) {
            int end = maxLength;
            // never split a surrogate pair
            if (Character.isHighSurrogate(s.charAt(end - 1))) {
                end--;
            }
            s = s.substring(0, end).strip();
        }
        return s;
    }

    public static final class Builder {
        private int maxTokens = 8;
        private int maxLength = 120;
        private boolean stripPaths = true;
        private boolean stripCodeLocations = true;
        private boolean stripIdentifiers = true;
        private boolean stripNumbers = true;

        private Builder() {
        }

        public Builder maxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder maxLength(int maxLength) {
            this.maxLength = maxLength;
            return this;
        }

        public Builder stripPaths(boolean stripPaths) {
            this.stripPaths = stripPaths;
            return this;
        }

        public Builder stripCodeLocations(boolean stripCodeLocations) {
            this.stripCodeLocations = stripCodeLocations;
            return this;
        }

        public Builder stripIdentifiers(boolean stripIdentifiers) {
            this.stripIdentifiers = stripIdentifiers;
            return this;
        }

        public Builder stripNumbers(boolean stripNumbers) {
            this.stripNumbers = stripNumbers;
            return this;
        }

        public SignatureNormalizer build() {
            return new SignatureNormalizer(this);
        }
    }
}
