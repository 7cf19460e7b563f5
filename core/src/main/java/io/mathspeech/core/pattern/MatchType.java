package io.mathspeech.core.pattern;

/** How a pattern's matcher string is interpreted. */
public enum MatchType {
    /** Java regular expression, searched with {@code find}. */
    REGEX,
    /** Plain substring. */
    LITERAL
}
