package io.mathspeech.standalone.cli;

import java.util.Locale;

/** How converted expressions are written to standard output. */
public enum OutputFormat {
    /** One line of speech text per expression. */
    TEXT,
    /** One JSON object per line. */
    JSON;

    /**
     * Parses {@code text} or {@code json}, case-insensitively.
     *
     * @throws IllegalArgumentException for any other value
     */
    public static OutputFormat fromId(String id) {
        try {
            return valueOf(id.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("--format must be text or json, got: " + id, e);
        }
    }
}
