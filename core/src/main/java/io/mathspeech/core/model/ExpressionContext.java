package io.mathspeech.core.model;

import java.util.Locale;
import java.util.Optional;

/** Syntactic setting of an expression. {@link #ANY} on a pattern means "applies everywhere". */
public enum ExpressionContext {
    INLINE,
    DISPLAY,
    EQUATION,
    THEOREM,
    PROOF,
    ANY;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Lenient lookup: returns empty for names outside the vocabulary. */
    public static Optional<ExpressionContext> lookup(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toUpperCase(Locale.ROOT);
        for (ExpressionContext c : values()) {
            if (c.name().equals(normalized)) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }

    /**
     * Strict lookup.
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    public static ExpressionContext fromId(String id) {
        return lookup(id).orElseThrow(() -> new IllegalArgumentException("Invalid expression context: " + id));
    }
}
