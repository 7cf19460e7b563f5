package io.mathspeech.core.pattern;

import io.mathspeech.core.model.RewriteContext;
import java.util.Locale;
import java.util.Objects;

/**
 * Precondition that must hold for a pattern to match, evaluated against the
 * {@link RewriteContext}.
 *
 * @param type   what is tested
 * @param value  the operand (context name, text fragment or domain name)
 * @param negate invert the result
 */
public record PatternCondition(Type type, String value, boolean negate) {

    /** Condition kinds. */
    public enum Type {
        /** Context type equals {@code value}. */
        CONTEXT,
        /** Text before the expression ends with {@code value}. */
        PRECEDING,
        /** Text after the expression starts with {@code value}. */
        FOLLOWING,
        /** The original full text contains {@code value}. */
        CONTAINS,
        /** The session domain equals {@code value}. */
        DOMAIN;

        /**
         * Parses a lower-case condition type name.
         *
         * @throws IllegalArgumentException if the name is unknown
         */
        public static Type fromId(String id) {
            if (id == null) {
                throw new IllegalArgumentException("condition type must not be null");
            }
            try {
                return valueOf(id.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown condition type: " + id, e);
            }
        }
    }

    public PatternCondition {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }

    public static PatternCondition of(Type type, String value) {
        return new PatternCondition(type, value, false);
    }

    public static PatternCondition not(Type type, String value) {
        return new PatternCondition(type, value, true);
    }

    /** Evaluates this condition, honouring {@link #negate()}. */
    public boolean evaluate(RewriteContext context) {
        boolean result = switch (type) {
            case CONTEXT -> context.contextType().id().equalsIgnoreCase(value);
            case PRECEDING -> context.preceding().endsWith(value);
            case FOLLOWING -> context.following().startsWith(value);
            case CONTAINS -> context.fullText().contains(value);
            case DOMAIN -> context.domain().id().equalsIgnoreCase(value);
        };
        return negate != result;
    }
}
