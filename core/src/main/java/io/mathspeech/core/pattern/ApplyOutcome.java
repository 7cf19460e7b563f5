package io.mathspeech.core.pattern;

import java.util.Objects;

/**
 * Result of {@link Pattern#apply}: the new text and whether the pattern fired.
 *
 * @param text    the text after application; the input text when {@code applied} is false
 * @param applied whether the pattern matched and was applied
 */
public record ApplyOutcome(String text, boolean applied) {

    public ApplyOutcome {
        Objects.requireNonNull(text, "text must not be null");
    }

    /** Outcome for a pattern that did not fire. */
    public static ApplyOutcome unchanged(String text) {
        return new ApplyOutcome(text, false);
    }

    /** Whether application produced text different from {@code original}. */
    public boolean changed(String original) {
        return applied && !text.equals(original);
    }
}
