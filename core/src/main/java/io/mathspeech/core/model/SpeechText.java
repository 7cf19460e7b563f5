package io.mathspeech.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Final natural-language output of one rewrite, ready for synthesis, plus how it was produced.
 * Immutable.
 *
 * @param text              the post-processed speech text
 * @param appliedPatternIds pattern ids in application order
 * @param iterationsUsed    number of fixpoint iterations run
 * @param converged         {@code false} if the iteration cap was hit before the text stabilized
 * @param domain            the domain the patterns were selected for
 * @param patternErrors     per-pattern failure counts (pattern id to count), in first-failure order
 * @param hints             pronunciation hints of the applied patterns, keyed by pattern id
 */
public record SpeechText(
        String text,
        List<String> appliedPatternIds,
        int iterationsUsed,
        boolean converged,
        Domain domain,
        Map<String, Integer> patternErrors,
        Map<String, PronunciationHint> hints) {

    public SpeechText {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(domain, "domain must not be null");
        appliedPatternIds = appliedPatternIds != null ? List.copyOf(appliedPatternIds) : List.of();
        patternErrors = patternErrors != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(patternErrors))
                : Map.of();
        hints = hints != null ? Collections.unmodifiableMap(new LinkedHashMap<>(hints)) : Map.of();
        if (iterationsUsed < 0) {
            throw new IllegalArgumentException("iterationsUsed must not be negative, got: " + iterationsUsed);
        }
    }

    /** Whether any pattern failed during the rewrite. */
    public boolean hasPatternErrors() {
        return !patternErrors.isEmpty();
    }

    @Override
    public String toString() {
        return "SpeechText[" + text + ", patterns=" + appliedPatternIds.size() + ", iterations=" + iterationsUsed
                + ", converged=" + converged + "]";
    }
}
