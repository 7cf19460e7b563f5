package io.mathspeech.core.error;

/** Thrown when a pattern is added to a store that already holds its id. */
public final class DuplicatePatternException extends PatternException {

    private static final long serialVersionUID = 1L;

    public DuplicatePatternException(String patternId) {
        super("Pattern with id '" + patternId + "' already exists", patternId);
    }
}
