package io.mathspeech.core.error;

/**
 * Abstract parent for rule-level errors. A pattern error is isolated to one rule: the rewrite
 * engine tallies it and moves on to the remaining candidates.
 */
public abstract class PatternException extends MathSpeechException {

    private static final long serialVersionUID = 1L;

    private final String patternId;

    protected PatternException(String message, String patternId) {
        super(message, Category.PATTERN);
        this.patternId = patternId;
    }

    protected PatternException(String message, Throwable cause, String patternId) {
        super(message, cause, Category.PATTERN);
        this.patternId = patternId;
    }

    /** The pattern that triggered the error, or {@code null} if not yet identified. */
    public String patternId() {
        return patternId;
    }
}
