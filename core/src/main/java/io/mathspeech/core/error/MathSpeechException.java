package io.mathspeech.core.error;

/**
 * Abstract base for all math-speech exceptions. Never thrown directly; use the concrete
 * subclasses under {@link ExpressionValidationException}, {@link PatternException} or {@link
 * RewriteProcessingException}.
 */
public abstract class MathSpeechException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Broad error category, used by callers to pick between hard failure and fallback. */
    public enum Category {
        /** Input rejected as unsafe or malformed. Terminal, never retried. */
        VALIDATION,
        /** A single rewrite rule is broken. Scoped to that rule. */
        PATTERN,
        /** Input was safe but could not be converted. Terminal for one rewrite call. */
        PROCESSING
    }

    private final Category category;

    protected MathSpeechException(String message, Category category) {
        super(message);
        this.category = category;
    }

    protected MathSpeechException(String message, Throwable cause, Category category) {
        super(message, cause);
        this.category = category;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The category this error belongs to. */
    public Category category() {
        return category;
    }
}
