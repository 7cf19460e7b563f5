package io.mathspeech.core.error;

/** Thrown when the input exceeds the configured length or brace nesting depth. */
public final class LimitExceededException extends ExpressionValidationException {

    private static final long serialVersionUID = 1L;

    private final int actual;
    private final int limit;

    public LimitExceededException(String message, String snippet, int actual, int limit) {
        super(message, Kind.LIMIT_EXCEEDED, snippet, null);
        this.actual = actual;
        this.limit = limit;
    }

    /** The measured value (length or depth). */
    public int actual() {
        return actual;
    }

    /** The configured limit that was exceeded. */
    public int limit() {
        return limit;
    }
}
