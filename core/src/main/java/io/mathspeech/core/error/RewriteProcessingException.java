package io.mathspeech.core.error;

/**
 * Abstract parent for failures of a single rewrite call on already validated input. Callers
 * decide the fallback (for example, speak the raw expression).
 */
public abstract class RewriteProcessingException extends MathSpeechException {

    private static final long serialVersionUID = 1L;

    private final String stage;
    private final String snippet;

    protected RewriteProcessingException(String message, String stage, String snippet) {
        super(message, Category.PROCESSING);
        this.stage = stage;
        this.snippet = snippet != null && snippet.length() > ExpressionValidationException.MAX_SNIPPET_LENGTH
                ? snippet.substring(0, ExpressionValidationException.MAX_SNIPPET_LENGTH)
                : snippet;
    }

    /** The processing stage that failed, e.g. {@code pattern_selection}. */
    public String stage() {
        return stage;
    }

    /** The expression being processed, truncated. */
    public String snippet() {
        return snippet;
    }
}
