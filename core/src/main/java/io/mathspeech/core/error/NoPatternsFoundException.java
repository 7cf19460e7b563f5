package io.mathspeech.core.error;

/**
 * Thrown when the pattern store returns no candidates for the expression's domain, including
 * the general domain.
 */
public final class NoPatternsFoundException extends RewriteProcessingException {

    private static final long serialVersionUID = 1L;

    public static final String STAGE = "pattern_selection";

    public NoPatternsFoundException(String domain, String snippet) {
        super("no patterns found for domain '" + domain + "'", STAGE, snippet);
    }
}
