package io.mathspeech.core.error;

/**
 * Abstract parent for input validation failures. Thrown (or returned inside a {@code
 * ValidationResult}) by the expression validator as soon as the first violation is found.
 * Carries the offending snippet, truncated for safety, and the character offset where one is
 * known.
 */
public abstract class ExpressionValidationException extends MathSpeechException {

    private static final long serialVersionUID = 1L;

    /** Maximum length of the snippet kept on the exception. */
    public static final int MAX_SNIPPET_LENGTH = 100;

    /** Validation failure kind. */
    public enum Kind {
        SYNTAX,
        LIMIT_EXCEEDED,
        SECURITY
    }

    private final Kind kind;
    private final String snippet;
    private final Integer offset;

    protected ExpressionValidationException(String message, Kind kind, String snippet, Integer offset) {
        super(message, Category.VALIDATION);
        this.kind = kind;
        this.snippet = truncate(snippet);
        this.offset = offset;
    }

    /** The failure kind. */
    public Kind kind() {
        return kind;
    }

    /** The offending input fragment, at most {@value #MAX_SNIPPET_LENGTH} characters. */
    public String snippet() {
        return snippet;
    }

    /** Character offset of the violation, or {@code null} if not position-specific. */
    public Integer offset() {
        return offset;
    }

    private static String truncate(String s) {
        if (s == null) {
            return "";
        }
        return s.length() <= MAX_SNIPPET_LENGTH ? s : s.substring(0, MAX_SNIPPET_LENGTH);
    }
}
