package io.mathspeech.core.error;

/** Thrown when delimiters are unbalanced or misnested, or the input is empty. */
public final class LatexSyntaxException extends ExpressionValidationException {

    private static final long serialVersionUID = 1L;

    public LatexSyntaxException(String message, String snippet) {
        super(message, Kind.SYNTAX, snippet, null);
    }

    public LatexSyntaxException(String message, String snippet, int offset) {
        super(message, Kind.SYNTAX, snippet, offset);
    }
}
