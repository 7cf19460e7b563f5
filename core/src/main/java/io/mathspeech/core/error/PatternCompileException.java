package io.mathspeech.core.error;

/**
 * Thrown at pattern construction when the matcher does not compile, a required field is empty,
 * or the output template references a capture group the matcher does not define.
 */
public final class PatternCompileException extends PatternException {

    private static final long serialVersionUID = 1L;

    public PatternCompileException(String message, String patternId) {
        super(message, patternId);
    }

    public PatternCompileException(String message, Throwable cause, String patternId) {
        super(message, cause, patternId);
    }
}
