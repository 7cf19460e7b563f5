package io.mathspeech.core.error;

/** Thrown when a well-formed pattern fails while matching or substituting. */
public final class PatternApplyException extends PatternException {

    private static final long serialVersionUID = 1L;

    public PatternApplyException(String message, Throwable cause, String patternId) {
        super(message, cause, patternId);
    }
}
