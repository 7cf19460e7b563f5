package io.mathspeech.core.error;

/**
 * Thrown when a pattern library file is missing, has invalid YAML, fails schema validation, or
 * holds a pattern definition that cannot be built. Carries the file that caused the error.
 */
public final class PatternLoadException extends PatternException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public PatternLoadException(String message, String patternId, String source) {
        super(message, patternId);
        this.source = source;
    }

    public PatternLoadException(String message, Throwable cause, String patternId, String source) {
        super(message, cause, patternId);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}
