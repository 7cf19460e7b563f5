package io.mathspeech.core.error;

/**
 * Thrown when the input contains a dangerous or disallowed command, an oversized command name,
 * a null byte, or excessive character repetition.
 */
public final class SecurityViolationException extends ExpressionValidationException {

    private static final long serialVersionUID = 1L;

    /** The kind of threat detected. */
    public enum Threat {
        NULL_BYTE,
        DANGEROUS_COMMAND,
        REPETITION_ATTACK,
        LONG_COMMAND,
        DISALLOWED_COMMAND
    }

    private final Threat threat;

    public SecurityViolationException(String message, Threat threat, String snippet) {
        super(message, Kind.SECURITY, snippet, null);
        this.threat = threat;
    }

    public SecurityViolationException(String message, Threat threat, String snippet, int offset) {
        super(message, Kind.SECURITY, snippet, offset);
        this.threat = threat;
    }

    /** The detected threat. */
    public Threat threat() {
        return threat;
    }
}
