package io.mathspeech.standalone.config;

/**
 * Thrown when configuration loading fails: missing file, invalid YAML, or a value that cannot
 * be parsed or is out of range. The message is meant for startup error output.
 */
public class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
