package io.mathspeech.core.service;

import io.mathspeech.core.model.SpeechText;
import java.util.Objects;

/**
 * Outcome of a conversion. Exactly one of three states:
 *
 * <ul>
 * <li>{@link Type#SUCCESS}: {@code speech} holds the rewritten text.</li>
 * <li>{@link Type#REJECTED}: the input failed validation; nothing may be spoken. {@code error}
 * holds the validation error.</li>
 * <li>{@link Type#FALLBACK}: the input was safe but could not be converted; {@code text} is the
 * sanitized raw LaTeX and {@code error} holds the cause.</li>
 * </ul>
 */
public final class ConversionResult {

    /** The type of conversion outcome. */
    public enum Type {
        SUCCESS,
        REJECTED,
        FALLBACK
    }

    private final Type type;
    private final ConversionRequest request;
    private final SpeechText speech;
    private final String text;
    private final RuntimeException error;
    private final boolean cached;

    private ConversionResult(
            Type type,
            ConversionRequest request,
            SpeechText speech,
            String text,
            RuntimeException error,
            boolean cached) {
        this.type = type;
        this.request = request;
        this.speech = speech;
        this.text = text;
        this.error = error;
        this.cached = cached;
    }

    public static ConversionResult success(ConversionRequest request, SpeechText speech, boolean cached) {
        Objects.requireNonNull(speech, "speech must not be null for SUCCESS");
        return new ConversionResult(Type.SUCCESS, request, speech, speech.text(), null, cached);
    }

    public static ConversionResult rejected(ConversionRequest request, RuntimeException error) {
        Objects.requireNonNull(error, "error must not be null for REJECTED");
        return new ConversionResult(Type.REJECTED, request, null, null, error, false);
    }

    public static ConversionResult fallback(ConversionRequest request, String fallbackText, RuntimeException error) {
        Objects.requireNonNull(fallbackText, "fallbackText must not be null for FALLBACK");
        return new ConversionResult(Type.FALLBACK, request, null, fallbackText, error, false);
    }

    public Type type() {
        return type;
    }

    public boolean isSuccess() {
        return type == Type.SUCCESS;
    }

    public boolean isRejected() {
        return type == Type.REJECTED;
    }

    public boolean isFallback() {
        return type == Type.FALLBACK;
    }

    public ConversionRequest request() {
        return request;
    }

    /** The full rewrite result; {@code null} unless SUCCESS. */
    public SpeechText speech() {
        return speech;
    }

    /** The text to speak; {@code null} for REJECTED. */
    public String text() {
        return text;
    }

    /** The failure; {@code null} for SUCCESS. */
    public RuntimeException error() {
        return error;
    }

    /** Whether a SUCCESS came from the result cache. */
    public boolean cached() {
        return cached;
    }

    @Override
    public String toString() {
        return switch (type) {
            case SUCCESS -> "ConversionResult[SUCCESS, " + text + (cached ? ", cached" : "") + "]";
            case REJECTED -> "ConversionResult[REJECTED, " + error.getMessage() + "]";
            case FALLBACK -> "ConversionResult[FALLBACK, " + text + "]";
        };
    }
}
