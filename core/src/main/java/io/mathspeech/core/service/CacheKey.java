package io.mathspeech.core.service;

import io.mathspeech.core.model.AudienceLevel;
import io.mathspeech.core.model.Domain;
import io.mathspeech.core.model.ExpressionContext;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Result cache key: the whitespace-normalized expression text plus every input that changes the
 * rewrite outcome.
 *
 * @param normalizedText expression text with whitespace runs collapsed and trimmed
 * @param audience       audience level
 * @param domainHint     domain hint, or {@code null}
 * @param contextType    context type
 */
public record CacheKey(
        String normalizedText, AudienceLevel audience, Domain domainHint, ExpressionContext contextType) {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public CacheKey {
        Objects.requireNonNull(normalizedText, "normalizedText must not be null");
        Objects.requireNonNull(audience, "audience must not be null");
        Objects.requireNonNull(contextType, "contextType must not be null");
    }

    /** Key for {@code text} converted with the request's settings. */
    public static CacheKey of(String text, ConversionRequest request) {
        return new CacheKey(normalize(text), request.audience(), request.domainHint(), request.contextType());
    }

    static String normalize(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }
}
