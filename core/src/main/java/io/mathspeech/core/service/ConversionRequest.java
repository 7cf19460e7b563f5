package io.mathspeech.core.service;

import io.mathspeech.core.model.AudienceLevel;
import io.mathspeech.core.model.Domain;
import io.mathspeech.core.model.ExpressionContext;

/**
 * One LaTeX-to-speech conversion request.
 *
 * @param latex       untrusted LaTeX input
 * @param audience    target audience (default: undergraduate)
 * @param domainHint  domain to use instead of detection, or {@code null}
 * @param contextType syntactic setting (default: inline)
 */
public record ConversionRequest(
        String latex, AudienceLevel audience, Domain domainHint, ExpressionContext contextType) {

    public ConversionRequest {
        audience = audience != null ? audience : AudienceLevel.UNDERGRADUATE;
        contextType = contextType != null ? contextType : ExpressionContext.INLINE;
    }

    /** Request with default audience, no domain hint and inline context. */
    public static ConversionRequest of(String latex) {
        return new ConversionRequest(latex, null, null, null);
    }

    public ConversionRequest withAudience(AudienceLevel audience) {
        return new ConversionRequest(latex, audience, domainHint, contextType);
    }

    public ConversionRequest withDomainHint(Domain domainHint) {
        return new ConversionRequest(latex, audience, domainHint, contextType);
    }

    public ConversionRequest withContextType(ExpressionContext contextType) {
        return new ConversionRequest(latex, audience, domainHint, contextType);
    }
}
