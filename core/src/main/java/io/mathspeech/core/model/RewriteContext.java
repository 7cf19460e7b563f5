package io.mathspeech.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Read-only view of the rewrite state consulted by pattern preconditions. The engine derives a
 * fresh instance with {@link #withCurrentText(String)} after every applied pattern; instances are
 * never mutated.
 *
 * <p>{@code preceding} and {@code following} are the text around the expression in its
 * surrounding document, empty when the expression stands alone.
 */
public record RewriteContext(
        ExpressionContext contextType,
        Domain domain,
        AudienceLevel audience,
        String fullText,
        String currentText,
        Set<String> variables,
        double complexity,
        String preceding,
        String following) {

    /** Canonical constructor with defaults for absent values. */
    public RewriteContext {
        contextType = contextType != null ? contextType : ExpressionContext.INLINE;
        domain = domain != null ? domain : Domain.GENERAL;
        audience = audience != null ? audience : AudienceLevel.UNDERGRADUATE;
        fullText = fullText != null ? fullText : "";
        currentText = currentText != null ? currentText : fullText;
        variables = variables != null ? Collections.unmodifiableSet(new LinkedHashSet<>(variables)) : Set.of();
        preceding = preceding != null ? preceding : "";
        following = following != null ? following : "";
    }

    /** Context for matching {@code text} outside an engine run (tests, coverage tools). */
    public static RewriteContext forText(String text) {
        return new RewriteContext(null, null, null, text, text, null, 0.0, null, null);
    }

    /** Returns a copy whose current text is {@code text}. */
    public RewriteContext withCurrentText(String text) {
        return new RewriteContext(
                contextType, domain, audience, fullText, text, variables, complexity, preceding, following);
    }
}
