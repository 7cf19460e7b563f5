package io.mathspeech.core.store;

import io.mathspeech.core.model.Domain;
import io.mathspeech.core.model.ExpressionContext;
import io.mathspeech.core.pattern.Pattern;
import java.util.Set;

/**
 * Filter for {@link PatternStore#findByFilters}. {@code null} components are not constrained.
 *
 * @param domain      required domain
 * @param contexts    pattern must apply to at least one of these contexts
 * @param minPriority inclusive lower priority bound
 * @param maxPriority inclusive upper priority bound
 * @param enabled     required enabled flag
 * @param tag         required tag
 */
public record PatternCriteria(
        Domain domain,
        Set<ExpressionContext> contexts,
        Integer minPriority,
        Integer maxPriority,
        Boolean enabled,
        String tag) {

    /** Matches everything. */
    public static final PatternCriteria ANY = new PatternCriteria(null, null, null, null, null, null);

    public PatternCriteria {
        contexts = contexts != null ? Set.copyOf(contexts) : null;
        if (minPriority != null && maxPriority != null && minPriority > maxPriority) {
            throw new IllegalArgumentException(
                    "minPriority must not exceed maxPriority, got: " + minPriority + " > " + maxPriority);
        }
    }

    public PatternCriteria withDomain(Domain domain) {
        return new PatternCriteria(domain, contexts, minPriority, maxPriority, enabled, tag);
    }

    public PatternCriteria withContexts(Set<ExpressionContext> contexts) {
        return new PatternCriteria(domain, contexts, minPriority, maxPriority, enabled, tag);
    }

    public PatternCriteria withPriorityRange(Integer min, Integer max) {
        return new PatternCriteria(domain, contexts, min, max, enabled, tag);
    }

    public PatternCriteria withEnabled(Boolean enabled) {
        return new PatternCriteria(domain, contexts, minPriority, maxPriority, enabled, tag);
    }

    public PatternCriteria withTag(String tag) {
        return new PatternCriteria(domain, contexts, minPriority, maxPriority, enabled, tag);
    }

    /** Whether {@code pattern} satisfies every set criterion. */
    public boolean test(Pattern pattern) {
        if (domain != null && pattern.domain() != domain) {
            return false;
        }
        if (contexts != null && contexts.stream().noneMatch(pattern::appliesTo)) {
            return false;
        }
        int priority = pattern.priority().value();
        if (minPriority != null && priority < minPriority) {
            return false;
        }
        if (maxPriority != null && priority > maxPriority) {
            return false;
        }
        if (enabled != null && pattern.enabled() != enabled) {
            return false;
        }
        return tag == null || pattern.tags().contains(tag);
    }
}
