package io.mathspeech.core.store;

import io.mathspeech.core.model.Domain;
import io.mathspeech.core.model.ExpressionContext;
import io.mathspeech.core.pattern.Pattern;
import java.util.List;
import java.util.Optional;

/**
 * Read-only query interface the rewrite engine uses to fetch candidate patterns.
 *
 * <p>
 * Implementations MUST be safe for concurrent reads, and the lists returned for one rewrite call
 * MUST come from a single consistent snapshot: a pattern never appears with two different
 * definitions within the same call. Callers that issue several queries for one rewrite should
 * take a {@link #snapshot()} first and query that.
 *
 * <p>
 * Result order is part of the contract: implementations return patterns in a stable order
 * (registration order), which the engine uses as the tie-break within one priority.
 */
public interface PatternStore {

    /** Patterns tagged with exactly {@code domain}, in registration order. */
    List<Pattern> findByDomain(Domain domain);

    /** Patterns applicable in {@code context} (including those tagged {@code ANY}). */
    List<Pattern> findByContext(ExpressionContext context);

    /** Patterns satisfying every criterion that is set. */
    List<Pattern> findByFilters(PatternCriteria criteria);

    Optional<Pattern> findById(String id);

    /** An immutable, internally consistent view of the current patterns. */
    PatternStore snapshot();
}
