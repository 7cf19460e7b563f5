package io.mathspeech.core.store;

import io.mathspeech.core.error.DuplicatePatternException;
import io.mathspeech.core.model.Domain;
import io.mathspeech.core.model.ExpressionContext;
import io.mathspeech.core.model.PriorityTier;
import io.mathspeech.core.pattern.Pattern;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of registered patterns, in registration order and indexed by id.
 *
 * <p>
 * This is the unit of atomic swap in {@link InMemoryPatternStore}: every mutation builds a new
 * registry and swaps it in. Readers that captured the old registry keep a consistent view.
 *
 * <p>
 * Thread-safe: all fields are final and collections are unmodifiable.
 */
public final class PatternRegistry implements PatternStore {

    private static final PatternRegistry EMPTY = new PatternRegistry(Map.of());

    private final Map<String, Pattern> byId;
    private final List<Pattern> ordered;

    private PatternRegistry(Map<String, Pattern> byId) {
        this.byId = Collections.unmodifiableMap(new LinkedHashMap<>(byId));
        this.ordered = List.copyOf(byId.values());
    }

    public static PatternRegistry empty() {
        return EMPTY;
    }

    /**
     * Registry holding {@code patterns} in iteration order.
     *
     * @throws DuplicatePatternException if two patterns share an id
     */
    public static PatternRegistry of(Collection<Pattern> patterns) {
        Builder b = builder();
        patterns.forEach(b::add);
        return b.build();
    }

    public static Builder builder() {
        return new Builder(Map.of());
    }

    /** A builder seeded with this registry's patterns. */
    public Builder toBuilder() {
        return new Builder(byId);
    }

    public int size() {
        return ordered.size();
    }

    public boolean isEmpty() {
        return ordered.isEmpty();
    }

    /** All patterns in registration order. */
    public List<Pattern> all() {
        return ordered;
    }

    @Override
    public List<Pattern> findByDomain(Domain domain) {
        return ordered.stream().filter(p -> p.domain() == domain).toList();
    }

    @Override
    public List<Pattern> findByContext(ExpressionContext context) {
        return ordered.stream().filter(p -> p.appliesTo(context)).toList();
    }

    @Override
    public List<Pattern> findByFilters(PatternCriteria criteria) {
        Objects.requireNonNull(criteria, "criteria must not be null");
        return ordered.stream().filter(criteria::test).toList();
    }

    @Override
    public Optional<Pattern> findById(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    /** Already immutable. */
    @Override
    public PatternRegistry snapshot() {
        return this;
    }

    /** Counts by domain, tier and declared context. */
    public StoreStatistics statistics() {
        Map<Domain, Integer> byDomain = new EnumMap<>(Domain.class);
        Map<PriorityTier, Integer> byTier = new EnumMap<>(PriorityTier.class);
        Map<ExpressionContext, Integer> byContext = new EnumMap<>(ExpressionContext.class);
        int enabled = 0;
        for (Pattern p : ordered) {
            byDomain.merge(p.domain(), 1, Integer::sum);
            byTier.merge(p.priority().tier(), 1, Integer::sum);
            for (ExpressionContext c : p.contexts()) {
                byContext.merge(c, 1, Integer::sum);
            }
            if (p.enabled()) {
                enabled++;
            }
        }
        return new StoreStatistics(ordered.size(), enabled, byDomain, byTier, byContext);
    }

    /** Builder for constructing a {@link PatternRegistry} incrementally. Not thread-safe. */
    public static final class Builder {

        private final Map<String, Pattern> byId;

        private Builder(Map<String, Pattern> seed) {
            this.byId = new LinkedHashMap<>(seed);
        }

        /**
         * Registers a new pattern.
         *
         * @throws DuplicatePatternException if the id is already registered
         */
        public Builder add(Pattern pattern) {
            if (byId.putIfAbsent(pattern.id(), pattern) != null) {
                throw new DuplicatePatternException(pattern.id());
            }
            return this;
        }

        /** Registers or replaces a pattern. A replaced pattern keeps its position. */
        public Builder put(Pattern pattern) {
            byId.put(pattern.id(), pattern);
            return this;
        }

        /** Removes the pattern with {@code id}; returns whether one was present. */
        public boolean remove(String id) {
            return byId.remove(id) != null;
        }

        public boolean contains(String id) {
            return byId.containsKey(id);
        }

        public PatternRegistry build() {
            return byId.isEmpty() ? EMPTY : new PatternRegistry(byId);
        }
    }
}
