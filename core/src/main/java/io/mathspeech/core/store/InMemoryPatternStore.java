package io.mathspeech.core.store;

import io.mathspeech.core.error.DuplicatePatternException;
import io.mathspeech.core.model.Domain;
import io.mathspeech.core.model.ExpressionContext;
import io.mathspeech.core.pattern.Pattern;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mutable {@link PatternStore} backed by an immutable {@link PatternRegistry} held in an
 * {@link AtomicReference}.
 *
 * <p>
 * Every mutation builds a new registry from the current one and swaps it in with
 * compare-and-set, retrying on contention. Queries read whichever registry is current; a caller
 * that needs several consistent queries takes a {@link #snapshot()} first. The rewrite engine
 * always does.
 *
 * <p>
 * Thread-safe.
 */
public final class InMemoryPatternStore implements PatternStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryPatternStore.class);

    private final AtomicReference<PatternRegistry> registryRef = new AtomicReference<>(PatternRegistry.empty());

    public InMemoryPatternStore() {}

    /**
     * Store initially holding {@code patterns}.
     *
     * @throws DuplicatePatternException if two patterns share an id
     */
    public InMemoryPatternStore(Collection<Pattern> patterns) {
        registryRef.set(PatternRegistry.of(patterns));
    }

    /**
     * Registers a new pattern.
     *
     * @throws DuplicatePatternException if a pattern with the same id exists
     */
    public void add(Pattern pattern) {
        Objects.requireNonNull(pattern, "pattern must not be null");
        update(current -> current.toBuilder().add(pattern).build());
        LOG.debug("pattern.added id={} version={}", pattern.id(), pattern.version());
    }

    /**
     * Replaces the pattern with the same id, keeping its position.
     *
     * @return {@code false} if no pattern with that id existed (nothing changed)
     */
    public boolean replace(Pattern pattern) {
        Objects.requireNonNull(pattern, "pattern must not be null");
        boolean[] replaced = new boolean[1];
        update(current -> {
            PatternRegistry.Builder b = current.toBuilder();
            replaced[0] = b.contains(pattern.id());
            return replaced[0] ? b.put(pattern).build() : current;
        });
        if (replaced[0]) {
            LOG.debug("pattern.replaced id={} version={}", pattern.id(), pattern.version());
        }
        return replaced[0];
    }

    /** Removes the pattern with {@code id}; returns whether one was present. */
    public boolean remove(String id) {
        boolean[] removed = new boolean[1];
        update(current -> {
            PatternRegistry.Builder b = current.toBuilder();
            removed[0] = b.remove(id);
            return removed[0] ? b.build() : current;
        });
        if (removed[0]) {
            LOG.debug("pattern.removed id={}", id);
        }
        return removed[0];
    }

    /**
     * Replaces the whole content with {@code patterns}. The new registry is built before the swap,
     * so a failure leaves the previous content in place.
     *
     * @throws DuplicatePatternException if two patterns share an id
     */
    public void reload(Collection<Pattern> patterns) {
        PatternRegistry next = PatternRegistry.of(patterns);
        PatternRegistry previous = registryRef.getAndSet(next);
        LOG.info("patterns.reloaded count={} previous={}", next.size(), previous.size());
    }

    public int size() {
        return registryRef.get().size();
    }

    public StoreStatistics statistics() {
        return registryRef.get().statistics();
    }

    @Override
    public List<Pattern> findByDomain(Domain domain) {
        return registryRef.get().findByDomain(domain);
    }

    @Override
    public List<Pattern> findByContext(ExpressionContext context) {
        return registryRef.get().findByContext(context);
    }

    @Override
    public List<Pattern> findByFilters(PatternCriteria criteria) {
        return registryRef.get().findByFilters(criteria);
    }

    @Override
    public Optional<Pattern> findById(String id) {
        return registryRef.get().findById(id);
    }

    /** The current registry; later mutations of this store do not affect it. */
    @Override
    public PatternRegistry snapshot() {
        return registryRef.get();
    }

    private void update(UnaryOperator<PatternRegistry> change) {
        while (true) {
            PatternRegistry current = registryRef.get();
            PatternRegistry next = change.apply(current);
            if (next == current || registryRef.compareAndSet(current, next)) {
                return;
            }
        }
    }
}
