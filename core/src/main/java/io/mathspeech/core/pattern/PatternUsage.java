package io.mathspeech.core.pattern;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Hit, miss and error counters per pattern id. Bookkeeping only; kept outside {@link Pattern} so
 * that applying a pattern stays a pure function.
 *
 * <p>
 * Thread-safe.
 */
public final class PatternUsage {

    private final ConcurrentMap<String, Counters> counters = new ConcurrentHashMap<>();

    public void recordHit(String patternId) {
        counters(patternId).hits.increment();
    }

    public void recordMiss(String patternId) {
        counters(patternId).misses.increment();
    }

    public void recordError(String patternId) {
        counters(patternId).errors.increment();
    }

    /** Current counts for {@code patternId}; all zero if never recorded. */
    public Snapshot snapshot(String patternId) {
        Counters c = counters.get(patternId);
        return c == null ? new Snapshot(0, 0, 0) : c.snapshot();
    }

    /** Current counts for every pattern seen, ordered by pattern id. */
    public Map<String, Snapshot> snapshotAll() {
        Map<String, Snapshot> result = new LinkedHashMap<>();
        counters.keySet().stream().sorted().forEach(id -> result.put(id, counters.get(id).snapshot()));
        return Collections.unmodifiableMap(result);
    }

    public void reset() {
        counters.clear();
    }

    private Counters counters(String patternId) {
        return counters.computeIfAbsent(patternId, id -> new Counters());
    }

    /**
     * Point-in-time counts.
     *
     * @param hits   applications that changed the text
     * @param misses attempts where the pattern did not match
     * @param errors failed applications
     */
    public record Snapshot(long hits, long misses, long errors) {

        /** Fraction of attempts that hit, or 0 if never attempted. */
        public double hitRate() {
            long attempts = hits + misses;
            return attempts == 0 ? 0.0 : (double) hits / attempts;
        }
    }

    private static final class Counters {
        final LongAdder hits = new LongAdder();
        final LongAdder misses = new LongAdder();
        final LongAdder errors = new LongAdder();

        Snapshot snapshot() {
            return new Snapshot(hits.sum(), misses.sum(), errors.sum());
        }
    }
}
