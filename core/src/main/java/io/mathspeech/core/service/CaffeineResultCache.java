package io.mathspeech.core.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import io.mathspeech.core.model.SpeechText;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link ResultCache} backed by a Caffeine cache: size-bounded, with an optional time-to-live
 * measured from the write.
 *
 * <p>
 * Cache maintenance runs on the calling thread, so evictions and expirations are visible in
 * {@link #statistics()} as soon as the call that caused them returns. Thread-safe.
 */
public final class CaffeineResultCache implements ResultCache {

    private final Cache<CacheKey, SpeechText> cache;

    /** Cache holding at most {@code maxSize} entries, without expiry. */
    public CaffeineResultCache(int maxSize) {
        this(maxSize, null, Ticker.systemTicker());
    }

    /** Cache on the system ticker. */
    public CaffeineResultCache(int maxSize, Duration ttl) {
        this(maxSize, ttl, Ticker.systemTicker());
    }

    /**
     * Creates a cache.
     *
     * @param maxSize maximum number of entries, positive
     * @param ttl     entry lifetime after write, or {@code null}/zero for no expiry
     * @param ticker  time source for expiry
     */
    public CaffeineResultCache(int maxSize, Duration ttl, Ticker ticker) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive, got: " + maxSize);
        }
        if (ttl != null && ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must not be negative, got: " + ttl);
        }
        Caffeine<Object, Object> builder = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .ticker(Objects.requireNonNull(ticker, "ticker must not be null"))
                .executor(Runnable::run)
                .recordStats();
        if (ttl != null && !ttl.isZero()) {
            builder.expireAfterWrite(ttl);
        }
        this.cache = builder.build();
    }

    @Override
    public Optional<SpeechText> get(CacheKey key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(CacheKey key, SpeechText value) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        cache.put(key, value);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
    }

    @Override
    public CacheStatistics statistics() {
        cache.cleanUp();
        CacheStats stats = cache.stats();
        return new CacheStatistics(stats.hitCount(), stats.missCount(), stats.evictionCount(), cache.estimatedSize());
    }

    /** Drops expired entries now instead of on the next access; returns how many were dropped. */
    public long purgeExpired() {
        long before = cache.stats().evictionCount();
        cache.cleanUp();
        return cache.stats().evictionCount() - before;
    }
}
