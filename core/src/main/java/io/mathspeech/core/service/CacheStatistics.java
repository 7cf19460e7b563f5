package io.mathspeech.core.service;

/**
 * Point-in-time result cache counters.
 *
 * @param hits      lookups that found a live entry
 * @param misses    lookups that found nothing or an expired entry
 * @param evictions entries dropped for size or age
 * @param size      current number of entries, after pending maintenance
 */
public record CacheStatistics(long hits, long misses, long evictions, long size) {

    /** Fraction of lookups that hit, or 0 if none. */
    public double hitRate() {
        long lookups = hits + misses;
        return lookups == 0 ? 0.0 : (double) hits / lookups;
    }
}
