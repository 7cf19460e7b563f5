package io.mathspeech.core.service;

import io.mathspeech.core.model.SpeechText;
import java.util.Optional;

/**
 * Opaque key-to-result store consulted by {@link MathSpeechService}. The engine itself never sees
 * the cache. Implementations MUST be thread-safe.
 */
public interface ResultCache {

    Optional<SpeechText> get(CacheKey key);

    void put(CacheKey key, SpeechText value);

    /** Drops every entry, e.g. after the pattern library was reloaded. */
    void invalidateAll();

    CacheStatistics statistics();
}
