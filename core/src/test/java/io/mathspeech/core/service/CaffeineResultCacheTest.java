package io.mathspeech.core.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.mathspeech.core.model.AudienceLevel;
import io.mathspeech.core.model.Domain;
import io.mathspeech.core.model.ExpressionContext;
import io.mathspeech.core.model.SpeechText;
import io.mathspeech.core.testkit.FakeTicker;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CaffeineResultCache")
class CaffeineResultCacheTest {

    private static CacheKey key(String text) {
        return new CacheKey(text, AudienceLevel.UNDERGRADUATE, null, ExpressionContext.INLINE);
    }

    private static SpeechText speech(String text) {
        return new SpeechText(text, List.of(), 1, true, Domain.ALGEBRA, null, null);
    }

    @Test
    @DisplayName("size bound evicts down to the maximum and counts the eviction")
    void sizeBound() {
        var cache = new CaffeineResultCache(2);
        cache.put(key("a"), speech("A"));
        cache.put(key("b"), speech("B"));
        cache.put(key("c"), speech("C"));

        CacheStatistics stats = cache.statistics();

        assertThat(stats.size()).isEqualTo(2);
        assertThat(stats.evictions()).isEqualTo(1);
    }

    @Test
    @DisplayName("entries expire once the ttl has elapsed since the write")
    void expiresAfterWrite() {
        var ticker = new FakeTicker();
        var cache = new CaffeineResultCache(10, Duration.ofMinutes(5), ticker);
        cache.put(key("a"), speech("A"));

        ticker.advance(Duration.ofMinutes(4));
        assertThat(cache.get(key("a"))).map(SpeechText::text).contains("A");

        ticker.advance(Duration.ofMinutes(1));
        assertThat(cache.get(key("a"))).isEmpty();

        CacheStatistics stats = cache.statistics();
        assertThat(stats.evictions()).isEqualTo(1);
        assertThat(stats.size()).isZero();
    }

    @Test
    @DisplayName("purgeExpired drops only stale entries")
    void purgeExpired() {
        var ticker = new FakeTicker();
        var cache = new CaffeineResultCache(10, Duration.ofSeconds(30), ticker);
        cache.put(key("old"), speech("old"));
        ticker.advance(Duration.ofSeconds(20));
        cache.put(key("new"), speech("new"));
        ticker.advance(Duration.ofSeconds(15));

        assertThat(cache.purgeExpired()).isEqualTo(1);
        assertThat(cache.get(key("new"))).isPresent();
        assertThat(cache.get(key("old"))).isEmpty();
    }

    @Test
    @DisplayName("zero ttl means entries never expire")
    void zeroTtl() {
        var ticker = new FakeTicker();
        var cache = new CaffeineResultCache(10, Duration.ZERO, ticker);
        cache.put(key("a"), speech("A"));

        ticker.advance(Duration.ofDays(365));

        assertThat(cache.get(key("a"))).isPresent();
        assertThat(cache.purgeExpired()).isZero();
    }

    @Test
    @DisplayName("hits and misses come from the cache's own statistics")
    void hitsAndMisses() {
        var cache = new CaffeineResultCache(4);
        cache.put(key("a"), speech("A"));
        cache.get(key("a"));
        cache.get(key("a"));
        cache.get(key("missing"));

        CacheStatistics stats = cache.statistics();

        assertThat(stats.hits()).isEqualTo(2);
        assertThat(stats.misses()).isEqualTo(1);
        assertThat(stats.hitRate()).isEqualTo(2.0 / 3.0);

        cache.invalidateAll();
        assertThat(cache.statistics().size()).isZero();
    }

    @Test
    @DisplayName("cache key normalizes whitespace and includes the audience")
    void keyNormalizesWhitespace() {
        var request = ConversionRequest.of("x");

        assertThat(CacheKey.of("x  +\n y", request)).isEqualTo(CacheKey.of("x + y", request));
        assertThat(CacheKey.of("x", request.withAudience(AudienceLevel.RESEARCH)))
                .isNotEqualTo(CacheKey.of("x", request));
    }

    @Test
    @DisplayName("non-positive size and negative ttl are rejected")
    void invalidArguments() {
        assertThatThrownBy(() -> new CaffeineResultCache(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CaffeineResultCache(1, Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ttl must not be negative");
    }
}
