package com.example.keyseq_backend.service.similarity;

import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.when;

class SimilarityCacheTest {

    private final SimilarityCache cache = new SimilarityCache();

    @Test
    void keysOnFrameIdAndNormalizedText() {
        cache.put(7, "  Person Enters ", 0.42);

        assertThat(cache.get(7, "person enters")).hasValue(0.42);
        assertThat(cache.get(8, "person enters")).isEmpty();
        assertThat(cache.hits()).isEqualTo(1);
        assertThat(cache.misses()).isEqualTo(1);
    }

    @Test
    void clearDropsEntriesAndCounters() {
        cache.put(1, "a", 0.1);
        cache.get(1, "a");

        cache.clear();

        assertThat(cache.size()).isZero();
        assertThat(cache.hits()).isZero();
        assertThat(cache.get(1, "a")).isEmpty();
    }

    @Test
    void acceptsConcurrentWriters() {
        CompletableFuture<?>[] writers = IntStream.range(0, 8)
                .mapToObj(t -> CompletableFuture.runAsync(() -> {
                    for (int i = 0; i < 500; i++) {
                        cache.put(i, "event " + t, i / 500.0);
                    }
                }))
                .toArray(CompletableFuture[]::new);

        CompletableFuture.allOf(writers).join();

        assertThat(cache.size()).isEqualTo(8 * 500);
    }

    @Test
    void entriesExpireAfterTtl() {
        Clock clock = Mockito.mock(Clock.class);
        Instant t0 = Instant.parse("2026-01-01T00:00:00Z");
        when(clock.instant()).thenReturn(t0, t0.plusSeconds(59), t0.plusSeconds(60));
        SimilarityCache expiring = new SimilarityCache(clock, Duration.ofSeconds(60), 100);

        expiring.put(3, "car stops", 0.7);

        assertThat(expiring.get(3, "car stops")).hasValue(0.7);
        assertThat(expiring.get(3, "car stops")).isEmpty();
        assertThat(expiring.size()).isZero();
        assertThat(expiring.misses()).isEqualTo(1);
    }

    @Test
    void fullCachePurgesExpiredEntriesBeforeLiveOnes() {
        Clock clock = Mockito.mock(Clock.class);
        Instant t0 = Instant.parse("2026-01-01T00:00:00Z");
        when(clock.instant()).thenReturn(t0);
        SimilarityCache bounded = new SimilarityCache(clock, Duration.ofSeconds(10), 4);
        bounded.put(1, "a", 0.1);
        bounded.put(2, "a", 0.2);
        when(clock.instant()).thenReturn(t0.plusSeconds(5));
        bounded.put(3, "a", 0.3);
        bounded.put(4, "a", 0.4);
        when(clock.instant()).thenReturn(t0.plusSeconds(11));

        bounded.put(5, "a", 0.5);

        assertThat(bounded.size()).isEqualTo(3);
        assertThat(bounded.get(1, "a")).isEmpty();
        assertThat(bounded.get(3, "a")).hasValue(0.3);
        assertThat(bounded.get(5, "a")).hasValue(0.5);
    }

    @Test
    void fullCacheDropsEntriesClosestToExpiry() {
        Clock clock = Mockito.mock(Clock.class);
        Instant t0 = Instant.parse("2026-01-01T00:00:00Z");
        SimilarityCache bounded = new SimilarityCache(clock, Duration.ofMinutes(10), 10);
        for (int i = 0; i < 10; i++) {
            when(clock.instant()).thenReturn(t0.plusSeconds(i));
            bounded.put(i, "a", i / 10.0);
        }
        when(clock.instant()).thenReturn(t0.plusSeconds(10));

        bounded.put(10, "a", 1.0);

        assertThat(bounded.size()).isEqualTo(10);
        assertThat(bounded.get(0, "a")).isEmpty();
        assertThat(bounded.get(1, "a")).hasValue(0.1);
        assertThat(bounded.get(10, "a")).hasValue(1.0);
    }

    @Test
    void rejectsNonPositiveTtl() {
        assertThrows(IllegalArgumentException.class,
                () -> new SimilarityCache(Clock.systemUTC(), Duration.ZERO, 10));
    }
}
