package com.example.keyseq_backend.service.similarity;

import com.example.keyseq_backend.config.SimilarityProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide memo of frame/text similarities keyed by frame id and normalized event text.
 * Entries expire after {@code similarity.cache-ttl-seconds}; once {@code similarity.cache-max-entries}
 * is reached, expired entries are purged first and then the entries closest to expiry.
 * Safe for concurrent readers and writers.
 */
@Component
public class SimilarityCache {
    private static final Logger LOGGER = LoggerFactory.getLogger(SimilarityCache.class);
    static final Duration DEFAULT_TTL = Duration.ofMinutes(30);
    static final int DEFAULT_MAX_ENTRIES = 500_000;

    private final Map<Key, CacheEntry> entries = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final Clock clock;
    private final Duration ttl;
    private final int maxEntries;

    public SimilarityCache() {
        this(Clock.systemUTC(), DEFAULT_TTL, DEFAULT_MAX_ENTRIES);
    }

    @Autowired
    public SimilarityCache(SimilarityProperties props, Clock clock) {
        this(clock, Duration.ofSeconds(props.getCacheTtlSeconds()), props.getCacheMaxEntries());
    }

    SimilarityCache(Clock clock, Duration ttl, int maxEntries) {
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("cache ttl must be positive");
        }
        if (maxEntries < 1) {
            throw new IllegalArgumentException("cache max entries must be >= 1");
        }
        this.clock = clock;
        this.ttl = ttl;
        this.maxEntries = maxEntries;
    }

    public OptionalDouble get(long frameId, String text) {
        Key key = new Key(frameId, normalize(text));
        CacheEntry cached = entries.get(key);
        if (cached != null && cached.isExpired(clock.instant())) {
            entries.remove(key, cached);
            cached = null;
        }
        if (cached == null) {
            misses.incrementAndGet();
            return OptionalDouble.empty();
        }
        hits.incrementAndGet();
        return OptionalDouble.of(cached.similarity());
    }

    public void put(long frameId, String text, double similarity) {
        Instant now = clock.instant();
        if (entries.size() >= maxEntries) {
            evict(now);
        }
        entries.put(new Key(frameId, normalize(text)), new CacheEntry(similarity, now.plus(ttl)));
    }

    public void clear() {
        entries.clear();
        hits.set(0);
        misses.set(0);
    }

    public int size() {
        return entries.size();
    }

    public long hits() {
        return hits.get();
    }

    public long misses() {
        return misses.get();
    }

    // drops expired entries, then trims to 90% of the bound by earliest expiry
    private synchronized void evict(Instant now) {
        if (entries.size() < maxEntries) {
            return;
        }
        int before = entries.size();
        entries.values().removeIf(entry -> entry.isExpired(now));
        int target = maxEntries - Math.max(1, maxEntries / 10);
        int excess = entries.size() - target;
        if (excess > 0) {
            entries.entrySet().stream()
                    .sorted(Comparator.comparing((Map.Entry<Key, CacheEntry> e) -> e.getValue().expiresAt()))
                    .limit(excess)
                    .map(Map.Entry::getKey)
                    .toList()
                    .forEach(entries::remove);
        }
        LOGGER.debug("similarity cache evicted {} entries, size={}", before - entries.size(), entries.size());
    }

    static String normalize(String text) {
        return text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
    }

    private record Key(long frameId, String text) {
    }

    private record CacheEntry(double similarity, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
