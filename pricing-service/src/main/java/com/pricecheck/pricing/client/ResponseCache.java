package com.pricecheck.pricing.client;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded in-memory TTL cache for source responses.
 *
 * <p>Eviction is by insertion order, not by access: when the cache is full the entry that was
 * stored first goes, even if it was read a moment ago. Re-storing a key moves it to the back.
 * Expired entries are dropped lazily when read.
 *
 * <p>All operations are mutually exclusive on the instance monitor.
 */
public class ResponseCache<V> {

    private final Duration ttl;
    private final int maxEntries;
    private final Clock clock;
    private final LinkedHashMap<String, Entry<V>> entries = new LinkedHashMap<>();

    private long hits;
    private long misses;
    private long evictions;

    public ResponseCache(Duration ttl, int maxEntries) {
        this(ttl, maxEntries, Clock.systemUTC());
    }

    public ResponseCache(Duration ttl, int maxEntries, Clock clock) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be >= 1, got " + maxEntries);
        }
        this.ttl        = ttl;
        this.maxEntries = maxEntries;
        this.clock      = clock;
    }

    /**
     * @return the live value for {@code key}; empty when absent or expired
     */
    public synchronized Optional<V> get(String key) {
        Entry<V> entry = entries.get(key);
        if (entry == null) {
            misses++;
            return Optional.empty();
        }
        if (!clock.instant().isBefore(entry.expiresAt())) {
            entries.remove(key);
            misses++;
            return Optional.empty();
        }
        hits++;
        return Optional.of(entry.value());
    }

    public synchronized void put(String key, V value) {
        entries.remove(key);
        Iterator<Map.Entry<String, Entry<V>>> oldestFirst = entries.entrySet().iterator();
        while (entries.size() >= maxEntries && oldestFirst.hasNext()) {
            oldestFirst.next();
            oldestFirst.remove();
            evictions++;
        }
        entries.put(key, new Entry<>(value, clock.instant().plus(ttl)));
    }

    public synchronized void clear() {
        entries.clear();
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized CacheStats stats() {
        return new CacheStats(entries.size(), hits, misses, evictions);
    }

    private record Entry<V>(V value, Instant expiresAt) {}

    public record CacheStats(
        @JsonProperty("size")      int size,
        @JsonProperty("hits")      long hits,
        @JsonProperty("misses")    long misses,
        @JsonProperty("evictions") long evictions
    ) {}
}
