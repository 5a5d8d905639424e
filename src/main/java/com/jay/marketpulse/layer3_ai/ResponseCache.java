package com.jay.marketpulse.layer3_ai;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fingerprint → generated text with a time-to-live.
 * Expired entries are never returned; they are dropped on read or by {@link #sweep()}.
 * When the cache is full the oldest {@code evictBatch} entries by creation time are evicted.
 */
@Slf4j
public class ResponseCache {

    private final Map<String, CacheEntry> entries = new HashMap<>();
    private final Duration defaultTtl;
    private final int maxEntries;
    private final int evictBatch;
    private final Clock clock;

    private long hits;
    private long misses;

    public ResponseCache(Duration defaultTtl, int maxEntries, int evictBatch, Clock clock) {
        this.defaultTtl = defaultTtl;
        this.maxEntries = Math.max(1, maxEntries);
        this.evictBatch = Math.max(1, evictBatch);
        this.clock = clock;
    }

    public synchronized Optional<String> get(RequestFingerprint fp) {
        String key = fp.key();
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            misses++;
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key);
            misses++;
            return Optional.empty();
        }
        hits++;
        return Optional.of(entry.getText());
    }

    public void put(RequestFingerprint fp, String text) {
        put(fp, text, defaultTtl);
    }

    public synchronized void put(RequestFingerprint fp, String text, Duration ttl) {
        String key = fp.key();
        if (!entries.containsKey(key) && entries.size() >= maxEntries) {
            evictOldest();
        }
        Instant now = clock.instant();
        entries.put(key, CacheEntry.builder()
            .key(key)
            .label(fp.toString())
            .text(text)
            .createdAt(now)
            .expiresAt(now.plus(ttl))
            .build());
    }

    /** Removes every expired entry; returns how many were removed. */
    public synchronized int sweep() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(e -> e.isExpired(now));
        int removed = before - entries.size();
        if (removed > 0) log.info("ResponseCache: swept {} expired entries, {} remain", removed, entries.size());
        return removed;
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized Map<String, Object> stats() {
        return Map.of(
            "entries", entries.size(),
            "maxEntries", maxEntries,
            "hits", hits,
            "misses", misses,
            "ttlHours", defaultTtl.toHours());
    }

    /** Copy of the live entries, for persistence. */
    public synchronized List<CacheEntry> entries() {
        Instant now = clock.instant();
        List<CacheEntry> copy = new ArrayList<>();
        for (CacheEntry e : entries.values()) {
            if (!e.isExpired(now)) copy.add(e);
        }
        return copy;
    }

    /** Loads persisted entries, skipping expired or malformed ones. Returns the number loaded. */
    public synchronized int restore(List<CacheEntry> persisted) {
        if (persisted == null) return 0;
        Instant now = clock.instant();
        int loaded = 0;
        for (CacheEntry e : persisted) {
            if (e == null || e.getKey() == null || e.getText() == null || e.isExpired(now)) continue;
            if (!entries.containsKey(e.getKey()) && entries.size() >= maxEntries) evictOldest();
            entries.put(e.getKey(), e);
            loaded++;
        }
        return loaded;
    }

    private void evictOldest() {
        List<CacheEntry> oldest = new ArrayList<>(entries.values());
        oldest.sort(Comparator.comparing(CacheEntry::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder())));
        int n = Math.min(evictBatch, oldest.size());
        for (int i = 0; i < n; i++) {
            entries.remove(oldest.get(i).getKey());
        }
        log.info("ResponseCache: capacity {} reached, evicted {} oldest entries", maxEntries, n);
    }
}
