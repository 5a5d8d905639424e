package com.jay.marketpulse.layer3_ai;

import com.fasterxml.jackson.core.type.TypeReference;
import com.jay.marketpulse.layer5_status.ArtifactStore;
import com.jay.marketpulse.layer5_status.PersistenceException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Keeps the ResponseCache across restarts in a JSON file next to the other artifacts.
 */
@Slf4j
public class CachePersistence {

    private static final TypeReference<List<CacheEntry>> ENTRIES = new TypeReference<>() {};

    private final ResponseCache cache;
    private final ArtifactStore artifacts;
    private final String fileName;
    private final boolean enabled;

    public CachePersistence(ResponseCache cache, ArtifactStore artifacts, String fileName, boolean enabled) {
        this.cache = cache;
        this.artifacts = artifacts;
        this.fileName = fileName;
        this.enabled = enabled;
    }

    public int load() {
        if (!enabled) return 0;
        int loaded = artifacts.read(fileName, ENTRIES).map(cache::restore).orElse(0);
        log.info("CachePersistence: restored {} cached generations from {}", loaded, fileName);
        return loaded;
    }

    public void flush() {
        if (!enabled) return;
        cache.sweep();
        try {
            artifacts.write(fileName, cache.entries());
            log.debug("CachePersistence: flushed {} entries", cache.size());
        } catch (PersistenceException e) {
            log.warn("CachePersistence: flush failed: {}", e.getMessage());
        }
    }
}
