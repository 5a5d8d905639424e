package com.jay.marketpulse.layer6_jobs;

import com.fasterxml.jackson.core.type.TypeReference;
import com.jay.marketpulse.layer5_status.ArtifactStore;
import com.jay.marketpulse.layer5_status.PersistenceException;
import com.jay.marketpulse.model.TickerSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * ai_summaries.json, keyed by ticker. Updates are merged into the existing document under
 * a lock, so concurrent jobs never drop each other's entries.
 */
@Slf4j
@Component
public class TickerSummaryStore {

    public static final String FILE = "ai_summaries.json";
    private static final TypeReference<LinkedHashMap<String, TickerSummary>> SUMMARIES = new TypeReference<>() {};

    private final ArtifactStore artifacts;
    private final ReentrantLock lock = new ReentrantLock();

    public TickerSummaryStore(ArtifactStore artifacts) {
        this.artifacts = artifacts;
    }

    /**
     * @throws PersistenceException when the file cannot be written, or exists but cannot be
     *                              parsed; in that case the file is left untouched
     */
    public void merge(TickerSummary summary) {
        lock.lock();
        try {
            Map<String, TickerSummary> all;
            try {
                all = artifacts.readStrict(FILE, SUMMARIES).orElseGet(LinkedHashMap::new);
            } catch (PersistenceException e) {
                log.error("{} is unreadable, not storing summary for {}: {}", FILE, summary.getTicker(), e.getMessage());
                throw e;
            }
            all.put(summary.getTicker(), summary);
            artifacts.write(FILE, all);
            log.debug("Stored summary for {} ({} tickers on file)", summary.getTicker(), all.size());
        } finally {
            lock.unlock();
        }
    }

    public Optional<TickerSummary> find(String ticker) {
        if (ticker == null) return Optional.empty();
        return artifacts.read(FILE, SUMMARIES)
            .map(all -> all.get(ticker.trim().toUpperCase(Locale.ROOT)));
    }
}
