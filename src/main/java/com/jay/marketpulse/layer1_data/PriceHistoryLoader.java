package com.jay.marketpulse.layer1_data;

import com.jay.marketpulse.config.PulseConfig;
import com.jay.marketpulse.model.PriceBar;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Fetches daily history for many symbols in parallel, capped at
 * {@code market.fetch_concurrency} concurrent requests.
 * Symbols with no data are left out of the result.
 */
@Slf4j
@Service
public class PriceHistoryLoader {

    private final MarketDataSource source;
    private final ExecutorService fetchExecutor;

    public PriceHistoryLoader(MarketDataSource source, PulseConfig config) {
        this.source = source;
        this.fetchExecutor = Executors.newFixedThreadPool(Math.max(1, config.market().getFetchConcurrency()));
    }

    public Map<String, List<PriceBar>> loadAll(Collection<String> symbols, String range) {
        List<String> unique = new ArrayList<>(new LinkedHashSet<>(symbols));
        List<Future<List<PriceBar>>> futures = new ArrayList<>();
        for (String symbol : unique) {
            futures.add(fetchExecutor.submit(() -> source.dailyHistory(symbol, range)));
        }

        Map<String, List<PriceBar>> result = new LinkedHashMap<>();
        for (int i = 0; i < unique.size(); i++) {
            try {
                List<PriceBar> bars = futures.get(i).get();
                if (!bars.isEmpty()) result.put(unique.get(i), bars);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while loading price history", e);
            } catch (ExecutionException e) {
                log.warn("History for {} failed: {}", unique.get(i), e.getCause().getMessage());
            }
        }
        log.info("PriceHistoryLoader: {}/{} symbols loaded ({})", result.size(), unique.size(), range);
        return result;
    }

    @PreDestroy
    public void shutdown() {
        fetchExecutor.shutdownNow();
    }
}
