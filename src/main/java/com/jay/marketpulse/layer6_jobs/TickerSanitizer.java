package com.jay.marketpulse.layer6_jobs;

import com.jay.marketpulse.config.PulseConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Normalises user-supplied tickers: trimmed, upper-cased, characters outside
 * {@code [A-Z0-9.-]} removed, empties and duplicates dropped. Entries longer than the
 * configured length are discarded and the list is cut at the configured maximum.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TickerSanitizer {

    private final PulseConfig config;

    public List<String> sanitize(List<String> raw) {
        if (raw == null) return List.of();
        int maxTickers = config.onDemand().getMaxTickers();
        int maxLength = config.onDemand().getMaxTickerLength();

        Set<String> clean = new LinkedHashSet<>();
        for (String t : raw) {
            if (t == null) continue;
            String s = t.trim().toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9.\\-]", "");
            if (s.isEmpty()) continue;
            if (s.length() > maxLength) {
                log.debug("Ticker '{}' longer than {} chars, dropped", s, maxLength);
                continue;
            }
            clean.add(s);
            if (clean.size() == maxTickers) break;
        }
        return new ArrayList<>(clean);
    }
}
