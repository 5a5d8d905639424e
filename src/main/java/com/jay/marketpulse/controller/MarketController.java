package com.jay.marketpulse.controller;

import com.jay.marketpulse.layer3_ai.ExternalTextClient;
import com.jay.marketpulse.layer3_ai.RequestThrottler;
import com.jay.marketpulse.layer3_ai.ResponseCache;
import com.jay.marketpulse.layer5_status.ArtifactStore;
import com.jay.marketpulse.layer6_jobs.JobAcknowledgement;
import com.jay.marketpulse.layer6_jobs.OnDemandJobService;
import com.jay.marketpulse.layer6_jobs.TickerSummaryStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;

/**
 * REST API: US market artifacts, quota status and on-demand summaries.
 *
 * Endpoints:
 *   GET  /api/us/quota-status           throttler, cache and client counters
 *   GET  /api/us/macro-analysis         macro_analysis.json
 *   GET  /api/us/sector-heatmap         sector_heatmap.json
 *   GET  /api/us/risk-overview          portfolio_risk.json
 *   GET  /api/us/ai-narrative           ai_narrative.json
 *   GET  /api/us/calendar               weekly_calendar.json, no events when absent
 *   GET  /api/us/ai-summary/{ticker}    stored on-demand summary
 *   POST /api/us/generate-ai-summary    queue an on-demand job (202)
 */
@Slf4j
@RestController
@RequestMapping("/api/us")
@RequiredArgsConstructor
public class MarketController {

    private final ArtifactStore artifacts;
    private final RequestThrottler throttler;
    private final ResponseCache cache;
    private final ExternalTextClient textClient;
    private final OnDemandJobService jobService;
    private final TickerSummaryStore summaryStore;

    public record GenerateSummaryRequest(List<String> tickers) {}

    @GetMapping("/quota-status")
    public ResponseEntity<Map<String, Object>> quotaStatus() {
        return ResponseEntity.ok(Map.of(
            "throttle", throttler.snapshot(),
            "cache", cache.stats(),
            "client", textClient.stats()
        ));
    }

    @GetMapping("/macro-analysis")
    public ResponseEntity<?> macroAnalysis() {
        return artifact("macro_analysis.json");
    }

    @GetMapping("/sector-heatmap")
    public ResponseEntity<?> sectorHeatmap() {
        return artifact("sector_heatmap.json");
    }

    @GetMapping("/risk-overview")
    public ResponseEntity<?> riskOverview() {
        return artifact("portfolio_risk.json");
    }

    @GetMapping("/ai-narrative")
    public ResponseEntity<?> aiNarrative() {
        return artifact("ai_narrative.json");
    }

    @GetMapping("/calendar")
    public ResponseEntity<?> calendar() {
        return artifacts.readTree("weekly_calendar.json")
            .<ResponseEntity<?>>map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.ok(Map.of("events", List.of())));
    }

    @GetMapping("/ai-summary/{ticker}")
    public ResponseEntity<?> aiSummary(@PathVariable String ticker) {
        return summaryStore.find(ticker)
            .<ResponseEntity<?>>map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.ok(Collections.singletonMap("summary", null)));
    }

    @PostMapping("/generate-ai-summary")
    public ResponseEntity<?> generateAiSummary(@RequestBody GenerateSummaryRequest request) {
        try {
            JobAcknowledgement ack = jobService.submit(request.tickers());
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(ack);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (RejectedExecutionException e) {
            log.warn("On-demand queue full: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("error", "Too many on-demand jobs queued, retry later"));
        }
    }

    private ResponseEntity<?> artifact(String name) {
        return artifacts.readTree(name)
            .<ResponseEntity<?>>map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Map.of("error", name + " not generated yet")));
    }
}
