package com.jay.marketpulse.layer6_jobs;

import com.jay.marketpulse.config.PulseConfig;
import com.jay.marketpulse.layer1_data.MarketDataSource;
import com.jay.marketpulse.layer1_data.NewsSource;
import com.jay.marketpulse.layer2_analysis.TechnicalSnapshotModule;
import com.jay.marketpulse.layer2_analysis.TechnicalSnapshotModule.TechnicalSnapshot;
import com.jay.marketpulse.layer3_ai.ExternalTextClient;
import com.jay.marketpulse.layer3_ai.GenerationOptions;
import com.jay.marketpulse.layer3_ai.GenerationResult;
import com.jay.marketpulse.layer3_ai.RequestFingerprint;
import com.jay.marketpulse.layer5_status.PersistenceException;
import com.jay.marketpulse.layer5_status.StatusRecord;
import com.jay.marketpulse.layer5_status.StatusStore;
import com.jay.marketpulse.model.Headline;
import com.jay.marketpulse.model.PriceBar;
import com.jay.marketpulse.model.TickerSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.UUID;

/**
 * Layer 6: On-demand AI summaries for a user-supplied ticker list.
 *
 * <p>{@link #submit} sanitises the list, queues the job and returns at once. The job writes
 * one entry per ticker into ai_summaries.json and publishes percentage progress to the
 * StatusStore. A ticker whose summary cannot be generated is stored as failed so the
 * client can retry it.
 */
@Slf4j
@Service
public class OnDemandJobService {

    static final String TEMPLATE = "ticker-summary-v1";

    private final TickerSanitizer sanitizer;
    private final MarketDataSource marketData;
    private final NewsSource newsSource;
    private final TechnicalSnapshotModule technicalModule;
    private final ExternalTextClient textClient;
    private final TickerSummaryStore summaryStore;
    private final StatusStore statusStore;
    private final TaskExecutor executor;
    private final PulseConfig config;
    private final Clock clock;
    private final ZoneId marketZone;

    public OnDemandJobService(TickerSanitizer sanitizer, MarketDataSource marketData, NewsSource newsSource,
                              TechnicalSnapshotModule technicalModule, ExternalTextClient textClient,
                              TickerSummaryStore summaryStore, StatusStore statusStore,
                              @Qualifier("onDemandExecutor") TaskExecutor executor,
                              PulseConfig config, Clock clock, ZoneId marketZone) {
        this.sanitizer = sanitizer;
        this.marketData = marketData;
        this.newsSource = newsSource;
        this.technicalModule = technicalModule;
        this.textClient = textClient;
        this.summaryStore = summaryStore;
        this.statusStore = statusStore;
        this.executor = executor;
        this.config = config;
        this.clock = clock;
        this.marketZone = marketZone;
    }

    /**
     * @throws IllegalArgumentException when no ticker survives sanitisation
     * @throws java.util.concurrent.RejectedExecutionException when the job queue is full
     */
    public JobAcknowledgement submit(List<String> rawTickers) {
        List<String> tickers = sanitizer.sanitize(rawTickers);
        if (tickers.isEmpty()) {
            throw new IllegalArgumentException("No valid tickers in request");
        }
        String jobId = "job-" + UUID.randomUUID().toString().substring(0, 8);
        executor.execute(() -> runJob(jobId, tickers));
        log.info("On-demand job {} accepted for {}", jobId, tickers);
        return JobAcknowledgement.accepted(jobId, tickers);
    }

    void runJob(String jobId, List<String> tickers) {
        String snapshotVersion = LocalDate.now(clock.withZone(marketZone)).toString();
        int total = tickers.size();
        int failed = 0;
        for (int i = 0; i < total; i++) {
            String ticker = tickers.get(i);
            statusStore.publish(StatusRecord.running(clock.instant(), jobId, "AI Summary", i, total, "Summarising " + ticker).asPercent());
            TickerSummary summary;
            try {
                summary = summarise(jobId, ticker, snapshotVersion);
            } catch (RuntimeException e) {
                log.error("On-demand job {}: {} failed: {}", jobId, ticker, e.getMessage());
                summary = failedSummary(jobId, ticker, e.getMessage());
            }
            if (summary.isFailed()) failed++;
            try {
                summaryStore.merge(summary);
            } catch (PersistenceException e) {
                log.error("On-demand job {}: could not store summary for {}: {}", jobId, ticker, e.getMessage());
            }
        }
        statusStore.publish(StatusRecord.completed(clock.instant(), jobId, total,
            String.format("AI summaries: %d ok, %d failed", total - failed, failed)).asPercent());
        log.info("On-demand job {} finished: {}/{} summaries generated", jobId, total - failed, total);
    }

    TickerSummary summarise(String jobId, String ticker, String snapshotVersion) {
        PulseConfig.OnDemand cfg = config.onDemand();
        List<PriceBar> bars = marketData.dailyHistory(ticker, "6mo");
        TechnicalSnapshot technical = technicalModule.analyse(ticker, bars);
        List<Headline> headlines = newsSource.headlines(ticker + " stock", cfg.getHeadlineLimit());

        String prompt = buildPrompt(ticker, technical, headlines);
        GenerationResult result = textClient.generate(
            new RequestFingerprint(ticker, TEMPLATE, snapshotVersion), prompt,
            GenerationOptions.of(cfg.getTemperature(), cfg.getMaxOutputTokens()));

        return TickerSummary.builder()
            .ticker(ticker)
            .summary(result.isSuccess() ? result.text() : "AI summary unavailable: " + result.errorMessage())
            .technical(technical != null ? technical.asMap() : null)
            .headlines(headlines)
            .failed(!result.isSuccess())
            .jobId(jobId)
            .updatedAt(LocalDateTime.now(clock.withZone(marketZone)))
            .build();
    }

    private TickerSummary failedSummary(String jobId, String ticker, String error) {
        return TickerSummary.builder()
            .ticker(ticker)
            .summary("AI summary unavailable: " + error)
            .headlines(List.of())
            .failed(true)
            .jobId(jobId)
            .updatedAt(LocalDateTime.now(clock.withZone(marketZone)))
            .build();
    }

    static String buildPrompt(String ticker, TechnicalSnapshot technical, List<Headline> headlines) {
        StringBuilder sb = new StringBuilder();
        sb.append("Write a 3-4 sentence investment summary for ").append(ticker).append(".\n");
        if (technical != null) {
            sb.append(String.format("Price %.2f (%.2f%% 1d), RSI(14) %s, SMA20 %s, SMA50 %s, trend %s.%n",
                technical.price(), technical.change1d(), technical.rsi14(), technical.sma20(),
                technical.sma50(), technical.trend()));
        }
        if (!headlines.isEmpty()) {
            sb.append("Recent headlines:\n");
            for (Headline h : headlines) sb.append("- ").append(h.getTitle()).append('\n');
        }
        sb.append("Be factual, mention the main driver and one risk. Plain text, no headers.");
        return sb.toString();
    }
}
