package com.jay.marketpulse.layer6_jobs;

import com.jay.marketpulse.MutableClock;
import com.jay.marketpulse.SyntheticMarketData;
import com.jay.marketpulse.config.PulseConfig;
import com.jay.marketpulse.layer2_analysis.TechnicalSnapshotModule;
import com.jay.marketpulse.layer3_ai.BackoffController;
import com.jay.marketpulse.layer3_ai.ErrorKind;
import com.jay.marketpulse.layer3_ai.ExternalTextClient;
import com.jay.marketpulse.layer3_ai.GenerationOptions;
import com.jay.marketpulse.layer3_ai.RequestThrottler;
import com.jay.marketpulse.layer3_ai.ResponseCache;
import com.jay.marketpulse.layer3_ai.ServiceCallException;
import com.jay.marketpulse.layer3_ai.TextGenerationBackend;
import com.jay.marketpulse.layer5_status.ArtifactStore;
import com.jay.marketpulse.layer5_status.RunState;
import com.jay.marketpulse.layer5_status.StatusRecord;
import com.jay.marketpulse.layer5_status.StatusStore;
import com.jay.marketpulse.model.TickerSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OnDemandJobServiceTest {

    @TempDir
    Path dataDir;

    private final List<String> prompts = new ArrayList<>();
    private TickerSummaryStore summaryStore;
    private StatusStore statusStore;
    private OnDemandJobService service;
    private MutableClock clock;

    /** Answers every prompt except the ones naming a ticker that starts with "BAD". */
    private final TextGenerationBackend backend = new TextGenerationBackend() {
        @Override
        public String generate(String prompt, GenerationOptions options) {
            prompts.add(prompt);
            if (prompt.contains(" for BAD")) throw new ServiceCallException(ErrorKind.INVALID_REQUEST, "rejected");
            return "Solid quarter, watch margins.";
        }

        @Override
        public boolean isConfigured() {
            return true;
        }
    };

    @BeforeEach
    void setUp() {
        PulseConfig config = new PulseConfig();
        clock = new MutableClock(Instant.parse("2026-10-16T14:00:00Z"));
        ZoneId zone = ZoneId.of("America/New_York");
        ArtifactStore artifacts = new ArtifactStore(dataDir);
        summaryStore = new TickerSummaryStore(artifacts);
        statusStore = new StatusStore(artifacts, clock);
        ExternalTextClient client = new ExternalTextClient(backend,
            new ResponseCache(Duration.ofHours(24), 100, 10, clock),
            new RequestThrottler(Duration.ZERO, 1, 0, clock, zone),
            new BackoffController(Duration.ofMillis(1), 2.0, Duration.ofMillis(5), 2, 0),
            GenerationOptions.of(0.5, 1000));
        SyntheticMarketData market = new SyntheticMarketData();
        service = new OnDemandJobService(new TickerSanitizer(config), market, market, new TechnicalSnapshotModule(),
            client, summaryStore, statusStore, new SyncTaskExecutor(), config, clock, zone);
    }

    @Test
    @DisplayName("Each sanitised ticker gets a stored summary and the job ends at 100%")
    void storesOneSummaryPerTicker() {
        JobAcknowledgement ack = service.submit(List.of("aapl", "MS$FT"));

        assertThat(ack.status()).isEqualTo("accepted");
        assertThat(ack.tickers()).containsExactly("AAPL", "MSFT");

        TickerSummary aapl = summaryStore.find("aapl").orElseThrow();
        assertThat(aapl.isFailed()).isFalse();
        assertThat(aapl.getSummary()).isEqualTo("Solid quarter, watch margins.");
        assertThat(aapl.getTechnical()).containsKeys("price", "rsi_14", "trend");
        assertThat(aapl.getHeadlines()).hasSize(3);
        assertThat(aapl.getJobId()).isEqualTo(ack.jobId());
        assertThat(summaryStore.find("MSFT")).isPresent();

        StatusRecord status = statusStore.latest();
        assertThat(status.runId()).isEqualTo(ack.jobId());
        assertThat(status.state()).isEqualTo(RunState.COMPLETED);
        assertThat(status.progress()).isEqualTo("100%");
    }

    @Test
    @DisplayName("A failed ticker is stored as failed without stopping the rest of the job")
    void failedTickerDoesNotStopJob() {
        service.submit(List.of("BADCO", "NVDA"));

        TickerSummary bad = summaryStore.find("BADCO").orElseThrow();
        assertThat(bad.isFailed()).isTrue();
        assertThat(bad.getSummary()).startsWith("AI summary unavailable");
        assertThat(summaryStore.find("NVDA").orElseThrow().isFailed()).isFalse();
        assertThat(statusStore.latest().detail()).isEqualTo("AI summaries: 1 ok, 1 failed");
    }

    @Test
    void sameTickerTwiceOnTheSameDayIsServedFromCache() {
        service.submit(List.of("AAPL"));
        service.submit(List.of("AAPL"));

        assertThat(prompts).hasSize(1);
    }

    @Test
    void rejectsRequestWithNoUsableTicker() {
        assertThatThrownBy(() -> service.submit(List.of("$$$", "")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(prompts).isEmpty();
    }

    @Test
    void promptCarriesTechnicalsAndHeadlines() {
        service.submit(List.of("AAPL"));

        assertThat(prompts.get(0))
            .contains("investment summary for AAPL")
            .contains("RSI(14)")
            .contains("AAPL stock headline 1");
    }

    @Test
    @DisplayName("submit acknowledges before the job finishes on a real pool")
    void submitReturnsWhileJobIsStillRunning() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        TextGenerationBackend slowBackend = new TextGenerationBackend() {
            @Override
            public String generate(String prompt, GenerationOptions options) {
                entered.countDown();
                try {
                    if (!release.await(10, TimeUnit.SECONDS)) throw new IllegalStateException("never released");
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
                return "Held summary.";
            }

            @Override
            public boolean isConfigured() {
                return true;
            }
        };
        ZoneId zone = ZoneId.of("America/New_York");
        ExternalTextClient client = new ExternalTextClient(slowBackend,
            new ResponseCache(Duration.ofHours(24), 100, 10, clock),
            new RequestThrottler(Duration.ZERO, 1, 0, clock, zone),
            new BackoffController(Duration.ofMillis(1), 2.0, Duration.ofMillis(5), 2, 0),
            GenerationOptions.of(0.5, 1000));
        PulseConfig config = new PulseConfig();
        SyntheticMarketData market = new SyntheticMarketData();
        ThreadPoolTaskExecutor pool = new ThreadPoolTaskExecutor();
        pool.setCorePoolSize(1);
        pool.setMaxPoolSize(1);
        pool.setQueueCapacity(4);
        pool.setThreadNamePrefix("on-demand-test-");
        pool.initialize();
        try {
            OnDemandJobService async = new OnDemandJobService(new TickerSanitizer(config), market, market,
                new TechnicalSnapshotModule(), client, summaryStore, statusStore, pool, config, clock, zone);

            JobAcknowledgement ack = async.submit(List.of("AAPL"));

            assertThat(ack.status()).isEqualTo("accepted");
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(summaryStore.find("AAPL")).isEmpty();
            StatusRecord running = statusStore.latest();
            assertThat(running.runId()).isEqualTo(ack.jobId());
            assertThat(running.state()).isEqualTo(RunState.RUNNING);

            release.countDown();
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (statusStore.latest().state() != RunState.COMPLETED && System.nanoTime() < deadline) {
                Thread.sleep(20);
            }
            assertThat(statusStore.latest().state()).isEqualTo(RunState.COMPLETED);
            assertThat(summaryStore.find("AAPL").orElseThrow().getSummary()).isEqualTo("Held summary.");
        } finally {
            pool.shutdown();
        }
    }

    @Test
    void corruptSummaryFileIsKeptAndJobStillCompletes() throws Exception {
        Path file = dataDir.resolve(TickerSummaryStore.FILE);
        Files.writeString(file, "{\"AAPL\": {\"ticker\": ");

        service.submit(List.of("MSFT"));

        assertThat(Files.readString(file)).isEqualTo("{\"AAPL\": {\"ticker\": ");
        assertThat(statusStore.latest().state()).isEqualTo(RunState.COMPLETED);
    }
}
