package com.jay.marketpulse.layer4_pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.jay.marketpulse.MutableClock;
import com.jay.marketpulse.SyntheticMarketData;
import com.jay.marketpulse.config.PulseConfig;
import com.jay.marketpulse.layer1_data.PriceHistoryLoader;
import com.jay.marketpulse.layer2_analysis.MacroIndicatorModule;
import com.jay.marketpulse.layer2_analysis.PortfolioRiskModule;
import com.jay.marketpulse.layer2_analysis.SectorHeatmapModule;
import com.jay.marketpulse.layer3_ai.BackoffController;
import com.jay.marketpulse.layer3_ai.ExternalTextClient;
import com.jay.marketpulse.layer3_ai.RequestThrottler;
import com.jay.marketpulse.layer3_ai.ResponseCache;
import com.jay.marketpulse.layer3_ai.ServiceCallException;
import com.jay.marketpulse.layer3_ai.ErrorKind;
import com.jay.marketpulse.layer3_ai.TextGenerationBackend;
import com.jay.marketpulse.layer3_ai.GenerationOptions;
import com.jay.marketpulse.layer4_pipeline.stages.AiNarrativeStage;
import com.jay.marketpulse.layer4_pipeline.stages.EconomicCalendarStage;
import com.jay.marketpulse.layer4_pipeline.stages.MacroDataStage;
import com.jay.marketpulse.layer4_pipeline.stages.PortfolioRiskStage;
import com.jay.marketpulse.layer4_pipeline.stages.SectorHeatmapStage;
import com.jay.marketpulse.layer5_status.ArtifactStore;
import com.jay.marketpulse.layer5_status.RunState;
import com.jay.marketpulse.layer5_status.StatusStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class PipelineEndToEndTest {

    @TempDir
    Path dataDir;

    private final PulseConfig config = new PulseConfig();
    private final MutableClock clock = new MutableClock(Instant.parse("2026-10-16T14:00:00Z"));
    private final ZoneId zone = ZoneId.of("America/New_York");
    private final SyntheticMarketData market = new SyntheticMarketData();
    private final PriceHistoryLoader loader = new PriceHistoryLoader(market, config);

    @AfterEach
    void tearDown() {
        loader.shutdown();
    }

    /** Counts calls; fails with the given kind when set. */
    static class CountingBackend implements TextGenerationBackend {
        final AtomicInteger calls = new AtomicInteger();
        volatile ErrorKind failWith;

        CountingBackend(ErrorKind failWith) {
            this.failWith = failWith;
        }

        @Override
        public String generate(String prompt, GenerationOptions options) {
            calls.incrementAndGet();
            if (failWith != null) throw new ServiceCallException(failWith, "down");
            return "### Strategic Sentiment\nRisk-on.";
        }

        @Override
        public boolean isConfigured() {
            return true;
        }
    }

    private PipelineRunner runner(ArtifactStore artifacts, TextGenerationBackend backend) {
        ExternalTextClient client = new ExternalTextClient(backend,
            new ResponseCache(Duration.ofHours(24), 100, 10, clock),
            new RequestThrottler(Duration.ZERO, 1, 0, clock, zone),
            new BackoffController(Duration.ofMillis(1), 2.0, Duration.ofMillis(5), 2, 0),
            GenerationOptions.of(0.5, 1000));
        List<PipelineStage> stages = List.of(
            new MacroDataStage(config, loader, market, new MacroIndicatorModule()),
            new SectorHeatmapStage(config, loader, new SectorHeatmapModule()),
            new PortfolioRiskStage(config, loader, new PortfolioRiskModule(config)),
            new AiNarrativeStage(config, client),
            new EconomicCalendarStage(config, market, client, zone));
        return new PipelineRunner(stages, new StatusStore(artifacts, clock), artifacts, Runnable::run, clock, zone,
            Duration.ofSeconds(60));
    }

    @Test
    void fullRun_writesAllArtifactsAndReusesNarrativeFromCache() {
        ArtifactStore artifacts = new ArtifactStore(dataDir);
        CountingBackend backend = new CountingBackend(null);
        PipelineRunner runner = runner(artifacts, backend);

        RunOutcome first = runner.run(false).orElseThrow();
        backend.failWith = ErrorKind.TRANSIENT_SERVICE_ERROR;
        RunOutcome second = runner.run(false).orElseThrow();

        assertThat(first.state()).isEqualTo(RunState.COMPLETED);
        assertThat(second.state()).isEqualTo(RunState.COMPLETED);
        assertThat(backend.calls.get()).isEqualTo(1);

        JsonNode macro = artifacts.readTree("macro_analysis.json").orElseThrow();
        assertThat(macro.path("macroIndicators").has("VIX")).isTrue();
        assertThat(macro.path("macroIndicators").has("YieldSpread")).isTrue();
        assertThat(artifacts.readTree("sector_heatmap.json").orElseThrow().path("sectors").size()).isEqualTo(6);
        assertThat(artifacts.readTree("portfolio_risk.json").orElseThrow().path("tickers").size()).isEqualTo(7);
        JsonNode narrative = artifacts.readTree("ai_narrative.json").orElseThrow();
        assertThat(narrative.path("narrative").asText()).contains("Risk-on");
        assertThat(narrative.path("fromCache").asBoolean()).isTrue();
        assertThat(narrative.path("stale").asBoolean()).isFalse();
        JsonNode calendar = artifacts.readTree("weekly_calendar.json").orElseThrow();
        assertThat(calendar.path("weekStart").asText()).isEqualTo("2026-10-16");
        assertThat(calendar.path("events").size()).isEqualTo(2);
        assertThat(calendar.path("events").get(0).path("impact").asText()).isEqualTo("Medium");
        assertThat(new StatusStore(artifacts, clock).latest().progress()).isEqualTo("[5/5]");
    }

    @Test
    void failedNarrative_keepsPreviousTextWithStaleMarker() {
        ArtifactStore artifacts = new ArtifactStore(dataDir);
        runner(artifacts, new CountingBackend(null)).run(false);

        CountingBackend failing = new CountingBackend(ErrorKind.QUOTA_EXCEEDED);
        RunOutcome outcome = runner(artifacts, failing).run(false).orElseThrow();

        assertThat(outcome.state()).isEqualTo(RunState.COMPLETED);
        assertThat(failing.calls.get()).isEqualTo(2);
        JsonNode narrative = artifacts.readTree("ai_narrative.json").orElseThrow();
        assertThat(narrative.path("stale").asBoolean()).isTrue();
        assertThat(narrative.path("errorKind").asText()).isEqualTo("QUOTA_EXCEEDED");
        assertThat(narrative.path("narrative").asText()).contains("Risk-on").contains("previous cycle");
    }

    @Test
    void missingMacroData_failsTheRunAtTheFirstStage() {
        config.market().getMacroTickers().values().forEach(market::without);
        ArtifactStore artifacts = new ArtifactStore(dataDir);

        RunOutcome outcome = runner(artifacts, new CountingBackend(null)).run(false).orElseThrow();

        assertThat(outcome.state()).isEqualTo(RunState.FAILED);
        assertThat(outcome.failedStage()).isEqualTo(MacroDataStage.NAME);
        assertThat(artifacts.readTree("sector_heatmap.json")).isEmpty();
    }

    @Test
    void unexpectedBackendError_doesNotFailTheRun() {
        ArtifactStore artifacts = new ArtifactStore(dataDir);
        TextGenerationBackend broken = new CountingBackend(null) {
            @Override
            public String generate(String prompt, GenerationOptions options) {
                throw new IllegalArgumentException("unexpected url: htps//bad");
            }
        };

        RunOutcome outcome = runner(artifacts, broken).run(false).orElseThrow();

        assertThat(outcome.state()).isEqualTo(RunState.COMPLETED);
        JsonNode narrative = artifacts.readTree("ai_narrative.json").orElseThrow();
        assertThat(narrative.path("errorKind").asText()).isEqualTo("INVALID_REQUEST");
        assertThat(narrative.path("narrative").isNull()).isTrue();
    }
}
