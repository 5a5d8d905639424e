package com.jay.marketpulse.layer4_pipeline;

import com.jay.marketpulse.MutableClock;
import com.jay.marketpulse.layer5_status.ArtifactStore;
import com.jay.marketpulse.layer5_status.PersistenceException;
import com.jay.marketpulse.layer5_status.RunState;
import com.jay.marketpulse.layer5_status.StatusRecord;
import com.jay.marketpulse.layer5_status.StatusStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

class PipelineRunnerTest {

    @TempDir
    Path dataDir;

    private final MutableClock clock = new MutableClock(Instant.parse("2026-10-16T14:00:00Z"));
    private final List<String> executed = new ArrayList<>();

    /** Captures every published record in order. */
    static class RecordingStatusStore extends StatusStore {
        final List<StatusRecord> records = new ArrayList<>();

        RecordingStatusStore(ArtifactStore artifacts, Clock clock) {
            super(artifacts, clock);
        }

        @Override
        public synchronized void publish(StatusRecord record) {
            records.add(record);
            super.publish(record);
        }
    }

    private PipelineStage stage(String name, boolean usesText, Function<StageContext, Object> body) {
        return new PipelineStage() {
            @Override public String name() { return name; }
            @Override public String artifactName() { return name.toLowerCase().replace(' ', '_') + ".json"; }
            @Override public boolean usesTextGeneration() { return usesText; }
            @Override public Object execute(StageContext context) {
                executed.add(name);
                return body.apply(context);
            }
        };
    }

    private PipelineStage ok(String name) {
        return stage(name, false, ctx -> Map.of("stage", name));
    }

    private PipelineRunner runner(List<PipelineStage> stages, StatusStore status, ArtifactStore artifacts) {
        return new PipelineRunner(stages, status, artifacts, Runnable::run, clock, ZoneOffset.UTC, Duration.ofSeconds(60));
    }

    @Test
    @DisplayName("Progress is published before each stage and COMPLETED N/N at the end")
    void run_publishesOrderedProgress() {
        ArtifactStore artifacts = new ArtifactStore(dataDir);
        RecordingStatusStore status = new RecordingStatusStore(artifacts, clock);
        PipelineRunner runner = runner(List.of(ok("Macro"), ok("Heatmap"), ok("Risk")), status, artifacts);

        RunOutcome outcome = runner.run(false).orElseThrow();

        assertThat(outcome.state()).isEqualTo(RunState.COMPLETED);
        assertThat(status.records).extracting(StatusRecord::progress)
            .containsExactly("[0/3]", "[1/3]", "[2/3]", "[3/3]");
        assertThat(status.records).extracting(StatusRecord::state)
            .containsExactly(RunState.RUNNING, RunState.RUNNING, RunState.RUNNING, RunState.COMPLETED);
        assertThat(status.records).extracting(StatusRecord::runId).containsOnly(outcome.runId());
        assertThat(status.records.get(3).terminal()).isTrue();
        assertThat(Files.exists(dataDir.resolve("risk.json"))).isTrue();
    }

    @Test
    @DisplayName("Status records and stage timestamps come from the injected clock")
    void run_stampsRecordsWithInjectedClock() {
        ArtifactStore artifacts = new ArtifactStore(dataDir);
        RecordingStatusStore status = new RecordingStatusStore(artifacts, clock);
        List<Instant> stageTimes = new ArrayList<>();
        PipelineStage timed = stage("Timed", false, ctx -> {
            stageTimes.add(ctx.now());
            clock.advance(Duration.ofMillis(250));
            return Map.of("ok", true);
        });
        PipelineRunner runner = runner(List.of(timed), status, artifacts);

        runner.run(false);

        assertThat(stageTimes).containsExactly(Instant.parse("2026-10-16T14:00:00Z"));
        assertThat(status.records.get(0).timestamp()).isEqualTo(Instant.parse("2026-10-16T14:00:00Z"));
        StatusRecord done = status.records.get(1);
        assertThat(done.timestamp()).isEqualTo(Instant.parse("2026-10-16T14:00:00.250Z"));
        assertThat(done.detail()).startsWith("Completed in 250 ms");
    }

    @Test
    @DisplayName("A failing stage stops the run and keeps earlier artifacts")
    void run_stopsAtFailingStage() {
        ArtifactStore artifacts = new ArtifactStore(dataDir);
        RecordingStatusStore status = new RecordingStatusStore(artifacts, clock);
        PipelineStage broken = stage("Heatmap", false, ctx -> {
            throw new StageComputationException("No sector could be priced");
        });
        PipelineRunner runner = runner(List.of(ok("Macro"), broken, ok("Risk")), status, artifacts);

        RunOutcome outcome = runner.run(false).orElseThrow();

        assertThat(outcome.state()).isEqualTo(RunState.FAILED);
        assertThat(outcome.failedStage()).isEqualTo("Heatmap");
        assertThat(executed).containsExactly("Macro", "Heatmap");
        StatusRecord last = status.records.get(status.records.size() - 1);
        assertThat(last.state()).isEqualTo(RunState.FAILED);
        assertThat(last.stageName()).isEqualTo("Heatmap");
        assertThat(last.detail()).contains("No sector could be priced");
        assertThat(last.progress()).isEqualTo("[1/3]");
        assertThat(Files.exists(dataDir.resolve("macro.json"))).isTrue();
        assertThat(Files.exists(dataDir.resolve("risk.json"))).isFalse();
    }

    @Test
    void fastMode_skipsTextStagesButCountsThem() {
        ArtifactStore artifacts = new ArtifactStore(dataDir);
        RecordingStatusStore status = new RecordingStatusStore(artifacts, clock);
        PipelineStage narrative = stage("Narrative", true, ctx -> Map.of("text", "x"));
        PipelineRunner runner = runner(List.of(ok("Macro"), narrative), status, artifacts);

        RunOutcome outcome = runner.run(true).orElseThrow();

        assertThat(outcome.skippedStages()).containsExactly("Narrative");
        assertThat(executed).containsExactly("Macro");
        assertThat(status.records.get(status.records.size() - 1).progress()).isEqualTo("[2/2]");
        assertThat(status.records.get(1).detail()).contains("fast mode");
    }

    @Test
    void laterStagesSeeEarlierOutputs() {
        ArtifactStore artifacts = new ArtifactStore(dataDir);
        List<Object> seen = new ArrayList<>();
        PipelineStage reader = stage("Reader", false, ctx -> {
            seen.add(ctx.output("Macro", Map.class).orElse(null));
            return null;
        });
        PipelineRunner runner = runner(List.of(ok("Macro"), reader), new StatusStore(artifacts, clock), artifacts);

        runner.run(false);

        assertThat(seen).containsExactly(Map.of("stage", "Macro"));
    }

    @Test
    @DisplayName("An artifact write failure is logged and the run continues")
    void persistenceFailure_doesNotAbortRun() {
        ArtifactStore failing = new ArtifactStore(dataDir) {
            @Override
            public void write(String name, Object value) {
                if (name.equals("macro.json")) throw new PersistenceException("disk full", null);
                super.write(name, value);
            }
        };
        PipelineRunner runner = runner(List.of(ok("Macro"), ok("Risk")), new StatusStore(failing, clock), failing);

        RunOutcome outcome = runner.run(false).orElseThrow();

        assertThat(outcome.state()).isEqualTo(RunState.COMPLETED);
        assertThat(executed).containsExactly("Macro", "Risk");
    }

    @Test
    @DisplayName("Only one run at a time")
    void secondRunWhileBusy_isRefused() throws Exception {
        ArtifactStore artifacts = new ArtifactStore(dataDir);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        PipelineStage slow = stage("Slow", false, ctx -> {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return null;
        });
        PipelineRunner runner = runner(List.of(slow), new StatusStore(artifacts, clock), artifacts);
        Thread background = new Thread(() -> runner.run(false));
        background.start();
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        Optional<RunOutcome> second = runner.run(false);
        TriggerResult manual = runner.triggerManual(false);

        release.countDown();
        background.join(5000);
        assertThat(second).isEmpty();
        assertThat(manual).isEqualTo(TriggerResult.BUSY);
        assertThat(runner.isRunning()).isFalse();
    }

    @Test
    void manualTrigger_respectsCooldown() {
        ArtifactStore artifacts = new ArtifactStore(dataDir);
        PipelineRunner runner = runner(List.of(ok("Macro")), new StatusStore(artifacts, clock), artifacts);

        assertThat(runner.triggerManual(false)).isEqualTo(TriggerResult.STARTED);
        clock.advance(Duration.ofSeconds(30));
        assertThat(runner.triggerManual(false)).isEqualTo(TriggerResult.SKIPPED);
        clock.advance(Duration.ofSeconds(31));
        assertThat(runner.triggerManual(true)).isEqualTo(TriggerResult.STARTED);
        assertThat(executed).containsExactly("Macro", "Macro");
    }
}
