package com.jay.marketpulse.layer4_pipeline;

import com.jay.marketpulse.layer5_status.ArtifactStore;
import com.jay.marketpulse.layer5_status.PersistenceException;
import com.jay.marketpulse.layer5_status.RunState;
import com.jay.marketpulse.layer5_status.StatusRecord;
import com.jay.marketpulse.layer5_status.StatusStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Layer 4: runs the stages in order and publishes progress.
 *
 * <p>Before stage {@code i} (0-based) a RUNNING record with ratio {@code i/N} is published;
 * after the last stage, COMPLETED with {@code N/N}. A failing stage ends the run with FAILED
 * and later stages do not run. Artifacts of earlier stages stay on disk. A failed artifact
 * write is logged and the run continues.
 *
 * <p>Only one run executes at a time.
 */
@Slf4j
public class PipelineRunner {

    private final List<PipelineStage> stages;
    private final StatusStore statusStore;
    private final ArtifactStore artifacts;
    private final Executor manualExecutor;
    private final Clock clock;
    private final ZoneId marketZone;
    private final Duration manualCooldown;

    private final ReentrantLock runLock = new ReentrantLock();
    private Instant lastManualTrigger;

    public PipelineRunner(List<PipelineStage> stages, StatusStore statusStore, ArtifactStore artifacts,
                          Executor manualExecutor, Clock clock, ZoneId marketZone, Duration manualCooldown) {
        this.stages = List.copyOf(stages);
        this.statusStore = statusStore;
        this.artifacts = artifacts;
        this.manualExecutor = manualExecutor;
        this.clock = clock;
        this.marketZone = marketZone;
        this.manualCooldown = manualCooldown;
    }

    /**
     * Runs the pipeline on the calling thread.
     *
     * @return the outcome, or empty if another run was in progress
     */
    public Optional<RunOutcome> run(boolean fastMode) {
        if (!runLock.tryLock()) {
            log.warn("PipelineRunner: run requested while another run is in progress, ignored");
            return Optional.empty();
        }
        try {
            return Optional.of(execute(fastMode));
        } finally {
            runLock.unlock();
        }
    }

    /** Starts a run in the background unless one is running or the cooldown has not passed. */
    public synchronized TriggerResult triggerManual(boolean fastMode) {
        if (isRunning()) return TriggerResult.BUSY;
        Instant now = clock.instant();
        if (lastManualTrigger != null && now.isBefore(lastManualTrigger.plus(manualCooldown))) {
            log.info("PipelineRunner: manual trigger within {}s cooldown, skipped", manualCooldown.toSeconds());
            return TriggerResult.SKIPPED;
        }
        try {
            manualExecutor.execute(() -> run(fastMode));
        } catch (RejectedExecutionException e) {
            log.warn("PipelineRunner: manual run rejected by executor: {}", e.getMessage());
            return TriggerResult.BUSY;
        }
        lastManualTrigger = now;
        log.info("PipelineRunner: manual run started (fast={})", fastMode);
        return TriggerResult.STARTED;
    }

    public boolean isRunning() {
        return runLock.isLocked();
    }

    public List<String> stageNames() {
        return stages.stream().map(PipelineStage::name).toList();
    }

    private RunOutcome execute(boolean fastMode) {
        String runId = UUID.randomUUID().toString().substring(0, 8);
        String snapshotVersion = LocalDate.now(clock.withZone(marketZone)).toString();
        StageContext context = new StageContext(runId, fastMode, snapshotVersion, artifacts, clock);
        int total = stages.size();
        List<String> executed = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        Instant started = clock.instant();

        log.info("=== PIPELINE RUN {} ({} stages, fast={}) ===", runId, total, fastMode);
        for (int i = 0; i < total; i++) {
            PipelineStage stage = stages.get(i);
            boolean skip = fastMode && stage.usesTextGeneration();
            statusStore.publish(StatusRecord.running(clock.instant(), runId, stage.name(), i, total,
                skip ? "Skipped (fast mode)" : "Running " + stage.name()));
            if (skip) {
                skipped.add(stage.name());
                continue;
            }

            Object output;
            try {
                output = stage.execute(context);
            } catch (RuntimeException e) {
                String summary = e.getClass().getSimpleName() + ": " + e.getMessage();
                log.error("Stage '{}' failed in run {}: {}", stage.name(), runId, summary, e);
                statusStore.publish(StatusRecord.failed(clock.instant(), runId, stage.name(), i, total, summary));
                return new RunOutcome(runId, RunState.FAILED, executed, skipped, stage.name(), summary);
            }

            context.record(stage.name(), output);
            persist(stage, output);
            executed.add(stage.name());
        }

        String detail = String.format("Completed in %d ms%s", Duration.between(started, clock.instant()).toMillis(),
            skipped.isEmpty() ? "" : ", skipped " + skipped);
        statusStore.publish(StatusRecord.completed(clock.instant(), runId, total, detail));
        log.info("=== PIPELINE RUN {} COMPLETE: {} ===", runId, detail);
        return new RunOutcome(runId, RunState.COMPLETED, executed, skipped, null, null);
    }

    private void persist(PipelineStage stage, Object output) {
        if (output == null || stage.artifactName() == null) return;
        try {
            artifacts.write(stage.artifactName(), output);
        } catch (PersistenceException e) {
            log.error("Could not persist {} for stage '{}', continuing with in-memory result: {}",
                stage.artifactName(), stage.name(), e.getMessage());
        }
    }
}
