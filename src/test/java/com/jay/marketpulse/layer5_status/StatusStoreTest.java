package com.jay.marketpulse.layer5_status;

import com.jay.marketpulse.MutableClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class StatusStoreTest {

    @TempDir
    Path dataDir;

    private static final Instant T0 = Instant.parse("2026-10-16T14:00:00Z");
    private final MutableClock clock = new MutableClock(T0);

    @Test
    void latest_isIdleWhenNothingWasPublished() {
        StatusStore store = new StatusStore(new ArtifactStore(dataDir), clock);

        StatusRecord latest = store.latest();

        assertThat(latest.state()).isEqualTo(RunState.IDLE);
        assertThat(latest.terminal()).isFalse();
        assertThat(latest.timestamp()).isEqualTo(T0);
    }

    @Test
    void latest_isLastWriterWinsAndSurvivesRestart() {
        ArtifactStore artifacts = new ArtifactStore(dataDir);
        StatusStore store = new StatusStore(artifacts, clock);

        store.publish(StatusRecord.running(T0, "run-a", "Macro Data", 0, 4, "Running"));
        store.publish(StatusRecord.running(T0, "job-b", "AI Summary", 1, 2, "Summarising MSFT").asPercent());

        assertThat(store.latest().runId()).isEqualTo("job-b");
        StatusRecord reloaded = new StatusStore(artifacts, clock).latest();
        assertThat(reloaded.runId()).isEqualTo("job-b");
        assertThat(reloaded.progress()).isEqualTo("50%");
        assertThat(reloaded.state()).isEqualTo(RunState.RUNNING);
    }

    @Test
    void latest_fallsBackToIdleOnTornFile() throws Exception {
        Files.writeString(dataDir.resolve(StatusStore.STATUS_FILE), "{\"state\": \"RUNN");

        assertThat(new StatusStore(new ArtifactStore(dataDir), clock).latest().state()).isEqualTo(RunState.IDLE);
    }

    @Test
    void progressRendering() {
        assertThat(StatusRecord.running(T0, "r", "Sector Heatmap", 1, 4, null).progress()).isEqualTo("[1/4]");
        assertThat(StatusRecord.completed(T0, "r", 4, null).progress()).isEqualTo("[4/4]");
        assertThat(StatusRecord.completed(T0, "r", 3, null).asPercent().progress()).isEqualTo("100%");
        assertThat(StatusRecord.percent(1, 3)).isEqualTo("33%");
    }

    @Test
    void concurrentPublishers_leaveMemoryAndFileOnTheSameRecord() throws Exception {
        ArtifactStore artifacts = new ArtifactStore(dataDir);
        StatusStore store = new StatusStore(artifacts, clock);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                String runId = "run-" + t;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 25; i++) {
                        store.publish(StatusRecord.running(T0, runId, "Stage", i, 25, "step " + i));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) f.get(10, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        StatusRecord inMemory = store.latest();
        StatusRecord onDisk = new StatusStore(artifacts, clock).latest();
        assertThat(onDisk.runId()).isEqualTo(inMemory.runId());
        assertThat(onDisk.detail()).isEqualTo(inMemory.detail());
    }
}
