package com.jay.marketpulse.layer4_pipeline;

import com.jay.marketpulse.layer5_status.ArtifactStore;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-run state shared by the stages of one pipeline run. Each run gets a fresh context.
 */
@Getter
public class StageContext {

    private final String runId;
    private final boolean fastMode;
    /** Trading date in the market zone, used as the snapshot part of request fingerprints. */
    private final String snapshotVersion;
    private final ArtifactStore artifacts;
    @Getter(AccessLevel.NONE)
    private final Clock clock;

    private final Map<String, Object> outputs = new HashMap<>();

    public StageContext(String runId, boolean fastMode, String snapshotVersion, ArtifactStore artifacts, Clock clock) {
        this.runId = runId;
        this.fastMode = fastMode;
        this.snapshotVersion = snapshotVersion;
        this.artifacts = artifacts;
        this.clock = clock;
    }

    /** Timestamp for artifacts written by the current stage. */
    public Instant now() {
        return clock.instant();
    }

    void record(String stageName, Object output) {
        if (output != null) outputs.put(stageName, output);
    }

    public <T> Optional<T> output(String stageName, Class<T> type) {
        Object value = outputs.get(stageName);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }
}
