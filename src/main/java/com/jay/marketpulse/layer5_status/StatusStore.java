package com.jay.marketpulse.layer5_status;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;

/**
 * Holds the most recent StatusRecord (last writer wins) and mirrors it to
 * pipeline_status.json for out-of-process pollers. The in-memory record and the file are
 * updated together, so both always name the same latest record.
 */
@Slf4j
public class StatusStore {

    public static final String STATUS_FILE = "pipeline_status.json";

    private final ArtifactStore artifacts;
    private final Clock clock;
    private StatusRecord latest;

    public StatusStore(ArtifactStore artifacts, Clock clock) {
        this.artifacts = artifacts;
        this.clock = clock;
    }

    public synchronized void publish(StatusRecord record) {
        latest = record;
        log.info("Status: {} {} {} {}", record.state(), record.progress(),
            record.stageName() != null ? record.stageName() : "-",
            record.detail() != null ? record.detail() : "");
        try {
            artifacts.write(STATUS_FILE, record);
        } catch (PersistenceException e) {
            log.warn("StatusStore: could not persist status: {}", e.getMessage());
        }
    }

    /** Latest record in memory, else the persisted one, else idle. */
    public synchronized StatusRecord latest() {
        if (latest != null) return latest;
        return artifacts.read(STATUS_FILE, StatusRecord.class)
            .filter(r -> r.state() != null)
            .orElseGet(() -> StatusRecord.idle(clock.instant()));
    }
}
