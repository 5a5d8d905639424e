package com.jay.marketpulse.layer5_status;

import java.time.Instant;

/**
 * Latest progress of a pipeline run or on-demand job, as polled by clients.
 * {@code progress} is either a ratio {@code "[2/4]"} or a percentage {@code "50%"}.
 */
public record StatusRecord(
    Instant timestamp,
    String runId,
    RunState state,
    String stageName,
    int stageIndex,
    int completed,
    int total,
    String progress,
    String detail,
    boolean terminal
) {

    public static StatusRecord idle(Instant at) {
        return new StatusRecord(at, null, RunState.IDLE, null, -1, 0, 0, ratio(0, 0),
            "No run recorded", false);
    }

    public static StatusRecord running(Instant at, String runId, String stageName, int stageIndex, int total,
                                       String detail) {
        return new StatusRecord(at, runId, RunState.RUNNING, stageName, stageIndex,
            stageIndex, total, ratio(stageIndex, total), detail, false);
    }

    public static StatusRecord completed(Instant at, String runId, int total, String detail) {
        return new StatusRecord(at, runId, RunState.COMPLETED, null, total, total, total,
            ratio(total, total), detail, true);
    }

    public static StatusRecord failed(Instant at, String runId, String stageName, int stageIndex, int total,
                                      String detail) {
        return new StatusRecord(at, runId, RunState.FAILED, stageName, stageIndex,
            stageIndex, total, ratio(stageIndex, total), detail, true);
    }

    /** Same record with the progress rendered as a percentage. */
    public StatusRecord asPercent() {
        return new StatusRecord(timestamp, runId, state, stageName, stageIndex, completed, total,
            percent(completed, total), detail, terminal);
    }

    public static String ratio(int completed, int total) {
        return "[" + completed + "/" + total + "]";
    }

    public static String percent(int completed, int total) {
        int pct = total <= 0 ? 0 : (int) Math.round(100.0 * completed / total);
        return pct + "%";
    }
}
