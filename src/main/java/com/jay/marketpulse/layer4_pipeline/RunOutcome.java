package com.jay.marketpulse.layer4_pipeline;

import com.jay.marketpulse.layer5_status.RunState;

import java.util.List;

/** Summary of one finished pipeline run. */
public record RunOutcome(
    String runId,
    RunState state,
    List<String> executedStages,
    List<String> skippedStages,
    String failedStage,
    String error
) {
    public boolean succeeded() {
        return state == RunState.COMPLETED;
    }
}
