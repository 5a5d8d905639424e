package com.jay.marketpulse.layer4_pipeline;

public enum TriggerResult {
    STARTED,
    /** A run is already in progress. */
    BUSY,
    /** Inside the manual-trigger cooldown. */
    SKIPPED;

    public String wireValue() {
        return name().toLowerCase();
    }
}
