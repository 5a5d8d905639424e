package com.jay.marketpulse.layer5_status;

public enum RunState {
    IDLE,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
