package com.jay.marketpulse.layer4_pipeline;

public class StageComputationException extends RuntimeException {

    public StageComputationException(String message) {
        super(message);
    }

    public StageComputationException(String message, Throwable cause) {
        super(message, cause);
    }
}
