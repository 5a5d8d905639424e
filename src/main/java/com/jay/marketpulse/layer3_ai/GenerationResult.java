package com.jay.marketpulse.layer3_ai;

/**
 * Outcome of {@link ExternalTextClient#generate}. A failed result is a degraded outcome,
 * callers continue without the text.
 */
public record GenerationResult(
    String text,
    boolean fromCache,
    int attempts,
    ErrorKind errorKind,
    String errorMessage
) {

    public static GenerationResult generated(String text, int attempts) {
        return new GenerationResult(text, false, attempts, null, null);
    }

    public static GenerationResult cached(String text) {
        return new GenerationResult(text, true, 0, null, null);
    }

    public static GenerationResult failed(ErrorKind kind, String message, int attempts) {
        return new GenerationResult(null, false, attempts, kind, message);
    }

    public boolean isSuccess() {
        return errorKind == null;
    }
}
