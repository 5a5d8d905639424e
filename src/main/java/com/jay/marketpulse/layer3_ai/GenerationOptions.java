package com.jay.marketpulse.layer3_ai;

public record GenerationOptions(double temperature, int maxOutputTokens) {

    public static GenerationOptions of(double temperature, int maxOutputTokens) {
        return new GenerationOptions(temperature, maxOutputTokens);
    }
}
