package com.jay.marketpulse.layer3_ai;

/**
 * One raw call to the generative service. No caching, throttling or retry here.
 */
public interface TextGenerationBackend {

    /**
     * @return the generated text, never blank
     * @throws ServiceCallException classified failure
     */
    String generate(String prompt, GenerationOptions options);

    /** False when the backend cannot be called at all, e.g. no API key. */
    boolean isConfigured();
}
