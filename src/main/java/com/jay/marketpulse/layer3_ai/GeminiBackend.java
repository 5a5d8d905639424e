package com.jay.marketpulse.layer3_ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.jay.marketpulse.config.PulseConfig;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Gemini {@code models/{model}:generateContent} over OkHttp.
 * Non-2xx responses are classified with {@link ErrorKind#fromHttpStatus(int)}; on 429 the
 * {@code RetryInfo.retryDelay} detail is passed on as a retry hint.
 */
@Slf4j
public class GeminiBackend implements TextGenerationBackend {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final PulseConfig.Gemini cfg;
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();

    public GeminiBackend(PulseConfig.Gemini cfg) {
        this(cfg, new OkHttpClient.Builder()
            .connectTimeout(cfg.getConnectTimeoutSeconds(), TimeUnit.SECONDS)
            .readTimeout(cfg.getReadTimeoutSeconds(), TimeUnit.SECONDS)
            .build());
    }

    GeminiBackend(PulseConfig.Gemini cfg, OkHttpClient httpClient) {
        this.cfg = cfg;
        this.httpClient = httpClient;
    }

    @Override
    public boolean isConfigured() {
        return cfg.getApiKey() != null && !cfg.getApiKey().isBlank();
    }

    @Override
    public String generate(String prompt, GenerationOptions options) {
        if (!isConfigured()) {
            throw new ServiceCallException(ErrorKind.AUTH_FAILURE, "GOOGLE_API_KEY is not configured");
        }
        HttpUrl url = HttpUrl.get(cfg.getBaseUrl()).newBuilder()
            .addPathSegment(cfg.getModel() + ":generateContent")
            .addQueryParameter("key", cfg.getApiKey())
            .build();
        Request request = new Request.Builder()
            .url(url)
            .post(RequestBody.create(buildPayload(prompt, options), JSON))
            .build();

        try (Response response = httpClient.newCall(request).execute()) {
            String body = response.body() != null ? response.body().string() : "";
            if (!response.isSuccessful()) {
                throw classify(response.code(), body);
            }
            return extractText(body);
        } catch (IOException e) {
            throw new ServiceCallException(ErrorKind.TRANSIENT_SERVICE_ERROR,
                "Gemini I/O failure: " + e.getMessage(), null, e);
        }
    }

    String buildPayload(String prompt, GenerationOptions options) {
        ObjectNode root = mapper.createObjectNode();
        root.putArray("contents").addObject()
            .putArray("parts").addObject().put("text", prompt);
        root.putObject("generationConfig")
            .put("temperature", options.temperature())
            .put("maxOutputTokens", options.maxOutputTokens());
        return root.toString();
    }

    String extractText(String body) {
        try {
            JsonNode text = mapper.readTree(body)
                .path("candidates").path(0).path("content").path("parts").path(0).path("text");
            if (!text.isTextual() || text.asText().isBlank()) {
                throw new ServiceCallException(ErrorKind.INVALID_REQUEST, "Gemini response carried no text");
            }
            return text.asText().trim();
        } catch (IOException e) {
            throw new ServiceCallException(ErrorKind.INVALID_REQUEST, "Malformed Gemini response", null, e);
        }
    }

    ServiceCallException classify(int status, String body) {
        ErrorKind kind = ErrorKind.fromHttpStatus(status);
        Duration retryAfter = kind == ErrorKind.QUOTA_EXCEEDED ? parseRetryDelay(body) : null;
        log.warn("Gemini HTTP {} -> {}{}", status, kind,
            retryAfter != null ? " (server asks to wait " + retryAfter.toSeconds() + "s)" : "");
        return new ServiceCallException(kind, "Gemini HTTP " + status, retryAfter);
    }

    /** Reads {@code error.details[].retryDelay} ("13s", "1.5s") from a 429 body. */
    Duration parseRetryDelay(String body) {
        try {
            for (JsonNode detail : mapper.readTree(body).path("error").path("details")) {
                String delay = detail.path("retryDelay").asText("");
                if (delay.endsWith("s")) {
                    double seconds = Double.parseDouble(delay.substring(0, delay.length() - 1));
                    return Duration.ofMillis(Math.round(seconds * 1000));
                }
            }
        } catch (IOException | NumberFormatException e) {
            log.debug("Gemini 429 body has no usable retryDelay: {}", e.getMessage());
        }
        return null;
    }
}
