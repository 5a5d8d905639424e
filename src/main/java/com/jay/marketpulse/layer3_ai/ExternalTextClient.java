package com.jay.marketpulse.layer3_ai;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One logical generation request: cache, then throttle, then the backend, retrying
 * transient failures with backoff.
 *
 * <p>The throttle permit is held only for the duration of a single backend call and is
 * released before any backoff pause. Concurrent callers asking for the same uncached
 * fingerprint share one in-flight request.
 */
@Slf4j
public class ExternalTextClient {

    private final TextGenerationBackend backend;
    private final ResponseCache cache;
    private final RequestThrottler throttler;
    private final BackoffController backoff;
    private final GenerationOptions defaultOptions;

    private final ConcurrentHashMap<String, CompletableFuture<GenerationResult>> pending = new ConcurrentHashMap<>();

    private final AtomicLong serviceCalls = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong coalesced = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();

    public ExternalTextClient(TextGenerationBackend backend, ResponseCache cache, RequestThrottler throttler,
                              BackoffController backoff, GenerationOptions defaultOptions) {
        this.backend = backend;
        this.cache = cache;
        this.throttler = throttler;
        this.backoff = backoff;
        this.defaultOptions = defaultOptions;
    }

    public GenerationResult generate(RequestFingerprint fp, String prompt) {
        return generate(fp, prompt, defaultOptions);
    }

    public GenerationResult generate(RequestFingerprint fp, String prompt, GenerationOptions options) {
        Optional<String> hit = cache.get(fp);
        if (hit.isPresent()) {
            cacheHits.incrementAndGet();
            log.debug("ExternalTextClient: cache hit for {}", fp);
            return GenerationResult.cached(hit.get());
        }

        String key = fp.key();
        CompletableFuture<GenerationResult> mine = new CompletableFuture<>();
        CompletableFuture<GenerationResult> leader = pending.putIfAbsent(key, mine);
        if (leader != null) {
            coalesced.incrementAndGet();
            log.debug("ExternalTextClient: joining in-flight request for {}", fp);
            return awaitLeader(fp, leader);
        }

        try {
            // a previous leader may have filled the cache after our first lookup
            GenerationResult result = cache.get(fp)
                .map(GenerationResult::cached)
                .orElseGet(() -> callWithRetry(fp, prompt, options));
            mine.complete(result);
            return result;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            pending.remove(key, mine);
        }
    }

    public Map<String, Object> stats() {
        return Map.of(
            "serviceCalls", serviceCalls.get(),
            "cacheHits", cacheHits.get(),
            "coalesced", coalesced.get(),
            "failures", failures.get(),
            "configured", backend.isConfigured());
    }

    private GenerationResult callWithRetry(RequestFingerprint fp, String prompt, GenerationOptions options) {
        if (!backend.isConfigured()) {
            failures.incrementAndGet();
            log.warn("ExternalTextClient: backend not configured, skipping {}", fp);
            return GenerationResult.failed(ErrorKind.AUTH_FAILURE, "Text generation backend is not configured", 0);
        }

        int attempt = 0;
        while (true) {
            attempt++;
            ServiceCallException failure;
            try (ThrottlePermit permit = throttler.acquire()) {
                serviceCalls.incrementAndGet();
                String text = backend.generate(prompt, options);
                if (text == null || text.isBlank()) {
                    failures.incrementAndGet();
                    log.warn("ExternalTextClient: empty response for {} on attempt {}", fp, attempt);
                    return GenerationResult.failed(ErrorKind.INVALID_REQUEST, "Service returned no text", attempt);
                }
                cache.put(fp, text);
                log.info("ExternalTextClient: generated {} ({} chars, attempt {})", fp, text.length(), attempt);
                return GenerationResult.generated(text, attempt);
            } catch (ServiceCallException e) {
                failure = e;
            } catch (DailyBudgetExhaustedException e) {
                failures.incrementAndGet();
                return GenerationResult.failed(ErrorKind.BUDGET_EXHAUSTED, e.getMessage(), attempt - 1);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failures.incrementAndGet();
                return GenerationResult.failed(ErrorKind.TRANSIENT_SERVICE_ERROR, "Interrupted while throttled", attempt - 1);
            } catch (RuntimeException e) {
                failures.incrementAndGet();
                String summary = e.getClass().getSimpleName() + ": " + e.getMessage();
                log.error("ExternalTextClient: unexpected failure for {} on attempt {}: {}", fp, attempt, summary, e);
                return GenerationResult.failed(ErrorKind.INVALID_REQUEST, summary, attempt);
            }

            if (!backoff.shouldRetry(attempt, failure.getKind())) {
                failures.incrementAndGet();
                log.warn("ExternalTextClient: giving up on {} after {} attempt(s): {} {}",
                    fp, attempt, failure.getKind(), failure.getMessage());
                return GenerationResult.failed(failure.getKind(), failure.getMessage(), attempt);
            }

            Duration delay = backoff.delayFor(attempt - 1, failure.getRetryAfter());
            log.warn("ExternalTextClient: {} on attempt {} for {}, retrying in {} ms",
                failure.getKind(), attempt, fp, delay.toMillis());
            try {
                backoff.pause(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failures.incrementAndGet();
                return GenerationResult.failed(failure.getKind(), "Interrupted during backoff", attempt);
            }
        }
    }

    private GenerationResult awaitLeader(RequestFingerprint fp, CompletableFuture<GenerationResult> leader) {
        try {
            GenerationResult shared = leader.get();
            return shared.isSuccess() ? GenerationResult.cached(shared.text()) : shared;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return GenerationResult.failed(ErrorKind.TRANSIENT_SERVICE_ERROR, "Interrupted waiting for " + fp, 0);
        } catch (ExecutionException e) {
            return GenerationResult.failed(ErrorKind.TRANSIENT_SERVICE_ERROR,
                "Shared request failed: " + e.getCause().getMessage(), 0);
        }
    }
}
