package com.jay.marketpulse.scheduler;

import com.jay.marketpulse.config.PulseConfig;
import com.jay.marketpulse.layer3_ai.CachePersistence;
import com.jay.marketpulse.layer4_pipeline.PipelineRunner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic triggers.
 *
 *   Pipeline refresh : every pulse.pipeline.period-ms (default 1 hour)
 *   Cache flush      : every pulse.cache.flush-ms (default 10 minutes), sweeps expired entries
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineScheduler {

    private final PipelineRunner pipelineRunner;
    private final CachePersistence cachePersistence;
    private final PulseConfig config;

    @Value("${pulse.scheduler.enabled:true}")
    private boolean enabled;

    // ── Pipeline ──────────────────────────────────────────────────────────────

    @Scheduled(fixedRateString = "${pulse.pipeline.period-ms:3600000}",
               initialDelayString = "${pulse.pipeline.initial-delay-ms:30000}")
    public void refreshPipeline() {
        if (!enabled) return;
        log.info("=== SCHEDULED PIPELINE REFRESH ===");
        try {
            pipelineRunner.run(config.pipeline().isFastMode())
                .ifPresentOrElse(
                    outcome -> log.info("Scheduled run {} ended {}", outcome.runId(), outcome.state()),
                    () -> log.info("Scheduled run skipped, a run is already in progress"));
        } catch (Exception e) {
            log.error("Scheduled pipeline run failed: {}", e.getMessage(), e);
        }
    }

    // ── Cache housekeeping ────────────────────────────────────────────────────

    @Scheduled(fixedDelayString = "${pulse.cache.flush-ms:600000}")
    public void flushCache() {
        try {
            cachePersistence.flush();
        } catch (Exception e) {
            log.error("Cache flush failed: {}", e.getMessage());
        }
    }
}
