package com.jay.marketpulse.config;

import com.jay.marketpulse.layer3_ai.BackoffController;
import com.jay.marketpulse.layer3_ai.CachePersistence;
import com.jay.marketpulse.layer3_ai.ExternalTextClient;
import com.jay.marketpulse.layer3_ai.GeminiBackend;
import com.jay.marketpulse.layer3_ai.GenerationOptions;
import com.jay.marketpulse.layer3_ai.RequestThrottler;
import com.jay.marketpulse.layer3_ai.ResponseCache;
import com.jay.marketpulse.layer3_ai.TextGenerationBackend;
import com.jay.marketpulse.layer4_pipeline.PipelineRunner;
import com.jay.marketpulse.layer4_pipeline.PipelineStage;
import com.jay.marketpulse.layer5_status.ArtifactStore;
import com.jay.marketpulse.layer5_status.StatusStore;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;

/**
 * Wires the shared gate objects from PulseConfig. They are plain classes so tests can
 * build fresh instances without a Spring context.
 */
@Configuration
public class PulseBeans {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ZoneId marketZone(PulseConfig config) {
        return ZoneId.of(config.pipeline().getMarketZone());
    }

    @Bean
    public ArtifactStore artifactStore(PulseConfig config) {
        return new ArtifactStore(Path.of(config.storage().getDataDir()));
    }

    @Bean
    public StatusStore statusStore(ArtifactStore artifactStore, Clock clock) {
        return new StatusStore(artifactStore, clock);
    }

    @Bean
    public TextGenerationBackend textGenerationBackend(PulseConfig config) {
        return new GeminiBackend(config.gemini());
    }

    @Bean
    public RequestThrottler requestThrottler(PulseConfig config, Clock clock, ZoneId marketZone) {
        PulseConfig.Throttle t = config.throttle();
        return new RequestThrottler(Duration.ofMillis(t.getMinIntervalMs()), t.getMaxConcurrent(),
            t.getDailyLimit(), clock, marketZone);
    }

    @Bean
    public BackoffController backoffController(PulseConfig config) {
        PulseConfig.Backoff b = config.backoff();
        return new BackoffController(Duration.ofMillis(b.getBaseDelayMs()), b.getGrowthFactor(),
            Duration.ofMillis(b.getMaxDelayMs()), b.getMaxAttempts(), b.getJitterRatio());
    }

    @Bean
    public ResponseCache responseCache(PulseConfig config, Clock clock) {
        PulseConfig.Cache c = config.cache();
        return new ResponseCache(Duration.ofHours(c.getTtlHours()), c.getMaxEntries(), c.getEvictBatch(), clock);
    }

    @Bean(initMethod = "load", destroyMethod = "flush")
    public CachePersistence cachePersistence(PulseConfig config, ResponseCache cache, ArtifactStore artifactStore) {
        return new CachePersistence(cache, artifactStore, config.cache().getFileName(), config.cache().isPersist());
    }

    @Bean
    public ExternalTextClient externalTextClient(PulseConfig config, TextGenerationBackend backend,
                                                 ResponseCache cache, RequestThrottler throttler,
                                                 BackoffController backoff) {
        PulseConfig.Gemini g = config.gemini();
        return new ExternalTextClient(backend, cache, throttler, backoff,
            GenerationOptions.of(g.getTemperature(), g.getMaxOutputTokens()));
    }

    @Bean
    public ThreadPoolTaskExecutor onDemandExecutor(PulseConfig config) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.onDemand().getWorkerThreads());
        executor.setMaxPoolSize(config.onDemand().getWorkerThreads());
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("on-demand-");
        executor.initialize();
        return executor;
    }

    @Bean
    public ThreadPoolTaskExecutor pipelineExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("pipeline-manual-");
        executor.initialize();
        return executor;
    }

    @Bean
    public PipelineRunner pipelineRunner(PulseConfig config, List<PipelineStage> stages, StatusStore statusStore,
                                         ArtifactStore artifactStore,
                                         @Qualifier("pipelineExecutor") ThreadPoolTaskExecutor pipelineExecutor,
                                         Clock clock, ZoneId marketZone) {
        return new PipelineRunner(stages, statusStore, artifactStore, pipelineExecutor, clock, marketZone,
            Duration.ofSeconds(config.pipeline().getManualCooldownSeconds()));
    }
}
