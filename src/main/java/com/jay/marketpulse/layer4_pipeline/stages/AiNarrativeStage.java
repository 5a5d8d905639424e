package com.jay.marketpulse.layer4_pipeline.stages;

import com.jay.marketpulse.config.PulseConfig;
import com.jay.marketpulse.layer2_analysis.MacroIndicatorModule.IndicatorReading;
import com.jay.marketpulse.layer2_analysis.PortfolioRiskModule.RiskReport;
import com.jay.marketpulse.layer2_analysis.SectorHeatmapModule.SectorTile;
import com.jay.marketpulse.layer3_ai.ExternalTextClient;
import com.jay.marketpulse.layer3_ai.GenerationResult;
import com.jay.marketpulse.layer3_ai.RequestFingerprint;
import com.jay.marketpulse.layer4_pipeline.PipelineStage;
import com.jay.marketpulse.layer4_pipeline.StageContext;
import com.jay.marketpulse.layer4_pipeline.stages.MacroDataStage.MacroArtifact;
import com.jay.marketpulse.layer4_pipeline.stages.SectorHeatmapStage.HeatmapArtifact;
import com.jay.marketpulse.model.Headline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;

/**
 * Writes the market narrative from the outputs of the earlier stages.
 *
 * <p>A failed generation does not fail the run. The previous successful narrative is kept
 * with a stale marker appended, or the artifact records the error if there is none.
 */
@Slf4j
@Component
@Order(4)
@RequiredArgsConstructor
public class AiNarrativeStage implements PipelineStage {

    public static final String NAME = "AI Narrative";
    static final String TEMPLATE = "market-narrative-v1";
    static final String STALE_MARKER =
        "\n\n*(Note: preserved report from a previous cycle due to temporary API limits)*";

    private final PulseConfig config;
    private final ExternalTextClient textClient;

    public record NarrativeArtifact(
        Instant timestamp,
        String narrative,
        boolean stale,
        boolean fromCache,
        String errorKind,
        String error
    ) {}

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String artifactName() {
        return "ai_narrative.json";
    }

    @Override
    public boolean usesTextGeneration() {
        return true;
    }

    @Override
    public NarrativeArtifact execute(StageContext context) {
        String prompt = buildPrompt(context);
        RequestFingerprint fp = new RequestFingerprint("US_MARKET", TEMPLATE, context.getSnapshotVersion());
        GenerationResult result = textClient.generate(fp, prompt);

        if (result.isSuccess()) {
            return new NarrativeArtifact(context.now(), result.text(), false, result.fromCache(), null, null);
        }

        String kind = result.errorKind().name();
        NarrativeArtifact previous = context.getArtifacts()
            .read(artifactName(), NarrativeArtifact.class)
            .filter(p -> p.narrative() != null && !p.narrative().isBlank())
            .orElse(null);
        if (previous != null && config.pipeline().isKeepPreviousNarrative()) {
            log.warn("Narrative generation failed ({}), keeping previous narrative from {}", kind, previous.timestamp());
            String text = previous.narrative().endsWith(STALE_MARKER)
                ? previous.narrative() : previous.narrative() + STALE_MARKER;
            return new NarrativeArtifact(context.now(), text, true, false, kind, result.errorMessage());
        }
        log.warn("Narrative generation failed ({}) and no previous narrative exists", kind);
        return new NarrativeArtifact(context.now(), null, false, false, kind, result.errorMessage());
    }

    String buildPrompt(StageContext context) {
        StringBuilder sb = new StringBuilder();
        sb.append("Role: Senior macro strategist covering the US stock market.\n");
        sb.append("Task: Write a concise market intelligence report in English markdown (### headers).\n\n");

        context.output(MacroDataStage.NAME, MacroArtifact.class).ifPresent(macro -> {
            sb.append("Indicators:\n");
            for (Map.Entry<String, IndicatorReading> e : macro.macroIndicators().entrySet()) {
                sb.append(String.format("- %s: %.2f (%.2f%% 1d)%n", e.getKey(), e.getValue().value(), e.getValue().change1d()));
            }
            if (!macro.news().isEmpty()) {
                sb.append("\nRecent headlines:\n");
                for (Headline h : macro.news()) sb.append("- ").append(h.getTitle()).append('\n');
            }
        });

        context.output(SectorHeatmapStage.NAME, HeatmapArtifact.class).ifPresent(heatmap -> {
            sb.append("\nSector performance (").append(heatmap.period()).append("):\n");
            for (SectorTile s : heatmap.sectors()) {
                sb.append(String.format("- %s: %.2f%%%n", s.name(), s.avgChange()));
            }
        });

        context.output(PortfolioRiskStage.NAME, RiskReport.class).ifPresent(risk ->
            sb.append(String.format("%nPortfolio: volatility %.2f%%, %s, %d highly correlated pairs%n",
                risk.portfolioVolatilityPct(), risk.diversificationStatus(), risk.highCorrelations().size())));

        sb.append("\nCover: 1) risk-on or risk-off regime from VIX and yields, ")
          .append("2) yield curve impact on equity valuations, ")
          .append("3) sector rotation, 4) two or three tactical ideas with levels to watch.\n");
        return sb.toString();
    }
}
