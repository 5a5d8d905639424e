package com.jay.marketpulse.layer4_pipeline.stages;

import com.jay.marketpulse.config.PulseConfig;
import com.jay.marketpulse.layer1_data.PriceHistoryLoader;
import com.jay.marketpulse.layer2_analysis.SectorHeatmapModule;
import com.jay.marketpulse.layer2_analysis.SectorHeatmapModule.SectorTile;
import com.jay.marketpulse.layer4_pipeline.PipelineStage;
import com.jay.marketpulse.layer4_pipeline.StageComputationException;
import com.jay.marketpulse.layer4_pipeline.StageContext;
import com.jay.marketpulse.model.PriceBar;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Component
@Order(2)
@RequiredArgsConstructor
public class SectorHeatmapStage implements PipelineStage {

    public static final String NAME = "Sector Heatmap";

    private final PulseConfig config;
    private final PriceHistoryLoader historyLoader;
    private final SectorHeatmapModule heatmapModule;

    public record HeatmapArtifact(Instant timestamp, String period, List<SectorTile> sectors) {}

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String artifactName() {
        return "sector_heatmap.json";
    }

    @Override
    public HeatmapArtifact execute(StageContext context) {
        PulseConfig.Market market = config.market();
        List<String> tickers = market.getSectors().values().stream().flatMap(List::stream).toList();
        Map<String, List<PriceBar>> histories = historyLoader.loadAll(tickers, market.getHeatmapRange());
        List<SectorTile> sectors = heatmapModule.compute(market.getSectors(), histories);
        if (sectors.isEmpty()) {
            throw new StageComputationException("No sector could be priced");
        }
        return new HeatmapArtifact(context.now(), market.getHeatmapRange(), sectors);
    }
}
