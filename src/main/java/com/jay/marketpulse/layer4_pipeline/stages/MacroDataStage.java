package com.jay.marketpulse.layer4_pipeline.stages;

import com.jay.marketpulse.config.PulseConfig;
import com.jay.marketpulse.layer1_data.NewsSource;
import com.jay.marketpulse.layer1_data.PriceHistoryLoader;
import com.jay.marketpulse.layer2_analysis.MacroIndicatorModule;
import com.jay.marketpulse.layer2_analysis.MacroIndicatorModule.IndicatorReading;
import com.jay.marketpulse.layer4_pipeline.PipelineStage;
import com.jay.marketpulse.layer4_pipeline.StageComputationException;
import com.jay.marketpulse.layer4_pipeline.StageContext;
import com.jay.marketpulse.model.Headline;
import com.jay.marketpulse.model.PriceBar;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
@Order(1)
@RequiredArgsConstructor
public class MacroDataStage implements PipelineStage {

    public static final String NAME = "Macro Data";

    private final PulseConfig config;
    private final PriceHistoryLoader historyLoader;
    private final NewsSource newsSource;
    private final MacroIndicatorModule macroModule;

    public record MacroArtifact(
        Instant timestamp,
        Map<String, IndicatorReading> macroIndicators,
        List<Headline> news
    ) {}

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String artifactName() {
        return "macro_analysis.json";
    }

    @Override
    public MacroArtifact execute(StageContext context) {
        PulseConfig.Market market = config.market();
        Map<String, List<PriceBar>> bySymbol = historyLoader.loadAll(market.getMacroTickers().values(), "5d");

        // keep the configured indicator names and order
        Map<String, List<PriceBar>> byName = new LinkedHashMap<>();
        market.getMacroTickers().forEach((name, symbol) -> {
            List<PriceBar> bars = bySymbol.get(symbol);
            if (bars != null) byName.put(name, bars);
        });

        Map<String, IndicatorReading> readings = macroModule.compute(byName);
        if (readings.isEmpty()) {
            throw new StageComputationException("No macro indicator could be fetched");
        }
        List<Headline> news = newsSource.headlines(market.getMacroNewsQuery(), market.getMacroHeadlineLimit());
        log.info("Macro data: {} indicators, {} headlines", readings.size(), news.size());
        return new MacroArtifact(context.now(), readings, news);
    }
}
