package com.jay.marketpulse.layer4_pipeline.stages;

import com.jay.marketpulse.config.PulseConfig;
import com.jay.marketpulse.layer1_data.PriceHistoryLoader;
import com.jay.marketpulse.layer2_analysis.PortfolioRiskModule;
import com.jay.marketpulse.layer2_analysis.PortfolioRiskModule.RiskReport;
import com.jay.marketpulse.layer4_pipeline.PipelineStage;
import com.jay.marketpulse.layer4_pipeline.StageComputationException;
import com.jay.marketpulse.layer4_pipeline.StageContext;
import com.jay.marketpulse.model.PriceBar;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
@Order(3)
@RequiredArgsConstructor
public class PortfolioRiskStage implements PipelineStage {

    public static final String NAME = "Portfolio Risk";

    private final PulseConfig config;
    private final PriceHistoryLoader historyLoader;
    private final PortfolioRiskModule riskModule;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String artifactName() {
        return "portfolio_risk.json";
    }

    @Override
    public RiskReport execute(StageContext context) {
        PulseConfig.Market market = config.market();
        Map<String, List<PriceBar>> histories = historyLoader.loadAll(market.getPortfolio(), market.getRiskRange());
        try {
            return riskModule.analyse(histories);
        } catch (IllegalArgumentException e) {
            throw new StageComputationException("Portfolio risk unavailable: " + e.getMessage(), e);
        }
    }
}
