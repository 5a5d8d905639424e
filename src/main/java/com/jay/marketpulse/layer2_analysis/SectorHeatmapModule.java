package com.jay.marketpulse.layer2_analysis;

import com.jay.marketpulse.model.PriceBar;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Layer 2: Sector heatmap.
 * Per-stock change over the loaded window and the simple average per sector, each mapped
 * to a colour band.
 */
@Slf4j
@Component
public class SectorHeatmapModule {

    public record StockTile(String ticker, double price, double change, String color) {}

    public record SectorTile(String name, double avgChange, String color, List<StockTile> stocks) {}

    public List<SectorTile> compute(Map<String, List<String>> sectors, Map<String, List<PriceBar>> histories) {
        List<SectorTile> tiles = new ArrayList<>();
        for (Map.Entry<String, List<String>> sector : sectors.entrySet()) {
            List<StockTile> stocks = new ArrayList<>();
            for (String ticker : sector.getValue()) {
                List<PriceBar> bars = histories.get(ticker);
                if (bars == null || bars.size() < 2) continue;
                double first = bars.get(0).getClose();
                double last = bars.get(bars.size() - 1).getClose();
                if (first <= 0) continue;
                double change = (last / first - 1) * 100;
                stocks.add(new StockTile(ticker, round2(last), round2(change), colorFor(change)));
            }
            if (stocks.isEmpty()) {
                log.debug("Sector {} has no priced members, skipped", sector.getKey());
                continue;
            }
            double avg = stocks.stream().mapToDouble(StockTile::change).average().orElse(0);
            tiles.add(new SectorTile(sector.getKey(), round2(avg), colorFor(avg), stocks));
        }
        return tiles;
    }

    public static String colorFor(double change) {
        if (change >= 3) return "#00C853";
        if (change >= 1) return "#4CAF50";
        if (change >= 0) return "#81C784";
        if (change >= -1) return "#EF9A9A";
        if (change >= -3) return "#F44336";
        return "#B71C1C";
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
