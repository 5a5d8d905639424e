package com.jay.marketpulse.layer2_analysis;

import com.jay.marketpulse.model.PriceBar;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;
import org.ta4j.core.indicators.RSIIndicator;
import org.ta4j.core.indicators.SMAIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Layer 2: Technical snapshot for the on-demand summaries, computed with ta4j.
 * RSI(14), SMA 20/50 and the 1-day change of the latest close.
 */
@Slf4j
@Component
public class TechnicalSnapshotModule {

    private static final int RSI_PERIOD = 14;
    private static final int SMA_SHORT = 20;
    private static final int SMA_MEDIUM = 50;

    public record TechnicalSnapshot(
        double price,
        double change1d,
        Double rsi14,
        Double sma20,
        Double sma50,
        String trend
    ) {
        public Map<String, Object> asMap() {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("price", price);
            m.put("change_1d", change1d);
            m.put("rsi_14", rsi14);
            m.put("sma_20", sma20);
            m.put("sma_50", sma50);
            m.put("trend", trend);
            return m;
        }
    }

    /** Returns null when fewer than two bars are available. */
    public TechnicalSnapshot analyse(String ticker, List<PriceBar> bars) {
        if (bars == null || bars.size() < 2) {
            log.warn("Insufficient history for {} ({} bars)", ticker, bars == null ? 0 : bars.size());
            return null;
        }
        BarSeries series = buildSeries(ticker, bars);
        ClosePriceIndicator close = new ClosePriceIndicator(series);
        int last = series.getEndIndex();
        int count = series.getBarCount();
        if (count < 2) return null;

        double price = close.getValue(last).doubleValue();
        double prev = close.getValue(last - 1).doubleValue();
        double change = prev > 0 ? (price / prev - 1) * 100 : 0;

        Double rsi = count > RSI_PERIOD ? round2(new RSIIndicator(close, RSI_PERIOD).getValue(last).doubleValue()) : null;
        Double sma20 = count >= SMA_SHORT ? round2(new SMAIndicator(close, SMA_SHORT).getValue(last).doubleValue()) : null;
        Double sma50 = count >= SMA_MEDIUM ? round2(new SMAIndicator(close, SMA_MEDIUM).getValue(last).doubleValue()) : null;

        return new TechnicalSnapshot(round2(price), round2(change), rsi, sma20, sma50, trend(price, sma20, sma50));
    }

    private static String trend(double price, Double sma20, Double sma50) {
        if (sma20 == null || sma50 == null) return "UNKNOWN";
        if (price > sma20 && sma20 > sma50) return "UPTREND";
        if (price < sma20 && sma20 < sma50) return "DOWNTREND";
        return "SIDEWAYS";
    }

    private BarSeries buildSeries(String ticker, List<PriceBar> bars) {
        BarSeries series = new BaseBarSeriesBuilder().withName(ticker).build();
        ZonedDateTime lastEnd = null;
        for (PriceBar bar : bars) {
            ZonedDateTime end = bar.getTimestamp().atZone(ZoneOffset.UTC);
            // ta4j rejects bars that do not move forward in time
            if (lastEnd != null && !end.isAfter(lastEnd)) continue;
            series.addBar(end, bar.getOpen(), bar.getHigh(), bar.getLow(), bar.getClose(), bar.getVolume());
            lastEnd = end;
        }
        return series;
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
