package com.jay.marketpulse.layer2_analysis;

import com.jay.marketpulse.model.PriceBar;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Layer 2: Macro indicators.
 * Latest value and 1-day change for each configured macro symbol, plus the 10Y-2Y yield spread.
 */
@Slf4j
@Component
public class MacroIndicatorModule {

    public static final String YIELD_SPREAD = "YieldSpread";

    public record IndicatorReading(double value, double change1d) {}

    /**
     * @param histories indicator name → daily bars, in the order the indicators should be reported
     */
    public Map<String, IndicatorReading> compute(Map<String, List<PriceBar>> histories) {
        Map<String, IndicatorReading> readings = new LinkedHashMap<>();
        histories.forEach((name, bars) -> {
            if (bars == null || bars.isEmpty()) return;
            double last = bars.get(bars.size() - 1).getClose();
            double prev = bars.size() > 1 ? bars.get(bars.size() - 2).getClose() : last;
            double change = prev > 0 ? (last / prev - 1) * 100 : 0;
            readings.put(name, new IndicatorReading(round2(last), round2(change)));
        });

        IndicatorReading ten = readings.get("10Y_Yield");
        IndicatorReading two = readings.get("2Y_Yield");
        if (ten != null && two != null) {
            readings.put(YIELD_SPREAD, new IndicatorReading(round2(ten.value() - two.value()), 0));
        }
        log.debug("Macro indicators: {}", readings.keySet());
        return readings;
    }

    static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
