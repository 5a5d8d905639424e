package com.jay.marketpulse.layer1_data;

import com.jay.marketpulse.model.PriceBar;

import java.util.List;

/**
 * Daily price history per symbol. Implementations return an empty list rather than throw
 * when a symbol cannot be fetched.
 */
public interface MarketDataSource {

    /**
     * @param symbol exchange symbol, e.g. {@code ^VIX} or {@code AAPL}
     * @param range  lookback window in the provider's notation, e.g. {@code 5d}, {@code 6mo}
     */
    List<PriceBar> dailyHistory(String symbol, String range);
}
