package com.jay.marketpulse.layer1_data;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jay.marketpulse.model.PriceBar;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Layer 1: Yahoo Finance chart API.
 * Reads {@code /v8/finance/chart/{symbol}?interval=1d&range=...} and maps the
 * timestamp / quote arrays to PriceBars. Rows with a null or non-positive close are skipped.
 */
@Slf4j
@Service
public class YahooMarketDataSource implements MarketDataSource {

    private static final String CHART_URL = "https://query1.finance.yahoo.com/v8/finance/chart/";

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public YahooMarketDataSource() {
        this(new OkHttpClient.Builder()
            .connectTimeout(10, TimeUnit.SECONDS)
            .readTimeout(15, TimeUnit.SECONDS)
            .build());
    }

    YahooMarketDataSource(OkHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public List<PriceBar> dailyHistory(String symbol, String range) {
        HttpUrl url = HttpUrl.get(CHART_URL).newBuilder()
            .addPathSegment(symbol)
            .addQueryParameter("interval", "1d")
            .addQueryParameter("range", range)
            .build();
        Request request = new Request.Builder()
            .url(url)
            .addHeader("User-Agent", "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36")
            .addHeader("Accept", "application/json")
            .get()
            .build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful() || response.body() == null) {
                log.warn("Yahoo chart fetch for {} failed: HTTP {}", symbol, response.code());
                return List.of();
            }
            List<PriceBar> bars = parseChart(objectMapper.readTree(response.body().string()));
            log.debug("Yahoo chart {}: {} bars ({})", symbol, bars.size(), range);
            return bars;
        } catch (Exception e) {
            log.error("Yahoo chart fetch for {} failed: {}", symbol, e.getMessage());
            return List.of();
        }
    }

    static List<PriceBar> parseChart(JsonNode root) {
        JsonNode result = root.path("chart").path("result");
        if (!result.isArray() || result.isEmpty()) return List.of();

        JsonNode timestamps = result.get(0).path("timestamp");
        JsonNode quote = result.get(0).path("indicators").path("quote").path(0);
        JsonNode opens = quote.path("open");
        JsonNode highs = quote.path("high");
        JsonNode lows = quote.path("low");
        JsonNode closes = quote.path("close");
        JsonNode volumes = quote.path("volume");

        List<PriceBar> bars = new ArrayList<>();
        for (int i = 0; i < timestamps.size(); i++) {
            if (i >= closes.size() || closes.get(i).isNull()) continue;
            double close = closes.get(i).asDouble(0);
            if (close <= 0) continue;
            LocalDateTime ts = LocalDateTime.ofInstant(
                Instant.ofEpochSecond(timestamps.get(i).asLong()), ZoneOffset.UTC);
            bars.add(PriceBar.builder()
                .timestamp(ts)
                .open(valueOr(opens, i, close))
                .high(valueOr(highs, i, close))
                .low(valueOr(lows, i, close))
                .close(close)
                .volume(volumes.path(i).asLong(0))
                .build());
        }
        return bars;
    }

    private static double valueOr(JsonNode series, int i, double fallback) {
        JsonNode n = series.path(i);
        return n.isMissingNode() || n.isNull() ? fallback : n.asDouble(fallback);
    }
}
