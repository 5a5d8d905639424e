package com.jay.marketpulse.layer1_data;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jay.marketpulse.model.PriceBar;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class YahooMarketDataSourceTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void parsesBarsAndSkipsRowsWithoutClose() throws Exception {
        String json = """
            {"chart":{"result":[{
              "timestamp":[1760619600,1760706000,1760792400],
              "indicators":{"quote":[{
                "open":[100.0,null,102.0],
                "high":[101.0,null,103.5],
                "low":[99.0,null,101.0],
                "close":[100.5,null,103.0],
                "volume":[1200,null,1500]
              }]}
            }],"error":null}}
            """;

        List<PriceBar> bars = YahooMarketDataSource.parseChart(mapper.readTree(json));

        assertThat(bars).hasSize(2);
        assertThat(bars.get(0).getClose()).isEqualTo(100.5);
        assertThat(bars.get(0).getTimestamp().toLocalDate()).isEqualTo(LocalDate.of(2025, 10, 16));
        assertThat(bars.get(1).getHigh()).isEqualTo(103.5);
        assertThat(bars.get(1).getVolume()).isEqualTo(1500);
    }

    @Test
    void missingOhlcFallsBackToClose() throws Exception {
        String json = """
            {"chart":{"result":[{"timestamp":[1760619600],
              "indicators":{"quote":[{"close":[42.0]}]}}]}}
            """;

        PriceBar bar = YahooMarketDataSource.parseChart(mapper.readTree(json)).get(0);

        assertThat(bar.getOpen()).isEqualTo(42.0);
        assertThat(bar.getLow()).isEqualTo(42.0);
        assertThat(bar.getVolume()).isZero();
    }

    @Test
    void errorPayloadGivesNoBars() throws Exception {
        String json = "{\"chart\":{\"result\":null,\"error\":{\"code\":\"Not Found\"}}}";

        assertThat(YahooMarketDataSource.parseChart(mapper.readTree(json))).isEmpty();
    }
}
