package com.jay.marketpulse.layer2_analysis;

import com.jay.marketpulse.config.PulseConfig;
import com.jay.marketpulse.model.PriceBar;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Layer 2: Portfolio risk.
 * Equal-weight portfolio volatility, per-ticker annualised volatility and the pairwise
 * correlation of daily returns. Histories are aligned on the dates all tickers share.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PortfolioRiskModule {

    private static final int TRADING_DAYS = 252;

    private final PulseConfig config;

    public record CorrelatedPair(String first, String second, double correlation) {}

    public record RiskReport(
        List<String> tickers,
        double portfolioVolatilityPct,
        List<CorrelatedPair> highCorrelations,
        String diversificationStatus,
        Map<String, Double> tickerVolatilities,
        Map<String, Map<String, Double>> correlationMatrix
    ) {}

    /**
     * @throws IllegalArgumentException when fewer than two tickers, or fewer than three shared
     *                                  dates, are available
     */
    public RiskReport analyse(Map<String, List<PriceBar>> histories) {
        List<String> tickers = new ArrayList<>(histories.keySet());
        if (tickers.size() < 2) {
            throw new IllegalArgumentException("Need at least 2 tickers with history, got " + tickers.size());
        }

        Map<String, Map<LocalDate, Double>> closesByDate = new LinkedHashMap<>();
        TreeSet<LocalDate> common = null;
        for (String t : tickers) {
            Map<LocalDate, Double> byDate = new HashMap<>();
            for (PriceBar bar : histories.get(t)) {
                byDate.put(bar.getTimestamp().toLocalDate(), bar.getClose());
            }
            closesByDate.put(t, byDate);
            if (common == null) common = new TreeSet<>(byDate.keySet());
            else common.retainAll(byDate.keySet());
        }
        if (common == null || common.size() < 3) {
            throw new IllegalArgumentException("Not enough overlapping history to compute returns");
        }

        List<LocalDate> dates = new ArrayList<>(common);
        int n = tickers.size();
        double[][] returns = new double[n][dates.size() - 1];
        for (int i = 0; i < n; i++) {
            Map<LocalDate, Double> closes = closesByDate.get(tickers.get(i));
            for (int d = 1; d < dates.size(); d++) {
                double prev = closes.get(dates.get(d - 1));
                returns[i][d - 1] = prev > 0 ? closes.get(dates.get(d)) / prev - 1 : 0;
            }
        }

        double[][] cov = new double[n][n];
        double[][] corr = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i; j < n; j++) {
                cov[i][j] = cov[j][i] = covariance(returns[i], returns[j]);
            }
        }
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                double denom = Math.sqrt(cov[i][i] * cov[j][j]);
                corr[i][j] = i == j ? 1.0 : (denom > 0 ? cov[i][j] / denom : 0);
            }
        }

        double weight = 1.0 / n;
        double variance = 0;
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                variance += weight * weight * cov[i][j];
            }
        }
        double portfolioVol = Math.sqrt(variance * TRADING_DAYS);

        double threshold = config.market().getHighCorrelationThreshold();
        List<CorrelatedPair> pairs = new ArrayList<>();
        Map<String, Double> vols = new LinkedHashMap<>();
        Map<String, Map<String, Double>> matrix = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            vols.put(tickers.get(i), round(Math.sqrt(cov[i][i] * TRADING_DAYS), 4));
            Map<String, Double> row = new LinkedHashMap<>();
            for (int j = 0; j < n; j++) {
                row.put(tickers.get(j), round(corr[i][j], 2));
                if (j > i && corr[i][j] > threshold) {
                    pairs.add(new CorrelatedPair(tickers.get(i), tickers.get(j), round(corr[i][j], 2)));
                }
            }
            matrix.put(tickers.get(i), row);
        }

        String status = pairs.size() < n / 2.0 ? "Diversified" : "Concentrated";
        log.info("Portfolio risk: {} tickers, volatility {}%, {} highly correlated pairs",
            n, round(portfolioVol * 100, 2), pairs.size());
        return new RiskReport(tickers, round(portfolioVol * 100, 2), pairs, status, vols, matrix);
    }

    private static double covariance(double[] a, double[] b) {
        int len = a.length;
        if (len < 2) return 0;
        double meanA = 0, meanB = 0;
        for (int k = 0; k < len; k++) {
            meanA += a[k];
            meanB += b[k];
        }
        meanA /= len;
        meanB /= len;
        double sum = 0;
        for (int k = 0; k < len; k++) {
            sum += (a[k] - meanA) * (b[k] - meanB);
        }
        return sum / (len - 1);
    }

    private static double round(double v, int places) {
        double scale = Math.pow(10, places);
        return Math.round(v * scale) / scale;
    }
}
