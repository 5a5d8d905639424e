package com.jay.marketpulse.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.util.PropertyPlaceholderHelper;

import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads and exposes the domain configuration from config.yaml.
 * Values are read once at startup. A missing file leaves every section at its defaults,
 * which is also what a plain {@code new PulseConfig()} gives tests.
 */
@Slf4j
@Component
public class PulseConfig {

    @Value("${pulse.config-file:config.yaml}")
    private String configFile;

    @Autowired(required = false)
    private Environment env;

    private static final PropertyPlaceholderHelper PLACEHOLDER_HELPER =
        new PropertyPlaceholderHelper("${", "}", ":", true);

    /** Resolves ${VAR:default} placeholders using Spring Environment (env vars / system props). */
    private String resolve(String value) {
        if (value == null || env == null) return value;
        return PLACEHOLDER_HELPER.replacePlaceholders(value, env::getProperty);
    }

    // ── Sections ──────────────────────────────────────────────────────────────
    private Gemini gemini = new Gemini();
    private Throttle throttle = new Throttle();
    private Backoff backoff = new Backoff();
    private Cache cache = new Cache();
    private Pipeline pipeline = new Pipeline();
    private Storage storage = new Storage();
    private Market market = new Market();
    private OnDemand onDemand = new OnDemand();
    private Calendar calendar = new Calendar();

    @PostConstruct
    public void load() {
        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            InputStream is = getClass().getClassLoader().getResourceAsStream(configFile);
            if (is == null) {
                log.warn("Config file '{}' not found on classpath, using defaults", configFile);
                return;
            }
            ConfigRoot root;
            try (is) {
                root = mapper.readValue(is, ConfigRoot.class);
            }
            this.gemini    = root.getGemini();
            this.throttle  = root.getThrottle();
            this.backoff   = root.getBackoff();
            this.cache     = root.getCache();
            this.pipeline  = root.getPipeline();
            this.storage   = root.getStorage();
            this.market    = root.getMarket();
            this.onDemand  = root.getOnDemand();
            this.calendar  = root.getCalendar();

            // Jackson reads ${VAR:default} as a literal string
            this.gemini.setApiKey(resolve(this.gemini.getApiKey()));
            this.storage.setDataDir(resolve(this.storage.getDataDir()));
            log.info("PulseConfig loaded from '{}'. Model: {}, min interval: {} ms, fast mode: {}",
                configFile, gemini.getModel(), throttle.getMinIntervalMs(), pipeline.isFastMode());
        } catch (Exception e) {
            log.error("Failed to load {}, using defaults: {}", configFile, e.getMessage());
        }
    }

    // ── Accessors ─────────────────────────────────────────────────────────────
    public Gemini gemini()       { return gemini; }
    public Throttle throttle()   { return throttle; }
    public Backoff backoff()     { return backoff; }
    public Cache cache()         { return cache; }
    public Pipeline pipeline()   { return pipeline; }
    public Storage storage()     { return storage; }
    public Market market()       { return market; }
    public OnDemand onDemand()   { return onDemand; }
    public Calendar calendar()   { return calendar; }

    // ── Config POJOs ──────────────────────────────────────────────────────────

    @Data public static class ConfigRoot {
        private Gemini gemini = new Gemini();
        private Throttle throttle = new Throttle();
        private Backoff backoff = new Backoff();
        private Cache cache = new Cache();
        private Pipeline pipeline = new Pipeline();
        private Storage storage = new Storage();
        private Market market = new Market();
        private OnDemand onDemand = new OnDemand();
        private Calendar calendar = new Calendar();
    }

    @Data public static class Gemini {
        private String apiKey = "";
        private String baseUrl = "https://generativelanguage.googleapis.com/v1beta/models";
        private String model = "gemini-2.0-flash";
        private int connectTimeoutSeconds = 10;
        private int readTimeoutSeconds = 30;
        private double temperature = 0.5;
        private int maxOutputTokens = 1000;
    }

    /** Free tier: 10 requests per minute, 1000 per day. */
    @Data public static class Throttle {
        private long minIntervalMs = 6000;
        private int maxConcurrent = 1;
        private int dailyLimit = 1000;
    }

    @Data public static class Backoff {
        private long baseDelayMs = 2000;
        private double growthFactor = 2.0;
        private long maxDelayMs = 60000;
        private int maxAttempts = 4;
        private double jitterRatio = 0.2;
    }

    @Data public static class Cache {
        private int ttlHours = 24;
        private int maxEntries = 2000;
        private int evictBatch = 100;
        private boolean persist = true;
        private String fileName = "gemini_cache.json";
    }

    @Data public static class Pipeline {
        private boolean fastMode = false;
        private int manualCooldownSeconds = 60;
        private String marketZone = "America/New_York";
        private boolean keepPreviousNarrative = true;
    }

    @Data public static class Storage {
        private String dataDir = "data";
    }

    @Data public static class Market {
        private Map<String, String> macroTickers = defaultMacroTickers();
        private Map<String, List<String>> sectors = defaultSectors();
        private List<String> portfolio = List.of("AAPL", "NVDA", "MSFT", "GOOGL", "AMZN", "META", "TSLA");
        private String macroNewsQuery = "Federal Reserve Economy";
        private int macroHeadlineLimit = 5;
        private int fetchConcurrency = 6;
        private String heatmapRange = "5d";
        private String riskRange = "6mo";
        private double highCorrelationThreshold = 0.75;
    }

    @Data public static class OnDemand {
        private int maxTickers = 20;
        private int maxTickerLength = 12;
        private int workerThreads = 2;
        private int headlineLimit = 3;
        private double temperature = 0.4;
        private int maxOutputTokens = 400;
    }

    /** Weekly economic calendar; events whose name contains a keyword are high impact. */
    @Data public static class Calendar {
        private int days = 7;
        private int eventLimit = 15;
        private List<String> highImpactKeywords = List.of("CPI", "Fed", "FOMC", "Employment", "Retail");
        private double temperature = 0.3;
        private int maxOutputTokens = 200;
    }

    private static Map<String, String> defaultMacroTickers() {
        Map<String, String> tickers = new LinkedHashMap<>();
        tickers.put("VIX", "^VIX");
        tickers.put("DXY", "DX-Y.NYB");
        tickers.put("2Y_Yield", "^IRX");
        tickers.put("10Y_Yield", "^TNX");
        tickers.put("GOLD", "GC=F");
        tickers.put("OIL", "CL=F");
        tickers.put("BTC", "BTC-USD");
        tickers.put("SPY", "SPY");
        tickers.put("QQQ", "QQQ");
        return tickers;
    }

    private static Map<String, List<String>> defaultSectors() {
        Map<String, List<String>> sectors = new LinkedHashMap<>();
        sectors.put("Technology", List.of("AAPL", "MSFT", "NVDA", "AVGO", "ORCL"));
        sectors.put("Financials", List.of("JPM", "V", "MA", "BAC", "GS"));
        sectors.put("Healthcare", List.of("LLY", "UNH", "JNJ", "ABBV", "MRK"));
        sectors.put("Energy", List.of("XOM", "CVX", "COP", "SLB", "EOG"));
        sectors.put("Consumer Discretionary", List.of("AMZN", "TSLA", "HD", "MCD", "NKE"));
        sectors.put("Communication Services", List.of("GOOGL", "META", "NFLX", "DIS", "TMUS"));
        return sectors;
    }
}
