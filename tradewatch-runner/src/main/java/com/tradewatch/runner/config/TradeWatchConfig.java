package com.tradewatch.runner.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonMerge;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.tradewatch.core.model.Interval;
import com.tradewatch.engine.sandbox.SandboxSettings;
import com.tradewatch.feed.FeedSettings;
import com.tradewatch.runner.sync.SyncSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Runtime configuration.
 *
 * Built from the bundled {@code tradewatch-defaults.yaml}, overlaid with the user file
 * ({@code -Dtradewatch.config}, {@code TRADEWATCH_CONFIG} or {@code ~/.tradewatch/tradewatch.yaml})
 * and finally with system property / environment overrides for deployment-specific keys.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TradeWatchConfig {

    private static final Logger log = LoggerFactory.getLogger(TradeWatchConfig.class);
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    public static final String DEFAULTS_RESOURCE = "/tradewatch-defaults.yaml";
    public static final Path DEFAULT_CONFIG_FILE =
        Path.of(System.getProperty("user.home"), ".tradewatch", "tradewatch.yaml");

    private String sourceId = "tradewatch";

    @JsonMerge
    private MarketDataConfig marketData = new MarketDataConfig();
    @JsonMerge
    private SandboxConfig sandbox = new SandboxConfig();
    @JsonMerge
    private ScreenerConfig screener = new ScreenerConfig();
    @JsonMerge
    private SignalsConfig signals = new SignalsConfig();
    @JsonMerge
    private SyncConfig sync = new SyncConfig();
    @JsonMerge
    private TradersConfig traders = new TradersConfig();
    @JsonMerge
    private HealthConfig health = new HealthConfig();
    @JsonMerge
    private ApiConfig api = new ApiConfig();

    public TradeWatchConfig() {
    }

    // ========== Loading ==========

    /**
     * Load using the process's system properties and environment.
     *
     * @throws ConfigException if a file cannot be read or the result is invalid
     */
    public static TradeWatchConfig load() {
        Properties props = System.getProperties();
        Map<String, String> env = System.getenv();
        String file = props.getProperty("tradewatch.config", env.get("TRADEWATCH_CONFIG"));
        return load(file != null ? Path.of(file) : DEFAULT_CONFIG_FILE, props, env);
    }

    /**
     * Load defaults, overlay {@code userFile} if it exists, then apply overrides.
     */
    public static TradeWatchConfig load(Path userFile, Properties props, Map<String, String> env) {
        TradeWatchConfig config = defaults();

        if (userFile != null && Files.exists(userFile)) {
            try {
                YAML.readerForUpdating(config).readValue(userFile.toFile());
                log.info("Loaded configuration from {}", userFile);
            } catch (IOException e) {
                throw new ConfigException("Failed to read " + userFile + ": " + e.getMessage(), e);
            }
        } else {
            log.info("No configuration file at {}, using bundled defaults", userFile);
        }

        config.applyOverrides(props, env);
        config.validate();
        return config;
    }

    /**
     * The bundled defaults, without overrides.
     */
    public static TradeWatchConfig defaults() {
        try (InputStream in = TradeWatchConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new ConfigException("Missing bundled " + DEFAULTS_RESOURCE);
            }
            return YAML.readValue(in, TradeWatchConfig.class);
        } catch (IOException e) {
            throw new ConfigException("Failed to read bundled defaults: " + e.getMessage(), e);
        }
    }

    void applyOverrides(Properties props, Map<String, String> env) {
        String value = override(props, env, "tradewatch.source.id", "TRADEWATCH_SOURCE_ID");
        if (value != null) {
            sourceId = value;
        }
        value = override(props, env, "tradewatch.sink.url", "TRADEWATCH_SINK_URL");
        if (value != null) {
            sync.setSinkUrl(value);
        }
        value = override(props, env, "tradewatch.sink.key", "TRADEWATCH_SINK_KEY");
        if (value != null) {
            sync.setSinkKey(value);
        }
        value = override(props, env, "tradewatch.api.port", "TRADEWATCH_API_PORT");
        if (value != null) {
            try {
                api.setPort(Integer.parseInt(value.trim()));
            } catch (NumberFormatException e) {
                throw new ConfigException("Invalid API port: " + value);
            }
        }
        value = override(props, env, "tradewatch.traders.dir", "TRADEWATCH_TRADERS_DIR");
        if (value != null) {
            traders.setSource("directory");
            traders.setDirectory(value);
        }
    }

    private static String override(Properties props, Map<String, String> env, String property, String variable) {
        String value = props.getProperty(property, env.get(variable));
        return value != null && !value.isBlank() ? value : null;
    }

    /**
     * @throws ConfigException on the first invalid setting
     */
    public void validate() {
        require(sourceId != null && !sourceId.isBlank(), "sourceId is required");

        require(marketData.symbols != null && !marketData.symbols.isEmpty(), "marketData.symbols must not be empty");
        require(Interval.isValid(marketData.defaultInterval), "marketData.defaultInterval is invalid: " + marketData.defaultInterval);
        require(marketData.bufferCapacity > 0, "marketData.bufferCapacity must be positive");
        require(marketData.reconnectBaseMs > 0 && marketData.reconnectMaxMs >= marketData.reconnectBaseMs,
            "marketData.reconnectBaseMs must be positive and not above reconnectMaxMs");
        require(marketData.staleAfterMs > 0, "marketData.staleAfterMs must be positive");
        require(marketData.backfillLimit > 0, "marketData.backfillLimit must be positive");

        require(sandbox.filterTimeoutMs > 0 && sandbox.seriesTimeoutMs > 0, "sandbox timeouts must be positive");
        require(sandbox.timeoutBackoffThreshold > 0 && sandbox.maxBackoffMultiplier > 0,
            "sandbox backoff settings must be positive");
        require(sandbox.seriesPoints > 0 && sandbox.candleSliceLength >= 0, "sandbox series sizes are invalid");

        require(screener.workers > 0, "screener.workers must be positive");
        require(screener.tickIntervalMs > 0 && screener.tickBudgetMs > 0, "screener tick settings must be positive");

        require(signals.dedupeBars > 0, "signals.dedupeBars must be positive");

        require(sync.flushIntervalMs > 0 && sync.heartbeatIntervalMs > 0, "sync intervals must be positive");
        require(sync.maxBatchSize > 0, "sync.maxBatchSize must be positive");
        require(sync.signalQueueCap > 0 && sync.metricQueueCap > 0 && sync.eventQueueCap > 0,
            "sync queue caps must be positive");
        require(sync.retryBaseMs > 0 && sync.retryMaxMs >= sync.retryBaseMs, "sync retry settings are invalid");
        require(sync.degradedAfterFailures > 0, "sync.degradedAfterFailures must be positive");

        require("directory".equals(traders.source) || "http".equals(traders.source),
            "traders.source must be 'directory' or 'http', got " + traders.source);
        require(!"directory".equals(traders.source) || (traders.directory != null && !traders.directory.isBlank()),
            "traders.directory is required for the directory source");
        require(!"http".equals(traders.source) || (traders.url != null && !traders.url.isBlank()),
            "traders.url is required for the http source");
        require(traders.reloadIntervalMs > 0, "traders.reloadIntervalMs must be positive");

        require(health.checkIntervalMs > 0, "health.checkIntervalMs must be positive");
        require(api.port >= 0 && api.port <= 65535, "api.port out of range: " + api.port);
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new ConfigException(message);
        }
    }

    // ========== Conversions ==========

    public FeedSettings toFeedSettings() {
        return new FeedSettings(marketData.streamUrl, marketData.restUrl, marketData.bufferCapacity,
            Duration.ofMillis(marketData.reconnectBaseMs), Duration.ofMillis(marketData.reconnectMaxMs),
            Duration.ofMillis(marketData.staleAfterMs));
    }

    /**
     * Sandbox threads are never fewer than screener workers, so every worker can have an
     * evaluation in flight.
     */
    public SandboxSettings toSandboxSettings() {
        int threads = Math.max(sandbox.threads, screener.workers);
        return new SandboxSettings(Duration.ofMillis(sandbox.filterTimeoutMs), Duration.ofMillis(sandbox.seriesTimeoutMs),
            sandbox.timeoutBackoffThreshold, sandbox.maxBackoffMultiplier, sandbox.seriesPoints,
            sandbox.candleSliceLength, threads);
    }

    public SyncSettings toSyncSettings() {
        return new SyncSettings(Duration.ofMillis(sync.flushIntervalMs), sync.maxBatchSize,
            sync.signalQueueCap, sync.metricQueueCap, sync.eventQueueCap,
            Duration.ofMillis(sync.heartbeatIntervalMs), Duration.ofMillis(sync.retryBaseMs),
            Duration.ofMillis(sync.retryMaxMs), sync.degradedAfterFailures);
    }

    // ========== Accessors ==========

    public String getSourceId() {
        return sourceId;
    }

    public void setSourceId(String sourceId) {
        this.sourceId = sourceId;
    }

    public MarketDataConfig getMarketData() {
        return marketData;
    }

    public void setMarketData(MarketDataConfig marketData) {
        this.marketData = marketData;
    }

    public SandboxConfig getSandbox() {
        return sandbox;
    }

    public void setSandbox(SandboxConfig sandbox) {
        this.sandbox = sandbox;
    }

    public ScreenerConfig getScreener() {
        return screener;
    }

    public void setScreener(ScreenerConfig screener) {
        this.screener = screener;
    }

    public SignalsConfig getSignals() {
        return signals;
    }

    public void setSignals(SignalsConfig signals) {
        this.signals = signals;
    }

    public SyncConfig getSync() {
        return sync;
    }

    public void setSync(SyncConfig sync) {
        this.sync = sync;
    }

    public TradersConfig getTraders() {
        return traders;
    }

    public void setTraders(TradersConfig traders) {
        this.traders = traders;
    }

    public HealthConfig getHealth() {
        return health;
    }

    public void setHealth(HealthConfig health) {
        this.health = health;
    }

    public ApiConfig getApi() {
        return api;
    }

    public void setApi(ApiConfig api) {
        this.api = api;
    }

    // ========== Sections ==========

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MarketDataConfig {
        private String streamUrl;
        private String restUrl;
        private List<String> symbols = new ArrayList<>();
        private String defaultInterval = Interval.DEFAULT;
        private int bufferCapacity;
        private long reconnectBaseMs;
        private long reconnectMaxMs;
        private long staleAfterMs;
        private boolean backfill;
        private int backfillLimit;

        public String getStreamUrl() {
            return streamUrl;
        }

        public void setStreamUrl(String streamUrl) {
            this.streamUrl = streamUrl;
        }

        public String getRestUrl() {
            return restUrl;
        }

        public void setRestUrl(String restUrl) {
            this.restUrl = restUrl;
        }

        public List<String> getSymbols() {
            return symbols;
        }

        public void setSymbols(List<String> symbols) {
            this.symbols = symbols;
        }

        public String getDefaultInterval() {
            return defaultInterval;
        }

        public void setDefaultInterval(String defaultInterval) {
            this.defaultInterval = defaultInterval;
        }

        public int getBufferCapacity() {
            return bufferCapacity;
        }

        public void setBufferCapacity(int bufferCapacity) {
            this.bufferCapacity = bufferCapacity;
        }

        public long getReconnectBaseMs() {
            return reconnectBaseMs;
        }

        public void setReconnectBaseMs(long reconnectBaseMs) {
            this.reconnectBaseMs = reconnectBaseMs;
        }

        public long getReconnectMaxMs() {
            return reconnectMaxMs;
        }

        public void setReconnectMaxMs(long reconnectMaxMs) {
            this.reconnectMaxMs = reconnectMaxMs;
        }

        public long getStaleAfterMs() {
            return staleAfterMs;
        }

        public void setStaleAfterMs(long staleAfterMs) {
            this.staleAfterMs = staleAfterMs;
        }

        public boolean isBackfill() {
            return backfill;
        }

        public void setBackfill(boolean backfill) {
            this.backfill = backfill;
        }

        public int getBackfillLimit() {
            return backfillLimit;
        }

        public void setBackfillLimit(int backfillLimit) {
            this.backfillLimit = backfillLimit;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SandboxConfig {
        private long filterTimeoutMs;
        private long seriesTimeoutMs;
        private int timeoutBackoffThreshold;
        private int maxBackoffMultiplier;
        private int seriesPoints;
        private int candleSliceLength;
        private int threads = 1;

        public long getFilterTimeoutMs() {
            return filterTimeoutMs;
        }

        public void setFilterTimeoutMs(long filterTimeoutMs) {
            this.filterTimeoutMs = filterTimeoutMs;
        }

        public long getSeriesTimeoutMs() {
            return seriesTimeoutMs;
        }

        public void setSeriesTimeoutMs(long seriesTimeoutMs) {
            this.seriesTimeoutMs = seriesTimeoutMs;
        }

        public int getTimeoutBackoffThreshold() {
            return timeoutBackoffThreshold;
        }

        public void setTimeoutBackoffThreshold(int timeoutBackoffThreshold) {
            this.timeoutBackoffThreshold = timeoutBackoffThreshold;
        }

        public int getMaxBackoffMultiplier() {
            return maxBackoffMultiplier;
        }

        public void setMaxBackoffMultiplier(int maxBackoffMultiplier) {
            this.maxBackoffMultiplier = maxBackoffMultiplier;
        }

        public int getSeriesPoints() {
            return seriesPoints;
        }

        public void setSeriesPoints(int seriesPoints) {
            this.seriesPoints = seriesPoints;
        }

        public int getCandleSliceLength() {
            return candleSliceLength;
        }

        public void setCandleSliceLength(int candleSliceLength) {
            this.candleSliceLength = candleSliceLength;
        }

        public int getThreads() {
            return threads;
        }

        public void setThreads(int threads) {
            this.threads = threads;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ScreenerConfig {
        private int workers;
        private long tickIntervalMs;
        private long tickBudgetMs;

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = workers;
        }

        public long getTickIntervalMs() {
            return tickIntervalMs;
        }

        public void setTickIntervalMs(long tickIntervalMs) {
            this.tickIntervalMs = tickIntervalMs;
        }

        public long getTickBudgetMs() {
            return tickBudgetMs;
        }

        public void setTickBudgetMs(long tickBudgetMs) {
            this.tickBudgetMs = tickBudgetMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SignalsConfig {
        private int dedupeBars;

        public int getDedupeBars() {
            return dedupeBars;
        }

        public void setDedupeBars(int dedupeBars) {
            this.dedupeBars = dedupeBars;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SyncConfig {
        private long flushIntervalMs;
        private int maxBatchSize;
        private int signalQueueCap;
        private int metricQueueCap;
        private int eventQueueCap;
        private long heartbeatIntervalMs;
        private long retryBaseMs;
        private long retryMaxMs;
        private int degradedAfterFailures;
        private String sinkUrl;
        private String sinkKey;

        public long getFlushIntervalMs() {
            return flushIntervalMs;
        }

        public void setFlushIntervalMs(long flushIntervalMs) {
            this.flushIntervalMs = flushIntervalMs;
        }

        public int getMaxBatchSize() {
            return maxBatchSize;
        }

        public void setMaxBatchSize(int maxBatchSize) {
            this.maxBatchSize = maxBatchSize;
        }

        public int getSignalQueueCap() {
            return signalQueueCap;
        }

        public void setSignalQueueCap(int signalQueueCap) {
            this.signalQueueCap = signalQueueCap;
        }

        public int getMetricQueueCap() {
            return metricQueueCap;
        }

        public void setMetricQueueCap(int metricQueueCap) {
            this.metricQueueCap = metricQueueCap;
        }

        public int getEventQueueCap() {
            return eventQueueCap;
        }

        public void setEventQueueCap(int eventQueueCap) {
            this.eventQueueCap = eventQueueCap;
        }

        public long getHeartbeatIntervalMs() {
            return heartbeatIntervalMs;
        }

        public void setHeartbeatIntervalMs(long heartbeatIntervalMs) {
            this.heartbeatIntervalMs = heartbeatIntervalMs;
        }

        public long getRetryBaseMs() {
            return retryBaseMs;
        }

        public void setRetryBaseMs(long retryBaseMs) {
            this.retryBaseMs = retryBaseMs;
        }

        public long getRetryMaxMs() {
            return retryMaxMs;
        }

        public void setRetryMaxMs(long retryMaxMs) {
            this.retryMaxMs = retryMaxMs;
        }

        public int getDegradedAfterFailures() {
            return degradedAfterFailures;
        }

        public void setDegradedAfterFailures(int degradedAfterFailures) {
            this.degradedAfterFailures = degradedAfterFailures;
        }

        public String getSinkUrl() {
            return sinkUrl;
        }

        public void setSinkUrl(String sinkUrl) {
            this.sinkUrl = sinkUrl;
        }

        public String getSinkKey() {
            return sinkKey;
        }

        public void setSinkKey(String sinkKey) {
            this.sinkKey = sinkKey;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TradersConfig {
        private String source = "directory";
        private String directory;
        private String url;
        private long reloadIntervalMs;

        public String getSource() {
            return source;
        }

        public void setSource(String source) {
            this.source = source;
        }

        public String getDirectory() {
            return directory;
        }

        /**
         * Directory path with a leading {@code ~} expanded.
         */
        public Path directoryPath() {
            String path = directory;
            if (path.startsWith("~")) {
                path = System.getProperty("user.home") + path.substring(1);
            }
            return Path.of(path);
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public long getReloadIntervalMs() {
            return reloadIntervalMs;
        }

        public void setReloadIntervalMs(long reloadIntervalMs) {
            this.reloadIntervalMs = reloadIntervalMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class HealthConfig {
        private long checkIntervalMs;

        public long getCheckIntervalMs() {
            return checkIntervalMs;
        }

        public void setCheckIntervalMs(long checkIntervalMs) {
            this.checkIntervalMs = checkIntervalMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiConfig {
        private boolean enabled;
        private int port;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }
    }
}
