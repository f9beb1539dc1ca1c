package com.algocoin.data.config;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.algocoin.data.metrics.Frequency;

/**
 * Configuration for the acquisition pipeline and the candle store.
 * Values are resolved with precedence:
 * 1. System properties (algocoin.* on the command line)
 * 2. Environment variables
 * 3. Properties file (algocoin.properties, or an explicit file)
 * 4. Default values
 */
public class PipelineConfig {

    private static final Logger logger = LoggerFactory.getLogger(PipelineConfig.class);

    // Configuration keys
    public static final String METRIC_BATCH_SIZE = "metricBatchSize";
    public static final String TIME_BATCH_DURATION = "timeBatchDuration";
    public static final String FREQUENCY = "frequency";
    public static final String AUTO_CLIP = "autoClip";
    public static final String MAX_CONCURRENT_BATCHES = "maxConcurrentBatches";
    public static final String REQUESTS_PER_MINUTE = "requestsPerMinute";
    public static final String REQUEST_TIMEOUT_SECONDS = "requestTimeoutSeconds";
    public static final String DEBUG_LEVEL = "debugLevel";

    public static final String SANTIMENT_API_KEY = "santimentApiKey";
    public static final String SANTIMENT_URL = "santimentUrl";
    public static final String LUNARCRUSH_API_KEY = "lunarCrushApiKey";
    public static final String LUNARCRUSH_URL = "lunarCrushUrl";

    public static final String STORE_URL = "storeUrl";
    public static final String STORE_USER = "storeUser";
    public static final String STORE_PASSWORD = "storePassword";
    public static final String STORE_DATABASE = "storeDatabase";

    // Environment variable keys
    public static final String ENV_METRIC_BATCH_SIZE = "ALGOCOIN_METRIC_BATCH_SIZE";
    public static final String ENV_TIME_BATCH_DURATION = "ALGOCOIN_TIME_BATCH_DURATION";
    public static final String ENV_FREQUENCY = "ALGOCOIN_FREQUENCY";
    public static final String ENV_AUTO_CLIP = "ALGOCOIN_AUTO_CLIP";
    public static final String ENV_SANTIMENT_API_KEY = "SANTIMENT_API_KEY";
    public static final String ENV_LUNARCRUSH_API_KEY = "LUNARCRUSH_API_KEY";
    public static final String ENV_STORE_URL = "CH_URL";
    public static final String ENV_STORE_USER = "CH_USER";
    public static final String ENV_STORE_PASSWORD = "CH_PASSWORD";
    public static final String ENV_STORE_DATABASE = "CH_DATABASE";

    public static final String SYSTEM_PROPERTY_PREFIX = "algocoin.";
    public static final String DEFAULT_PROPERTIES_FILE = "algocoin.properties";

    public static final String DEFAULT_SANTIMENT_URL = "https://api.santiment.net/graphql";
    public static final String DEFAULT_LUNARCRUSH_URL = "https://lunarcrush.com/api4";

    private final Properties properties;

    private PipelineConfig(Properties properties) {
        this.properties = properties;
    }

    /**
     * Loads from the classpath properties file, then environment, then system properties.
     */
    public static PipelineConfig load() {
        return load(null);
    }

    /**
     * Same as {@link #load()} but reads {@code configFile} instead of the
     * classpath file when it exists.
     */
    public static PipelineConfig load(File configFile) {
        Properties config = new Properties();
        if (configFile != null && configFile.exists()) {
            loadFromFile(config, configFile);
        } else {
            loadFromClasspath(config);
        }
        loadFromEnvironmentVariables(config);
        loadFromSystemProperties(config);

        PipelineConfig pipelineConfig = new PipelineConfig(config);
        pipelineConfig.logConfigurationStatus();
        return pipelineConfig;
    }

    /**
     * Uses only the given properties, no environment or system lookups.
     */
    public static PipelineConfig fromProperties(Properties properties) {
        Properties copy = new Properties();
        copy.putAll(properties);
        return new PipelineConfig(copy);
    }

    private static void loadFromClasspath(Properties config) {
        try (InputStream input = PipelineConfig.class.getClassLoader().getResourceAsStream(DEFAULT_PROPERTIES_FILE)) {
            if (input != null) {
                config.load(input);
                logger.info("Loaded configuration from {}", DEFAULT_PROPERTIES_FILE);
            } else {
                logger.debug("Properties file {} not found in classpath", DEFAULT_PROPERTIES_FILE);
            }
        } catch (IOException e) {
            logger.warn("Failed to load properties file {}: {}", DEFAULT_PROPERTIES_FILE, e.getMessage());
        }
    }

    private static void loadFromFile(Properties config, File configFile) {
        try (InputStream input = new FileInputStream(configFile)) {
            config.load(input);
            logger.info("Loaded configuration from {}", configFile.getAbsolutePath());
        } catch (IOException e) {
            logger.warn("Failed to load properties file {}: {}", configFile, e.getMessage());
        }
    }

    private static void loadFromEnvironmentVariables(Properties config) {
        mapEnvToProperty(config, ENV_METRIC_BATCH_SIZE, METRIC_BATCH_SIZE);
        mapEnvToProperty(config, ENV_TIME_BATCH_DURATION, TIME_BATCH_DURATION);
        mapEnvToProperty(config, ENV_FREQUENCY, FREQUENCY);
        mapEnvToProperty(config, ENV_AUTO_CLIP, AUTO_CLIP);
        mapEnvToProperty(config, ENV_SANTIMENT_API_KEY, SANTIMENT_API_KEY);
        mapEnvToProperty(config, ENV_LUNARCRUSH_API_KEY, LUNARCRUSH_API_KEY);
        mapEnvToProperty(config, ENV_STORE_URL, STORE_URL);
        mapEnvToProperty(config, ENV_STORE_USER, STORE_USER);
        mapEnvToProperty(config, ENV_STORE_PASSWORD, STORE_PASSWORD);
        mapEnvToProperty(config, ENV_STORE_DATABASE, STORE_DATABASE);
    }

    private static void loadFromSystemProperties(Properties config) {
        System.getProperties().stringPropertyNames().stream()
            .filter(key -> key.startsWith(SYSTEM_PROPERTY_PREFIX))
            .forEach(key -> config.setProperty(key.substring(SYSTEM_PROPERTY_PREFIX.length()),
                    System.getProperty(key)));
    }

    private static void mapEnvToProperty(Properties config, String envKey, String propKey) {
        String envValue = System.getenv(envKey);
        if (envValue != null && !envValue.trim().isEmpty()) {
            config.setProperty(propKey, envValue);
        }
    }

    /**
     * Log configuration status without revealing secrets
     */
    private void logConfigurationStatus() {
        logger.info("Pipeline configuration:");
        logger.info("  Metric batch size: {}", getMetricBatchSize());
        logger.info("  Time batch duration: {}", getTimeBatchDuration());
        logger.info("  Frequency: {}", getFrequency());
        logger.info("  Auto-clip: {}", isAutoClip());
        logger.info("  Santiment API key: {}", isConfigured(SANTIMENT_API_KEY) ? "✓ configured" : "✗ missing");
        logger.info("  LunarCrush API key: {}", isConfigured(LUNARCRUSH_API_KEY) ? "✓ configured" : "✗ missing");
        logger.info("  Store: {}", getConfiguredValue(STORE_URL, "not set"));
    }

    private boolean isConfigured(String key) {
        String value = properties.getProperty(key);
        return value != null && !value.trim().isEmpty();
    }

    private String getConfiguredValue(String key, String defaultDisplay) {
        String value = properties.getProperty(key);
        return (value != null && !value.trim().isEmpty()) ? value : defaultDisplay;
    }

    // Getters for configuration values

    public int getMetricBatchSize() {
        return Integer.parseInt(properties.getProperty(METRIC_BATCH_SIZE, "10").trim());
    }

    public Duration getTimeBatchDuration() {
        return Frequency.parseDuration(properties.getProperty(TIME_BATCH_DURATION, "30d"));
    }

    public Frequency getFrequency() {
        return Frequency.parse(properties.getProperty(FREQUENCY, "5m"));
    }

    public boolean isAutoClip() {
        return Boolean.parseBoolean(properties.getProperty(AUTO_CLIP, "false").trim());
    }

    public int getMaxConcurrentBatches() {
        return Integer.parseInt(properties.getProperty(MAX_CONCURRENT_BATCHES, "1").trim());
    }

    public int getRequestsPerMinute() {
        return Integer.parseInt(properties.getProperty(REQUESTS_PER_MINUTE, "60").trim());
    }

    public Duration getRequestTimeout() {
        return Duration.ofSeconds(Long.parseLong(properties.getProperty(REQUEST_TIMEOUT_SECONDS, "60").trim()));
    }

    public int getDebugLevel() {
        return Integer.parseInt(properties.getProperty(DEBUG_LEVEL, "0").trim());
    }

    public String getSantimentApiKey() {
        return properties.getProperty(SANTIMENT_API_KEY);
    }

    public String getSantimentUrl() {
        return properties.getProperty(SANTIMENT_URL, DEFAULT_SANTIMENT_URL);
    }

    public String getLunarCrushApiKey() {
        return properties.getProperty(LUNARCRUSH_API_KEY);
    }

    public String getLunarCrushUrl() {
        return properties.getProperty(LUNARCRUSH_URL, DEFAULT_LUNARCRUSH_URL);
    }

    public String getStoreUrl() {
        return properties.getProperty(STORE_URL);
    }

    public String getStoreUser() {
        return properties.getProperty(STORE_USER, "default");
    }

    public String getStorePassword() {
        return properties.getProperty(STORE_PASSWORD, "");
    }

    public String getStoreDatabase() {
        return properties.getProperty(STORE_DATABASE, "crypto");
    }

    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    /**
     * Returns a copy with one value overridden, used by CLI options.
     */
    public PipelineConfig with(String key, String value) {
        Properties copy = new Properties();
        copy.putAll(properties);
        if (value != null) {
            copy.setProperty(key, value);
        }
        return new PipelineConfig(copy);
    }

    // Validation methods

    public void validate() {
        if (getMetricBatchSize() <= 0) {
            throw new IllegalArgumentException(METRIC_BATCH_SIZE + " must be positive, got " + getMetricBatchSize());
        }
        if (getMaxConcurrentBatches() <= 0) {
            throw new IllegalArgumentException(
                    MAX_CONCURRENT_BATCHES + " must be positive, got " + getMaxConcurrentBatches());
        }
        if (getRequestsPerMinute() <= 0) {
            throw new IllegalArgumentException(REQUESTS_PER_MINUTE + " must be positive, got " + getRequestsPerMinute());
        }
        Duration timeBatch = getTimeBatchDuration();
        Frequency frequency = getFrequency();
        if (!frequency.divides(timeBatch)) {
            throw new IllegalArgumentException(TIME_BATCH_DURATION + " " + timeBatch
                    + " must be a positive whole multiple of " + FREQUENCY + " " + frequency);
        }
    }

    public void requireSantimentCredentials() {
        if (!isConfigured(SANTIMENT_API_KEY)) {
            throw new IllegalStateException("Santiment API key not configured. Set " + SANTIMENT_API_KEY
                    + " in the properties file or " + ENV_SANTIMENT_API_KEY + " in the environment.");
        }
    }

    public void requireLunarCrushCredentials() {
        if (!isConfigured(LUNARCRUSH_API_KEY)) {
            throw new IllegalStateException("LunarCrush API key not configured. Set " + LUNARCRUSH_API_KEY
                    + " in the properties file or " + ENV_LUNARCRUSH_API_KEY + " in the environment.");
        }
    }

    public void requireStore() {
        if (!isConfigured(STORE_URL)) {
            throw new IllegalStateException("Store not configured. Set " + STORE_URL
                    + " in the properties file or " + ENV_STORE_URL + " in the environment.");
        }
    }
}
