package com.goldtracker.config;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Run configuration for the gold tracker.
 * Loads from environment variables, then config.properties, then defaults.
 * Built once per run and handed to every component that needs it.
 */
public final class Config {
    private static final Logger logger = LoggerFactory.getLogger(Config.class);
    private static final String CONFIG_FILE = "config.properties";

    public static final double DEFAULT_DRAWDOWN_THRESHOLD_PCT = 10.0;
    public static final double DEFAULT_HISTORICAL_EXCHANGE_RATE = 25500.0;

    private final Map<String, String> env;
    private final Properties properties;

    @Positive(message = "Drawdown threshold must be positive")
    private final double drawdownThresholdPct;

    @Positive(message = "Historical exchange rate must be positive")
    private final double historicalExchangeRate;

    @NotBlank(message = "Data directory is required")
    private final String dataDir;

    @Min(value = 1, message = "HTTP timeout must be at least 1 second")
    private final int httpTimeoutSeconds;

    @Min(value = 1, message = "Market timeout must be at least 1 second")
    private final int marketTimeoutSeconds;

    @Min(value = 1, message = "At least one fetch thread is required")
    @Max(value = 32, message = "At most 32 fetch threads are allowed")
    private final int fetchThreads;

    public Config() {
        this(loadProperties(), System.getenv());
    }

    /**
     * Build from explicit sources. Environment values win over properties.
     */
    public Config(Properties properties, Map<String, String> env) {
        this.properties = properties;
        this.env = env;
        this.drawdownThresholdPct = getDoubleProperty("DRAWDOWN_THRESHOLD_PCT", DEFAULT_DRAWDOWN_THRESHOLD_PCT);
        this.historicalExchangeRate = getDoubleProperty("HISTORICAL_EXCHANGE_RATE", DEFAULT_HISTORICAL_EXCHANGE_RATE);
        this.dataDir = getProperty("DATA_DIR", "data");
        this.httpTimeoutSeconds = getIntProperty("HTTP_TIMEOUT_SECONDS", 15);
        this.marketTimeoutSeconds = getIntProperty("MARKET_TIMEOUT_SECONDS", 30);
        this.fetchThreads = getIntProperty("FETCH_THREADS", 4);

        validate();
        logger.info("Configuration loaded: dataDir={}, drawdownThreshold={}%, credentials present: {}",
            dataDir, drawdownThresholdPct, credentialSummary());
    }

    private static Properties loadProperties() {
        var props = new Properties();
        try (var fis = new FileInputStream(CONFIG_FILE)) {
            props.load(fis);
            logger.debug("Loaded properties from {}", CONFIG_FILE);
        } catch (IOException e) {
            logger.debug("No config.properties found");
        }
        return props;
    }

    /**
     * Validate configuration using Bean Validation.
     * Throws IllegalStateException if validation fails.
     */
    public void validate() {
        Validator validator = Validation.buildDefaultValidatorFactory().getValidator();
        var violations = validator.validate(this);

        if (!violations.isEmpty()) {
            var errorMessages = violations.stream()
                .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                .sorted()
                .toList();

            throw new IllegalStateException(
                "Configuration validation failed: " + String.join(", ", errorMessages)
            );
        }
    }

    // ==================== Provider credentials ====================

    public Optional<String> goldApiKey() {
        return credential("GOLDAPI_KEY");
    }

    public Optional<String> twelveDataApiKey() {
        return credential("TWELVEDATA_API_KEY");
    }

    public Optional<String> metalsDevKey() {
        return credential("METALS_DEV_KEY");
    }

    public Optional<String> vnAppMobApiKey() {
        return credential("VNAPPMOB_API_KEY");
    }

    // ==================== Analytics ====================

    public double drawdownThresholdPct() {
        return drawdownThresholdPct;
    }

    /**
     * USD/VND rate used when backfilling periods with no captured live rate.
     */
    public double historicalExchangeRate() {
        return historicalExchangeRate;
    }

    // ==================== Runtime ====================

    public Path dataDir() {
        return Path.of(dataDir);
    }

    public Duration httpTimeout() {
        return Duration.ofSeconds(httpTimeoutSeconds);
    }

    public Duration marketTimeout() {
        return Duration.ofSeconds(marketTimeoutSeconds);
    }

    public int fetchThreads() {
        return fetchThreads;
    }

    private Optional<String> credential(String key) {
        return Optional.ofNullable(getProperty(key)).filter(v -> !v.isBlank());
    }

    private String credentialSummary() {
        return String.format("goldapi=%s, twelvedata=%s, metalsdev=%s, vnappmob=%s",
            goldApiKey().isPresent(), twelveDataApiKey().isPresent(),
            metalsDevKey().isPresent(), vnAppMobApiKey().isPresent());
    }

    private String getProperty(String key) {
        return Optional.ofNullable(env.get(key))
                .or(() -> Optional.ofNullable(properties.getProperty(key)))
                .orElse(null);
    }

    private String getProperty(String key, String defaultValue) {
        String value = getProperty(key);
        return value != null ? value : defaultValue;
    }

    private double getDoubleProperty(String key, double defaultValue) {
        String value = getProperty(key);
        if (value == null || value.isBlank()) return defaultValue;
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Configuration validation failed: " + key + " is not a number: " + value);
        }
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = getProperty(key);
        if (value == null || value.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Configuration validation failed: " + key + " is not an integer: " + value);
        }
    }
}
