/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.tokenflow.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Configuration management for Tokenflow simulations.
 * Values come from built-in defaults, then a {@code tokenflow.properties} file, then
 * {@code tokenflow.*} system properties.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class TokenflowConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(TokenflowConfiguration.class);

    public static final String TICK_DELTA = "tokenflow.simulation.tick.delta";
    public static final String SEED = "tokenflow.simulation.seed";
    public static final String MAX_TICKS = "tokenflow.simulation.max.ticks";
    public static final String MAX_TOKENS = "tokenflow.simulation.max.tokens";
    public static final String SINK_RETAINED_TOKENS = "tokenflow.sink.retained.tokens";
    public static final String MAX_PATH_DEPTH = "tokenflow.lineage.max.path.depth";
    public static final String DEPTH_WARNING_THRESHOLD = "tokenflow.lineage.depth.warning.threshold";
    public static final String METRICS_ENABLED = "tokenflow.metrics.enabled";

    private static final long DEFAULT_TICK_DELTA = 1;
    private static final long DEFAULT_SEED = 42;
    private static final long DEFAULT_MAX_TICKS = 0;
    private static final long DEFAULT_MAX_TOKENS = 0;
    private static final int DEFAULT_SINK_RETAINED_TOKENS = 100;
    private static final int DEFAULT_MAX_PATH_DEPTH = 50;
    private static final int DEFAULT_DEPTH_WARNING_THRESHOLD = 20;

    private final Properties properties;

    public TokenflowConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public TokenflowConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    /**
     * Configuration holding only the built-in defaults, ignoring files and system properties.
     */
    public static TokenflowConfiguration defaults() {
        return new TokenflowConfiguration(null);
    }

    // Simulation
    public long getTickDelta() {
        long delta = getLongProperty(TICK_DELTA, DEFAULT_TICK_DELTA);
        if (delta <= 0) {
            logger.warn("Tick delta must be positive, got {}. Using default: {}", delta, DEFAULT_TICK_DELTA);
            return DEFAULT_TICK_DELTA;
        }
        return delta;
    }

    public long getSeed() {
        return getLongProperty(SEED, DEFAULT_SEED);
    }

    public long getMaxTicks() {
        return getLongProperty(MAX_TICKS, DEFAULT_MAX_TICKS);
    }

    public long getMaxTokens() {
        return getLongProperty(MAX_TOKENS, DEFAULT_MAX_TOKENS);
    }

    public int getSinkRetainedTokens() {
        return getIntProperty(SINK_RETAINED_TOKENS, DEFAULT_SINK_RETAINED_TOKENS);
    }

    // Lineage analysis
    public int getMaxPathDepth() {
        return getIntProperty(MAX_PATH_DEPTH, DEFAULT_MAX_PATH_DEPTH);
    }

    public int getDepthWarningThreshold() {
        return getIntProperty(DEPTH_WARNING_THRESHOLD, DEFAULT_DEPTH_WARNING_THRESHOLD);
    }

    // Monitoring
    public boolean isMetricsEnabled() {
        return getBooleanProperty(METRICS_ENABLED, true);
    }

    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid integer value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private long getLongProperty(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid long value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(TICK_DELTA, String.valueOf(DEFAULT_TICK_DELTA));
        properties.setProperty(SEED, String.valueOf(DEFAULT_SEED));
        properties.setProperty(MAX_TICKS, String.valueOf(DEFAULT_MAX_TICKS));
        properties.setProperty(MAX_TOKENS, String.valueOf(DEFAULT_MAX_TOKENS));
        properties.setProperty(SINK_RETAINED_TOKENS, String.valueOf(DEFAULT_SINK_RETAINED_TOKENS));
        properties.setProperty(MAX_PATH_DEPTH, String.valueOf(DEFAULT_MAX_PATH_DEPTH));
        properties.setProperty(DEPTH_WARNING_THRESHOLD, String.valueOf(DEFAULT_DEPTH_WARNING_THRESHOLD));
        properties.setProperty(METRICS_ENABLED, "true");
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "tokenflow.properties",
                "config/tokenflow.properties",
                System.getProperty("user.home") + "/.tokenflow/tokenflow.properties"
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: {}", configPath);
                    return;
                } catch (IOException e) {
                    logger.warn("Failed to load configuration from {}: {}", configPath, e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("tokenflow.properties")) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warn("Failed to load configuration from classpath: {}", e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("tokenflow."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.debug("Override from system property: {}={}", entry.getKey(), entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "TokenflowConfiguration{" +
                "tickDelta=" + getTickDelta() +
                ", seed=" + getSeed() +
                ", maxPathDepth=" + getMaxPathDepth() +
                ", metricsEnabled=" + isMetricsEnabled() +
                '}';
    }
}
