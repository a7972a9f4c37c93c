package com.example.modelaudit.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class AppConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(AppConfig.class);
    private final Properties properties = new Properties();

    public AppConfig() {
        loadProperties("config.properties");
    }

    public AppConfig(Properties properties) {
        this.properties.putAll(properties);
    }

    public void loadProperties(String resourceName) {
        try (InputStream inputStream = getClass().getClassLoader().getResourceAsStream(resourceName)) {
            if (inputStream == null) {
                throw new IllegalStateException("Unable to find configuration file: " + resourceName);
            }
            properties.load(inputStream);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load configuration file: " + resourceName, e);
        }
    }

    public Path getModelDirectory() {
        String directory = properties.getProperty("model.directory", "models");
        return Paths.get(directory).toAbsolutePath().normalize();
    }

    public String getModelFilePattern() {
        return properties.getProperty("model.file.pattern", ".*\\.(xlsx|xlsm|xls)");
    }

    public int getGraphBuildThreads() {
        return getInt("graph.build.threads", 1);
    }

    public int getMaxCycles() {
        return getInt("analysis.cycles.max", 100_000);
    }

    public Duration getCycleSearchTimeout() {
        return Duration.ofMillis(getLong("analysis.cycles.timeout-ms", 30_000L));
    }

    public int getPlugSkipColumns() {
        return getInt("audit.plug.skip-columns", 3);
    }

    public int getPlugMinCells() {
        return getInt("audit.plug.min-cells", 5);
    }

    public double getPlugFormulaRatio() {
        return getDouble("audit.plug.formula-ratio", 0.7);
    }

    public List<String> getPlugExcludedSheetKeywords() {
        String keywords = properties.getProperty("audit.plug.excluded-sheet-keywords", "raw,cache");
        if (keywords.isBlank()) {
            return List.of();
        }
        return Arrays.stream(keywords.split(","))
                .map(s -> s.trim().toLowerCase(Locale.ROOT))
                .filter(s -> !s.isEmpty())
                .toList();
    }

    public double getBalanceTolerance() {
        return getDouble("audit.balance.tolerance", 1.0);
    }

    public int getMaxReportedCircularReferences() {
        return getInt("audit.circular.max-reported", 25);
    }

    private int getInt(String key, int defaultValue) {
        return (int) getLong(key, defaultValue);
    }

    private long getLong(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for " + key + ": " + value, e);
        }
    }

    private double getDouble(String key, double defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid number for " + key + ": " + value, e);
        }
    }
}
