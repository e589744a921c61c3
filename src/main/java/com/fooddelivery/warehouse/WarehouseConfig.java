package com.fooddelivery.warehouse;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

/**
 * Runtime settings for the warehouse, read from {@code warehouse.properties} on the classpath.
 * Any key can be overridden by a JVM system property of the same name.
 */
public class WarehouseConfig {

    public static final String RESOURCE = "warehouse.properties";

    static final String APP_NAME = "warehouse.app-name";
    static final String SPARK_MASTER = "warehouse.spark.master";
    static final String SHUFFLE_PARTITIONS = "warehouse.spark.shuffle-partitions";
    static final String INPUT_PATH = "warehouse.input-path";
    static final String OUTPUT_PATH = "warehouse.output-path";
    static final String DATE_PATTERNS = "warehouse.date-patterns";
    static final String PERSIST = "warehouse.persist-snapshots";

    private final Properties properties;

    WarehouseConfig(Properties properties) {
        this.properties = properties;
    }

    /**
     * Loads the bundled defaults and applies system property overrides.
     */
    public static WarehouseConfig load() {
        Properties properties = new Properties();
        try (InputStream in = WarehouseConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read " + RESOURCE, e);
        }
        for (String key : properties.stringPropertyNames()) {
            String override = System.getProperty(key);
            if (override != null) {
                properties.setProperty(key, override);
            }
        }
        return new WarehouseConfig(properties);
    }

    public static WarehouseConfig of(Properties properties) {
        Properties copy = new Properties();
        copy.putAll(properties);
        return new WarehouseConfig(copy);
    }

    public String appName() {
        return properties.getProperty(APP_NAME, "FoodOrderWarehouse");
    }

    public String sparkMaster() {
        return properties.getProperty(SPARK_MASTER, "local[*]");
    }

    public int shufflePartitions() {
        return Integer.parseInt(properties.getProperty(SHUFFLE_PARTITIONS, "8").trim());
    }

    public String inputPath() {
        return properties.getProperty(INPUT_PATH, "data/food_orders.csv");
    }

    public String outputPath() {
        return properties.getProperty(OUTPUT_PATH, "output/");
    }

    public boolean persistSnapshots() {
        return Boolean.parseBoolean(properties.getProperty(PERSIST, "true").trim());
    }

    /**
     * Date patterns tried in order when parsing the order date column.
     */
    public List<String> datePatterns() {
        String raw = properties.getProperty(DATE_PATTERNS, "yyyy-MM-dd");
        List<String> patterns = new ArrayList<>();
        for (String pattern : raw.split(",")) {
            if (!pattern.trim().isEmpty()) {
                patterns.add(pattern.trim());
            }
        }
        return Collections.unmodifiableList(patterns);
    }

    /**
     * Returns a copy with the input and output paths replaced, used for command line arguments.
     */
    public WarehouseConfig withPaths(String inputPath, String outputPath) {
        Properties copy = new Properties();
        copy.putAll(properties);
        copy.setProperty(INPUT_PATH, inputPath);
        copy.setProperty(OUTPUT_PATH, outputPath);
        return new WarehouseConfig(copy);
    }
}
