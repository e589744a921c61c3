package com.fooddelivery.warehouse;

import org.apache.spark.sql.SparkSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for the food order warehouse.
 *
 * Usage:
 *   java -cp target/classes com.fooddelivery.warehouse.Main [input_csv_path] [output_path]
 *
 * Paths default to warehouse.input-path and warehouse.output-path from warehouse.properties.
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        WarehouseConfig config = WarehouseConfig.load();
        String inputPath = args.length > 0 ? args[0] : config.inputPath();
        String outputPath = args.length > 1 ? args[1] : config.outputPath();
        config = config.withPaths(inputPath, outputPath);

        logger.info("Initializing Spark session {} on {}", config.appName(), config.sparkMaster());
        SparkSession spark = SparkSession.builder()
            .appName(config.appName())
            .master(config.sparkMaster())
            .config("spark.sql.adaptive.enabled", "true")
            .config("spark.sql.shuffle.partitions", String.valueOf(config.shufflePartitions()))
            .getOrCreate();

        int status = 0;
        try {
            WarehousePipeline pipeline = new WarehousePipeline(spark, config);
            WarehouseSnapshot snapshot = pipeline.execute(inputPath, outputPath);
            logger.info("Warehouse built successfully: {}", snapshot);
        } catch (RuntimeException e) {
            logger.error("Error executing pipeline: {}", e.getMessage(), e);
            status = 1;
        } finally {
            spark.stop();
        }
        if (status != 0) {
            System.exit(status);
        }
    }
}
