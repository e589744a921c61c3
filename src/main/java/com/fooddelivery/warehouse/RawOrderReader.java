package com.fooddelivery.warehouse;

import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.SparkSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

import static org.apache.spark.sql.functions.*;

/**
 * Loads the CSV order feed and tags each record with its position in the feed.
 */
public class RawOrderReader {

    private static final Logger logger = LoggerFactory.getLogger(RawOrderReader.class);

    static final String CORRUPT_RECORD = "_corrupt_record";

    private final SparkSession spark;

    public RawOrderReader(SparkSession spark) {
        this.spark = spark;
    }

    /**
     * Reads the feed with an explicit string schema; malformed lines are dropped.
     */
    public Dataset<Row> read(String inputPath) {
        logger.info("Reading order feed from {}", inputPath);

        Dataset<Row> df = spark.read()
            .option("header", "true")
            .option("inferSchema", "false")
            .option("mode", "PERMISSIVE")
            .option("columnNameOfCorruptRecord", CORRUPT_RECORD)
            .schema(OrderColumns.feedSchema().add(CORRUPT_RECORD, "string", true))
            .csv(inputPath);

        // Spark refuses queries that only reference the corrupt record column unless the input is cached
        df.cache();
        Dataset<Row> wellFormed = df.filter(col(CORRUPT_RECORD).isNull()).drop(CORRUPT_RECORD);
        return withIngestSequence(wellFormed);
    }

    /**
     * Adds the ingestion sequence column unless the data set already carries one.
     */
    public static Dataset<Row> withIngestSequence(Dataset<Row> df) {
        if (Arrays.asList(df.columns()).contains(OrderColumns.INGEST_SEQ)) {
            return df;
        }
        return df.withColumn(OrderColumns.INGEST_SEQ, monotonically_increasing_id());
    }
}
