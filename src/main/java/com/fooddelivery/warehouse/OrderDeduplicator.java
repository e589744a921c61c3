package com.fooddelivery.warehouse;

import org.apache.spark.sql.Column;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.expressions.Window;
import org.apache.spark.sql.expressions.WindowSpec;

import static org.apache.spark.sql.functions.*;

/**
 * Collapses raw orders that are identical across every business column.
 * The earliest record in feed order (lowest ingest_seq) is the one kept.
 */
public class OrderDeduplicator {

    private static final String ROW_NUMBER = "_dup_rn";

    public Dataset<Row> deduplicate(Dataset<Row> rawOrders) {
        Dataset<Row> sequenced = RawOrderReader.withIngestSequence(rawOrders);

        Column[] businessKey = new Column[OrderColumns.BUSINESS_COLUMNS.length];
        for (int i = 0; i < businessKey.length; i++) {
            businessKey[i] = col(OrderColumns.BUSINESS_COLUMNS[i]);
        }
        // Window partitioning groups nulls together, as GROUP BY does
        WindowSpec duplicates = Window.partitionBy(businessKey).orderBy(col(OrderColumns.INGEST_SEQ).asc());

        return sequenced
            .withColumn(ROW_NUMBER, row_number().over(duplicates))
            .filter(col(ROW_NUMBER).equalTo(1))
            .drop(ROW_NUMBER);
    }

    /**
     * Groups of identical records with more than one member, with their size in duplicate_count.
     */
    public Dataset<Row> findDuplicates(Dataset<Row> rawOrders) {
        return rawOrders
            .groupBy(OrderColumns.BUSINESS_COLUMNS[0], tail(OrderColumns.BUSINESS_COLUMNS))
            .agg(count(lit(1)).alias("duplicate_count"))
            .filter(col("duplicate_count").gt(1));
    }

    private static String[] tail(String[] columns) {
        String[] rest = new String[columns.length - 1];
        System.arraycopy(columns, 1, rest, 0, rest.length);
        return rest;
    }
}
