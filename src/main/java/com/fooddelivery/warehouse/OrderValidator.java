package com.fooddelivery.warehouse;

import org.apache.spark.sql.Column;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.apache.spark.sql.functions.*;

/**
 * Read-only quality checks over raw orders: null counts per column and blank required fields.
 */
public class OrderValidator {

    private static final Logger logger = LoggerFactory.getLogger(OrderValidator.class);

    public ValidationReport validate(Dataset<Row> rawOrders) {
        String[] columns = OrderColumns.BUSINESS_COLUMNS;

        // One pass: total plus SUM(CASE WHEN c IS NULL THEN 1 ELSE 0 END) per column
        Column[] aggregates = new Column[columns.length];
        for (int i = 0; i < columns.length; i++) {
            aggregates[i] = sum(when(col(columns[i]).isNull(), 1).otherwise(0)).alias(columns[i]);
        }
        Row counts = rawOrders.agg(count(lit(1)).alias("total"), aggregates).first();

        long total = counts.getLong(0);
        Map<String, Long> nullCounts = new LinkedHashMap<>();
        for (int i = 0; i < columns.length; i++) {
            // SUM over an empty set is null
            nullCounts.put(columns[i], counts.isNullAt(i + 1) ? 0L : counts.getLong(i + 1));
        }

        Dataset<Row> blankRecords = rawOrders.filter(anyBlank());
        long blankCount = blankRecords.count();

        ValidationReport report = new ValidationReport(total, nullCounts, blankRecords, blankCount);
        if (report.isClean()) {
            logger.info("Validated {} raw orders, no findings", total);
        } else {
            logger.warn("Validated {} raw orders: null counts {}, {} records with blank required fields",
                total, nullCounts, blankCount);
        }
        return report;
    }

    private static Column anyBlank() {
        Column condition = lit(false);
        for (String column : OrderColumns.REQUIRED_TEXT_COLUMNS) {
            condition = condition.or(coalesce(trim(col(column)).equalTo(""), lit(false)));
        }
        return condition;
    }
}
