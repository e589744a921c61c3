package com.fooddelivery.warehouse;

import org.apache.spark.sql.Column;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.api.java.UDF1;
import org.apache.spark.sql.expressions.UserDefinedFunction;
import org.apache.spark.sql.types.DataType;
import org.apache.spark.sql.types.DataTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;

import static org.apache.spark.sql.functions.*;

/**
 * Coerces the all-string feed into typed raw orders.
 * Text columns are passed through untouched so blank values stay visible to the validator.
 */
public class OrderCleaner {

    private static final Logger logger = LoggerFactory.getLogger(OrderCleaner.class);

    private static final String DECIMAL_PATTERN = "^-?\\d+(\\.\\d+)?$";
    private static final String INTEGER_PATTERN = "^\\d+$";

    private final String[] datePatterns;

    public OrderCleaner(List<String> datePatterns) {
        if (datePatterns.isEmpty()) {
            throw new IllegalArgumentException("At least one date pattern is required");
        }
        this.datePatterns = datePatterns.toArray(new String[0]);
    }

    /**
     * Applies every column rule and returns the typed raw order set.
     */
    public Dataset<Row> normalize(Dataset<Row> feed) {
        Dataset<Row> cleaned = cleanOrderDate(feed);
        cleaned = cleanPrice(cleaned);
        cleaned = cleanRating(cleaned);
        cleaned = cleanRatingCount(cleaned);
        return cleaned;
    }

    /**
     * Parse order_date against the configured patterns; unparseable values become null
     */
    public Dataset<Row> cleanOrderDate(Dataset<Row> df) {
        String[] patterns = datePatterns;
        UserDefinedFunction parseDate = udf(
            (UDF1<String, String>) value -> parseIsoDate(value, patterns),
            DataTypes.StringType
        );

        return df.withColumn(OrderColumns.ORDER_DATE,
            to_date(parseDate.apply(col(OrderColumns.ORDER_DATE).cast(DataTypes.StringType)), "yyyy-MM-dd")
        );
    }

    public Dataset<Row> cleanPrice(Dataset<Row> df) {
        return df.withColumn(OrderColumns.PRICE,
            parseNumber(OrderColumns.PRICE, DECIMAL_PATTERN, DataTypes.createDecimalType(10, 2)));
    }

    public Dataset<Row> cleanRating(Dataset<Row> df) {
        return df.withColumn(OrderColumns.RATING,
            parseNumber(OrderColumns.RATING, DECIMAL_PATTERN, DataTypes.createDecimalType(4, 2)));
    }

    public Dataset<Row> cleanRatingCount(Dataset<Row> df) {
        return df.withColumn(OrderColumns.RATING_COUNT,
            parseNumber(OrderColumns.RATING_COUNT, INTEGER_PATTERN, DataTypes.IntegerType));
    }

    private static Column parseNumber(String column, String pattern, DataType type) {
        Column trimmed = trim(col(column).cast(DataTypes.StringType));
        return when(trimmed.rlike(pattern), trimmed.cast(type))
            .otherwise(lit(null).cast(type));
    }

    /**
     * Returns the date in yyyy-MM-dd form, or null when no pattern matches strictly.
     */
    static String parseIsoDate(String value, String[] patterns) {
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        String trimmed = value.trim();
        DateTimeParseException lastFailure = null;
        for (String pattern : patterns) {
            // STRICT resolution needs proleptic years
            DateTimeFormatter formatter = DateTimeFormatter.ofPattern(pattern.replace("yyyy", "uuuu"))
                .withResolverStyle(ResolverStyle.STRICT);
            try {
                return LocalDate.parse(trimmed, formatter).toString();
            } catch (DateTimeParseException e) {
                lastFailure = e;
            }
        }
        if (lastFailure != null && logger.isTraceEnabled()) {
            logger.trace("No date pattern matches '{}': {}", trimmed, lastFailure.getMessage());
        }
        return null;
    }
}
