package com.fooddelivery.warehouse;

import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Advisory findings about a raw order set. Never blocks the pipeline.
 */
public class ValidationReport {

    private final long totalRecords;
    private final Map<String, Long> nullCounts;
    private final Dataset<Row> blankRecords;
    private final long blankRecordCount;

    public ValidationReport(long totalRecords, Map<String, Long> nullCounts,
                            Dataset<Row> blankRecords, long blankRecordCount) {
        this.totalRecords = totalRecords;
        this.nullCounts = Collections.unmodifiableMap(new LinkedHashMap<>(nullCounts));
        this.blankRecords = blankRecords;
        this.blankRecordCount = blankRecordCount;
    }

    public long getTotalRecords() {
        return totalRecords;
    }

    /**
     * Null count per business column, in feed column order.
     */
    public Map<String, Long> getNullCounts() {
        return nullCounts;
    }

    public long nullCount(String column) {
        Long count = nullCounts.get(column);
        if (count == null) {
            throw new IllegalArgumentException("Unknown column: " + column);
        }
        return count;
    }

    /**
     * Records where at least one required text column is an empty or whitespace-only string.
     */
    public Dataset<Row> getBlankRecords() {
        return blankRecords;
    }

    public long getBlankRecordCount() {
        return blankRecordCount;
    }

    public boolean isClean() {
        return blankRecordCount == 0 && nullCounts.values().stream().allMatch(count -> count == 0);
    }

    @Override
    public String toString() {
        return "ValidationReport{totalRecords=" + totalRecords
            + ", nullCounts=" + nullCounts
            + ", blankRecords=" + blankRecordCount + "}";
    }
}
