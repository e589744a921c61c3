package com.fooddelivery.warehouse;

import org.apache.spark.sql.Row;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Collected rows of one report, with the column labels and the snapshot they were read from.
 */
public class ReportResult {

    private final ReportName report;
    private final long snapshotVersion;
    private final List<String> columns;
    private final List<Row> rows;

    public ReportResult(ReportName report, long snapshotVersion, String[] columns, List<Row> rows) {
        this.report = report;
        this.snapshotVersion = snapshotVersion;
        this.columns = Collections.unmodifiableList(Arrays.asList(columns.clone()));
        this.rows = Collections.unmodifiableList(rows);
    }

    public ReportName getReport() {
        return report;
    }

    public long getSnapshotVersion() {
        return snapshotVersion;
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<Row> getRows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    @Override
    public String toString() {
        return report.fileName() + "@v" + snapshotVersion + " " + columns + " (" + rows.size() + " rows)";
    }
}
