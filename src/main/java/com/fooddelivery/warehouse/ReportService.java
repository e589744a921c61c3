package com.fooddelivery.warehouse;

import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Runs catalog reports against the currently published snapshot.
 */
public class ReportService {

    private static final Logger logger = LoggerFactory.getLogger(ReportService.class);

    private final SnapshotRegistry registry;

    public ReportService(SnapshotRegistry registry) {
        this.registry = registry;
    }

    /**
     * Runs one report and collects its rows.
     *
     * @throws ReportException if no snapshot has been built yet or the query fails
     */
    public ReportResult run(ReportName report) {
        return run(report, currentSnapshot(report));
    }

    /**
     * Runs the given reports concurrently, all against the same snapshot. Each future fails on
     * its own with a {@link ReportException} without affecting the others.
     */
    public Map<ReportName, CompletableFuture<ReportResult>> runAll(Collection<ReportName> reports, Executor executor) {
        Map<ReportName, CompletableFuture<ReportResult>> results = new EnumMap<>(ReportName.class);
        if (reports.isEmpty()) {
            return results;
        }
        WarehouseSnapshot snapshot = currentSnapshot(reports.iterator().next());
        for (ReportName report : reports) {
            results.put(report, CompletableFuture.supplyAsync(() -> run(report, snapshot), executor));
        }
        return results;
    }

    private ReportResult run(ReportName report, WarehouseSnapshot snapshot) {
        long start = System.nanoTime();
        try {
            Dataset<Row> rows = report.query(new OrderReports(snapshot));
            ReportResult result = new ReportResult(report, snapshot.getVersion(), rows.columns(), rows.collectAsList());
            logger.debug("Report {} on v{} returned {} rows in {} ms", report.fileName(), snapshot.getVersion(),
                result.size(), (System.nanoTime() - start) / 1_000_000);
            return result;
        } catch (Exception e) {
            // analysis errors surface as checked exceptions from Spark
            logger.error("Report {} failed on snapshot v{}", report.fileName(), snapshot.getVersion(), e);
            throw new ReportException(report, "Report " + report.fileName() + " failed: " + e.getMessage(), e);
        }
    }

    private WarehouseSnapshot currentSnapshot(ReportName report) {
        return registry.current().orElseThrow(() ->
            new ReportException(report, "No warehouse snapshot has been built yet"));
    }
}
