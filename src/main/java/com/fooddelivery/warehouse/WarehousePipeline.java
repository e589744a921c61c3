package com.fooddelivery.warehouse;

import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.SparkSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Full-reload pipeline: raw orders are validated, deduplicated, split into dimensions and loaded
 * into the fact table, and the result is published as a new warehouse snapshot.
 */
public class WarehousePipeline {

    private static final Logger logger = LoggerFactory.getLogger(WarehousePipeline.class);

    private final WarehouseConfig config;
    private final SnapshotRegistry registry;
    private final RawOrderReader reader;
    private final OrderCleaner cleaner;
    private final OrderValidator validator;
    private final OrderDeduplicator deduplicator;
    private final DimensionBuilder dimensionBuilder;
    private final FactLoader factLoader;

    public WarehousePipeline(SparkSession spark, WarehouseConfig config) {
        this(spark, config, new SnapshotRegistry());
    }

    public WarehousePipeline(SparkSession spark, WarehouseConfig config, SnapshotRegistry registry) {
        this.config = config;
        this.registry = registry;
        this.reader = new RawOrderReader(spark);
        this.cleaner = new OrderCleaner(config.datePatterns());
        this.validator = new OrderValidator();
        this.deduplicator = new OrderDeduplicator();
        this.dimensionBuilder = new DimensionBuilder();
        this.factLoader = new FactLoader();
    }

    /**
     * Runs the whole pipeline over a CSV feed: rebuild, persist the snapshot, write every report.
     */
    public WarehouseSnapshot execute(String inputPath, String outputPath) {
        logger.info("Starting food order warehouse pipeline, input={} output={}", inputPath, outputPath);

        Dataset<Row> rawOrders = readAndClean(inputPath);

        WarehouseWriter writer = new WarehouseWriter(outputPath);
        WarehouseSnapshot snapshot = rebuild(rawOrders, config.persistSnapshots() ? writer : null);

        logger.info("Generating reports for snapshot v{}", snapshot.getVersion());
        OrderReports reports = new OrderReports(snapshot);
        for (ReportName report : ReportName.values()) {
            writer.writeReport(report, report.query(reports));
        }

        logger.info("Pipeline execution completed, snapshot v{}", snapshot.getVersion());
        return snapshot;
    }

    /**
     * Reads the feed and coerces it to typed raw orders.
     */
    public Dataset<Row> readAndClean(String inputPath) {
        return cleaner.normalize(reader.read(inputPath));
    }

    public WarehouseSnapshot rebuild(Dataset<Row> rawOrders) {
        return rebuild(rawOrders, null);
    }

    /**
     * Builds a new snapshot from typed raw orders and publishes it. When {@code writer} is given the
     * snapshot is persisted before it is published, numbered after every version already on disk.
     * On any failure the previous snapshot stays current.
     *
     * @throws RebuildFailureException if any stage fails
     */
    public WarehouseSnapshot rebuild(Dataset<Row> rawOrders, WarehouseWriter writer) {
        try {
            long persistedVersion = writer == null ? 0 : writer.latestVersion();
            return registry.rebuild(persistedVersion, version -> buildSnapshot(version, rawOrders, writer));
        } catch (RebuildFailureException e) {
            throw e;
        } catch (Exception e) {
            logger.error("Warehouse rebuild failed, keeping snapshot {}",
                registry.current().map(s -> "v" + s.getVersion()).orElse("(none)"), e);
            throw new RebuildFailureException("Warehouse rebuild failed: " + e.getMessage(), e);
        }
    }

    private WarehouseSnapshot buildSnapshot(long version, Dataset<Row> rawOrders, WarehouseWriter writer) {
        logger.info("Step 1: Validating raw orders");
        ValidationReport validation = validator.validate(rawOrders);

        logger.info("Step 2: Removing duplicate orders");
        logger.info("Found {} groups of duplicate orders", deduplicator.findDuplicates(rawOrders).count());
        Dataset<Row> orders = deduplicator.deduplicate(rawOrders).localCheckpoint();
        long orderCount = orders.count();
        logger.info("{} of {} raw orders remain after deduplication", orderCount, validation.getTotalRecords());

        logger.info("Step 3: Building dimensions");
        Dimensions dimensions = materialize(dimensionBuilder.build(orders));

        logger.info("Step 4: Loading fact table");
        Dataset<Row> facts = factLoader.load(orders, dimensions).localCheckpoint();
        long factCount = facts.count();
        if (factCount < orderCount) {
            logger.info("{} orders did not resolve against every dimension and were left out of the fact table",
                orderCount - factCount);
        }
        logger.info("Loaded {} fact rows", factCount);

        WarehouseSnapshot snapshot = new WarehouseSnapshot(version, Instant.now(), dimensions, facts, validation);
        if (writer != null) {
            writer.writeSnapshot(snapshot);
        }
        return snapshot;
    }

    /**
     * Checkpoints the five dimensions concurrently; they share no state.
     */
    private Dimensions materialize(Dimensions lazy) {
        Map<String, Dataset<Row>> tables = lazy.tables();
        ExecutorService executor = Executors.newFixedThreadPool(tables.size());
        try {
            List<Callable<Dataset<Row>>> tasks = new ArrayList<>();
            for (Map.Entry<String, Dataset<Row>> table : tables.entrySet()) {
                tasks.add(() -> {
                    Dataset<Row> checkpointed = table.getValue().localCheckpoint();
                    logger.info("Built {} with {} rows", table.getKey(), checkpointed.count());
                    return checkpointed;
                });
            }
            List<Future<Dataset<Row>>> futures = executor.invokeAll(tasks);
            return new Dimensions(futures.get(0).get(), futures.get(1).get(), futures.get(2).get(),
                futures.get(3).get(), futures.get(4).get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RebuildFailureException("Interrupted while building dimensions", e);
        } catch (ExecutionException e) {
            throw new RebuildFailureException("Dimension build failed: " + e.getCause().getMessage(), e.getCause());
        } finally {
            executor.shutdown();
        }
    }

    public SnapshotRegistry getRegistry() {
        return registry;
    }

    public ReportService reportService() {
        return new ReportService(registry);
    }
}
