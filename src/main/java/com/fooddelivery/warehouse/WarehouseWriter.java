package com.fooddelivery.warehouse;

import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.SparkSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.Map;
import java.util.OptionalLong;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Persists warehouse snapshots and reports under an output directory.
 *
 * <p>Layout: {@code snapshots/v<N>/<table>} as Parquet, a {@code CURRENT} file naming the
 * live version, and {@code reports/<report>} as single-file CSV. A snapshot is written to a
 * staging directory first; only a complete snapshot is renamed into place and made current.
 * An existing version directory is never replaced.
 */
public class WarehouseWriter {

    private static final Logger logger = LoggerFactory.getLogger(WarehouseWriter.class);

    static final String CURRENT = "CURRENT";

    private static final Pattern SNAPSHOT_DIR = Pattern.compile("v\\d+");

    private final Path outputPath;

    public WarehouseWriter(String outputPath) {
        this.outputPath = Paths.get(outputPath);
    }

    public Path snapshotPath(long version) {
        return outputPath.resolve("snapshots").resolve("v" + version);
    }

    public void writeSnapshot(WarehouseSnapshot snapshot) {
        Path target = snapshotPath(snapshot.getVersion());
        if (Files.exists(target)) {
            throw new IllegalStateException("Snapshot v" + snapshot.getVersion() + " already exists under " + outputPath);
        }
        Path staging = target.resolveSibling(".v" + snapshot.getVersion() + "-staging");
        try {
            deleteRecursively(staging);
            for (Map.Entry<String, Dataset<Row>> table : snapshot.tables().entrySet()) {
                table.getValue()
                    .write()
                    .mode("overwrite")
                    .parquet(staging.resolve(table.getKey()).toString());
                logger.debug("Wrote {} for snapshot v{}", table.getKey(), snapshot.getVersion());
            }
            Files.move(staging, target, StandardCopyOption.ATOMIC_MOVE);
            markCurrent(snapshot.getVersion());
            logger.info("Snapshot v{} persisted to {}", snapshot.getVersion(), target);
        } catch (IOException e) {
            deleteQuietly(staging);
            throw new UncheckedIOException("Failed to persist snapshot v" + snapshot.getVersion(), e);
        } catch (Exception e) {
            deleteQuietly(staging);
            throw e;
        }
    }

    /**
     * Version named by the CURRENT pointer, if any snapshot has been persisted.
     */
    public OptionalLong currentVersion() {
        Path pointer = outputPath.resolve(CURRENT);
        if (!Files.exists(pointer)) {
            return OptionalLong.empty();
        }
        try {
            String content = new String(Files.readAllBytes(pointer), StandardCharsets.UTF_8).trim();
            return OptionalLong.of(Long.parseLong(content));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + pointer, e);
        }
    }

    /**
     * Highest snapshot version found on disk, either as a {@code snapshots/v<N>} directory or named
     * by the CURRENT pointer; 0 when nothing has been persisted.
     */
    public long latestVersion() {
        long latest = currentVersion().orElse(0);
        Path snapshots = outputPath.resolve("snapshots");
        if (!Files.isDirectory(snapshots)) {
            return latest;
        }
        try (Stream<Path> children = Files.list(snapshots)) {
            for (Path child : (Iterable<Path>) children::iterator) {
                String name = child.getFileName().toString();
                if (Files.isDirectory(child) && SNAPSHOT_DIR.matcher(name).matches()) {
                    latest = Math.max(latest, Long.parseLong(name.substring(1)));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list " + snapshots, e);
        }
        return latest;
    }

    /**
     * Reads one table of the current persisted snapshot.
     */
    public Dataset<Row> readCurrentTable(SparkSession spark, String table) {
        OptionalLong version = currentVersion();
        if (!version.isPresent()) {
            throw new IllegalStateException("No snapshot has been persisted under " + outputPath);
        }
        return spark.read().parquet(snapshotPath(version.getAsLong()).resolve(table).toString());
    }

    public void writeReport(ReportName report, Dataset<Row> rows) {
        rows.coalesce(1)
            .write()
            .mode("overwrite")
            .option("header", "true")
            .csv(outputPath.resolve("reports").resolve(report.fileName()).toString());
        logger.info("Generated report {}", report.fileName());
    }

    private void markCurrent(long version) throws IOException {
        Path pointer = outputPath.resolve(CURRENT);
        Path temp = outputPath.resolve(CURRENT + ".tmp");
        Files.write(temp, Long.toString(version).getBytes(StandardCharsets.UTF_8));
        Files.move(temp, pointer, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    }

    static void deleteRecursively(Path path) throws IOException {
        if (!Files.exists(path)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(path)) {
            for (Path p : (Iterable<Path>) walk.sorted(Comparator.reverseOrder())::iterator) {
                Files.delete(p);
            }
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            deleteRecursively(path);
        } catch (IOException e) {
            logger.warn("Could not remove staging directory {}: {}", path, e.getMessage());
        }
    }
}
