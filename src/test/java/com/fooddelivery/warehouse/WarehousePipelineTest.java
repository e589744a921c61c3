package com.fooddelivery.warehouse;

import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.SparkSession;
import org.junit.jupiter.api.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

import static com.fooddelivery.warehouse.OrderFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for WarehousePipeline rebuilds
 */
public class WarehousePipelineTest {

    private static SparkSession spark;
    private WarehousePipeline pipeline;
    private String testOutputPath;

    @BeforeAll
    public static void setUpSpark() {
        spark = localSpark("WarehousePipelineTest");
    }

    @AfterAll
    public static void tearDownSpark() {
        if (spark != null) {
            spark.stop();
        }
    }

    @BeforeEach
    public void setUp() {
        pipeline = new WarehousePipeline(spark, WarehouseConfig.of(new Properties()));
        testOutputPath = "test_pipeline_output_" + System.currentTimeMillis();
    }

    @AfterEach
    public void tearDown() throws Exception {
        WarehouseWriter.deleteRecursively(Paths.get(testOutputPath));
    }

    @Test
    public void testRebuild_DuplicateOrdersBecomeOneFact() {
        WarehouseSnapshot snapshot = pipeline.rebuild(rawOrders(spark, austinPizza(), austinPizza()));

        assertEquals(1, snapshot.getVersion());
        assertEquals(2, snapshot.getValidation().getTotalRecords());
        assertEquals(1, snapshot.getFacts().count());
        for (Dataset<Row> dimension : snapshot.getDimensions().tables().values()) {
            assertEquals(1, dimension.count());
        }
        assertEquals(6, snapshot.tables().size());
        assertSame(snapshot, pipeline.getRegistry().current().orElseThrow(IllegalStateException::new));
    }

    @Test
    public void testRebuild_PreviousSnapshotStaysReadable() {
        WarehouseSnapshot first = pipeline.rebuild(rawOrders(spark, austinPizza()));
        WarehouseSnapshot second = pipeline.rebuild(rawOrders(spark,
            austinPizza(),
            order("TX", "Dallas", "L2", "R2", "Burgers", "Whopper", "2024-02-10", 150, 4.0, 30)
        ));

        assertEquals(2, second.getVersion());
        assertEquals(2, second.getFacts().count());
        assertEquals(1, first.getFacts().count(), "An older snapshot is not changed by a rebuild");
        assertEquals(1, new OrderReports(first).totalOrders());
    }

    @Test
    public void testRebuild_FailureKeepsPreviousSnapshot() {
        WarehouseSnapshot first = pipeline.rebuild(rawOrders(spark, austinPizza()));

        assertThrows(RebuildFailureException.class, () -> pipeline.rebuild(spark.range(5).toDF()));

        assertSame(first, pipeline.getRegistry().current().orElseThrow(IllegalStateException::new));
        assertEquals(2, pipeline.rebuild(rawOrders(spark, austinPizza())).getVersion());
    }

    @Test
    public void testRebuild_PersistsSnapshotAndMovesCurrentPointer() {
        WarehouseWriter writer = new WarehouseWriter(testOutputPath);

        pipeline.rebuild(rawOrders(spark, austinPizza()), writer);
        pipeline.rebuild(rawOrders(spark, austinPizza(),
            order("TX", "Dallas", "L2", "R2", "Burgers", "Whopper", "2024-02-10", 150, 4.0, 30)), writer);

        assertEquals(2, writer.currentVersion().getAsLong());
        for (String table : new String[] {Dimensions.DATE, Dimensions.LOCATION, Dimensions.RESTAURANT,
            Dimensions.CATEGORY, Dimensions.DISH, WarehouseSnapshot.FACT}) {
            assertTrue(Files.isDirectory(writer.snapshotPath(2).resolve(table)), table + " should be persisted");
        }
        assertTrue(Files.isDirectory(writer.snapshotPath(1)), "Older snapshots are kept on disk");
        assertEquals(2, writer.readCurrentTable(spark, WarehouseSnapshot.FACT).count());
    }

    @Test
    public void testRebuild_FailedPersistIsNotPublished() throws Exception {
        WarehouseWriter writer = new WarehouseWriter(testOutputPath);
        WarehouseSnapshot first = pipeline.rebuild(rawOrders(spark, austinPizza()), writer);

        // a plain file where the snapshot directory tree has to go
        Path snapshots = Paths.get(testOutputPath, "snapshots");
        WarehouseWriter.deleteRecursively(snapshots);
        Files.write(snapshots, new byte[0]);

        assertThrows(RebuildFailureException.class, () -> pipeline.rebuild(rawOrders(spark, austinPizza()), writer));

        assertSame(first, pipeline.getRegistry().current().orElseThrow(IllegalStateException::new));
        assertEquals(1, writer.currentVersion().getAsLong());
    }

    @Test
    public void testRebuild_NewProcessContinuesPersistedVersions() {
        new WarehousePipeline(spark, WarehouseConfig.of(new Properties()))
            .rebuild(rawOrders(spark, austinPizza()), new WarehouseWriter(testOutputPath));

        WarehousePipeline restarted = new WarehousePipeline(spark, WarehouseConfig.of(new Properties()));
        WarehouseWriter writer = new WarehouseWriter(testOutputPath);
        WarehouseSnapshot second = restarted.rebuild(rawOrders(spark, austinPizza(),
            order("TX", "Dallas", "L2", "R2", "Burgers", "Whopper", "2024-02-10", 150, 4.0, 30)), writer);

        assertEquals(2, second.getVersion());
        assertEquals(2, writer.currentVersion().getAsLong());
        assertTrue(Files.isDirectory(writer.snapshotPath(2)));
        assertEquals(1, spark.read().parquet(writer.snapshotPath(1).resolve(WarehouseSnapshot.FACT).toString()).count(),
            "The first process's snapshot is left as it was");
        assertEquals(2, writer.readCurrentTable(spark, WarehouseSnapshot.FACT).count());
    }
}
