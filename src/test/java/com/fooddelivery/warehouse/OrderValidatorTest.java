package com.fooddelivery.warehouse;

import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.SparkSession;
import org.junit.jupiter.api.*;

import java.util.List;

import static com.fooddelivery.warehouse.OrderFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for OrderValidator
 */
public class OrderValidatorTest {

    private static SparkSession spark;
    private OrderValidator validator;

    @BeforeAll
    public static void setUpSpark() {
        spark = localSpark("OrderValidatorTest");
    }

    @AfterAll
    public static void tearDownSpark() {
        if (spark != null) {
            spark.stop();
        }
    }

    @BeforeEach
    public void setUp() {
        validator = new OrderValidator();
    }

    @Test
    public void testValidate_CountsNullsPerColumn() {
        Dataset<Row> raw = rawOrders(spark,
            austinPizza(),
            order(null, "Austin", "L1", "R1", "Pizza", "Margherita", null, 200, 4.5, 10),
            order("TX", null, "L1", "R1", null, "Margherita", null, null, null, null)
        );

        ValidationReport report = validator.validate(raw);

        assertEquals(3, report.getTotalRecords());
        assertEquals(1, report.nullCount(OrderColumns.STATE));
        assertEquals(1, report.nullCount(OrderColumns.CITY));
        assertEquals(0, report.nullCount(OrderColumns.LOCATION));
        assertEquals(1, report.nullCount(OrderColumns.CATEGORY));
        assertEquals(2, report.nullCount(OrderColumns.ORDER_DATE));
        assertEquals(1, report.nullCount(OrderColumns.PRICE));
        assertEquals(1, report.nullCount(OrderColumns.RATING));
        assertEquals(1, report.nullCount(OrderColumns.RATING_COUNT));
        assertEquals(10, report.getNullCounts().size());
        assertFalse(report.isClean());
    }

    @Test
    public void testValidate_FindsBlankRequiredFields() {
        Dataset<Row> raw = rawOrders(spark,
            austinPizza(),
            order("TX", "", "L1", "R1", "Pizza", "Margherita", "2024-01-01", 200, 4.5, 10),
            order("TX", "Austin", "   ", "R1", "Pizza", "Margherita", "2024-01-01", 200, 4.5, 10),
            order("TX", "Austin", "L1", "R1", "Pizza", "", "2024-01-01", 200, 4.5, 10),
            // null is counted as missing, not as blank
            order("TX", "Austin", "L1", null, "Pizza", "Margherita", "2024-01-01", 200, 4.5, 10)
        );

        ValidationReport report = validator.validate(raw);

        assertEquals(3, report.getBlankRecordCount());
        List<Row> blanks = report.getBlankRecords().collectAsList();
        assertEquals(3, blanks.size());
        assertEquals(1, report.nullCount(OrderColumns.RESTAURANT_NAME));
    }

    @Test
    public void testValidate_DoesNotChangeInput() {
        Dataset<Row> raw = rawOrders(spark,
            austinPizza(),
            order("TX", "", "L1", "R1", "Pizza", "Margherita", null, 200, 4.5, 10)
        );

        validator.validate(raw);

        assertEquals(2, raw.count());
    }

    @Test
    public void testValidate_CleanAndEmptyInputs() {
        ValidationReport clean = validator.validate(rawOrders(spark, austinPizza()));
        assertTrue(clean.isClean());

        ValidationReport empty = validator.validate(rawOrders(spark));
        assertEquals(0, empty.getTotalRecords());
        assertEquals(0, empty.nullCount(OrderColumns.STATE));
        assertTrue(empty.isClean());
    }

    @Test
    public void testNullCount_UnknownColumnIsRejected() {
        ValidationReport report = validator.validate(rawOrders(spark, austinPizza()));
        assertThrows(IllegalArgumentException.class, () -> report.nullCount("no_such_column"));
    }
}
