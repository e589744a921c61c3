package com.fooddelivery.warehouse;

import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.RowFactory;
import org.apache.spark.sql.SparkSession;
import org.apache.spark.sql.types.DataTypes;

import java.math.BigDecimal;
import java.sql.Date;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Shared helpers for building typed raw orders in tests.
 */
final class OrderFixtures {

    private OrderFixtures() {
    }

    static SparkSession localSpark(String appName) {
        // Disable security for local testing (avoids Java 17+ Subject.getSubject() issues)
        System.setProperty("java.security.auth.login.config", "NONE");
        System.setProperty("hadoop.security.authentication", "simple");

        return SparkSession.builder()
            .appName(appName)
            .master("local[2]")
            .config("spark.driver.host", "localhost")
            .config("spark.driver.bindAddress", "127.0.0.1")
            .config("spark.hadoop.fs.defaultFS", "file:///")
            .config("spark.sql.shuffle.partitions", "4")
            .config("spark.ui.enabled", "false")
            .getOrCreate();
    }

    /**
     * A typed raw order; date may be null, price and rating are given as plain numbers.
     */
    static Row order(String state, String city, String location, String restaurant, String category,
                     String dish, String date, Number price, Number rating, Integer ratingCount) {
        return RowFactory.create(state, city, location, restaurant, category, dish,
            date == null ? null : Date.valueOf(date),
            price == null ? null : new BigDecimal(price.toString()),
            rating == null ? null : new BigDecimal(rating.toString()),
            ratingCount);
    }

    /**
     * Order at a fixed place and date, varying only what the report tests care about.
     */
    static Row order(String city, String restaurant, String category, String dish, String date, Number price) {
        return order("ST", city, "L1", restaurant, category, dish, date, price, 4.0, 10);
    }

    static Dataset<Row> rawOrders(SparkSession spark, Row... rows) {
        return spark.createDataFrame(Arrays.asList(rows), OrderColumns.rawOrderSchema());
    }

    /**
     * Raw orders with an explicit ingest_seq, taken from the row's position in the argument list.
     */
    static Dataset<Row> sequencedOrders(SparkSession spark, Row... rows) {
        List<Row> sequenced = new ArrayList<>();
        for (int i = 0; i < rows.length; i++) {
            Object[] values = new Object[rows[i].length() + 1];
            for (int j = 0; j < rows[i].length(); j++) {
                values[j] = rows[i].get(j);
            }
            values[rows[i].length()] = (long) i;
            sequenced.add(RowFactory.create(values));
        }
        return spark.createDataFrame(sequenced,
            OrderColumns.rawOrderSchema().add(OrderColumns.INGEST_SEQ, DataTypes.LongType, false));
    }

    static Row austinPizza() {
        return order("TX", "Austin", "L1", "R1", "Pizza", "Margherita", "2024-01-01", 200, 4.5, 10);
    }
}
