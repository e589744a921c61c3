package com.fooddelivery.warehouse;

import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * The five dimension tables of one warehouse build.
 */
public class Dimensions {

    public static final String DATE = "dim_date";
    public static final String LOCATION = "dim_location";
    public static final String RESTAURANT = "dim_restaurant";
    public static final String CATEGORY = "dim_category";
    public static final String DISH = "dim_dish";

    private final Dataset<Row> date;
    private final Dataset<Row> location;
    private final Dataset<Row> restaurant;
    private final Dataset<Row> category;
    private final Dataset<Row> dish;

    public Dimensions(Dataset<Row> date, Dataset<Row> location, Dataset<Row> restaurant,
                      Dataset<Row> category, Dataset<Row> dish) {
        this.date = date;
        this.location = location;
        this.restaurant = restaurant;
        this.category = category;
        this.dish = dish;
    }

    public Dataset<Row> date() {
        return date;
    }

    public Dataset<Row> location() {
        return location;
    }

    public Dataset<Row> restaurant() {
        return restaurant;
    }

    public Dataset<Row> category() {
        return category;
    }

    public Dataset<Row> dish() {
        return dish;
    }

    /**
     * Tables keyed by their table name, in build order.
     */
    public Map<String, Dataset<Row>> tables() {
        Map<String, Dataset<Row>> tables = new LinkedHashMap<>();
        tables.put(DATE, date);
        tables.put(LOCATION, location);
        tables.put(RESTAURANT, restaurant);
        tables.put(CATEGORY, category);
        tables.put(DISH, dish);
        return Collections.unmodifiableMap(tables);
    }

    public Dimensions map(UnaryOperator<Dataset<Row>> operator) {
        return new Dimensions(operator.apply(date), operator.apply(location), operator.apply(restaurant),
            operator.apply(category), operator.apply(dish));
    }
}
