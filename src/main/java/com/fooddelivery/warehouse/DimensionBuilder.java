package com.fooddelivery.warehouse;

import org.apache.spark.sql.Column;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.expressions.Window;
import org.apache.spark.sql.types.DataTypes;

import static org.apache.spark.sql.functions.*;

/**
 * Derives the date, location, restaurant, category and dish dimensions from deduplicated orders.
 *
 * <p>Each dimension holds the distinct non-null natural keys found in the orders, numbered
 * 1..N in ascending natural-key order. Restaurants and dishes are identified by name alone,
 * so same-named restaurants in different cities share one row.
 *
 * <p>Weeks follow ISO-8601: weeks start on Monday and week 1 contains the first Thursday of the year.
 */
public class DimensionBuilder {

    public Dimensions build(Dataset<Row> orders) {
        return new Dimensions(
            buildDate(orders),
            buildLocation(orders),
            buildRestaurant(orders),
            buildCategory(orders),
            buildDish(orders)
        );
    }

    public Dataset<Row> buildDate(Dataset<Row> orders) {
        Column fullDate = col(OrderColumns.FULL_DATE);
        Dataset<Row> dates = orders
            .select(col(OrderColumns.ORDER_DATE).alias(OrderColumns.FULL_DATE))
            .filter(fullDate.isNotNull())
            .distinct();

        return withSurrogateKey(dates, OrderColumns.DATE_ID, OrderColumns.FULL_DATE)
            .withColumn(OrderColumns.YEAR, year(fullDate))
            .withColumn(OrderColumns.MONTH, month(fullDate))
            .withColumn(OrderColumns.MONTH_NAME, date_format(fullDate, "MMMM"))
            .withColumn(OrderColumns.QUARTER, quarter(fullDate))
            .withColumn(OrderColumns.WEEK, weekofyear(fullDate))
            .withColumn(OrderColumns.DAY, dayofmonth(fullDate));
    }

    public Dataset<Row> buildLocation(Dataset<Row> orders) {
        return naturalKeyDimension(orders, OrderColumns.LOCATION_ID,
            OrderColumns.STATE, OrderColumns.CITY, OrderColumns.LOCATION);
    }

    public Dataset<Row> buildRestaurant(Dataset<Row> orders) {
        return naturalKeyDimension(orders, OrderColumns.RESTAURANT_ID, OrderColumns.RESTAURANT_NAME);
    }

    public Dataset<Row> buildCategory(Dataset<Row> orders) {
        return naturalKeyDimension(orders, OrderColumns.CATEGORY_ID, OrderColumns.CATEGORY);
    }

    public Dataset<Row> buildDish(Dataset<Row> orders) {
        return naturalKeyDimension(orders, OrderColumns.DISH_ID, OrderColumns.DISH_NAME);
    }

    private static Dataset<Row> naturalKeyDimension(Dataset<Row> orders, String keyColumn, String... naturalKey) {
        Column[] columns = new Column[naturalKey.length];
        Column complete = lit(true);
        for (int i = 0; i < naturalKey.length; i++) {
            columns[i] = col(naturalKey[i]);
            complete = complete.and(col(naturalKey[i]).isNotNull());
        }
        Dataset<Row> distinctKeys = orders.select(columns).filter(complete).distinct();
        return withSurrogateKey(distinctKeys, keyColumn, naturalKey);
    }

    /**
     * Numbers rows 1..N by ascending natural key and puts the key column first.
     */
    private static Dataset<Row> withSurrogateKey(Dataset<Row> distinctKeys, String keyColumn, String... naturalKey) {
        Column[] ordering = new Column[naturalKey.length];
        Column[] selection = new Column[naturalKey.length + 1];
        selection[0] = col(keyColumn);
        for (int i = 0; i < naturalKey.length; i++) {
            ordering[i] = col(naturalKey[i]).asc();
            selection[i + 1] = col(naturalKey[i]);
        }
        return distinctKeys
            .withColumn(keyColumn, row_number().over(Window.orderBy(ordering)).cast(DataTypes.IntegerType))
            .select(selection);
    }
}
