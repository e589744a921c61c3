package com.fooddelivery.warehouse;

import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.expressions.Window;
import org.apache.spark.sql.types.DataTypes;

import static org.apache.spark.sql.functions.*;

/**
 * Resolves the surrogate keys of every deduplicated order and builds the fact table.
 *
 * <p>All five lookups are inner joins on natural-key equality. An order whose date, location,
 * restaurant, category or dish does not resolve (null values never match) gets no fact row.
 */
public class FactLoader {

    public Dataset<Row> load(Dataset<Row> orders, Dimensions dimensions) {
        Dataset<Row> o = RawOrderReader.withIngestSequence(orders).alias("o");
        Dataset<Row> dd = dimensions.date().alias("dd");
        Dataset<Row> dl = dimensions.location().alias("dl");
        Dataset<Row> dr = dimensions.restaurant().alias("dr");
        Dataset<Row> dc = dimensions.category().alias("dc");
        Dataset<Row> dsh = dimensions.dish().alias("dsh");

        Dataset<Row> resolved = o
            .join(dd, col("dd." + OrderColumns.FULL_DATE).equalTo(col("o." + OrderColumns.ORDER_DATE)))
            .join(dl, col("dl." + OrderColumns.STATE).equalTo(col("o." + OrderColumns.STATE))
                .and(col("dl." + OrderColumns.CITY).equalTo(col("o." + OrderColumns.CITY)))
                .and(col("dl." + OrderColumns.LOCATION).equalTo(col("o." + OrderColumns.LOCATION))))
            .join(dr, col("dr." + OrderColumns.RESTAURANT_NAME).equalTo(col("o." + OrderColumns.RESTAURANT_NAME)))
            .join(dc, col("dc." + OrderColumns.CATEGORY).equalTo(col("o." + OrderColumns.CATEGORY)))
            .join(dsh, col("dsh." + OrderColumns.DISH_NAME).equalTo(col("o." + OrderColumns.DISH_NAME)));

        return resolved
            .withColumn(OrderColumns.ORDER_ID,
                row_number().over(Window.orderBy(col("o." + OrderColumns.INGEST_SEQ).asc()))
                    .cast(DataTypes.IntegerType))
            .select(
                col(OrderColumns.ORDER_ID),
                col("dd." + OrderColumns.DATE_ID).alias(OrderColumns.DATE_ID),
                col("o." + OrderColumns.PRICE).alias(OrderColumns.PRICE),
                col("o." + OrderColumns.RATING).alias(OrderColumns.RATING),
                col("o." + OrderColumns.RATING_COUNT).alias(OrderColumns.RATING_COUNT),
                col("dl." + OrderColumns.LOCATION_ID).alias(OrderColumns.LOCATION_ID),
                col("dr." + OrderColumns.RESTAURANT_ID).alias(OrderColumns.RESTAURANT_ID),
                col("dc." + OrderColumns.CATEGORY_ID).alias(OrderColumns.CATEGORY_ID),
                col("dsh." + OrderColumns.DISH_ID).alias(OrderColumns.DISH_ID)
            );
    }
}
