package com.fooddelivery.warehouse;

import org.apache.spark.sql.Column;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.expressions.Window;
import org.apache.spark.sql.expressions.WindowSpec;
import org.apache.spark.sql.types.DataTypes;

import static com.fooddelivery.warehouse.OrderColumns.*;
import static org.apache.spark.sql.functions.*;

/**
 * Analytical reports over one warehouse snapshot. Every method is a read-only query;
 * nothing is evaluated until the caller collects or writes the result.
 *
 * <p>Revenue and average price are computed on the price cast to double. Volume rankings
 * break ties in order count by ascending label.
 */
public class OrderReports {

    public static final String AVG_PRICE = "avg_price";
    public static final String AVG_RATING = "avg_rating";
    public static final String DAY_NAME = "day_name";
    public static final String PRICE_RANGE = "price_range";
    public static final String RANK = "rank";
    public static final String RUNNING_TOTAL_REVENUE = "running_total_revenue";

    static final String UNDER_100 = "Under 100";
    static final String FROM_100 = "100 - 199";
    static final String FROM_200 = "200 - 299";
    static final String FROM_300 = "300 - 399";
    static final String CATCH_ALL = "500+";

    private static final String DAY_INDEX = "day_index";

    private final Dataset<Row> facts;
    private final Dimensions dimensions;

    public OrderReports(WarehouseSnapshot snapshot) {
        this(snapshot.getFacts(), snapshot.getDimensions());
    }

    public OrderReports(Dataset<Row> facts, Dimensions dimensions) {
        this.facts = facts;
        this.dimensions = dimensions;
    }

    // ---------------------------------------------------------------- KPIs

    /**
     * Single row: total_orders, total_revenue, avg_price, avg_rating.
     */
    public Dataset<Row> kpiSummary() {
        Column price = col(PRICE).cast(DataTypes.DoubleType);
        return facts.agg(
            count(lit(1)).alias(TOTAL_ORDERS),
            coalesce(sum(price), lit(0.0)).alias(TOTAL_REVENUE),
            avg(price).alias(AVG_PRICE),
            avg(col(RATING)).cast(DataTypes.DoubleType).alias(AVG_RATING)
        );
    }

    public long totalOrders() {
        return facts.count();
    }

    public double totalRevenue() {
        return kpiSummary().first().getDouble(1);
    }

    /**
     * Average price, NaN when there are no orders.
     */
    public double averagePrice() {
        Row kpis = kpiSummary().first();
        return kpis.isNullAt(2) ? Double.NaN : kpis.getDouble(2);
    }

    /**
     * Average rating over orders that carry one, NaN when none do.
     */
    public double averageRating() {
        Row kpis = kpiSummary().first();
        return kpis.isNullAt(3) ? Double.NaN : kpis.getDouble(3);
    }

    // ---------------------------------------------------------------- trends

    public Dataset<Row> ordersByYear() {
        return withDates()
            .groupBy(YEAR)
            .agg(count(lit(1)).alias(TOTAL_ORDERS))
            .orderBy(col(YEAR));
    }

    public Dataset<Row> ordersByQuarter() {
        return withDates()
            .groupBy(YEAR, QUARTER)
            .agg(count(lit(1)).alias(TOTAL_ORDERS))
            .orderBy(col(YEAR), col(QUARTER));
    }

    public Dataset<Row> ordersByMonth() {
        return withDates()
            .groupBy(YEAR, MONTH, MONTH_NAME)
            .agg(count(lit(1)).alias(TOTAL_ORDERS))
            .orderBy(col(YEAR), col(MONTH));
    }

    /**
     * Orders per weekday name, Monday first.
     */
    public Dataset<Row> ordersByDayOfWeek() {
        // dayofweek is 1 = Sunday .. 7 = Saturday; shift to ISO 1 = Monday .. 7 = Sunday
        Column isoDayIndex = pmod(dayofweek(col(FULL_DATE)).plus(5), lit(7)).plus(1);
        return withDates()
            .withColumn(DAY_NAME, date_format(col(FULL_DATE), "EEEE"))
            .withColumn(DAY_INDEX, isoDayIndex)
            .groupBy(DAY_INDEX, DAY_NAME)
            .agg(count(lit(1)).alias(TOTAL_ORDERS))
            .orderBy(col(DAY_INDEX))
            .select(DAY_NAME, TOTAL_ORDERS);
    }

    // ---------------------------------------------------------------- volume rankings

    public Dataset<Row> topCities(int limit) {
        return byVolume(facts.join(dimensions.location(), LOCATION_ID), CITY).limit(limit);
    }

    public Dataset<Row> topRestaurants(int limit) {
        return byVolume(facts.join(dimensions.restaurant(), RESTAURANT_ID), RESTAURANT_NAME).limit(limit);
    }

    public Dataset<Row> topDishes(int limit) {
        return byVolume(facts.join(dimensions.dish(), DISH_ID), DISH_NAME).limit(limit);
    }

    public Dataset<Row> categoriesByVolume() {
        return byVolume(facts.join(dimensions.category(), CATEGORY_ID), CATEGORY);
    }

    public Dataset<Row> revenueByState() {
        return facts.join(dimensions.location(), LOCATION_ID)
            .groupBy(STATE)
            .agg(sum(col(PRICE).cast(DataTypes.DoubleType)).alias(TOTAL_REVENUE))
            .orderBy(desc(TOTAL_REVENUE), asc(STATE));
    }

    /**
     * Order count and average rating per category, busiest first.
     */
    public Dataset<Row> categoryPerformance() {
        return facts.join(dimensions.category(), CATEGORY_ID)
            .groupBy(CATEGORY)
            .agg(
                count(lit(1)).alias(TOTAL_ORDERS),
                avg(col(RATING)).cast(DataTypes.DoubleType).alias(AVG_RATING)
            )
            .orderBy(desc(TOTAL_ORDERS), asc(CATEGORY));
    }

    /**
     * Orders per price bucket. Prices from 400 up, and prices between the integer bounds of
     * the named buckets (such as 199.50), all land in the "500+" bucket.
     */
    public Dataset<Row> ordersByPriceRange() {
        return facts
            .withColumn(PRICE_RANGE, priceRange(col(PRICE).cast(DataTypes.DoubleType)))
            .groupBy(PRICE_RANGE)
            .agg(count(lit(1)).alias(TOTAL_ORDERS))
            .orderBy(desc(TOTAL_ORDERS), asc(PRICE_RANGE));
    }

    public Dataset<Row> ratingDistribution() {
        return facts
            .groupBy(RATING)
            .agg(count(lit(1)).alias(TOTAL_ORDERS))
            .orderBy(desc(TOTAL_ORDERS), asc(RATING));
    }

    // ---------------------------------------------------------------- window reports

    /**
     * The busiest restaurants of every city, numbered 1, 2, 3 with no shared positions.
     * Restaurants with equal counts are numbered by name.
     */
    public Dataset<Row> topRestaurantsPerCity(int perCity) {
        Dataset<Row> cityRestaurants = facts
            .join(dimensions.location(), LOCATION_ID)
            .join(dimensions.restaurant(), RESTAURANT_ID)
            .groupBy(CITY, RESTAURANT_NAME)
            .agg(count(lit(1)).alias(TOTAL_ORDERS));

        WindowSpec byCity = Window.partitionBy(col(CITY))
            .orderBy(desc(TOTAL_ORDERS), asc(RESTAURANT_NAME));

        return cityRestaurants
            .withColumn(RANK, row_number().over(byCity))
            .filter(col(RANK).leq(perCity))
            .orderBy(col(CITY), col(RANK));
    }

    /**
     * The most ordered dishes of every category. Dishes with equal counts share a rank and the
     * next count down takes the next rank with no gap, so a category may return more rows than
     * {@code maxRank} when there are ties.
     */
    public Dataset<Row> topDishesPerCategory(int maxRank) {
        Dataset<Row> categoryDishes = facts
            .join(dimensions.category(), CATEGORY_ID)
            .join(dimensions.dish(), DISH_ID)
            .groupBy(CATEGORY, DISH_NAME)
            .agg(count(lit(1)).alias(TOTAL_ORDERS));

        WindowSpec byCategory = Window.partitionBy(col(CATEGORY)).orderBy(desc(TOTAL_ORDERS));

        return categoryDishes
            .withColumn(RANK, dense_rank().over(byCategory))
            .filter(col(RANK).leq(maxRank))
            .orderBy(col(CATEGORY), col(RANK), col(DISH_NAME));
    }

    /**
     * Monthly revenue with the cumulative revenue of every month up to and including it.
     */
    public Dataset<Row> runningRevenueByMonth() {
        Dataset<Row> monthly = withDates()
            .groupBy(YEAR, MONTH, MONTH_NAME)
            .agg(sum(col(PRICE).cast(DataTypes.DoubleType)).alias(TOTAL_REVENUE));

        WindowSpec chronological = Window.orderBy(col(YEAR), col(MONTH))
            .rowsBetween(Window.unboundedPreceding(), Window.currentRow());

        return monthly
            .withColumn(RUNNING_TOTAL_REVENUE, sum(col(TOTAL_REVENUE)).over(chronological))
            .orderBy(col(YEAR), col(MONTH));
    }

    // ----------------------------------------------------------------

    static Column priceRange(Column price) {
        return when(price.lt(100), UNDER_100)
            .when(price.between(100, 199), FROM_100)
            .when(price.between(200, 299), FROM_200)
            .when(price.between(300, 399), FROM_300)
            .otherwise(CATCH_ALL);
    }

    private Dataset<Row> withDates() {
        return facts.join(dimensions.date(), DATE_ID);
    }

    private static Dataset<Row> byVolume(Dataset<Row> joined, String label) {
        return joined
            .groupBy(label)
            .agg(count(lit(1)).alias(TOTAL_ORDERS))
            .orderBy(desc(TOTAL_ORDERS), asc(label));
    }
}
