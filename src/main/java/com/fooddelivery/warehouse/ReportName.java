package com.fooddelivery.warehouse;

import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;

import java.util.function.Function;

/**
 * The fixed catalog of warehouse reports.
 */
public enum ReportName {

    KPI_SUMMARY("kpi_summary", OrderReports::kpiSummary),
    ORDERS_BY_YEAR("orders_by_year", OrderReports::ordersByYear),
    ORDERS_BY_QUARTER("orders_by_quarter", OrderReports::ordersByQuarter),
    ORDERS_BY_MONTH("orders_by_month", OrderReports::ordersByMonth),
    ORDERS_BY_DAY_OF_WEEK("orders_by_day_of_week", OrderReports::ordersByDayOfWeek),
    TOP_CITIES("top_10_cities", reports -> reports.topCities(10)),
    REVENUE_BY_STATE("revenue_by_state", OrderReports::revenueByState),
    TOP_RESTAURANTS("top_10_restaurants", reports -> reports.topRestaurants(10)),
    CATEGORIES_BY_VOLUME("categories_by_volume", OrderReports::categoriesByVolume),
    TOP_DISHES("top_10_dishes", reports -> reports.topDishes(10)),
    CATEGORY_PERFORMANCE("category_performance", OrderReports::categoryPerformance),
    ORDERS_BY_PRICE_RANGE("orders_by_price_range", OrderReports::ordersByPriceRange),
    RATING_DISTRIBUTION("rating_distribution", OrderReports::ratingDistribution),
    TOP_RESTAURANTS_PER_CITY("top_3_restaurants_per_city", reports -> reports.topRestaurantsPerCity(3)),
    TOP_DISHES_PER_CATEGORY("top_5_dishes_per_category", reports -> reports.topDishesPerCategory(5)),
    RUNNING_REVENUE_BY_MONTH("running_revenue_by_month", OrderReports::runningRevenueByMonth);

    private final String fileName;
    private final Function<OrderReports, Dataset<Row>> query;

    ReportName(String fileName, Function<OrderReports, Dataset<Row>> query) {
        this.fileName = fileName;
        this.query = query;
    }

    public String fileName() {
        return fileName;
    }

    public Dataset<Row> query(OrderReports reports) {
        return query.apply(reports);
    }
}
