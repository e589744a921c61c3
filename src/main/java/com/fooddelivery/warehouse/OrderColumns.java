package com.fooddelivery.warehouse;

import org.apache.spark.sql.types.DataTypes;
import org.apache.spark.sql.types.StructType;

/**
 * Column names and schemas shared by every stage of the warehouse pipeline.
 */
public final class OrderColumns {

    public static final String STATE = "state";
    public static final String CITY = "city";
    public static final String LOCATION = "location";
    public static final String RESTAURANT_NAME = "restaurant_name";
    public static final String CATEGORY = "category";
    public static final String DISH_NAME = "dish_name";
    public static final String ORDER_DATE = "order_date";
    public static final String PRICE = "price_inr";
    public static final String RATING = "rating";
    public static final String RATING_COUNT = "rating_count";

    // Feed order, used to break ties deterministically
    public static final String INGEST_SEQ = "ingest_seq";

    /** Every business column of a raw order, in the order the Deduplicator groups by. */
    public static final String[] BUSINESS_COLUMNS = {
        STATE, CITY, ORDER_DATE, RESTAURANT_NAME, LOCATION, CATEGORY, DISH_NAME, PRICE, RATING, RATING_COUNT
    };

    /** Text columns that must not be blank. */
    public static final String[] REQUIRED_TEXT_COLUMNS = {
        STATE, CITY, RESTAURANT_NAME, LOCATION, CATEGORY, DISH_NAME
    };

    public static final String DATE_ID = "date_id";
    public static final String FULL_DATE = "full_date";
    public static final String YEAR = "year";
    public static final String MONTH = "month";
    public static final String MONTH_NAME = "month_name";
    public static final String QUARTER = "quarter";
    public static final String WEEK = "week";
    public static final String DAY = "day";
    public static final String LOCATION_ID = "location_id";
    public static final String RESTAURANT_ID = "restaurant_id";
    public static final String CATEGORY_ID = "category_id";
    public static final String DISH_ID = "dish_id";
    public static final String ORDER_ID = "order_id";

    public static final String TOTAL_ORDERS = "total_orders";
    public static final String TOTAL_REVENUE = "total_revenue";

    private OrderColumns() {
    }

    /**
     * Schema of the CSV feed, all columns read as strings in the feed's own column order.
     */
    public static StructType feedSchema() {
        return new StructType()
            .add(STATE, DataTypes.StringType, true)
            .add(CITY, DataTypes.StringType, true)
            .add(ORDER_DATE, DataTypes.StringType, true)
            .add(RESTAURANT_NAME, DataTypes.StringType, true)
            .add(LOCATION, DataTypes.StringType, true)
            .add(CATEGORY, DataTypes.StringType, true)
            .add(DISH_NAME, DataTypes.StringType, true)
            .add(PRICE, DataTypes.StringType, true)
            .add(RATING, DataTypes.StringType, true)
            .add(RATING_COUNT, DataTypes.StringType, true);
    }

    /**
     * Typed schema of a raw order once cleaned, without the ingestion sequence.
     */
    public static StructType rawOrderSchema() {
        return new StructType()
            .add(STATE, DataTypes.StringType, true)
            .add(CITY, DataTypes.StringType, true)
            .add(LOCATION, DataTypes.StringType, true)
            .add(RESTAURANT_NAME, DataTypes.StringType, true)
            .add(CATEGORY, DataTypes.StringType, true)
            .add(DISH_NAME, DataTypes.StringType, true)
            .add(ORDER_DATE, DataTypes.DateType, true)
            .add(PRICE, DataTypes.createDecimalType(10, 2), true)
            .add(RATING, DataTypes.createDecimalType(4, 2), true)
            .add(RATING_COUNT, DataTypes.IntegerType, true);
    }
}
