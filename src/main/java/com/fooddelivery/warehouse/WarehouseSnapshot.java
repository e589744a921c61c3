package com.fooddelivery.warehouse;

import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One complete, immutable build of the star schema. Every rebuild produces a new snapshot
 * with a higher version; readers keep whichever snapshot they started with.
 */
public final class WarehouseSnapshot {

    public static final String FACT = "fact_orders";

    private final long version;
    private final Instant builtAt;
    private final Dimensions dimensions;
    private final Dataset<Row> facts;
    private final ValidationReport validation;

    public WarehouseSnapshot(long version, Instant builtAt, Dimensions dimensions, Dataset<Row> facts,
                             ValidationReport validation) {
        this.version = version;
        this.builtAt = builtAt;
        this.dimensions = dimensions;
        this.facts = facts;
        this.validation = validation;
    }

    public long getVersion() {
        return version;
    }

    public Instant getBuiltAt() {
        return builtAt;
    }

    public Dimensions getDimensions() {
        return dimensions;
    }

    public Dataset<Row> getFacts() {
        return facts;
    }

    public ValidationReport getValidation() {
        return validation;
    }

    /**
     * The five dimensions followed by the fact table, keyed by table name.
     */
    public Map<String, Dataset<Row>> tables() {
        Map<String, Dataset<Row>> tables = new LinkedHashMap<>(dimensions.tables());
        tables.put(FACT, facts);
        return Collections.unmodifiableMap(tables);
    }

    @Override
    public String toString() {
        return "WarehouseSnapshot{version=" + version + ", builtAt=" + builtAt + "}";
    }
}
