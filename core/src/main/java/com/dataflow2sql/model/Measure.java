package com.dataflow2sql.model;

import com.dataflow2sql.types.DataType;
import com.dataflow2sql.types.UnresolvedType;
import java.util.Objects;

/**
 * A measure declared by a data source.
 *
 * <p>{@code expr} is the column or SQL expression backing the measure; when it is
 * null the measure reads the column named like the measure, except for COUNT
 * measures, which count rows through the literal {@code 1}.
 *
 * @param name the measure name
 * @param expr the backing column or SQL expression (may be null)
 * @param aggregation the declared aggregation
 * @param dataType the type of the unaggregated value
 */
public record Measure(String name, String expr, AggregationType aggregation, DataType dataType) {

    public Measure {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(aggregation, "aggregation must not be null");
        Objects.requireNonNull(dataType, "dataType must not be null");
    }

    /**
     * Creates a measure of undeclared type.
     *
     * @param name the measure name
     * @param expr the backing column or SQL expression (may be null)
     * @param aggregation the declared aggregation
     */
    public Measure(String name, String expr, AggregationType aggregation) {
        this(name, expr, aggregation, UnresolvedType.get());
    }
}
