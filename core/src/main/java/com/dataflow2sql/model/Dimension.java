package com.dataflow2sql.model;

import com.dataflow2sql.naming.TimeGranularity;
import com.dataflow2sql.types.DataType;
import com.dataflow2sql.types.TimestampType;
import com.dataflow2sql.types.UnresolvedType;
import java.util.Objects;

/**
 * A dimension declared by a data source.
 *
 * @param name the dimension name
 * @param expr the backing column or SQL expression (null reads the column named like the dimension)
 * @param type categorical or time
 * @param timeGranularity the granularity of the stored values, time dimensions only
 * @param dataType the value type
 */
public record Dimension(String name, String expr, DimensionType type,
                        TimeGranularity timeGranularity, DataType dataType) {

    public Dimension {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(dataType, "dataType must not be null");
        if (type == DimensionType.TIME && timeGranularity == null) {
            throw new IllegalArgumentException("time dimension '" + name + "' must declare a granularity");
        }
        if (type == DimensionType.CATEGORICAL && timeGranularity != null) {
            throw new IllegalArgumentException("categorical dimension '" + name + "' cannot declare a granularity");
        }
    }

    /**
     * Creates a categorical dimension of undeclared type.
     *
     * @param name the dimension name
     * @param expr the backing column or SQL expression (may be null)
     * @return the dimension
     */
    public static Dimension categorical(String name, String expr) {
        return new Dimension(name, expr, DimensionType.CATEGORICAL, null, UnresolvedType.get());
    }

    /**
     * Creates a daily time dimension.
     *
     * @param name the dimension name
     * @param expr the backing column or SQL expression (may be null)
     * @return the dimension
     */
    public static Dimension time(String name, String expr) {
        return new Dimension(name, expr, DimensionType.TIME, TimeGranularity.DAY, TimestampType.get());
    }

    /**
     * Returns whether this is a time dimension.
     *
     * @return true for time dimensions
     */
    public boolean isTime() {
        return type == DimensionType.TIME;
    }
}
