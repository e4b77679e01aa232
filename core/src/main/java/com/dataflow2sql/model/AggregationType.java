package com.dataflow2sql.model;

import com.dataflow2sql.types.DataType;
import com.dataflow2sql.types.DoubleType;
import com.dataflow2sql.types.LongType;

/**
 * Aggregation functions a measure can declare.
 *
 * <p>SUM_BOOLEAN counts the rows where a boolean expression is true.
 * COUNT_DISTINCT requires a dialect with native {@code COUNT(DISTINCT ...)}.
 */
public enum AggregationType {
    SUM,
    SUM_BOOLEAN,
    COUNT,
    COUNT_DISTINCT,
    MIN,
    MAX,
    AVERAGE;

    /**
     * Returns whether the aggregated value can be re-aggregated by summing
     * partial results.
     *
     * @return true for SUM, SUM_BOOLEAN and COUNT
     */
    public boolean isAdditive() {
        return this == SUM || this == SUM_BOOLEAN || this == COUNT;
    }

    /**
     * Returns the type of the aggregated value.
     *
     * @param inputType the type of the unaggregated value
     * @return LONG for counts, DOUBLE for averages, the input type otherwise
     */
    public DataType resultType(DataType inputType) {
        switch (this) {
            case COUNT:
            case COUNT_DISTINCT:
            case SUM_BOOLEAN:
                return LongType.get();
            case AVERAGE:
                return DoubleType.get();
            default:
                return inputType;
        }
    }
}
