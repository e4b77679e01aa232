package com.dataflow2sql.schema;

/**
 * Semantic role of an output column.
 *
 * <p>The declaration order is the canonical column order used by every dataflow
 * node except source reads.
 */
public enum ElementKind {
    TIME_DIMENSION,
    ENTITY,
    DIMENSION,
    MEASURE,
    METRIC;

    public boolean isGroupable() {
        return this == TIME_DIMENSION || this == ENTITY || this == DIMENSION;
    }
}
