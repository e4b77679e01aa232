package com.dataflow2sql.model;

/**
 * Kinds of dimensions.
 */
public enum DimensionType {
    CATEGORICAL,
    TIME
}
