package com.dataflow2sql.types;

/**
 * Sealed interface for the data types carried by dataflow output columns.
 *
 * <p>The compiler only needs enough typing to decide how literals are written,
 * which result type an aggregation produces, and which type name a dialect
 * uses in a {@code CAST}. Warehouse-side types are not validated.
 *
 * <p>Common data types include:
 * <ul>
 *   <li>Primitive types: BooleanType, IntegerType, LongType, DoubleType, StringType</li>
 *   <li>Temporal types: DateType, TimestampType</li>
 *   <li>UnresolvedType for columns whose type the semantic model did not declare</li>
 * </ul>
 */
public sealed interface DataType
    permits BooleanType, IntegerType, LongType, DoubleType, StringType,
            DateType, TimestampType, UnresolvedType {

    /**
     * Returns a human-readable name for this data type.
     *
     * @return the type name
     */
    String typeName();

    /**
     * Returns whether values of this type are numeric.
     *
     * @return true for integer and floating point types
     */
    default boolean isNumeric() {
        return false;
    }

    /**
     * Returns whether values of this type are temporal.
     *
     * @return true for date and timestamp types
     */
    default boolean isTemporal() {
        return false;
    }
}
