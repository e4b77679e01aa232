package com.dataflow2sql.schema;

import com.dataflow2sql.model.AggregationType;
import com.dataflow2sql.naming.ColumnIdentifier;
import com.dataflow2sql.naming.ColumnNamingResolver;
import com.dataflow2sql.types.DataType;
import java.util.Objects;

/**
 * A named, typed column of a dataflow node's output.
 *
 * @param identifier the logical column name
 * @param kind the semantic role
 * @param dataType the value type
 * @param aggregation the declared aggregation, measures only (null otherwise)
 */
public record OutputColumn(ColumnIdentifier identifier, ElementKind kind, DataType dataType,
                           AggregationType aggregation) {

    public OutputColumn {
        Objects.requireNonNull(identifier, "identifier must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(dataType, "dataType must not be null");
        if (kind == ElementKind.MEASURE && aggregation == null) {
            throw new IllegalArgumentException("measure '" + identifier + "' must declare an aggregation");
        }
        if (kind != ElementKind.MEASURE && aggregation != null) {
            throw new IllegalArgumentException("only measures carry an aggregation: " + identifier);
        }
    }

    public static OutputColumn of(ColumnIdentifier identifier, ElementKind kind, DataType dataType) {
        return new OutputColumn(identifier, kind, dataType, null);
    }

    public static OutputColumn measure(ColumnIdentifier identifier, DataType dataType, AggregationType aggregation) {
        return new OutputColumn(identifier, ElementKind.MEASURE, dataType, aggregation);
    }

    /**
     * Returns the physical alias of this column.
     *
     * @return the alias resolved by the standard naming resolver
     */
    public String alias() {
        return ColumnNamingResolver.standard().resolve(identifier);
    }

    /**
     * Returns a copy under another identifier.
     *
     * @param newIdentifier the identifier
     * @return the renamed column
     */
    public OutputColumn withIdentifier(ColumnIdentifier newIdentifier) {
        return new OutputColumn(newIdentifier, kind, dataType, aggregation);
    }

    @Override
    public String toString() {
        return alias() + ": " + kind + " " + dataType;
    }
}
