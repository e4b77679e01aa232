package com.dataflow2sql.types;

/**
 * Placeholder type for columns whose type the semantic model left undeclared.
 *
 * <p>Rendering never depends on it; aggregations over an unresolved column keep
 * the column's type unresolved unless the aggregation fixes the result type.
 */
public final class UnresolvedType implements DataType {

    private static final UnresolvedType INSTANCE = new UnresolvedType();

    private UnresolvedType() {}

    public static UnresolvedType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "unresolved";
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof UnresolvedType;
    }

    @Override
    public int hashCode() {
        return typeName().hashCode();
    }

    @Override
    public String toString() {
        return typeName();
    }
}
