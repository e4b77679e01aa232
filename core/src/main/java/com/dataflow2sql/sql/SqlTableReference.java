package com.dataflow2sql.sql;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Reference to a warehouse table or view, e.g. {@code db.schema.fct_bookings}.
 */
public final class SqlTableReference implements SqlQueryPlanNode {

    private final List<String> nameParts;

    /**
     * Creates a table reference from a dot-separated name.
     *
     * @param qualifiedName the table name, optionally qualified by database and schema
     */
    public SqlTableReference(String qualifiedName) {
        Objects.requireNonNull(qualifiedName, "qualifiedName must not be null");
        List<String> parts = Arrays.asList(qualifiedName.split("\\.", -1));
        for (String part : parts) {
            if (part.isEmpty()) {
                throw new IllegalArgumentException("Invalid table name: '" + qualifiedName + "'");
            }
        }
        this.nameParts = List.copyOf(parts);
    }

    /**
     * Returns the name parts, outermost first.
     *
     * @return the database, schema and table parts that were given
     */
    public List<String> nameParts() {
        return nameParts;
    }

    public String tableName() {
        return nameParts.get(nameParts.size() - 1);
    }

    @Override
    public <R> R accept(SqlQueryPlanNodeVisitor<R> visitor) {
        return visitor.visitTableReference(this);
    }

    @Override
    public String toString() {
        return String.join(".", nameParts);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof SqlTableReference && nameParts.equals(((SqlTableReference) obj).nameParts);
    }

    @Override
    public int hashCode() {
        return nameParts.hashCode();
    }
}
