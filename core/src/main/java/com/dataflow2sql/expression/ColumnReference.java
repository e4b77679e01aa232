package com.dataflow2sql.expression;

import com.dataflow2sql.types.DataType;
import com.dataflow2sql.types.UnresolvedType;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing a reference to a physical column.
 *
 * <p>Column references can be:
 * <ul>
 *   <li>Qualified by a subquery or table alias: {@code subq_3.listing}</li>
 *   <li>Unqualified, resolved against the FROM and JOIN sources of the
 *       enclosing statement: {@code listing__capacity}</li>
 * </ul>
 */
public final class ColumnReference implements Expression {

    private final String columnName;
    private final String qualifier; // Optional table/subquery alias
    private final DataType dataType;

    /**
     * Creates a column reference.
     *
     * @param columnName the column name
     * @param qualifier the table or subquery alias (may be null)
     * @param dataType the data type of the column
     */
    public ColumnReference(String columnName, String qualifier, DataType dataType) {
        this.columnName = Objects.requireNonNull(columnName, "columnName must not be null");
        this.qualifier = qualifier;
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
    }

    public String columnName() {
        return columnName;
    }

    /**
     * Returns the qualifier (table or subquery alias).
     *
     * @return the qualifier, or null if not qualified
     */
    public String qualifier() {
        return qualifier;
    }

    public boolean isQualified() {
        return qualifier != null;
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public List<Expression> children() {
        return Collections.emptyList();
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitColumnReference(this);
    }

    @Override
    public String toString() {
        return qualifier != null ? qualifier + "." + columnName : columnName;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ColumnReference)) return false;
        ColumnReference that = (ColumnReference) obj;
        return Objects.equals(columnName, that.columnName) &&
               Objects.equals(qualifier, that.qualifier) &&
               Objects.equals(dataType, that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columnName, qualifier, dataType);
    }

    // ==================== Factory Methods ====================

    /**
     * Creates an unqualified column reference of unresolved type.
     *
     * @param columnName the column name
     * @return the column reference
     */
    public static ColumnReference of(String columnName) {
        return new ColumnReference(columnName, null, UnresolvedType.get());
    }

    /**
     * Creates a qualified column reference.
     *
     * @param qualifier the table or subquery alias
     * @param columnName the column name
     * @param dataType the data type
     * @return the column reference
     */
    public static ColumnReference qualified(String qualifier, String columnName, DataType dataType) {
        return new ColumnReference(columnName, Objects.requireNonNull(qualifier, "qualifier must not be null"), dataType);
    }
}
