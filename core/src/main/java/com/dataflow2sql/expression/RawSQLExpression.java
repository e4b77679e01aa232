package com.dataflow2sql.expression;

import com.dataflow2sql.types.DataType;
import com.dataflow2sql.types.UnresolvedType;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression that represents a raw SQL expression string.
 *
 * <p>This is used for element expressions declared in the semantic model, which
 * are passed through verbatim without parsing. Column references inside raw
 * SQL are opaque to validation.
 *
 * <p>Examples:
 * <pre>
 *   CASE WHEN is_instant THEN 1 ELSE 0 END
 *   1
 * </pre>
 */
public final class RawSQLExpression implements Expression {

    private final String sql;
    private final DataType dataType;

    public RawSQLExpression(String sql) {
        this(sql, UnresolvedType.get());
    }

    public RawSQLExpression(String sql, DataType dataType) {
        this.sql = Objects.requireNonNull(sql, "sql must not be null");
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
    }

    public String sql() {
        return sql;
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
        return visitor.visitRawSQL(this);
    }

    @Override
    public String toString() {
        return sql;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof RawSQLExpression)) return false;
        RawSQLExpression that = (RawSQLExpression) obj;
        return sql.equals(that.sql) && dataType.equals(that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sql, dataType);
    }
}
