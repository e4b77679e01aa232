package com.dataflow2sql.sql;

import com.dataflow2sql.expression.Expression;
import java.util.Objects;

/**
 * One ORDER BY item.
 *
 * @param expression the sort key
 * @param descending true for DESC
 */
public record SqlOrderBy(Expression expression, boolean descending) {

    public SqlOrderBy {
        Objects.requireNonNull(expression, "expression must not be null");
    }
}
