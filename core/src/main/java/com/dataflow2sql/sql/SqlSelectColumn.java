package com.dataflow2sql.sql;

import com.dataflow2sql.expression.Expression;
import java.util.Objects;

/**
 * One SELECT item: an expression and the alias it is exposed under.
 *
 * @param expression the expression
 * @param alias the output column alias
 */
public record SqlSelectColumn(Expression expression, String alias) {

    public SqlSelectColumn {
        Objects.requireNonNull(expression, "expression must not be null");
        Objects.requireNonNull(alias, "alias must not be null");
    }
}
