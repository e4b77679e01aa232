package com.dataflow2sql.expression;

import com.dataflow2sql.types.DataType;
import java.util.List;

/**
 * Base interface for all expressions of the SQL intermediate representation.
 *
 * <p>Expressions are used in:
 * <ul>
 *   <li>SELECT items (projections, aggregations, metric formulas)</li>
 *   <li>JOIN ... ON conditions</li>
 *   <li>WHERE predicates</li>
 *   <li>GROUP BY and ORDER BY items</li>
 * </ul>
 *
 * <p>Expressions are immutable and know nothing about SQL syntax: text is
 * produced by {@link com.dataflow2sql.generator.SqlExpressionRenderer} for a
 * given dialect. The set of expression kinds is closed, and every consumer
 * dispatches through {@link ExpressionVisitor}.
 */
public sealed interface Expression
    permits AggregateFunction, BinaryExpression, CaseWhenExpression, CastExpression,
            ColumnReference, DateTruncExpression, ElementReference, FunctionCall,
            Literal, RawSQLExpression, UnaryExpression {

    /**
     * Returns the data type of the value produced by this expression.
     *
     * @return the data type
     */
    DataType dataType();

    /**
     * Returns the direct sub-expressions, left to right.
     *
     * @return the children (empty for leaves)
     */
    List<Expression> children();

    /**
     * Dispatches to the visitor method for this expression kind.
     *
     * @param visitor the visitor
     * @param <R> the visitor result type
     * @return the visitor's result
     */
    <R> R accept(ExpressionVisitor<R> visitor);
}
