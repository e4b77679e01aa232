package com.dataflow2sql.sql;

/**
 * Visitor over the closed set of {@link SqlQueryPlanNode} kinds.
 *
 * @param <R> the result type
 */
public interface SqlQueryPlanNodeVisitor<R> {

    R visitSelectStatement(SqlSelectStatement statement);

    R visitTableReference(SqlTableReference table);
}
