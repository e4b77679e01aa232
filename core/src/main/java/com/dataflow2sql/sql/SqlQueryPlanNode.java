package com.dataflow2sql.sql;

/**
 * A node of the SQL query plan: either one SELECT statement or a base table.
 *
 * <p>The plan is a strict tree. A statement exclusively owns the nodes it reads
 * from; the same node instance never appears twice in one plan.
 */
public sealed interface SqlQueryPlanNode permits SqlSelectStatement, SqlTableReference {

    /**
     * Dispatches to the visitor method for this node kind.
     *
     * @param visitor the visitor
     * @param <R> the visitor result type
     * @return the visitor's result
     */
    <R> R accept(SqlQueryPlanNodeVisitor<R> visitor);
}
