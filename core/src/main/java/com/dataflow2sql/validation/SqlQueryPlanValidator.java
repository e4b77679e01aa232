package com.dataflow2sql.validation;

import com.dataflow2sql.exception.ValidationException;
import com.dataflow2sql.expression.ColumnReference;
import com.dataflow2sql.expression.ElementReference;
import com.dataflow2sql.expression.Expression;
import com.dataflow2sql.sql.SqlJoinDescription;
import com.dataflow2sql.sql.SqlOrderBy;
import com.dataflow2sql.sql.SqlQueryPlan;
import com.dataflow2sql.sql.SqlQueryPlanNodeVisitor;
import com.dataflow2sql.sql.SqlSelectColumn;
import com.dataflow2sql.sql.SqlSelectStatement;
import com.dataflow2sql.sql.SqlTableReference;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Validates SQL query plans before rendering.
 *
 * <p>Validation rules:
 * <ul>
 *   <li><b>Alias uniqueness:</b> every source alias (subquery or table) occurs
 *       once in the whole tree, and the select aliases of a statement are distinct</li>
 *   <li><b>Referential closure:</b> every column reference of a statement
 *       (select items, ON, WHERE, GROUP BY, ORDER BY) names a source of that
 *       statement and a column the source produces; unqualified references must
 *       be produced by one of the statement's sources</li>
 *   <li>No element reference survives lowering</li>
 * </ul>
 *
 * <p>Columns of base tables are not known to the compiler, so references to a
 * table alias are only checked for the alias.
 *
 * <p>Example usage:
 * <pre>
 *   SqlQueryPlan sqlPlan = converter.convert(dataflowPlan);
 *   SqlQueryPlanValidator.validate(sqlPlan);  // Throws ValidationException if invalid
 *   String sql = renderer.render(sqlPlan, DialectProfiles.BIGQUERY);
 * </pre>
 *
 * @see ValidationException
 */
public final class SqlQueryPlanValidator {

    /** Columns a source produces, null for base tables. */
    private static final SqlQueryPlanNodeVisitor<Set<String>> PRODUCED_COLUMNS = new SqlQueryPlanNodeVisitor<>() {
        @Override
        public Set<String> visitSelectStatement(SqlSelectStatement statement) {
            return new HashSet<>(statement.outputAliases());
        }

        @Override
        public Set<String> visitTableReference(SqlTableReference table) {
            return null;
        }
    };

    private static final SqlQueryPlanNodeVisitor<Void> NESTED_VALIDATION = new SqlQueryPlanNodeVisitor<>() {
        @Override
        public Void visitSelectStatement(SqlSelectStatement statement) {
            validateStatement(statement);
            return null;
        }

        @Override
        public Void visitTableReference(SqlTableReference table) {
            return null;
        }
    };

    private SqlQueryPlanValidator() {}

    /**
     * Validates a SQL query plan.
     *
     * @param plan the plan to validate
     * @throws ValidationException if validation fails
     */
    public static void validate(SqlQueryPlan plan) {
        Objects.requireNonNull(plan, "Plan cannot be null");
        Set<String> seen = new HashSet<>();
        for (String alias : plan.sourceAliases()) {
            if (!seen.add(alias)) {
                throw new ValidationException("Source alias '" + alias + "' is defined more than once", alias);
            }
        }
        validateStatement(plan.root());
    }

    private static void validateStatement(SqlSelectStatement statement) {
        Set<String> selectAliases = new HashSet<>();
        for (String alias : statement.outputAliases()) {
            if (!selectAliases.add(alias)) {
                throw new ValidationException(
                    "Select alias '" + alias + "' is defined twice in: " + statement.description(), alias);
            }
        }

        // alias -> produced columns, null for base tables
        Map<String, Set<String>> scope = new LinkedHashMap<>();
        scope.put(statement.fromSourceAlias(), statement.fromSource().accept(PRODUCED_COLUMNS));
        for (SqlJoinDescription join : statement.joinDescriptions()) {
            scope.put(join.rightAlias(), join.right().accept(PRODUCED_COLUMNS));
        }

        List<Expression> expressions = new ArrayList<>();
        for (SqlSelectColumn column : statement.selectColumns()) {
            expressions.add(column.expression());
        }
        for (SqlJoinDescription join : statement.joinDescriptions()) {
            expressions.add(join.onCondition());
        }
        if (statement.whereExpression() != null) {
            expressions.add(statement.whereExpression());
        }
        expressions.addAll(statement.groupBys());
        for (SqlOrderBy orderBy : statement.orderBys()) {
            expressions.add(orderBy.expression());
        }
        for (Expression expression : expressions) {
            checkReferences(expression, scope, statement);
        }

        statement.fromSource().accept(NESTED_VALIDATION);
        for (SqlJoinDescription join : statement.joinDescriptions()) {
            join.right().accept(NESTED_VALIDATION);
        }
    }

    private static void checkReferences(Expression expression, Map<String, Set<String>> scope,
                                        SqlSelectStatement statement) {
        if (expression instanceof ElementReference) {
            throw new ValidationException("Unresolved element reference " + expression
                + " in: " + statement.description(), ((ElementReference) expression).identifier().toString());
        }
        if (expression instanceof ColumnReference) {
            checkColumn((ColumnReference) expression, scope, statement);
        }
        for (Expression child : expression.children()) {
            checkReferences(child, scope, statement);
        }
    }

    private static void checkColumn(ColumnReference reference, Map<String, Set<String>> scope,
                                    SqlSelectStatement statement) {
        String column = reference.columnName();
        if (reference.isQualified()) {
            String qualifier = reference.qualifier();
            if (!scope.containsKey(qualifier)) {
                throw new ValidationException(String.format(
                    "Reference %s.%s names alias '%s', which is not a source of: %s (sources: %s)",
                    qualifier, column, qualifier, statement.description(), scope.keySet()), qualifier);
            }
            Set<String> produced = scope.get(qualifier);
            if (produced != null && !produced.contains(column)) {
                throw new ValidationException(String.format(
                    "Source '%s' does not produce column '%s' (in: %s)", qualifier, column,
                    statement.description()), qualifier + "." + column);
            }
            return;
        }
        for (Set<String> produced : scope.values()) {
            if (produced == null || produced.contains(column)) {
                return;
            }
        }
        throw new ValidationException(String.format(
            "Column '%s' is not produced by any source of: %s", column, statement.description()), column);
    }
}
