package com.dataflow2sql.generator;

import com.dataflow2sql.expression.BinaryExpression;
import com.dataflow2sql.expression.ColumnReference;
import com.dataflow2sql.expression.Expression;
import com.dataflow2sql.sql.SqlJoinDescription;
import com.dataflow2sql.sql.SqlOrderBy;
import com.dataflow2sql.sql.SqlQueryPlan;
import com.dataflow2sql.sql.SqlQueryPlanNode;
import com.dataflow2sql.sql.SqlQueryPlanNodeVisitor;
import com.dataflow2sql.sql.SqlSelectColumn;
import com.dataflow2sql.sql.SqlSelectStatement;
import com.dataflow2sql.sql.SqlTableReference;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders a SQL query plan as one SQL statement of nested subqueries.
 *
 * <p>Each statement is preceded by its description as {@code --} comment lines.
 * Nested statements are emitted in place, parenthesized, indented one level
 * and followed by their alias:
 * <pre>
 * -- Aggregate Measures
 * SELECT
 *   subq_8.metric_time
 *   , SUM(subq_8.bookings) AS bookings
 * FROM (
 *   -- Pass Only Elements:
 *   --   ['bookings', 'metric_time']
 *   SELECT
 *     ...
 * ) subq_8
 * GROUP BY
 *   subq_8.metric_time
 * </pre>
 *
 * <p>Conjunctions and disjunctions in ON and WHERE clauses are laid out one
 * parenthesized operand per block. A select item omits {@code AS} when it
 * reads a column already named like its alias.
 *
 * <p>Rendering is a pure function of the plan and the dialect profile. The
 * renderer holds no mutable state and may be shared across threads.
 */
public class SqlQueryPlanRenderer {

    private static final Logger logger = LoggerFactory.getLogger(SqlQueryPlanRenderer.class);

    /** Default number of spaces per indentation level. */
    public static final int DEFAULT_INDENT_WIDTH = 2;

    private final String indent;

    public SqlQueryPlanRenderer() {
        this(DEFAULT_INDENT_WIDTH);
    }

    /**
     * Creates a renderer with a custom indentation width.
     *
     * @param indentWidth the number of spaces per nesting level (1 to 8)
     */
    public SqlQueryPlanRenderer(int indentWidth) {
        if (indentWidth < 1 || indentWidth > 8) {
            throw new IllegalArgumentException("Indent width must be between 1 and 8: " + indentWidth);
        }
        this.indent = " ".repeat(indentWidth);
    }

    /**
     * Renders a SQL query plan.
     *
     * @param plan the plan
     * @param profile the target dialect
     * @return the SQL text, without a trailing newline
     * @throws com.dataflow2sql.exception.UnsupportedConstructException if the
     *         dialect cannot express a construct of the plan
     */
    public String render(SqlQueryPlan plan, DialectProfile profile) {
        Objects.requireNonNull(plan, "plan must not be null");
        Objects.requireNonNull(profile, "profile must not be null");
        List<String> lines = new ArrayList<>();
        renderStatement(plan.root(), profile, lines);
        String sql = String.join("\n", lines);
        logger.debug("Rendered {} line(s) of {} SQL", lines.size(), profile.name());
        return sql;
    }

    private void renderStatement(SqlSelectStatement statement, DialectProfile profile, List<String> lines) {
        SqlExpressionRenderer expressions = new SqlExpressionRenderer(profile, statement.description());

        for (String descriptionLine : statement.description().split("\n", -1)) {
            lines.add(("-- " + descriptionLine).stripTrailing());
        }

        lines.add("SELECT");
        List<SqlSelectColumn> columns = statement.selectColumns();
        for (int i = 0; i < columns.size(); i++) {
            lines.add(indent + (i == 0 ? "" : ", ") + selectItem(columns.get(i), expressions, profile));
        }

        renderSource("FROM", statement.fromSource(), statement.fromSourceAlias(), profile, lines);

        for (SqlJoinDescription join : statement.joinDescriptions()) {
            renderSource(profile.joinKeyword(join.joinType()), join.right(), join.rightAlias(), profile, lines);
            lines.add("ON");
            for (String line : conditionLines(join.onCondition(), expressions)) {
                lines.add(indent + line);
            }
        }

        if (statement.whereExpression() != null) {
            List<String> where = conditionLines(statement.whereExpression(), expressions);
            if (where.size() == 1) {
                lines.add("WHERE " + where.get(0));
            } else {
                lines.add("WHERE");
                for (String line : where) {
                    lines.add(indent + line);
                }
            }
        }

        if (!statement.groupBys().isEmpty()) {
            lines.add("GROUP BY");
            List<Expression> groupBys = statement.groupBys();
            for (int i = 0; i < groupBys.size(); i++) {
                lines.add(indent + (i == 0 ? "" : ", ") + expressions.render(groupBys.get(i)));
            }
        }

        if (!statement.orderBys().isEmpty()) {
            lines.add("ORDER BY");
            List<SqlOrderBy> orderBys = statement.orderBys();
            for (int i = 0; i < orderBys.size(); i++) {
                SqlOrderBy orderBy = orderBys.get(i);
                lines.add(indent + (i == 0 ? "" : ", ") + expressions.render(orderBy.expression())
                    + (orderBy.descending() ? " DESC" : ""));
            }
        }

        statement.limit().ifPresent(limit -> lines.add("LIMIT " + limit));
    }

    private void renderSource(String keyword, SqlQueryPlanNode source, String alias, DialectProfile profile,
                              List<String> lines) {
        String quotedAlias = profile.quoteIdentifier(alias);
        source.accept(new SqlQueryPlanNodeVisitor<Void>() {
            @Override
            public Void visitSelectStatement(SqlSelectStatement statement) {
                lines.add(keyword + " (");
                List<String> nested = new ArrayList<>();
                renderStatement(statement, profile, nested);
                for (String line : nested) {
                    lines.add(indent + line);
                }
                lines.add(") " + quotedAlias);
                return null;
            }

            @Override
            public Void visitTableReference(SqlTableReference table) {
                lines.add(keyword + " " + tableName(table, profile) + " " + quotedAlias);
                return null;
            }
        });
    }

    private static String selectItem(SqlSelectColumn column, SqlExpressionRenderer expressions,
                                     DialectProfile profile) {
        String sql = expressions.render(column.expression());
        Expression expression = column.expression();
        if (expression instanceof ColumnReference
                && ((ColumnReference) expression).columnName().equals(column.alias())) {
            return sql;
        }
        return sql + " AS " + profile.quoteIdentifier(column.alias());
    }

    private static String tableName(SqlTableReference table, DialectProfile profile) {
        StringJoiner name = new StringJoiner(".");
        for (String part : table.nameParts()) {
            name.add(profile.quoteIdentifier(part));
        }
        return name.toString();
    }

    /**
     * Lays out a condition. AND and OR chains become parenthesized blocks, one
     * per operand; other expressions stay on one line.
     */
    private List<String> conditionLines(Expression condition, SqlExpressionRenderer expressions) {
        List<String> lines = new ArrayList<>();
        if (!isLogical(condition)) {
            lines.add(expressions.render(condition));
            return lines;
        }
        BinaryExpression.Operator operator = ((BinaryExpression) condition).operator();
        List<Expression> operands = new ArrayList<>();
        flatten(condition, operator, operands);
        lines.add("(");
        for (int i = 0; i < operands.size(); i++) {
            if (i > 0) {
                lines.add(") " + operator.symbol() + " (");
            }
            for (String line : conditionLines(operands.get(i), expressions)) {
                lines.add(indent + line);
            }
        }
        lines.add(")");
        return lines;
    }

    private static void flatten(Expression expression, BinaryExpression.Operator operator, List<Expression> operands) {
        if (expression instanceof BinaryExpression && ((BinaryExpression) expression).operator() == operator) {
            BinaryExpression binary = (BinaryExpression) expression;
            flatten(binary.left(), operator, operands);
            flatten(binary.right(), operator, operands);
        } else {
            operands.add(expression);
        }
    }

    private static boolean isLogical(Expression expression) {
        return expression instanceof BinaryExpression && ((BinaryExpression) expression).operator().isLogical();
    }
}
