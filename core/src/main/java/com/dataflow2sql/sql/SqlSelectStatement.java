package com.dataflow2sql.sql;

import com.dataflow2sql.expression.Expression;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * One SELECT statement of the SQL query plan.
 *
 * <p>A statement reads from one source (a base table or a nested statement)
 * under an alias, optionally joins further nested sources, and may carry a
 * WHERE predicate, GROUP BY items, ORDER BY items and a LIMIT. The description
 * names the logical operation the statement performs and is emitted as a SQL
 * comment.
 *
 * <p>SQL form:
 * <pre>
 * -- description
 * SELECT selectColumns
 * FROM fromSource fromAlias
 * [joinType JOIN right rightAlias ON condition]...
 * [WHERE where]
 * [GROUP BY groupBys]
 * [ORDER BY orderBys]
 * [LIMIT limit]
 * </pre>
 *
 * <p>Statements are immutable; use {@link #builder(String)} to create one.
 */
public final class SqlSelectStatement implements SqlQueryPlanNode {

    private final String description;
    private final List<SqlSelectColumn> selectColumns;
    private final SqlQueryPlanNode fromSource;
    private final String fromSourceAlias;
    private final List<SqlJoinDescription> joinDescriptions;
    private final Expression whereExpression;
    private final List<Expression> groupBys;
    private final List<SqlOrderBy> orderBys;
    private final Long limit;

    private SqlSelectStatement(Builder builder) {
        this.description = builder.description;
        this.selectColumns = List.copyOf(builder.selectColumns);
        this.fromSource = Objects.requireNonNull(builder.fromSource, "fromSource must not be null");
        this.fromSourceAlias = Objects.requireNonNull(builder.fromSourceAlias, "fromSourceAlias must not be null");
        this.joinDescriptions = List.copyOf(builder.joinDescriptions);
        this.whereExpression = builder.whereExpression;
        this.groupBys = List.copyOf(builder.groupBys);
        this.orderBys = List.copyOf(builder.orderBys);
        this.limit = builder.limit;

        if (selectColumns.isEmpty()) {
            throw new IllegalArgumentException("SELECT requires at least one column: " + description);
        }
    }

    public String description() {
        return description;
    }

    public List<SqlSelectColumn> selectColumns() {
        return selectColumns;
    }

    public SqlQueryPlanNode fromSource() {
        return fromSource;
    }

    public String fromSourceAlias() {
        return fromSourceAlias;
    }

    public List<SqlJoinDescription> joinDescriptions() {
        return joinDescriptions;
    }

    /**
     * Returns the WHERE predicate.
     *
     * @return the predicate, or null if the statement does not filter
     */
    public Expression whereExpression() {
        return whereExpression;
    }

    public List<Expression> groupBys() {
        return groupBys;
    }

    public List<SqlOrderBy> orderBys() {
        return orderBys;
    }

    public OptionalLong limit() {
        return limit == null ? OptionalLong.empty() : OptionalLong.of(limit);
    }

    /**
     * Returns the aliases of the select columns, in order.
     *
     * @return the output column aliases
     */
    public List<String> outputAliases() {
        List<String> aliases = new ArrayList<>(selectColumns.size());
        for (SqlSelectColumn column : selectColumns) {
            aliases.add(column.alias());
        }
        return aliases;
    }

    @Override
    public <R> R accept(SqlQueryPlanNodeVisitor<R> visitor) {
        return visitor.visitSelectStatement(this);
    }

    @Override
    public String toString() {
        return String.format("SqlSelectStatement(%s, from=%s)", description.replace('\n', ' '), fromSourceAlias);
    }

    public static Builder builder(String description) {
        return new Builder(description);
    }

    /**
     * Builder for {@link SqlSelectStatement}.
     */
    public static final class Builder {

        private final String description;
        private final List<SqlSelectColumn> selectColumns = new ArrayList<>();
        private SqlQueryPlanNode fromSource;
        private String fromSourceAlias;
        private final List<SqlJoinDescription> joinDescriptions = new ArrayList<>();
        private Expression whereExpression;
        private final List<Expression> groupBys = new ArrayList<>();
        private final List<SqlOrderBy> orderBys = new ArrayList<>();
        private Long limit;

        private Builder(String description) {
            this.description = Objects.requireNonNull(description, "description must not be null");
        }

        public Builder select(Expression expression, String alias) {
            selectColumns.add(new SqlSelectColumn(expression, alias));
            return this;
        }

        public Builder select(SqlSelectColumn column) {
            selectColumns.add(Objects.requireNonNull(column, "column must not be null"));
            return this;
        }

        public Builder from(SqlQueryPlanNode source, String alias) {
            this.fromSource = source;
            this.fromSourceAlias = alias;
            return this;
        }

        public Builder join(SqlJoinDescription join) {
            joinDescriptions.add(Objects.requireNonNull(join, "join must not be null"));
            return this;
        }

        public Builder where(Expression predicate) {
            this.whereExpression = predicate;
            return this;
        }

        public Builder groupBy(Expression expression) {
            groupBys.add(Objects.requireNonNull(expression, "expression must not be null"));
            return this;
        }

        public Builder orderBy(SqlOrderBy orderBy) {
            orderBys.add(Objects.requireNonNull(orderBy, "orderBy must not be null"));
            return this;
        }

        public Builder limit(long rowLimit) {
            if (rowLimit < 0) {
                throw new IllegalArgumentException("limit must not be negative: " + rowLimit);
            }
            this.limit = rowLimit;
            return this;
        }

        public SqlSelectStatement build() {
            return new SqlSelectStatement(this);
        }
    }
}
