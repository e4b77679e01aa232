package com.dataflow2sql.lowering;

import com.dataflow2sql.exception.CompilationException;
import com.dataflow2sql.exception.MalformedPlanException;
import com.dataflow2sql.expression.AggregateFunction;
import com.dataflow2sql.expression.BinaryExpression;
import com.dataflow2sql.expression.CaseWhenExpression;
import com.dataflow2sql.expression.CastExpression;
import com.dataflow2sql.expression.ColumnReference;
import com.dataflow2sql.expression.DateTruncExpression;
import com.dataflow2sql.expression.Expression;
import com.dataflow2sql.expression.FunctionCall;
import com.dataflow2sql.expression.Literal;
import com.dataflow2sql.expression.RawSQLExpression;
import com.dataflow2sql.expression.UnaryExpression;
import com.dataflow2sql.logical.AggregateMeasuresNode;
import com.dataflow2sql.logical.ComputeMetricsNode;
import com.dataflow2sql.logical.ConstrainOutputNode;
import com.dataflow2sql.logical.DataflowPlanNode;
import com.dataflow2sql.logical.DataflowPlanNodeVisitor;
import com.dataflow2sql.logical.FilterElementsNode;
import com.dataflow2sql.logical.JoinOnEntitiesNode;
import com.dataflow2sql.logical.MetricTimeDimensionTransformNode;
import com.dataflow2sql.logical.OrderByLimitNode;
import com.dataflow2sql.logical.ReadSqlSourceNode;
import com.dataflow2sql.naming.ColumnIdentifier;
import com.dataflow2sql.schema.ElementKind;
import com.dataflow2sql.schema.OutputColumn;
import com.dataflow2sql.schema.OutputSchema;
import com.dataflow2sql.sql.SqlJoinDescription;
import com.dataflow2sql.sql.SqlOrderBy;
import com.dataflow2sql.sql.SqlQueryPlan;
import com.dataflow2sql.sql.SqlSelectStatement;
import com.dataflow2sql.sql.SqlTableReference;
import com.dataflow2sql.types.DoubleType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lowers a dataflow plan into a SQL query plan, one SELECT per dataflow node.
 *
 * <p>Predecessors are lowered before the node that consumes them. A nested
 * statement receives its alias right after it has been lowered, so aliases
 * {@code subq_0, subq_1, ...} follow a post-order traversal of the plan, left
 * predecessor before right. Source tables are aliased {@code <source>_src_<n>}
 * from a second counter. The root statement is not aliased.
 *
 * <p>Each call to {@link #convert(DataflowPlanNode)} owns its counters, so the
 * converter holds no mutable state and may be shared across threads. A node
 * reachable along two paths is lowered once per path; the two statements are
 * independent copies with their own aliases.
 *
 * <p>Example usage:
 * <pre>
 *   SqlQueryPlan sqlPlan = new DataflowToSqlQueryPlanConverter().convert(computeMetricsNode);
 * </pre>
 *
 * @see com.dataflow2sql.generator.SqlQueryPlanRenderer
 */
public class DataflowToSqlQueryPlanConverter {

    private static final Logger logger = LoggerFactory.getLogger(DataflowToSqlQueryPlanConverter.class);

    /** Prefix of nested statement aliases. */
    public static final String SUBQUERY_ALIAS_PREFIX = "subq_";

    /** Infix of source table aliases. */
    public static final String SOURCE_ALIAS_INFIX = "_src_";

    private static final Pattern BARE_COLUMN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    /**
     * Lowers a dataflow plan.
     *
     * @param root the sink node of the plan
     * @return the SQL query plan
     * @throws MalformedPlanException if the plan violates a structural rule
     * @throws com.dataflow2sql.exception.UnresolvableIdentifierException if an
     *         expression references an element its input does not produce
     */
    public SqlQueryPlan convert(DataflowPlanNode root) {
        Objects.requireNonNull(root, "root must not be null");
        LoweringContext context = new LoweringContext();
        SqlSelectStatement statement = context.lower(root);
        logger.debug("Lowered {} into {} nested statement(s)", root, context.subqueryCounter);
        return new SqlQueryPlan(statement);
    }

    /**
     * State of one compilation: alias counters and the nodes being lowered.
     */
    private static final class LoweringContext implements DataflowPlanNodeVisitor<SqlSelectStatement> {

        private int subqueryCounter;
        private int sourceCounter;
        private final Set<DataflowPlanNode> inProgress = Collections.newSetFromMap(new IdentityHashMap<>());

        SqlSelectStatement lower(DataflowPlanNode node) {
            if (!inProgress.add(node)) {
                throw new MalformedPlanException("Dataflow plan contains a cycle", node);
            }
            try {
                return node.accept(this);
            } catch (CompilationException e) {
                throw e;
            } catch (IllegalArgumentException e) {
                throw new MalformedPlanException("Cannot lower node: " + e.getMessage(), e, node);
            } finally {
                inProgress.remove(node);
            }
        }

        /**
         * Lowers a predecessor and assigns it the next subquery alias.
         */
        private Nested lowerNested(DataflowPlanNode parent) {
            SqlSelectStatement statement = lower(parent);
            String alias = SUBQUERY_ALIAS_PREFIX + subqueryCounter++;
            logger.trace("Assigned alias {} to {}", alias, parent);
            return new Nested(statement, alias, parent.outputSchema());
        }

        @Override
        public SqlSelectStatement visitReadSqlSource(ReadSqlSourceNode node) {
            String tableAlias = node.dataSource().name() + SOURCE_ALIAS_INFIX + sourceCounter++;
            SqlSelectStatement.Builder builder = SqlSelectStatement.builder(node.description())
                .from(new SqlTableReference(node.dataSource().sqlTable()), tableAlias);
            for (ReadSqlSourceNode.SourceColumn sourceColumn : node.sourceColumns()) {
                OutputColumn column = sourceColumn.column();
                Expression expression;
                if (sourceColumn.expr() == null) {
                    expression = Literal.of(1L);
                } else if (BARE_COLUMN.matcher(sourceColumn.expr()).matches()) {
                    expression = ColumnReference.qualified(tableAlias, sourceColumn.expr(), column.dataType());
                } else {
                    expression = new RawSQLExpression(sourceColumn.expr(), column.dataType());
                }
                if (sourceColumn.truncation() != null) {
                    expression = new DateTruncExpression(sourceColumn.truncation(), expression);
                }
                builder.select(expression, column.alias());
            }
            return builder.build();
        }

        @Override
        public SqlSelectStatement visitMetricTimeDimensionTransform(MetricTimeDimensionTransformNode node) {
            Nested input = lowerNested(node.parentNodes().get(0));
            Map<ColumnIdentifier, OutputColumn> metricTimeSources = node.metricTimeSources();
            SqlSelectStatement.Builder builder = SqlSelectStatement.builder(node.description())
                .from(input.statement, input.alias);
            for (OutputColumn column : node.outputSchema().columns()) {
                OutputColumn source = metricTimeSources.getOrDefault(column.identifier(), column);
                builder.select(input.reference(source), column.alias());
            }
            return builder.build();
        }

        @Override
        public SqlSelectStatement visitFilterElements(FilterElementsNode node) {
            Nested input = lowerNested(node.parentNodes().get(0));
            return passThrough(node, input).build();
        }

        @Override
        public SqlSelectStatement visitConstrainOutput(ConstrainOutputNode node) {
            Nested input = lowerNested(node.parentNodes().get(0));
            Expression predicate = new ElementReferenceRewriter(node, input.schema, null, false)
                .rewrite(node.predicate());
            return passThrough(node, input)
                .where(predicate)
                .build();
        }

        @Override
        public SqlSelectStatement visitJoinOnEntities(JoinOnEntitiesNode node) {
            OutputSchema schema = node.outputSchema();
            Nested left = lowerNested(node.left());
            Nested right = lowerNested(node.right());

            Map<ColumnIdentifier, OutputColumn> rightSources = new HashMap<>();
            for (OutputColumn column : right.schema.columns()) {
                if (!node.isRightJoinKey(column.identifier())) {
                    rightSources.put(node.prefixedRightIdentifier(column.identifier()), column);
                }
            }

            SqlSelectStatement.Builder builder = SqlSelectStatement.builder(node.description())
                .from(left.statement, left.alias);
            for (OutputColumn column : schema.columns()) {
                OutputColumn rightSource = rightSources.get(column.identifier());
                if (rightSource != null) {
                    builder.select(right.reference(rightSource), column.alias());
                } else {
                    builder.select(left.reference(column), column.alias());
                }
            }

            List<Expression> conditions = new ArrayList<>();
            for (JoinOnEntitiesNode.JoinKey key : node.joinKeys()) {
                conditions.add(BinaryExpression.equal(
                    left.reference(left.column(key.leftColumn())),
                    right.reference(right.column(key.rightColumn()))));
            }
            JoinOnEntitiesNode.ValidityWindow window = node.validityWindow();
            if (window != null) {
                Expression time = left.reference(left.column(window.leftTime()));
                Expression windowStart = right.reference(right.column(window.windowStart()));
                Expression windowEnd = right.reference(right.column(window.windowEnd()));
                conditions.add(BinaryExpression.greaterThanOrEqual(time, windowStart));
                conditions.add(BinaryExpression.or(
                    BinaryExpression.lessThan(time, windowEnd),
                    UnaryExpression.isNull(windowEnd)));
            }
            builder.join(new SqlJoinDescription(right.statement, right.alias, node.joinType(),
                BinaryExpression.andAll(conditions)));
            return builder.build();
        }

        @Override
        public SqlSelectStatement visitAggregateMeasures(AggregateMeasuresNode node) {
            OutputSchema schema = node.outputSchema();
            Nested input = lowerNested(node.parentNodes().get(0));
            SqlSelectStatement.Builder builder = SqlSelectStatement.builder(node.description())
                .from(input.statement, input.alias);
            for (OutputColumn column : schema.columns()) {
                OutputColumn source = input.column(column.identifier());
                if (column.kind() == ElementKind.MEASURE) {
                    builder.select(aggregate(source, input.reference(source)), column.alias());
                } else {
                    builder.select(input.reference(source), column.alias());
                }
            }
            for (OutputColumn column : input.schema.groupableColumns()) {
                builder.groupBy(input.reference(column));
            }
            return builder.build();
        }

        @Override
        public SqlSelectStatement visitComputeMetrics(ComputeMetricsNode node) {
            OutputSchema schema = node.outputSchema();
            Nested input = lowerNested(node.parentNodes().get(0));
            SqlSelectStatement.Builder builder = SqlSelectStatement.builder(node.description())
                .from(input.statement, input.alias);
            for (OutputColumn column : input.schema.groupableColumns()) {
                builder.select(input.reference(column), column.alias());
            }
            for (ComputeMetricsNode.MetricSpec metric : node.metrics()) {
                builder.select(metricExpression(node, input, metric.expression()),
                    schema.find(ColumnIdentifier.of(metric.name())).orElseThrow().alias());
            }
            return builder.build();
        }

        @Override
        public SqlSelectStatement visitOrderByLimit(OrderByLimitNode node) {
            Nested input = lowerNested(node.parentNodes().get(0));
            SqlSelectStatement.Builder builder = passThrough(node, input);
            for (OrderByLimitNode.OrderBySpec spec : node.orderBySpecs()) {
                OutputColumn column = node.resolveReference(input.schema, spec.element());
                builder.orderBy(new SqlOrderBy(input.reference(column), spec.descending()));
            }
            node.limit().ifPresent(builder::limit);
            return builder.build();
        }

        /**
         * Starts a statement selecting every output column from the same
         * column of the input.
         */
        private SqlSelectStatement.Builder passThrough(DataflowPlanNode node, Nested input) {
            SqlSelectStatement.Builder builder = SqlSelectStatement.builder(node.description())
                .from(input.statement, input.alias);
            for (OutputColumn column : node.outputSchema().columns()) {
                builder.select(input.reference(column), column.alias());
            }
            return builder;
        }

        private Expression aggregate(OutputColumn measure, Expression value) {
            switch (measure.aggregation()) {
                case SUM:
                    return new AggregateFunction(AggregateFunction.Function.SUM, value);
                case SUM_BOOLEAN:
                    return new AggregateFunction(AggregateFunction.Function.SUM, CaseWhenExpression.indicator(value));
                case COUNT:
                    return new AggregateFunction(AggregateFunction.Function.COUNT, value);
                case COUNT_DISTINCT:
                    return new AggregateFunction(AggregateFunction.Function.COUNT, true, value);
                case MIN:
                    return new AggregateFunction(AggregateFunction.Function.MIN, value);
                case MAX:
                    return new AggregateFunction(AggregateFunction.Function.MAX, value);
                case AVERAGE:
                    return new AggregateFunction(AggregateFunction.Function.AVG, value);
                default:
                    throw new IllegalStateException("Unknown aggregation: " + measure.aggregation());
            }
        }

        private Expression metricExpression(ComputeMetricsNode node, Nested input,
                                            ComputeMetricsNode.MetricExpression expression) {
            if (expression instanceof ComputeMetricsNode.MeasureProxy) {
                ColumnIdentifier measure = ((ComputeMetricsNode.MeasureProxy) expression).measure();
                return input.reference(node.resolveReference(input.schema, measure));
            }
            if (expression instanceof ComputeMetricsNode.RatioMetric) {
                ComputeMetricsNode.RatioMetric ratio = (ComputeMetricsNode.RatioMetric) expression;
                Expression numerator = input.reference(node.resolveReference(input.schema, ratio.numerator()));
                Expression denominator = input.reference(node.resolveReference(input.schema, ratio.denominator()));
                // NULL on a zero denominator
                return BinaryExpression.divide(
                    new CastExpression(numerator, DoubleType.get()),
                    FunctionCall.nullIf(denominator, Literal.of(0L)));
            }
            Expression formula = ((ComputeMetricsNode.DerivedMetric) expression).formula();
            return new ElementReferenceRewriter(node, input.schema, input.alias, true).rewrite(formula);
        }
    }

    /**
     * A lowered predecessor with its alias and output schema.
     */
    private static final class Nested {

        final SqlSelectStatement statement;
        final String alias;
        final OutputSchema schema;

        Nested(SqlSelectStatement statement, String alias, OutputSchema schema) {
            this.statement = statement;
            this.alias = alias;
            this.schema = schema;
        }

        OutputColumn column(ColumnIdentifier identifier) {
            return schema.find(identifier).orElseThrow(() -> new IllegalStateException(
                "Nested statement " + alias + " has no column " + identifier));
        }

        ColumnReference reference(OutputColumn column) {
            return ColumnReference.qualified(alias, column.alias(), column.dataType());
        }
    }
}
