package com.dataflow2sql.logical;

import com.dataflow2sql.exception.MalformedPlanException;
import com.dataflow2sql.expression.Expression;
import com.dataflow2sql.naming.ColumnIdentifier;
import com.dataflow2sql.schema.ElementKind;
import com.dataflow2sql.schema.OutputColumn;
import com.dataflow2sql.schema.OutputSchema;
import com.dataflow2sql.types.DataType;
import com.dataflow2sql.types.DoubleType;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Dataflow node computing metrics from aggregated measures.
 *
 * <p>The output holds every non-measure input column unchanged, followed by one
 * column per metric, in declaration order. Measures are not carried through.
 *
 * <p>Three metric forms are supported:
 * <ul>
 *   <li>{@link MeasureProxy}: the measure under the metric's name</li>
 *   <li>{@link RatioMetric}: numerator divided by denominator, NULL when the
 *       denominator is zero</li>
 *   <li>{@link DerivedMetric}: an arithmetic formula over element references;
 *       every division yields NULL on a zero divisor</li>
 * </ul>
 */
public final class ComputeMetricsNode extends DataflowPlanNode {

    /** How a metric value is computed. */
    public sealed interface MetricExpression permits MeasureProxy, RatioMetric, DerivedMetric {
    }

    /**
     * Exposes one measure as a metric.
     *
     * @param measure the aggregated measure
     */
    public record MeasureProxy(ColumnIdentifier measure) implements MetricExpression {
        public MeasureProxy {
            Objects.requireNonNull(measure, "measure must not be null");
        }
    }

    /**
     * Divides one measure by another.
     *
     * @param numerator the numerator measure
     * @param denominator the denominator measure
     */
    public record RatioMetric(ColumnIdentifier numerator, ColumnIdentifier denominator) implements MetricExpression {
        public RatioMetric {
            Objects.requireNonNull(numerator, "numerator must not be null");
            Objects.requireNonNull(denominator, "denominator must not be null");
        }
    }

    /**
     * Combines measures through an expression of element references, literals
     * and arithmetic operators.
     *
     * @param formula the formula
     */
    public record DerivedMetric(Expression formula) implements MetricExpression {
        public DerivedMetric {
            Objects.requireNonNull(formula, "formula must not be null");
        }
    }

    /**
     * A named metric.
     *
     * @param name the metric name, used as the output alias
     * @param expression how the value is computed
     */
    public record MetricSpec(String name, MetricExpression expression) {
        public MetricSpec {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(expression, "expression must not be null");
        }

        public static MetricSpec proxy(String name, String measure) {
            return new MetricSpec(name, new MeasureProxy(ColumnIdentifier.of(measure)));
        }

        public static MetricSpec ratio(String name, String numerator, String denominator) {
            return new MetricSpec(name,
                new RatioMetric(ColumnIdentifier.of(numerator), ColumnIdentifier.of(denominator)));
        }

        public static MetricSpec derived(String name, Expression formula) {
            return new MetricSpec(name, new DerivedMetric(formula));
        }
    }

    private final List<MetricSpec> metrics;

    /**
     * Creates a metric computation node.
     *
     * @param parent the aggregated input
     * @param metrics the metrics to compute (at least one)
     */
    public ComputeMetricsNode(DataflowPlanNode parent, List<MetricSpec> metrics) {
        super(single(parent), 1);
        Objects.requireNonNull(metrics, "metrics must not be null");
        this.metrics = List.copyOf(metrics);
    }

    public List<MetricSpec> metrics() {
        return metrics;
    }

    @Override
    public int requiredParentCount() {
        return 1;
    }

    @Override
    protected OutputSchema computeOutputSchema() {
        if (metrics.isEmpty()) {
            throw new MalformedPlanException("At least one metric must be computed", this);
        }
        OutputSchema input = parent().outputSchema();
        List<OutputColumn> columns = new ArrayList<>(input.groupableColumns());
        Set<String> names = new HashSet<>();
        for (OutputColumn column : columns) {
            names.add(column.alias());
        }
        for (MetricSpec metric : metrics) {
            ColumnIdentifier id;
            try {
                id = ColumnIdentifier.of(metric.name());
            } catch (IllegalArgumentException e) {
                throw new MalformedPlanException("Invalid metric name '" + metric.name() + "'", e, this);
            }
            if (!names.add(id.toString())) {
                throw new MalformedPlanException("Metric '" + metric.name() + "' collides with another column", this);
            }
            columns.add(OutputColumn.of(id, ElementKind.METRIC, metricType(input, metric.expression())));
        }
        return new OutputSchema(columns);
    }

    private DataType metricType(OutputSchema input, MetricExpression expression) {
        if (expression instanceof MeasureProxy) {
            return resolveReference(input, ((MeasureProxy) expression).measure()).dataType();
        }
        if (expression instanceof RatioMetric) {
            return DoubleType.get();
        }
        return ((DerivedMetric) expression).formula().dataType();
    }

    @Override
    public String description() {
        return "Compute Metrics via Expressions";
    }

    @Override
    public <R> R accept(DataflowPlanNodeVisitor<R> visitor) {
        return visitor.visitComputeMetrics(this);
    }

    @Override
    public String toString() {
        return "ComputeMetrics(" + metrics + ")";
    }
}
