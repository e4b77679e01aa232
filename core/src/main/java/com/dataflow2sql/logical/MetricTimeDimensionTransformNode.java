package com.dataflow2sql.logical;

import com.dataflow2sql.exception.MalformedPlanException;
import com.dataflow2sql.naming.ColumnIdentifier;
import com.dataflow2sql.schema.ElementKind;
import com.dataflow2sql.schema.OutputColumn;
import com.dataflow2sql.schema.OutputSchema;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Dataflow node exposing a time dimension of its input as {@code metric_time}.
 *
 * <p>Every input column is passed through. For each granularity variant of the
 * chosen dimension present in the input, an extra {@code metric_time} column of
 * the same granularity is added ({@code ds__week AS metric_time__week}).
 */
public final class MetricTimeDimensionTransformNode extends DataflowPlanNode {

    private final String timeDimensionName;

    /**
     * Creates a metric time transform.
     *
     * @param parent the input node
     * @param timeDimensionName the name of the time dimension to expose as metric time
     */
    public MetricTimeDimensionTransformNode(DataflowPlanNode parent, String timeDimensionName) {
        super(single(parent), 1);
        this.timeDimensionName = Objects.requireNonNull(timeDimensionName, "timeDimensionName must not be null");
    }

    public String timeDimensionName() {
        return timeDimensionName;
    }

    /**
     * Maps each added {@code metric_time} column to the input column it copies.
     *
     * @return the metric time columns keyed by identifier, finest granularity first
     * @throws MalformedPlanException if the input has no such time dimension
     */
    public Map<ColumnIdentifier, OutputColumn> metricTimeSources() {
        OutputSchema input = parent().outputSchema();
        Map<ColumnIdentifier, OutputColumn> sources = new LinkedHashMap<>();
        for (OutputColumn column : input.columns()) {
            ColumnIdentifier id = column.identifier();
            if (column.kind() == ElementKind.TIME_DIMENSION
                    && id.entityPath().isEmpty()
                    && id.elementName().equals(timeDimensionName)) {
                sources.put(ColumnIdentifier.metricTime(id.granularity().orElse(null)), column);
            }
        }
        if (!sources.containsKey(ColumnIdentifier.metricTime(null))) {
            throw new MalformedPlanException(
                "Input has no time dimension named '" + timeDimensionName + "'", this);
        }
        return sources;
    }

    @Override
    public int requiredParentCount() {
        return 1;
    }

    @Override
    protected OutputSchema computeOutputSchema() {
        OutputSchema input = parent().outputSchema();
        List<OutputColumn> columns = new ArrayList<>(input.columns());
        for (Map.Entry<ColumnIdentifier, OutputColumn> entry : metricTimeSources().entrySet()) {
            if (input.contains(entry.getKey())) {
                throw new MalformedPlanException("Input already contains '" + entry.getKey() + "'", this);
            }
            columns.add(entry.getValue().withIdentifier(entry.getKey()));
        }
        return OutputSchema.canonical(columns);
    }

    @Override
    public String description() {
        return "Metric Time Dimension '" + timeDimensionName + "'";
    }

    @Override
    public <R> R accept(DataflowPlanNodeVisitor<R> visitor) {
        return visitor.visitMetricTimeDimensionTransform(this);
    }

    @Override
    public String toString() {
        return String.format("MetricTimeDimensionTransform(%s)", timeDimensionName);
    }
}
