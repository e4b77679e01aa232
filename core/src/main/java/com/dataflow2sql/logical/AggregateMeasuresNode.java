package com.dataflow2sql.logical;

import com.dataflow2sql.exception.MalformedPlanException;
import com.dataflow2sql.schema.ElementKind;
import com.dataflow2sql.schema.OutputColumn;
import com.dataflow2sql.schema.OutputSchema;
import java.util.ArrayList;
import java.util.List;

/**
 * Dataflow node aggregating every measure of its input, grouped by every
 * non-measure column.
 *
 * <p>Each measure is wrapped in its declared aggregation and keeps its alias:
 * <pre>
 *   SELECT subq_8.metric_time, SUM(subq_8.bookings) AS bookings
 *   FROM (...) subq_8
 *   GROUP BY subq_8.metric_time
 * </pre>
 */
public final class AggregateMeasuresNode extends DataflowPlanNode {

    public AggregateMeasuresNode(DataflowPlanNode parent) {
        super(single(parent), 1);
    }

    @Override
    public int requiredParentCount() {
        return 1;
    }

    @Override
    protected OutputSchema computeOutputSchema() {
        OutputSchema input = parent().outputSchema();
        if (!input.columnsOfKind(ElementKind.METRIC).isEmpty()) {
            throw new MalformedPlanException(
                "Cannot aggregate metric columns " + input.columnsOfKind(ElementKind.METRIC), this);
        }
        List<OutputColumn> measures = input.columnsOfKind(ElementKind.MEASURE);
        if (measures.isEmpty()) {
            throw new MalformedPlanException("Input has no measures to aggregate: " + input.aliases(), this);
        }
        List<OutputColumn> columns = new ArrayList<>(input.groupableColumns());
        for (OutputColumn measure : measures) {
            columns.add(OutputColumn.measure(measure.identifier(),
                measure.aggregation().resultType(measure.dataType()), measure.aggregation()));
        }
        return new OutputSchema(columns);
    }

    @Override
    public String description() {
        return "Aggregate Measures";
    }

    @Override
    public <R> R accept(DataflowPlanNodeVisitor<R> visitor) {
        return visitor.visitAggregateMeasures(this);
    }

    @Override
    public String toString() {
        return "AggregateMeasures";
    }
}
