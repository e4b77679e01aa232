package com.dataflow2sql.logical;

/**
 * Visitor over the closed set of {@link DataflowPlanNode} kinds.
 *
 * @param <R> the result type
 */
public interface DataflowPlanNodeVisitor<R> {

    R visitReadSqlSource(ReadSqlSourceNode node);

    R visitMetricTimeDimensionTransform(MetricTimeDimensionTransformNode node);

    R visitFilterElements(FilterElementsNode node);

    R visitConstrainOutput(ConstrainOutputNode node);

    R visitJoinOnEntities(JoinOnEntitiesNode node);

    R visitAggregateMeasures(AggregateMeasuresNode node);

    R visitComputeMetrics(ComputeMetricsNode node);

    R visitOrderByLimit(OrderByLimitNode node);
}
