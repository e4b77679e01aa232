package com.dataflow2sql.logical;

import com.dataflow2sql.exception.MalformedPlanException;
import com.dataflow2sql.exception.UnresolvableIdentifierException;
import com.dataflow2sql.naming.ColumnIdentifier;
import com.dataflow2sql.schema.OutputColumn;
import com.dataflow2sql.schema.OutputSchema;
import java.util.Collections;
import java.util.List;

/**
 * Base class for all nodes of a dataflow plan.
 *
 * <p>A dataflow plan is a DAG of logical operations (read, filter, join,
 * aggregate, compute) describing a metric query before SQL generation. Each
 * node has exactly the predecessors its kind requires and an output schema
 * computable from the plan alone.
 *
 * <p>The set of node kinds is closed. Consumers dispatch through
 * {@link DataflowPlanNodeVisitor}, so adding a kind breaks every consumer at
 * compile time until it handles the new kind.
 *
 * <p>Nodes are immutable. The output schema is computed on first request and
 * cached; computing it twice yields an equal schema, so concurrent compilations
 * of the same plan are safe.
 *
 * @see com.dataflow2sql.lowering.DataflowToSqlQueryPlanConverter
 */
public abstract sealed class DataflowPlanNode
    permits ReadSqlSourceNode, MetricTimeDimensionTransformNode, FilterElementsNode,
            ConstrainOutputNode, JoinOnEntitiesNode, AggregateMeasuresNode,
            ComputeMetricsNode, OrderByLimitNode {

    /** Predecessor nodes, left to right */
    private final List<DataflowPlanNode> parentNodes;

    /** Output schema, computed lazily */
    private volatile OutputSchema outputSchema;

    /**
     * Creates a node.
     *
     * @param parentNodes the predecessors
     * @param requiredParentCount the number of predecessors this node kind requires
     * @throws MalformedPlanException if the predecessor count is wrong or a predecessor is null
     */
    protected DataflowPlanNode(List<DataflowPlanNode> parentNodes, int requiredParentCount) {
        if (parentNodes == null || parentNodes.size() != requiredParentCount || parentNodes.contains(null)) {
            throw new MalformedPlanException(
                getClass().getSimpleName() + " requires " + requiredParentCount + " predecessor(s), got "
                + (parentNodes == null ? 0 : parentNodes.stream().filter(p -> p != null).count()),
                null);
        }
        this.parentNodes = List.copyOf(parentNodes);
    }

    /**
     * Returns the predecessors of this node, left to right.
     *
     * @return an unmodifiable list of predecessors
     */
    public List<DataflowPlanNode> parentNodes() {
        return parentNodes;
    }

    /**
     * Returns the number of predecessors this node kind requires.
     *
     * @return 0 for source reads, 2 for joins, 1 otherwise
     */
    public abstract int requiredParentCount();

    /**
     * Returns the output schema of this node.
     *
     * @return the output schema
     * @throws MalformedPlanException if the node's prerequisites on its input are violated
     */
    public OutputSchema outputSchema() {
        OutputSchema schema = outputSchema;
        if (schema == null) {
            schema = computeOutputSchema();
            outputSchema = schema;
        }
        return schema;
    }

    /**
     * Returns the output schema if it has already been computed.
     *
     * @return the cached schema, or null
     */
    public OutputSchema cachedOutputSchema() {
        return outputSchema;
    }

    /**
     * Computes the output schema from the predecessors' schemas.
     *
     * @return the output schema
     */
    protected abstract OutputSchema computeOutputSchema();

    /**
     * Returns the human-readable description of this node's logical operation.
     *
     * <p>The description is emitted as a comment above the node's SELECT and must
     * be deterministic.
     *
     * @return the description (may span several lines)
     */
    public abstract String description();

    /**
     * Dispatches to the visitor method for this node kind.
     *
     * @param visitor the visitor
     * @param <R> the visitor result type
     * @return the visitor's result
     */
    public abstract <R> R accept(DataflowPlanNodeVisitor<R> visitor);

    /**
     * Resolves an element referenced by one of this node's expressions against
     * an input schema.
     *
     * @param input the input schema
     * @param identifier the referenced element
     * @return the matching input column
     * @throws UnresolvableIdentifierException if no input column matches
     */
    public OutputColumn resolveReference(OutputSchema input, ColumnIdentifier identifier) {
        return input.find(identifier).orElseThrow(() -> {
            List<String> path = identifier.entityPath();
            boolean unreachable = !path.isEmpty() && !input.reachableEntities().contains(path.get(0));
            return new UnresolvableIdentifierException(identifier, unreachable, this);
        });
    }

    protected DataflowPlanNode parent() {
        return parentNodes.get(0);
    }

    protected static List<DataflowPlanNode> single(DataflowPlanNode parent) {
        return Collections.singletonList(parent);
    }

    /**
     * Formats aliases like {@code ['bookings', 'metric_time']}.
     *
     * @param aliases the aliases
     * @return the formatted list
     */
    protected static String formatAliasList(List<String> aliases) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < aliases.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append('\'').append(aliases.get(i)).append('\'');
        }
        return sb.append(']').toString();
    }

    /**
     * Returns a human-readable string representation of this node.
     *
     * @return a string representation
     */
    @Override
    public abstract String toString();
}
