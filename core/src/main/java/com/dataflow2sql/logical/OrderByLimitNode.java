package com.dataflow2sql.logical;

import com.dataflow2sql.exception.MalformedPlanException;
import com.dataflow2sql.naming.ColumnIdentifier;
import com.dataflow2sql.schema.OutputSchema;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Dataflow node sorting its input and optionally keeping the first rows.
 */
public final class OrderByLimitNode extends DataflowPlanNode {

    /**
     * One sort key.
     *
     * @param element the element to sort by
     * @param descending true for descending order
     */
    public record OrderBySpec(ColumnIdentifier element, boolean descending) {
        public OrderBySpec {
            Objects.requireNonNull(element, "element must not be null");
        }

        public static OrderBySpec ascending(String element) {
            return new OrderBySpec(ColumnIdentifier.of(element), false);
        }

        public static OrderBySpec descending(String element) {
            return new OrderBySpec(ColumnIdentifier.of(element), true);
        }
    }

    private final List<OrderBySpec> orderBySpecs;
    private final Long limit;

    /**
     * Creates an order-by/limit node.
     *
     * @param parent the input node
     * @param orderBySpecs the sort keys (may be empty when a limit is given)
     * @param limit the maximum number of rows, or null for no limit
     */
    public OrderByLimitNode(DataflowPlanNode parent, List<OrderBySpec> orderBySpecs, Long limit) {
        super(single(parent), 1);
        Objects.requireNonNull(orderBySpecs, "orderBySpecs must not be null");
        if (orderBySpecs.isEmpty() && limit == null) {
            throw new MalformedPlanException("Order-by node needs sort keys or a limit", null);
        }
        if (limit != null && limit < 0) {
            throw new MalformedPlanException("Limit must not be negative: " + limit, null);
        }
        this.orderBySpecs = List.copyOf(orderBySpecs);
        this.limit = limit;
    }

    public List<OrderBySpec> orderBySpecs() {
        return orderBySpecs;
    }

    public OptionalLong limit() {
        return limit == null ? OptionalLong.empty() : OptionalLong.of(limit);
    }

    @Override
    public int requiredParentCount() {
        return 1;
    }

    @Override
    protected OutputSchema computeOutputSchema() {
        return parent().outputSchema();
    }

    @Override
    public String description() {
        StringBuilder sb = new StringBuilder();
        if (!orderBySpecs.isEmpty()) {
            List<String> aliases = new ArrayList<>();
            for (OrderBySpec spec : orderBySpecs) {
                aliases.add(spec.element().toString());
            }
            sb.append("Order By ").append(formatAliasList(aliases));
        }
        if (limit != null) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append("Limit ").append(limit);
        }
        return sb.toString();
    }

    @Override
    public <R> R accept(DataflowPlanNodeVisitor<R> visitor) {
        return visitor.visitOrderByLimit(this);
    }

    @Override
    public String toString() {
        return String.format("OrderByLimit(%s, limit=%s)", orderBySpecs, limit);
    }
}
