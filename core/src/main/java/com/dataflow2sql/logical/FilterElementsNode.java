package com.dataflow2sql.logical;

import com.dataflow2sql.exception.MalformedPlanException;
import com.dataflow2sql.naming.ColumnIdentifier;
import com.dataflow2sql.schema.OutputColumn;
import com.dataflow2sql.schema.OutputSchema;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Dataflow node keeping only the listed elements of its input.
 *
 * <p>The description lists the elements in the order given; the output uses
 * the canonical column order.
 */
public final class FilterElementsNode extends DataflowPlanNode {

    private final List<ColumnIdentifier> includedElements;

    /**
     * Creates a filter node.
     *
     * @param parent the input node
     * @param includedElements the elements to keep
     */
    public FilterElementsNode(DataflowPlanNode parent, List<ColumnIdentifier> includedElements) {
        super(single(parent), 1);
        Objects.requireNonNull(includedElements, "includedElements must not be null");
        this.includedElements = List.copyOf(includedElements);
    }

    public List<ColumnIdentifier> includedElements() {
        return includedElements;
    }

    @Override
    public int requiredParentCount() {
        return 1;
    }

    @Override
    protected OutputSchema computeOutputSchema() {
        if (includedElements.isEmpty()) {
            throw new MalformedPlanException("Element filter must keep at least one element", this);
        }
        OutputSchema input = parent().outputSchema();
        Set<ColumnIdentifier> seen = new HashSet<>();
        List<OutputColumn> columns = new ArrayList<>(includedElements.size());
        for (ColumnIdentifier id : includedElements) {
            if (!seen.add(id)) {
                throw new MalformedPlanException("Element '" + id + "' is listed twice", this);
            }
            OutputColumn column = input.find(id).orElseThrow(() -> new MalformedPlanException(
                "Input does not contain element '" + id + "'", this));
            columns.add(column);
        }
        return OutputSchema.canonical(columns);
    }

    @Override
    public String description() {
        List<String> aliases = includedElements.stream()
            .map(ColumnIdentifier::toString)
            .collect(Collectors.toList());
        return "Pass Only Elements:\n  " + formatAliasList(aliases);
    }

    @Override
    public <R> R accept(DataflowPlanNodeVisitor<R> visitor) {
        return visitor.visitFilterElements(this);
    }

    @Override
    public String toString() {
        return "FilterElements(" + includedElements + ")";
    }
}
