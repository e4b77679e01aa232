package com.dataflow2sql.exception;

import com.dataflow2sql.logical.DataflowPlanNode;
import com.dataflow2sql.naming.ColumnIdentifier;

/**
 * Thrown when an element referenced by an expression cannot be mapped to a
 * column of the node's input.
 *
 * <p>Raised while lowering, never while rendering.
 */
public class UnresolvableIdentifierException extends CompilationException {

    private final ColumnIdentifier identifier;
    private final boolean entityPathUnreachable;

    /**
     * Creates an unresolvable identifier exception.
     *
     * @param identifier the identifier that could not be resolved
     * @param entityPathUnreachable true if the first entity of the path is not reachable
     * @param node the node whose input was searched
     */
    public UnresolvableIdentifierException(ColumnIdentifier identifier, boolean entityPathUnreachable,
                                           DataflowPlanNode node) {
        super(entityPathUnreachable
                ? "Entity path " + identifier.entityPath() + " of '" + identifier + "' is not reachable"
                : "No input column matches '" + identifier + "'",
            node);
        this.identifier = identifier;
        this.entityPathUnreachable = entityPathUnreachable;
    }

    public ColumnIdentifier getIdentifier() {
        return identifier;
    }

    public boolean isEntityPathUnreachable() {
        return entityPathUnreachable;
    }
}
