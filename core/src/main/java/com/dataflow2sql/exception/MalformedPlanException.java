package com.dataflow2sql.exception;

import com.dataflow2sql.logical.DataflowPlanNode;

/**
 * Thrown when the dataflow plan violates a structural rule.
 *
 * <p>Common causes:
 * <ul>
 *   <li>A node with the wrong number of predecessors, or a cyclic plan</li>
 *   <li>A node naming a column its input does not produce</li>
 *   <li>Aggregating an input without measures</li>
 *   <li>Two output columns resolving to the same alias</li>
 * </ul>
 */
public class MalformedPlanException extends CompilationException {

    public MalformedPlanException(String message, DataflowPlanNode node) {
        super(message, node);
    }

    public MalformedPlanException(String message, Throwable cause, DataflowPlanNode node) {
        super(message, cause, node);
    }
}
