package com.dataflow2sql.exception;

import com.dataflow2sql.logical.DataflowPlanNode;

/**
 * Base class of the errors that abort a compilation.
 *
 * <p>A compilation never returns partially rendered SQL: any subclass of this
 * exception propagates to the caller, identifying the dataflow node that could
 * not be compiled when one is known.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       String sql = compiler.compile(plan, DialectProfiles.BIGQUERY);
 *   } catch (UnsupportedConstructException e) {
 *       sql = compiler.compile(plan, DialectProfiles.DUCKDB);
 *   } catch (CompilationException e) {
 *       logger.error(e.getTechnicalMessage());
 *   }
 * </pre>
 *
 * @see MalformedPlanException
 * @see UnresolvableIdentifierException
 * @see UnsupportedConstructException
 */
public class CompilationException extends RuntimeException {

    private final DataflowPlanNode failedNode;

    /**
     * Creates a compilation exception.
     *
     * @param message the error message
     * @param node the dataflow node that failed to compile (may be null)
     */
    public CompilationException(String message, DataflowPlanNode node) {
        super(message + (node != null ? " (node: " + node + ")" : ""));
        this.failedNode = node;
    }

    /**
     * Creates a compilation exception with a cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     * @param node the dataflow node that failed to compile (may be null)
     */
    public CompilationException(String message, Throwable cause, DataflowPlanNode node) {
        super(message + (node != null ? " (node: " + node + ")" : ""), cause);
        this.failedNode = node;
    }

    /**
     * Returns the dataflow node that failed to compile.
     *
     * @return the failed node, or null if not available
     */
    public DataflowPlanNode getFailedNode() {
        return failedNode;
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Compilation Failed\n");
        sb.append("Error Type: ").append(getClass().getSimpleName()).append("\n");
        sb.append("Error: ").append(getMessage()).append("\n");

        if (failedNode != null) {
            sb.append("Failed Node Type: ").append(failedNode.getClass().getName()).append("\n");
            sb.append("Failed Node Output: ").append(failedNode.cachedOutputSchema()).append("\n");
        }

        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getMessage()).append("\n");
        }

        return sb.toString();
    }
}
