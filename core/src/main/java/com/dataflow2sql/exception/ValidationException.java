package com.dataflow2sql.exception;

/**
 * Thrown when a SQL query plan violates referential closure or alias uniqueness.
 *
 * @see com.dataflow2sql.validation.SqlQueryPlanValidator
 */
public class ValidationException extends CompilationException {

    private final String offendingAlias;

    /**
     * Creates a validation exception.
     *
     * @param message the error message
     * @param offendingAlias the alias or column the violation is about
     */
    public ValidationException(String message, String offendingAlias) {
        super(message, null);
        this.offendingAlias = offendingAlias;
    }

    public String getOffendingAlias() {
        return offendingAlias;
    }
}
