package com.dataflow2sql.exception;

/**
 * Thrown when the target dialect cannot express a construct the SQL plan needs.
 *
 * <p>The error is specific to the dialect: the caller may compile the same plan
 * for another dialect.
 */
public class UnsupportedConstructException extends CompilationException {

    private final String dialectName;
    private final String construct;

    /**
     * Creates an unsupported construct exception.
     *
     * @param dialectName the dialect that lacks the capability
     * @param construct the construct, e.g. {@code COUNT(DISTINCT ...)}
     * @param location the description or alias of the statement being rendered
     */
    public UnsupportedConstructException(String dialectName, String construct, String location) {
        super("Dialect '" + dialectName + "' does not support " + construct + " (in: " + location + ")", null);
        this.dialectName = dialectName;
        this.construct = construct;
    }

    public String getDialectName() {
        return dialectName;
    }

    public String getConstruct() {
        return construct;
    }
}
