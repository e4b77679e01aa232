package com.dataflow2sql.runtime;

import com.dataflow2sql.generator.DialectProfile;
import com.dataflow2sql.generator.DialectProfiles;
import com.dataflow2sql.generator.SqlQueryPlanRenderer;
import java.util.Objects;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiler settings: default dialect, IR validation and indentation.
 *
 * <p>Settings are read from system properties by {@link #fromSystemProperties()}:
 * <ul>
 *   <li>{@code dataflow2sql.dialect}: built-in dialect name (default {@code bigquery})</li>
 *   <li>{@code dataflow2sql.validate}: validate the SQL plan before rendering (default {@code true})</li>
 *   <li>{@code dataflow2sql.indent}: spaces per nesting level, 1 to 8 (default 2)</li>
 * </ul>
 * An invalid dialect name fails fast; an unparsable validate or indent value
 * falls back to the default with a warning.
 */
public final class CompilerConfig {

    private static final Logger logger = LoggerFactory.getLogger(CompilerConfig.class);

    public static final String PROP_DIALECT = "dataflow2sql.dialect";
    public static final String PROP_VALIDATE = "dataflow2sql.validate";
    public static final String PROP_INDENT = "dataflow2sql.indent";

    private static final String DEFAULT_DIALECT = "bigquery";
    private static final boolean DEFAULT_VALIDATE = true;
    private static final int DEFAULT_INDENT = SqlQueryPlanRenderer.DEFAULT_INDENT_WIDTH;

    private final DialectProfile dialect;
    private final boolean validate;
    private final int indentWidth;

    public CompilerConfig(DialectProfile dialect, boolean validate, int indentWidth) {
        this.dialect = Objects.requireNonNull(dialect, "dialect must not be null");
        if (indentWidth < 1 || indentWidth > 8) {
            throw new IllegalArgumentException("Indent width must be between 1 and 8: " + indentWidth);
        }
        this.validate = validate;
        this.indentWidth = indentWidth;
    }

    /**
     * Returns the default settings: BigQuery, validation on, two-space indentation.
     *
     * @return the default configuration
     */
    public static CompilerConfig defaults() {
        return new CompilerConfig(DialectProfiles.parse(DEFAULT_DIALECT), DEFAULT_VALIDATE, DEFAULT_INDENT);
    }

    /**
     * Reads the settings from system properties.
     *
     * @return the configuration
     * @throws IllegalArgumentException if the dialect name is unknown
     */
    public static CompilerConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /**
     * Reads the settings from the given properties.
     *
     * @param properties the properties
     * @return the configuration
     * @throws IllegalArgumentException if the dialect name is unknown
     */
    public static CompilerConfig fromProperties(Properties properties) {
        DialectProfile dialect = DialectProfiles.parse(properties.getProperty(PROP_DIALECT, DEFAULT_DIALECT));
        return new CompilerConfig(dialect, configuredValidate(properties), configuredIndent(properties));
    }

    public DialectProfile dialect() {
        return dialect;
    }

    public boolean validate() {
        return validate;
    }

    public int indentWidth() {
        return indentWidth;
    }

    public CompilerConfig withDialect(DialectProfile newDialect) {
        return new CompilerConfig(newDialect, validate, indentWidth);
    }

    public CompilerConfig withValidate(boolean newValidate) {
        return new CompilerConfig(dialect, newValidate, indentWidth);
    }

    public CompilerConfig withIndentWidth(int newIndentWidth) {
        return new CompilerConfig(dialect, validate, newIndentWidth);
    }

    // ========== Configuration Helpers ==========

    private static boolean configuredValidate(Properties properties) {
        String value = properties.getProperty(PROP_VALIDATE);
        if (value != null) {
            String normalized = value.trim().toLowerCase();
            if (normalized.equals("true") || normalized.equals("false")) {
                return Boolean.parseBoolean(normalized);
            }
            logger.warn("Ignoring invalid {}='{}', using {}", PROP_VALIDATE, value, DEFAULT_VALIDATE);
        }
        return DEFAULT_VALIDATE;
    }

    private static int configuredIndent(Properties properties) {
        String value = properties.getProperty(PROP_INDENT);
        if (value != null) {
            try {
                int indent = Integer.parseInt(value.trim());
                if (indent >= 1 && indent <= 8) {
                    return indent;
                }
            } catch (NumberFormatException e) {
                logger.debug("Unparsable {}='{}'", PROP_INDENT, value, e);
            }
            logger.warn("Ignoring invalid {}='{}', using {}", PROP_INDENT, value, DEFAULT_INDENT);
        }
        return DEFAULT_INDENT;
    }

    @Override
    public String toString() {
        return String.format("CompilerConfig(dialect=%s, validate=%s, indent=%d)",
            dialect.name(), validate, indentWidth);
    }
}
