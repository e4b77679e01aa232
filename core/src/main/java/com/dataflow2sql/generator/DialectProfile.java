package com.dataflow2sql.generator;

import com.dataflow2sql.exception.UnsupportedConstructException;
import com.dataflow2sql.naming.TimeGranularity;
import com.dataflow2sql.sql.SqlJoinType;
import com.dataflow2sql.types.DataType;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The surface syntax of one warehouse dialect.
 *
 * <p>A profile holds every dialect-specific token the renderer emits: the
 * identifier quote character, the string literal escaping, the join keywords, the date truncation template
 * of each granularity, the type names used in {@code CAST}, and whether
 * {@code COUNT(DISTINCT ...)} is available. Lowering never consults a profile.
 *
 * <p>Date truncation templates contain the placeholder {@value #EXPR_PLACEHOLDER},
 * replaced by the rendered argument:
 * <pre>
 *   DATE_TRUNC({expr}, isoweek)      -- BigQuery
 *   DATE_TRUNC('week', {expr})       -- DuckDB, Postgres, Snowflake
 * </pre>
 *
 * <p>Profiles are immutable; see {@link DialectProfiles} for the built-in ones.
 */
public final class DialectProfile {

    /** Placeholder for the truncated expression in date truncation templates. */
    public static final String EXPR_PLACEHOLDER = "{expr}";

    private final String name;
    private final char identifierQuoteChar;
    private final boolean backslashStringEscapes;
    private final boolean countDistinctSupported;
    private final Map<SqlJoinType, String> joinKeywords;
    private final Map<TimeGranularity, String> dateTruncTemplates;
    private final Map<String, String> typeNames;

    private DialectProfile(Builder builder) {
        this.name = builder.name;
        this.identifierQuoteChar = builder.identifierQuoteChar;
        this.backslashStringEscapes = builder.backslashStringEscapes;
        this.countDistinctSupported = builder.countDistinctSupported;
        this.joinKeywords = Collections.unmodifiableMap(new EnumMap<>(builder.joinKeywords));
        this.dateTruncTemplates = Collections.unmodifiableMap(new EnumMap<>(builder.dateTruncTemplates));
        this.typeNames = Map.copyOf(builder.typeNames);
    }

    public String name() {
        return name;
    }

    public char identifierQuoteChar() {
        return identifierQuoteChar;
    }

    /**
     * Returns whether string literals escape quotes and backslashes with a
     * backslash instead of doubling quotes.
     *
     * @return true for BigQuery-style literals
     */
    public boolean backslashStringEscapes() {
        return backslashStringEscapes;
    }

    /**
     * Returns whether {@code COUNT(DISTINCT x)} may be emitted.
     *
     * @return true if the dialect supports it natively
     */
    public boolean supportsCountDistinct() {
        return countDistinctSupported;
    }

    /**
     * Returns the keyword introducing a join, e.g. {@code LEFT OUTER JOIN}.
     *
     * @param joinType the join type
     * @return the keyword
     */
    public String joinKeyword(SqlJoinType joinType) {
        return joinKeywords.get(joinType);
    }

    /**
     * Renders the truncation of an expression to a granularity.
     *
     * @param granularity the granularity
     * @param renderedExpression the already rendered argument
     * @return the truncation SQL
     */
    public String dateTrunc(TimeGranularity granularity, String renderedExpression) {
        return dateTruncTemplates.get(granularity).replace(EXPR_PLACEHOLDER, renderedExpression);
    }

    /**
     * Returns the dialect's name for a data type.
     *
     * @param dataType the data type
     * @return the SQL type name
     * @throws UnsupportedConstructException if the dialect has no name for the type
     */
    public String typeName(DataType dataType) {
        String typeName = typeNames.get(dataType.typeName());
        if (typeName == null) {
            throw new UnsupportedConstructException(name, "CAST to " + dataType.typeName(), "type mapping");
        }
        return typeName;
    }

    /**
     * Quotes an identifier for this dialect if needed.
     *
     * @param identifier the identifier
     * @return the identifier, quoted if reserved or not a simple name
     */
    public String quoteIdentifier(String identifier) {
        return SQLQuoting.quoteIdentifierIfNeeded(identifier, identifierQuoteChar);
    }

    /**
     * Quotes a string literal for this dialect.
     *
     * @param value the string value
     * @return the quoted literal
     */
    public String quoteLiteral(String value) {
        return SQLQuoting.quoteLiteral(value, backslashStringEscapes);
    }

    /**
     * Returns a builder initialized with this profile's settings.
     *
     * @param newName the name of the derived profile
     * @return the builder
     */
    public Builder toBuilder(String newName) {
        Builder builder = new Builder(newName)
            .identifierQuoteChar(identifierQuoteChar)
            .backslashStringEscapes(backslashStringEscapes)
            .countDistinctSupported(countDistinctSupported);
        builder.joinKeywords.putAll(joinKeywords);
        builder.dateTruncTemplates.putAll(dateTruncTemplates);
        builder.typeNames.putAll(typeNames);
        return builder;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof DialectProfile)) return false;
        DialectProfile that = (DialectProfile) obj;
        return name.equals(that.name)
            && identifierQuoteChar == that.identifierQuoteChar
            && backslashStringEscapes == that.backslashStringEscapes
            && countDistinctSupported == that.countDistinctSupported
            && joinKeywords.equals(that.joinKeywords)
            && dateTruncTemplates.equals(that.dateTruncTemplates)
            && typeNames.equals(that.typeNames);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, identifierQuoteChar, backslashStringEscapes, countDistinctSupported,
            joinKeywords, dateTruncTemplates, typeNames);
    }

    @Override
    public String toString() {
        return "DialectProfile(" + name + ")";
    }

    /**
     * Builder for {@link DialectProfile}.
     */
    public static final class Builder {

        private final String name;
        private char identifierQuoteChar = '"';
        private boolean backslashStringEscapes;
        private boolean countDistinctSupported = true;
        private final Map<SqlJoinType, String> joinKeywords = new EnumMap<>(SqlJoinType.class);
        private final Map<TimeGranularity, String> dateTruncTemplates = new EnumMap<>(TimeGranularity.class);
        private final Map<String, String> typeNames = new HashMap<>();

        private Builder(String name) {
            Objects.requireNonNull(name, "name must not be null");
            if (name.isBlank()) {
                throw new IllegalArgumentException("Dialect name cannot be blank");
            }
            this.name = name;
        }

        public Builder identifierQuoteChar(char quoteChar) {
            this.identifierQuoteChar = quoteChar;
            return this;
        }

        public Builder backslashStringEscapes(boolean backslashEscapes) {
            this.backslashStringEscapes = backslashEscapes;
            return this;
        }

        public Builder countDistinctSupported(boolean supported) {
            this.countDistinctSupported = supported;
            return this;
        }

        public Builder joinKeyword(SqlJoinType joinType, String keyword) {
            joinKeywords.put(Objects.requireNonNull(joinType, "joinType must not be null"),
                Objects.requireNonNull(keyword, "keyword must not be null"));
            return this;
        }

        public Builder dateTruncTemplate(TimeGranularity granularity, String template) {
            Objects.requireNonNull(granularity, "granularity must not be null");
            Objects.requireNonNull(template, "template must not be null");
            if (!template.contains(EXPR_PLACEHOLDER)) {
                throw new IllegalArgumentException(
                    "Date truncation template for " + granularity + " lacks " + EXPR_PLACEHOLDER + ": " + template);
            }
            dateTruncTemplates.put(granularity, template);
            return this;
        }

        /**
         * Sets the SQL name of a data type.
         *
         * @param dataType the data type
         * @param sqlName the name used in {@code CAST}
         * @return this builder
         */
        public Builder typeName(DataType dataType, String sqlName) {
            return typeName(dataType.typeName(), sqlName);
        }

        public Builder typeName(String typeName, String sqlName) {
            typeNames.put(Objects.requireNonNull(typeName, "typeName must not be null"),
                Objects.requireNonNull(sqlName, "sqlName must not be null"));
            return this;
        }

        /**
         * Builds the profile.
         *
         * @return the profile
         * @throws IllegalArgumentException if a join type or granularity has no syntax
         */
        public DialectProfile build() {
            for (SqlJoinType joinType : SqlJoinType.values()) {
                if (!joinKeywords.containsKey(joinType)) {
                    throw new IllegalArgumentException("Dialect '" + name + "' lacks a keyword for " + joinType);
                }
            }
            for (TimeGranularity granularity : TimeGranularity.values()) {
                if (!dateTruncTemplates.containsKey(granularity)) {
                    throw new IllegalArgumentException(
                        "Dialect '" + name + "' lacks a date truncation template for " + granularity);
                }
            }
            return new DialectProfile(this);
        }
    }
}
