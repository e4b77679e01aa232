package com.dataflow2sql.generator;

import com.dataflow2sql.naming.TimeGranularity;
import com.dataflow2sql.sql.SqlJoinType;
import com.dataflow2sql.types.BooleanType;
import com.dataflow2sql.types.DateType;
import com.dataflow2sql.types.DoubleType;
import com.dataflow2sql.types.IntegerType;
import com.dataflow2sql.types.LongType;
import com.dataflow2sql.types.StringType;
import com.dataflow2sql.types.TimestampType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Built-in dialect profiles and loaders for custom ones.
 *
 * <p>Custom profiles are described by flat keys, either as
 * {@link Properties} or as a JSON object:
 * <pre>
 *   name=redshift
 *   base=postgres
 *   identifier.quote="
 *   string.backslash.escapes=false
 *   count.distinct.supported=true
 *   join.LEFT_OUTER=LEFT JOIN
 *   date.trunc.WEEK=DATE_TRUNC('week', {expr})
 *   type.double=FLOAT8
 * </pre>
 * Keys not given are taken from the {@code base} profile.
 */
public final class DialectProfiles {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    public static final DialectProfile BIGQUERY = DialectProfile.builder("bigquery")
        .identifierQuoteChar('`')
        .backslashStringEscapes(true)
        .countDistinctSupported(true)
        .joinKeyword(SqlJoinType.LEFT_OUTER, "LEFT OUTER JOIN")
        .joinKeyword(SqlJoinType.INNER, "INNER JOIN")
        .joinKeyword(SqlJoinType.FULL_OUTER, "FULL OUTER JOIN")
        .dateTruncTemplate(TimeGranularity.DAY, "DATE_TRUNC({expr}, day)")
        .dateTruncTemplate(TimeGranularity.WEEK, "DATE_TRUNC({expr}, isoweek)")
        .dateTruncTemplate(TimeGranularity.MONTH, "DATE_TRUNC({expr}, month)")
        .dateTruncTemplate(TimeGranularity.QUARTER, "DATE_TRUNC({expr}, quarter)")
        .dateTruncTemplate(TimeGranularity.YEAR, "DATE_TRUNC({expr}, isoyear)")
        .typeName(BooleanType.get(), "BOOL")
        .typeName(IntegerType.get(), "INT64")
        .typeName(LongType.get(), "INT64")
        .typeName(DoubleType.get(), "FLOAT64")
        .typeName(StringType.get(), "STRING")
        .typeName(DateType.get(), "DATE")
        .typeName(TimestampType.get(), "TIMESTAMP")
        .build();

    public static final DialectProfile DUCKDB = DialectProfile.builder("duckdb")
        .identifierQuoteChar('"')
        .countDistinctSupported(true)
        .joinKeyword(SqlJoinType.LEFT_OUTER, "LEFT JOIN")
        .joinKeyword(SqlJoinType.INNER, "INNER JOIN")
        .joinKeyword(SqlJoinType.FULL_OUTER, "FULL JOIN")
        .dateTruncTemplate(TimeGranularity.DAY, "DATE_TRUNC('day', {expr})")
        .dateTruncTemplate(TimeGranularity.WEEK, "DATE_TRUNC('week', {expr})")
        .dateTruncTemplate(TimeGranularity.MONTH, "DATE_TRUNC('month', {expr})")
        .dateTruncTemplate(TimeGranularity.QUARTER, "DATE_TRUNC('quarter', {expr})")
        .dateTruncTemplate(TimeGranularity.YEAR,
            "DATE_TRUNC('week', MAKE_DATE(CAST(ISOYEAR({expr}) AS INTEGER), 1, 4))")
        .typeName(BooleanType.get(), "BOOLEAN")
        .typeName(IntegerType.get(), "INTEGER")
        .typeName(LongType.get(), "BIGINT")
        .typeName(DoubleType.get(), "DOUBLE")
        .typeName(StringType.get(), "VARCHAR")
        .typeName(DateType.get(), "DATE")
        .typeName(TimestampType.get(), "TIMESTAMP")
        .build();

    public static final DialectProfile POSTGRES = DialectProfile.builder("postgres")
        .identifierQuoteChar('"')
        .countDistinctSupported(true)
        .joinKeyword(SqlJoinType.LEFT_OUTER, "LEFT OUTER JOIN")
        .joinKeyword(SqlJoinType.INNER, "INNER JOIN")
        .joinKeyword(SqlJoinType.FULL_OUTER, "FULL OUTER JOIN")
        .dateTruncTemplate(TimeGranularity.DAY, "DATE_TRUNC('day', {expr})")
        .dateTruncTemplate(TimeGranularity.WEEK, "DATE_TRUNC('week', {expr})")
        .dateTruncTemplate(TimeGranularity.MONTH, "DATE_TRUNC('month', {expr})")
        .dateTruncTemplate(TimeGranularity.QUARTER, "DATE_TRUNC('quarter', {expr})")
        .dateTruncTemplate(TimeGranularity.YEAR,
            "DATE_TRUNC('week', MAKE_DATE(CAST(EXTRACT(isoyear FROM {expr}) AS INT), 1, 4))")
        .typeName(BooleanType.get(), "BOOLEAN")
        .typeName(IntegerType.get(), "INTEGER")
        .typeName(LongType.get(), "BIGINT")
        .typeName(DoubleType.get(), "DOUBLE PRECISION")
        .typeName(StringType.get(), "TEXT")
        .typeName(DateType.get(), "DATE")
        .typeName(TimestampType.get(), "TIMESTAMP")
        .build();

    public static final DialectProfile SNOWFLAKE = DialectProfile.builder("snowflake")
        .identifierQuoteChar('"')
        .backslashStringEscapes(true)
        .countDistinctSupported(true)
        .joinKeyword(SqlJoinType.LEFT_OUTER, "LEFT OUTER JOIN")
        .joinKeyword(SqlJoinType.INNER, "INNER JOIN")
        .joinKeyword(SqlJoinType.FULL_OUTER, "FULL OUTER JOIN")
        .dateTruncTemplate(TimeGranularity.DAY, "DATE_TRUNC('day', {expr})")
        .dateTruncTemplate(TimeGranularity.WEEK, "DATE_TRUNC('week', {expr})")
        .dateTruncTemplate(TimeGranularity.MONTH, "DATE_TRUNC('month', {expr})")
        .dateTruncTemplate(TimeGranularity.QUARTER, "DATE_TRUNC('quarter', {expr})")
        .dateTruncTemplate(TimeGranularity.YEAR,
            "DATE_TRUNC('week', DATE_FROM_PARTS(YEAROFWEEKISO({expr}), 1, 4))")
        .typeName(BooleanType.get(), "BOOLEAN")
        .typeName(IntegerType.get(), "INTEGER")
        .typeName(LongType.get(), "BIGINT")
        .typeName(DoubleType.get(), "DOUBLE")
        .typeName(StringType.get(), "VARCHAR")
        .typeName(DateType.get(), "DATE")
        .typeName(TimestampType.get(), "TIMESTAMP")
        .build();

    private DialectProfiles() {}

    /**
     * Parse a built-in dialect name (case-insensitive).
     *
     * @param value "bigquery", "duckdb", "postgres" or "snowflake"
     * @return the profile
     * @throws IllegalArgumentException if value is not recognized
     */
    public static DialectProfile parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Dialect name cannot be null");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "bigquery" -> BIGQUERY;
            case "duckdb" -> DUCKDB;
            case "postgres", "postgresql" -> POSTGRES;
            case "snowflake" -> SNOWFLAKE;
            default -> throw new IllegalArgumentException(
                "Unknown dialect: '%s'. Valid values: bigquery, duckdb, postgres, snowflake".formatted(value));
        };
    }

    /**
     * Builds a profile from flat keys.
     *
     * @param properties the profile description
     * @return the profile
     * @throws IllegalArgumentException if a key or value is invalid, or the profile is incomplete
     */
    public static DialectProfile fromProperties(Properties properties) {
        String name = properties.getProperty("name");
        if (name == null) {
            throw new IllegalArgumentException("Dialect profile requires a 'name'");
        }
        String base = properties.getProperty("base");
        DialectProfile.Builder builder = base != null
            ? parse(base).toBuilder(name)
            : DialectProfile.builder(name);

        for (String key : properties.stringPropertyNames()) {
            String value = properties.getProperty(key);
            if (key.equals("name") || key.equals("base")) {
                continue;
            }
            if (key.equals("identifier.quote")) {
                if (value.length() != 1) {
                    throw new IllegalArgumentException("identifier.quote must be a single character: '" + value + "'");
                }
                builder.identifierQuoteChar(value.charAt(0));
            } else if (key.equals("string.backslash.escapes")) {
                builder.backslashStringEscapes(parseBoolean(key, value));
            } else if (key.equals("count.distinct.supported")) {
                builder.countDistinctSupported(parseBoolean(key, value));
            } else if (key.startsWith("join.")) {
                builder.joinKeyword(parseEnum(SqlJoinType.class, key, key.substring("join.".length())), value);
            } else if (key.startsWith("date.trunc.")) {
                builder.dateTruncTemplate(
                    parseEnum(TimeGranularity.class, key, key.substring("date.trunc.".length())), value);
            } else if (key.startsWith("type.")) {
                builder.typeName(key.substring("type.".length()).toLowerCase(Locale.ROOT), value);
            } else {
                throw new IllegalArgumentException("Unknown dialect profile key: '" + key + "'");
            }
        }
        return builder.build();
    }

    /**
     * Builds a profile from a flat JSON object using the keys of
     * {@link #fromProperties(Properties)}.
     *
     * @param json the JSON text
     * @return the profile
     * @throws IllegalArgumentException if the JSON is invalid or describes an invalid profile
     */
    public static DialectProfile fromJson(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to parse dialect profile JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Dialect profile JSON must be an object");
        }
        Properties properties = new Properties();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isValueNode()) {
                throw new IllegalArgumentException("Dialect profile key '" + field.getKey() + "' must be a scalar");
            }
            properties.setProperty(field.getKey(), field.getValue().asText());
        }
        return fromProperties(properties);
    }

    private static boolean parseBoolean(String key, String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true" -> true;
            case "false" -> false;
            default -> throw new IllegalArgumentException(key + " must be true or false: '" + value + "'");
        };
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String key, String value) {
        try {
            return Enum.valueOf(type, value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown " + type.getSimpleName() + " in key '" + key + "'", e);
        }
    }
}
