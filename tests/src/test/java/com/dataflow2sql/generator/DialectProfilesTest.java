package com.dataflow2sql.generator;

import com.dataflow2sql.naming.TimeGranularity;
import com.dataflow2sql.sql.SqlJoinType;
import com.dataflow2sql.test.TestBase;
import com.dataflow2sql.test.TestCategories;
import com.dataflow2sql.types.DoubleType;
import java.util.Properties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DialectProfiles")
@TestCategories.Unit
class DialectProfilesTest extends TestBase {

    @Nested
    @DisplayName("Built-in profiles")
    class BuiltIn {

        @ParameterizedTest(name = "{0}")
        @ValueSource(strings = {"bigquery", "DuckDB", " postgres ", "postgresql", "SNOWFLAKE"})
        void parse(String name) {
            assertThat(DialectProfiles.parse(name).name())
                .isEqualTo(name.trim().toLowerCase().replace("postgresql", "postgres"));
        }

        @Test
        @DisplayName("Unknown names list the valid values")
        void parseUnknown() {
            assertThatThrownBy(() -> DialectProfiles.parse("oracle"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Valid values");
            assertThatThrownBy(() -> DialectProfiles.parse(null))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Every profile covers all join types and granularities")
        void complete() {
            for (DialectProfile profile : new DialectProfile[] {
                DialectProfiles.BIGQUERY, DialectProfiles.DUCKDB, DialectProfiles.POSTGRES, DialectProfiles.SNOWFLAKE}) {
                for (SqlJoinType joinType : SqlJoinType.values()) {
                    assertThat(profile.joinKeyword(joinType)).endsWith("JOIN");
                }
                for (TimeGranularity granularity : TimeGranularity.values()) {
                    assertThat(profile.dateTrunc(granularity, "x")).contains("x");
                }
            }
        }

        @Test
        @DisplayName("Incomplete builders are rejected")
        void incomplete() {
            assertThatThrownBy(() -> DialectProfile.builder("partial").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("partial");
            assertThatThrownBy(() -> DialectProfile.builder("bad")
                .dateTruncTemplate(TimeGranularity.DAY, "TRUNC(x)"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("{expr}");
        }
    }

    @Nested
    @DisplayName("Custom profiles")
    class Custom {

        @Test
        @DisplayName("Properties override a base profile")
        void fromProperties() {
            Properties properties = new Properties();
            properties.setProperty("name", "redshift");
            properties.setProperty("base", "postgres");
            properties.setProperty("count.distinct.supported", "false");
            properties.setProperty("join.left_outer", "LEFT JOIN");
            properties.setProperty("date.trunc.WEEK", "TRUNC_WEEK({expr})");
            properties.setProperty("type.double", "FLOAT8");

            DialectProfile profile = DialectProfiles.fromProperties(properties);

            assertThat(profile.name()).isEqualTo("redshift");
            assertThat(profile.supportsCountDistinct()).isFalse();
            assertThat(profile.joinKeyword(SqlJoinType.LEFT_OUTER)).isEqualTo("LEFT JOIN");
            assertThat(profile.joinKeyword(SqlJoinType.INNER)).isEqualTo("INNER JOIN");
            assertThat(profile.dateTrunc(TimeGranularity.WEEK, "ds")).isEqualTo("TRUNC_WEEK(ds)");
            assertThat(profile.dateTrunc(TimeGranularity.MONTH, "ds")).isEqualTo("DATE_TRUNC('month', ds)");
            assertThat(profile.typeName(DoubleType.get())).isEqualTo("FLOAT8");
            assertThat(profile.identifierQuoteChar()).isEqualTo('"');
            assertThat(profile.quoteLiteral("d'Ivoire")).isEqualTo("'d''Ivoire'");
        }

        @Test
        @DisplayName("String literal escaping is part of the profile")
        void stringEscaping() {
            Properties properties = new Properties();
            properties.setProperty("name", "backslashed");
            properties.setProperty("base", "duckdb");
            properties.setProperty("string.backslash.escapes", "true");

            DialectProfile profile = DialectProfiles.fromProperties(properties);

            assertThat(profile.backslashStringEscapes()).isTrue();
            assertThat(profile.quoteLiteral("d'Ivoire")).isEqualTo("'d\\'Ivoire'");
            assertThat(DialectProfiles.BIGQUERY.backslashStringEscapes()).isTrue();
            assertThat(DialectProfiles.SNOWFLAKE.backslashStringEscapes()).isTrue();
            assertThat(DialectProfiles.DUCKDB.backslashStringEscapes()).isFalse();
            assertThat(DialectProfiles.POSTGRES.backslashStringEscapes()).isFalse();
            assertThat(DialectProfiles.BIGQUERY.toBuilder("copy").build().backslashStringEscapes()).isTrue();
        }

        @Test
        @DisplayName("Unknown keys and malformed values are rejected")
        void invalidProperties() {
            Properties unknownKey = new Properties();
            unknownKey.setProperty("name", "x");
            unknownKey.setProperty("base", "duckdb");
            unknownKey.setProperty("quote", "`");
            assertThatThrownBy(() -> DialectProfiles.fromProperties(unknownKey))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("quote");

            Properties badBoolean = new Properties();
            badBoolean.setProperty("name", "x");
            badBoolean.setProperty("base", "duckdb");
            badBoolean.setProperty("count.distinct.supported", "sometimes");
            assertThatThrownBy(() -> DialectProfiles.fromProperties(badBoolean))
                .isInstanceOf(IllegalArgumentException.class);

            assertThatThrownBy(() -> DialectProfiles.fromProperties(new Properties()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("name");
        }

        @Test
        @DisplayName("JSON uses the same keys")
        void fromJson() {
            DialectProfile profile = DialectProfiles.fromJson(
                "{\"name\": \"spark\", \"base\": \"bigquery\", \"count.distinct.supported\": false,"
                + " \"date.trunc.YEAR\": \"DATE_TRUNC('year', {expr})\"}");

            assertThat(profile.name()).isEqualTo("spark");
            assertThat(profile.identifierQuoteChar()).isEqualTo('`');
            assertThat(profile.supportsCountDistinct()).isFalse();
            assertThat(profile.dateTrunc(TimeGranularity.YEAR, "ds")).isEqualTo("DATE_TRUNC('year', ds)");
            assertThat(profile).isNotEqualTo(DialectProfiles.BIGQUERY);
        }

        @Test
        @DisplayName("Malformed JSON is rejected")
        void invalidJson() {
            assertThatThrownBy(() -> DialectProfiles.fromJson("{\"name\": "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("JSON");
            assertThatThrownBy(() -> DialectProfiles.fromJson("[1, 2]"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("object");
            assertThatThrownBy(() -> DialectProfiles.fromJson("{\"name\": \"x\", \"base\": {\"a\": 1}}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("scalar");
        }
    }
}
