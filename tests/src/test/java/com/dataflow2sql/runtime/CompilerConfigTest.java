package com.dataflow2sql.runtime;

import com.dataflow2sql.generator.DialectProfiles;
import com.dataflow2sql.test.TestBase;
import com.dataflow2sql.test.TestCategories;
import java.util.Properties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CompilerConfig")
@TestCategories.Unit
class CompilerConfigTest extends TestBase {

    @Test
    @DisplayName("Defaults: BigQuery, validation on, two-space indent")
    void defaults() {
        CompilerConfig config = CompilerConfig.fromProperties(new Properties());

        assertThat(config.dialect()).isEqualTo(DialectProfiles.BIGQUERY);
        assertThat(config.validate()).isTrue();
        assertThat(config.indentWidth()).isEqualTo(2);
        assertThat(config.toString()).isEqualTo(CompilerConfig.defaults().toString());
    }

    @Test
    @DisplayName("Properties override the defaults")
    void overrides() {
        Properties properties = new Properties();
        properties.setProperty(CompilerConfig.PROP_DIALECT, "DuckDB");
        properties.setProperty(CompilerConfig.PROP_VALIDATE, " FALSE ");
        properties.setProperty(CompilerConfig.PROP_INDENT, "4");

        CompilerConfig config = CompilerConfig.fromProperties(properties);

        assertThat(config.dialect()).isSameAs(DialectProfiles.DUCKDB);
        assertThat(config.validate()).isFalse();
        assertThat(config.indentWidth()).isEqualTo(4);
    }

    @Test
    @DisplayName("Unparsable values fall back, unknown dialects fail fast")
    void invalidValues() {
        Properties properties = new Properties();
        properties.setProperty(CompilerConfig.PROP_VALIDATE, "maybe");
        properties.setProperty(CompilerConfig.PROP_INDENT, "wide");
        CompilerConfig config = CompilerConfig.fromProperties(properties);
        assertThat(config.validate()).isTrue();
        assertThat(config.indentWidth()).isEqualTo(2);

        properties.setProperty(CompilerConfig.PROP_INDENT, "12");
        assertThat(CompilerConfig.fromProperties(properties).indentWidth()).isEqualTo(2);

        properties.setProperty(CompilerConfig.PROP_DIALECT, "oracle");
        assertThatThrownBy(() -> CompilerConfig.fromProperties(properties))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("oracle");
    }

    @Test
    @DisplayName("With-methods copy the other settings")
    void withMethods() {
        CompilerConfig config = CompilerConfig.defaults()
            .withDialect(DialectProfiles.SNOWFLAKE)
            .withValidate(false)
            .withIndentWidth(3);

        assertThat(config.dialect()).isSameAs(DialectProfiles.SNOWFLAKE);
        assertThat(config.validate()).isFalse();
        assertThat(config.indentWidth()).isEqualTo(3);
        assertThatThrownBy(() -> config.withIndentWidth(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
