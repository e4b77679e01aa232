package com.dataflow2sql.compiler;

import com.dataflow2sql.exception.CompilationException;
import com.dataflow2sql.exception.MalformedPlanException;
import com.dataflow2sql.exception.UnsupportedConstructException;
import com.dataflow2sql.generator.DialectProfile;
import com.dataflow2sql.generator.DialectProfiles;
import com.dataflow2sql.logical.AggregateMeasuresNode;
import com.dataflow2sql.logical.DataflowPlanNode;
import com.dataflow2sql.logical.FilterElementsNode;
import com.dataflow2sql.logical.MetricTimeDimensionTransformNode;
import com.dataflow2sql.logical.OrderByLimitNode;
import com.dataflow2sql.logical.OrderByLimitNode.OrderBySpec;
import com.dataflow2sql.logical.ReadSqlSourceNode;
import com.dataflow2sql.naming.TimeGranularity;
import com.dataflow2sql.runtime.CompilerConfig;
import com.dataflow2sql.test.ScenarioFixtures;
import com.dataflow2sql.test.TestBase;
import com.dataflow2sql.test.TestCategories;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.dataflow2sql.test.ScenarioFixtures.GOLDEN_SCHEMA;
import static com.dataflow2sql.test.ScenarioFixtures.ids;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end compilation of dataflow plans, checked against golden SQL.
 */
@DisplayName("MetricQueryCompiler")
@TestCategories.Tier1
class MetricQueryCompilerTest extends TestBase {

    private MetricQueryCompiler compiler;

    @BeforeEach
    @Override
    public void doSetUp() {
        compiler = new MetricQueryCompiler(CompilerConfig.defaults());
    }

    private static String snapshot(String name) throws IOException {
        try (InputStream in = MetricQueryCompilerTest.class.getResourceAsStream("/snapshots/" + name)) {
            assertThat(in).as("snapshot %s", name).isNotNull();
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).stripTrailing();
        }
    }

    @Nested
    @DisplayName("Golden output")
    class Golden {

        @Test
        @DisplayName("Validity window join matches the BigQuery snapshot")
        void joinToScdDimension() throws IOException {
            // Given
            logStep("Given: bookings joined to the listing valid at booking time");
            DataflowPlanNode plan = ScenarioFixtures.joinToScdDimensionPlan();

            // When
            logStep("When: compiling for BigQuery");
            String sql = compiler.compile(plan, DialectProfiles.BIGQUERY);
            logData("Compiled SQL", sql);

            // Then
            logStep("Then: the SQL matches the snapshot byte for byte");
            assertThat(sql).isEqualTo(snapshot("join_to_scd_dimension__bigquery.sql"));
        }

        @Test
        @DisplayName("Configured dialect is used by default")
        void configuredDialect() throws IOException {
            MetricQueryCompiler duckdbCompiler =
                new MetricQueryCompiler(CompilerConfig.defaults().withDialect(DialectProfiles.DUCKDB));
            DataflowPlanNode plan = ScenarioFixtures.joinToScdDimensionPlan();

            String sql = duckdbCompiler.compile(plan);

            assertThat(sql).isEqualTo(duckdbCompiler.compile(plan, DialectProfiles.DUCKDB))
                .isNotEqualTo(snapshot("join_to_scd_dimension__bigquery.sql"))
                .contains("\n          LEFT JOIN (\n")
                .contains("listings_src_1.user_id AS \"user\"");
        }
    }

    @Nested
    @DisplayName("Determinism")
    class Determinism {

        @Test
        @DisplayName("Repeated compilations are identical")
        void repeated() {
            DataflowPlanNode plan = ScenarioFixtures.joinToScdDimensionPlan();
            String first = compiler.compile(plan);

            for (int i = 0; i < 5; i++) {
                assertThat(compiler.compile(plan)).isEqualTo(first);
            }
            assertThat(compiler.compile(ScenarioFixtures.joinToScdDimensionPlan())).isEqualTo(first);
        }

        @Test
        @DisplayName("Concurrent compilations of one plan are identical")
        void concurrent() throws Exception {
            DataflowPlanNode plan = ScenarioFixtures.joinToScdDimensionPlan();
            String expected = new MetricQueryCompiler(CompilerConfig.defaults()).compile(
                ScenarioFixtures.joinToScdDimensionPlan());

            ExecutorService executor = Executors.newFixedThreadPool(8);
            try {
                List<Callable<String>> tasks = new ArrayList<>();
                for (int i = 0; i < 32; i++) {
                    DialectProfile dialect = i % 2 == 0 ? DialectProfiles.BIGQUERY : DialectProfiles.DUCKDB;
                    tasks.add(() -> compiler.compile(plan, dialect) + "|" + dialect.name());
                }
                List<Future<String>> results = executor.invokeAll(tasks);
                String expectedDuckdb = compiler.compile(plan, DialectProfiles.DUCKDB);
                for (Future<String> result : results) {
                    String value = result.get();
                    if (value.endsWith("|bigquery")) {
                        assertThat(value).isEqualTo(expected + "|bigquery");
                    } else {
                        assertThat(value).isEqualTo(expectedDuckdb + "|duckdb");
                    }
                }
            } finally {
                executor.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("Query shapes")
    class Shapes {

        @Test
        @DisplayName("Aggregation by a coarser metric time with ordering and limit")
        void orderedByMonth() {
            DataflowPlanNode plan = new OrderByLimitNode(
                new AggregateMeasuresNode(ScenarioFixtures.bookingsByMetricTime(
                    GOLDEN_SCHEMA, TimeGranularity.MONTH, List.of("bookings", "instant_bookings"))),
                List.of(OrderBySpec.descending("metric_time__month")), 3L);

            String sql = compiler.compile(plan, DialectProfiles.DUCKDB);
            logData("Compiled SQL", sql);

            assertThat(sql).startsWith("-- Order By ['metric_time__month'] Limit 3\nSELECT\n")
                .contains("SUM(CASE WHEN subq_2.instant_bookings THEN 1 ELSE 0 END) AS instant_bookings")
                .contains("GROUP BY\n    subq_2.metric_time__month\n")
                .contains("subq_0.ds__month AS metric_time__month")
                .endsWith("ORDER BY\n  subq_3.metric_time__month DESC\nLIMIT 3");
        }

        @Test
        @DisplayName("COUNT DISTINCT measures fail on dialects without it")
        void countDistinctUnsupported() {
            DataflowPlanNode plan = new AggregateMeasuresNode(new FilterElementsNode(
                new MetricTimeDimensionTransformNode(
                    new ReadSqlSourceNode(ScenarioFixtures.bookingsSource(GOLDEN_SCHEMA)), "ds"),
                ids("bookers", "metric_time")));
            DialectProfile limited = DialectProfiles.BIGQUERY.toBuilder("legacy").countDistinctSupported(false).build();

            assertThat(compiler.compile(plan, DialectProfiles.BIGQUERY))
                .contains("COUNT(DISTINCT subq_2.bookers) AS bookers");
            assertThatThrownBy(() -> compiler.compile(plan, limited))
                .isInstanceOf(UnsupportedConstructException.class)
                .hasMessageContaining("legacy");
        }

        @Test
        @DisplayName("Malformed plans abort with a technical message")
        void malformed() {
            DataflowPlanNode plan = new FilterElementsNode(
                new ReadSqlSourceNode(ScenarioFixtures.bookingsSource(GOLDEN_SCHEMA)), ids("metric_time"));

            assertThatThrownBy(() -> compiler.compile(plan))
                .isInstanceOf(MalformedPlanException.class)
                .satisfies(e -> assertThat(((CompilationException) e).getTechnicalMessage())
                    .contains("Error Type: MalformedPlanException")
                    .contains("FilterElementsNode"));
        }
    }
}
