package com.dataflow2sql.logical;

import com.dataflow2sql.exception.MalformedPlanException;
import com.dataflow2sql.exception.UnresolvableIdentifierException;
import com.dataflow2sql.expression.BinaryExpression;
import com.dataflow2sql.expression.ElementReference;
import com.dataflow2sql.logical.ComputeMetricsNode.MetricSpec;
import com.dataflow2sql.logical.OrderByLimitNode.OrderBySpec;
import com.dataflow2sql.naming.ColumnIdentifier;
import com.dataflow2sql.naming.TimeGranularity;
import com.dataflow2sql.schema.ElementKind;
import com.dataflow2sql.schema.OutputColumn;
import com.dataflow2sql.schema.OutputSchema;
import com.dataflow2sql.sql.SqlJoinType;
import com.dataflow2sql.test.ScenarioFixtures;
import com.dataflow2sql.test.TestBase;
import com.dataflow2sql.test.TestCategories;
import com.dataflow2sql.types.DoubleType;
import com.dataflow2sql.types.LongType;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.dataflow2sql.test.ScenarioFixtures.GOLDEN_SCHEMA;
import static com.dataflow2sql.test.ScenarioFixtures.ids;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Output schemas, descriptions and structural checks of the dataflow nodes.
 */
@DisplayName("Dataflow plan nodes")
@TestCategories.Unit
@TestCategories.Tier1
class DataflowPlanNodeTest extends TestBase {

    private ReadSqlSourceNode bookings;
    private ReadSqlSourceNode listings;

    @BeforeEach
    @Override
    public void doSetUp() {
        bookings = new ReadSqlSourceNode(ScenarioFixtures.bookingsSource(GOLDEN_SCHEMA));
        listings = new ReadSqlSourceNode(ScenarioFixtures.listingsSource(GOLDEN_SCHEMA));
    }

    @Nested
    @DisplayName("ReadSqlSourceNode")
    class Read {

        @Test
        @DisplayName("Emits measures, dimensions with granularity variants, then entities")
        void bookingsSchema() {
            assertThat(bookings.outputSchema().aliases()).containsExactly(
                "bookings", "instant_bookings", "booking_value", "bookers", "average_booking_value",
                "is_instant", "ds", "ds__week", "ds__month", "ds__quarter", "ds__year",
                "listing", "guest", "host");
            assertThat(bookings.requiredParentCount()).isZero();
            assertThat(bookings.description()).isEqualTo("Read Elements From Data Source 'bookings_source'");
        }

        @Test
        @DisplayName("Dimensions are also exposed through the primary entity")
        void listingsSchema() {
            List<String> aliases = listings.outputSchema().aliases();

            assertThat(aliases).containsSubsequence(
                "window_start", "window_end", "country", "capacity",
                "listing__window_start", "listing__country", "listing__capacity",
                "listing", "user", "listing__user");
            assertThat(aliases).contains("listing__window_end__year").doesNotContain("user__capacity");
        }

        @Test
        @DisplayName("Source columns carry expressions and truncations")
        void sourceColumns() {
            ReadSqlSourceNode.SourceColumn week = listings.sourceColumns().stream()
                .filter(c -> c.column().alias().equals("window_start__week"))
                .findFirst().orElseThrow();

            assertThat(week.expr()).isEqualTo("active_from");
            assertThat(week.truncation()).isEqualTo(TimeGranularity.WEEK);
            assertThat(week.column().kind()).isEqualTo(ElementKind.TIME_DIMENSION);
        }
    }

    @Nested
    @DisplayName("MetricTimeDimensionTransformNode")
    class MetricTime {

        @Test
        @DisplayName("Adds metric_time at every granularity in canonical order")
        void addsMetricTime() {
            MetricTimeDimensionTransformNode node = new MetricTimeDimensionTransformNode(bookings, "ds");

            assertThat(node.outputSchema().aliases()).containsExactly(
                "ds", "ds__week", "ds__month", "ds__quarter", "ds__year",
                "metric_time", "metric_time__week", "metric_time__month", "metric_time__quarter",
                "metric_time__year", "listing", "guest", "host", "is_instant",
                "bookings", "instant_bookings", "booking_value", "bookers", "average_booking_value");
            assertThat(node.metricTimeSources().get(ColumnIdentifier.metricTime(TimeGranularity.MONTH)).alias())
                .isEqualTo("ds__month");
            assertThat(node.description()).isEqualTo("Metric Time Dimension 'ds'");
        }

        @Test
        @DisplayName("Unknown or repeated time dimension is malformed")
        void malformed() {
            assertThatThrownBy(() -> new MetricTimeDimensionTransformNode(bookings, "created_at").outputSchema())
                .isInstanceOf(MalformedPlanException.class)
                .hasMessageContaining("created_at");

            MetricTimeDimensionTransformNode once = new MetricTimeDimensionTransformNode(bookings, "ds");
            assertThatThrownBy(() -> new MetricTimeDimensionTransformNode(once, "ds").outputSchema())
                .isInstanceOf(MalformedPlanException.class)
                .hasMessageContaining("metric_time");
        }
    }

    @Nested
    @DisplayName("FilterElementsNode")
    class Filter {

        @Test
        @DisplayName("Keeps only listed elements, canonically ordered, describing them in given order")
        void keepsListed() {
            FilterElementsNode node = new FilterElementsNode(bookings, ids("bookings", "ds", "listing"));

            assertThat(node.outputSchema().aliases()).containsExactly("ds", "listing", "bookings");
            assertThat(node.description()).isEqualTo("Pass Only Elements:\n  ['bookings', 'ds', 'listing']");
        }

        @Test
        @DisplayName("Empty, duplicated or missing elements are malformed")
        void malformed() {
            assertThatThrownBy(() -> new FilterElementsNode(bookings, List.of()).outputSchema())
                .isInstanceOf(MalformedPlanException.class);
            assertThatThrownBy(() -> new FilterElementsNode(bookings, ids("bookings", "bookings")).outputSchema())
                .isInstanceOf(MalformedPlanException.class)
                .hasMessageContaining("twice");
            assertThatThrownBy(() -> new FilterElementsNode(bookings, ids("revenue")).outputSchema())
                .isInstanceOf(MalformedPlanException.class)
                .hasMessageContaining("revenue")
                .satisfies(e -> assertThat(((MalformedPlanException) e).getFailedNode()).isNotNull());
        }
    }

    @Nested
    @DisplayName("JoinOnEntitiesNode")
    class Join {

        @Test
        @DisplayName("Prefixes right columns with the entity and drops the right key")
        void prefixesRightColumns() {
            DataflowPlanNode sink = ScenarioFixtures.bookingsWithListingCapacity(GOLDEN_SCHEMA, List.of("bookings"));
            JoinOnEntitiesNode join = (JoinOnEntitiesNode) sink.parentNodes().get(0);

            assertThat(join.outputSchema().aliases()).containsExactly(
                "metric_time", "listing__window_start", "listing__window_end", "listing",
                "listing__capacity", "bookings");
            assertThat(join.joinType()).isEqualTo(SqlJoinType.LEFT_OUTER);
            assertThat(join.isRightJoinKey(ColumnIdentifier.of("listing"))).isTrue();
            assertThat(join.description()).isEqualTo("Join Standard Outputs");
        }

        @Test
        @DisplayName("Right side carrying measures is malformed")
        void rightMeasuresRejected() {
            JoinOnEntitiesNode join = JoinOnEntitiesNode.onEntity(listings, bookings, "listing", null);

            assertThatThrownBy(join::outputSchema)
                .isInstanceOf(MalformedPlanException.class)
                .hasMessageContaining("measures");
        }

        @Test
        @DisplayName("Missing join key or window column is malformed")
        void missingColumns() {
            JoinOnEntitiesNode missingKey = JoinOnEntitiesNode.onEntity(bookings, listings, "guest", null);
            assertThatThrownBy(missingKey::outputSchema)
                .isInstanceOf(MalformedPlanException.class)
                .hasMessageContaining("right input does not contain 'guest'");

            FilterElementsNode narrow = new FilterElementsNode(listings, ids("listing", "capacity"));
            JoinOnEntitiesNode missingWindow = JoinOnEntitiesNode.onEntity(bookings, narrow, "listing",
                new JoinOnEntitiesNode.ValidityWindow(
                    ColumnIdentifier.of("ds"), ColumnIdentifier.of("window_start"), ColumnIdentifier.of("window_end")));
            assertThatThrownBy(missingWindow::outputSchema)
                .isInstanceOf(MalformedPlanException.class)
                .hasMessageContaining("window_start");
        }

        @Test
        @DisplayName("Wrong arity and missing keys fail at construction")
        void arity() {
            assertThatThrownBy(() -> new JoinOnEntitiesNode(bookings, null,
                List.of(new JoinOnEntitiesNode.JoinKey(ColumnIdentifier.of("listing"), ColumnIdentifier.of("listing"))),
                List.of("listing"), null, SqlJoinType.INNER))
                .isInstanceOf(MalformedPlanException.class)
                .hasMessageContaining("requires 2 predecessor(s), got 1");
            assertThatThrownBy(() -> new JoinOnEntitiesNode(bookings, listings, List.of(), List.of(), null,
                SqlJoinType.INNER))
                .isInstanceOf(MalformedPlanException.class);
            assertThatThrownBy(() -> new AggregateMeasuresNode(null))
                .isInstanceOf(MalformedPlanException.class);
        }
    }

    @Nested
    @DisplayName("AggregateMeasuresNode and ComputeMetricsNode")
    class Aggregation {

        @Test
        @DisplayName("Aggregation keeps groupable columns and types measure results")
        void aggregateSchema() {
            AggregateMeasuresNode node = new AggregateMeasuresNode(
                new FilterElementsNode(bookings, ids("is_instant", "instant_bookings", "bookers", "booking_value")));
            OutputSchema schema = node.outputSchema();

            assertThat(schema.aliases()).containsExactly("is_instant", "instant_bookings", "bookers", "booking_value");
            assertThat(schema.find(ColumnIdentifier.of("instant_bookings")).map(OutputColumn::dataType))
                .contains(LongType.get());
            assertThat(schema.find(ColumnIdentifier.of("booking_value")).map(OutputColumn::dataType))
                .contains(DoubleType.get());
        }

        @Test
        @DisplayName("Aggregating without measures is malformed")
        void noMeasures() {
            assertThatThrownBy(() -> new AggregateMeasuresNode(new FilterElementsNode(bookings, ids("listing")))
                .outputSchema())
                .isInstanceOf(MalformedPlanException.class)
                .hasMessageContaining("no measures");
        }

        @Test
        @DisplayName("Metrics replace measures and keep groupable columns")
        void metricsSchema() {
            AggregateMeasuresNode aggregated = new AggregateMeasuresNode(
                new FilterElementsNode(bookings, ids("listing", "bookings", "booking_value")));
            ComputeMetricsNode metrics = new ComputeMetricsNode(aggregated, List.of(
                MetricSpec.proxy("total_bookings", "bookings"),
                MetricSpec.ratio("value_per_booking", "booking_value", "bookings"),
                MetricSpec.derived("value_minus_bookings", BinaryExpression.subtract(
                    ElementReference.of("booking_value"), ElementReference.of("bookings")))));

            assertThat(metrics.outputSchema().aliases())
                .containsExactly("listing", "total_bookings", "value_per_booking", "value_minus_bookings");
            assertThat(metrics.outputSchema().columnsOfKind(ElementKind.METRIC)).hasSize(3);
            assertThat(metrics.outputSchema().find(ColumnIdentifier.of("value_per_booking")).map(OutputColumn::dataType))
                .contains(DoubleType.get());
            assertThat(metrics.description()).isEqualTo("Compute Metrics via Expressions");
        }

        @Test
        @DisplayName("Proxy of an unknown measure is unresolvable, aggregating metrics is malformed")
        void metricErrors() {
            AggregateMeasuresNode aggregated = new AggregateMeasuresNode(
                new FilterElementsNode(bookings, ids("listing", "bookings")));
            ComputeMetricsNode unknown = new ComputeMetricsNode(aggregated,
                List.of(MetricSpec.proxy("revenue", "booking_value")));

            assertThatThrownBy(unknown::outputSchema)
                .isInstanceOf(UnresolvableIdentifierException.class)
                .satisfies(e -> assertThat(((UnresolvableIdentifierException) e).isEntityPathUnreachable()).isFalse());

            ComputeMetricsNode metrics = new ComputeMetricsNode(aggregated, List.of(MetricSpec.proxy("b", "bookings")));
            assertThatThrownBy(() -> new AggregateMeasuresNode(metrics).outputSchema())
                .isInstanceOf(MalformedPlanException.class);

            ComputeMetricsNode collision = new ComputeMetricsNode(aggregated,
                List.of(MetricSpec.proxy("listing", "bookings")));
            assertThatThrownBy(collision::outputSchema)
                .isInstanceOf(MalformedPlanException.class)
                .hasMessageContaining("collides");
        }
    }

    @Nested
    @DisplayName("ConstrainOutputNode and OrderByLimitNode")
    class PassThrough {

        @Test
        @DisplayName("Schemas pass through unchanged")
        void passThrough() {
            ConstrainOutputNode constrained = new ConstrainOutputNode(bookings,
                ElementReference.of("is_instant"));
            OrderByLimitNode ordered = new OrderByLimitNode(constrained,
                Arrays.asList(OrderBySpec.descending("ds"), OrderBySpec.ascending("listing")), 100L);

            assertThat(constrained.outputSchema()).isEqualTo(bookings.outputSchema());
            assertThat(ordered.outputSchema()).isEqualTo(bookings.outputSchema());
            assertThat(constrained.description()).isEqualTo("Constrain Output with WHERE");
            assertThat(ordered.description()).isEqualTo("Order By ['ds', 'listing'] Limit 100");
            assertThat(ordered.limit()).hasValue(100L);
        }

        @Test
        @DisplayName("Order-by without keys or limit, or with a negative limit, is malformed")
        void malformedOrderBy() {
            assertThatThrownBy(() -> new OrderByLimitNode(bookings, List.of(), null))
                .isInstanceOf(MalformedPlanException.class);
            assertThatThrownBy(() -> new OrderByLimitNode(bookings, List.of(), -1L))
                .isInstanceOf(MalformedPlanException.class)
                .hasMessageContaining("-1");
            assertThat(new OrderByLimitNode(bookings, List.of(), 5L).description()).isEqualTo("Limit 5");
        }
    }
}
