package com.dataflow2sql.generator;

import com.dataflow2sql.expression.BinaryExpression;
import com.dataflow2sql.expression.ColumnReference;
import com.dataflow2sql.expression.Literal;
import com.dataflow2sql.lowering.DataflowToSqlQueryPlanConverter;
import com.dataflow2sql.sql.SqlJoinDescription;
import com.dataflow2sql.sql.SqlJoinType;
import com.dataflow2sql.sql.SqlOrderBy;
import com.dataflow2sql.sql.SqlQueryPlan;
import com.dataflow2sql.sql.SqlSelectStatement;
import com.dataflow2sql.sql.SqlTableReference;
import com.dataflow2sql.test.ScenarioFixtures;
import com.dataflow2sql.test.TestBase;
import com.dataflow2sql.test.TestCategories;
import com.dataflow2sql.types.DoubleType;
import com.dataflow2sql.types.LongType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SqlQueryPlanRenderer")
@TestCategories.Unit
@TestCategories.Tier1
class SqlQueryPlanRendererTest extends TestBase {

    private final SqlQueryPlanRenderer renderer = new SqlQueryPlanRenderer();

    private static SqlSelectStatement ordersRead() {
        return SqlSelectStatement.builder("Read Elements From Data Source 'orders'")
            .select(ColumnReference.qualified("orders_src_0", "order_id", LongType.get()), "order_id")
            .select(ColumnReference.qualified("orders_src_0", "amount", DoubleType.get()), "amount")
            .from(new SqlTableReference("sales.orders"), "orders_src_0")
            .build();
    }

    private static SqlQueryPlan filteredOrders() {
        ColumnReference amount = ColumnReference.qualified("subq_0", "amount", DoubleType.get());
        SqlSelectStatement root = SqlSelectStatement.builder("Constrain Output with WHERE\nthen sort")
            .select(ColumnReference.qualified("subq_0", "order_id", LongType.get()), "order_id")
            .select(amount, "total")
            .from(ordersRead(), "subq_0")
            .where(BinaryExpression.and(
                BinaryExpression.greaterThan(amount, Literal.of(10L)),
                BinaryExpression.lessThan(amount, Literal.of(100L))))
            .orderBy(new SqlOrderBy(amount, true))
            .limit(10)
            .build();
        return new SqlQueryPlan(root);
    }

    @Nested
    @DisplayName("Layout")
    class Layout {

        @Test
        @DisplayName("Nested statements, conditions, ordering and limit")
        void fullLayout() {
            String sql = renderer.render(filteredOrders(), DialectProfiles.DUCKDB);
            logData("Rendered SQL", sql);

            assertThat(sql).isEqualTo(String.join("\n",
                "-- Constrain Output with WHERE",
                "-- then sort",
                "SELECT",
                "  subq_0.order_id",
                "  , subq_0.amount AS total",
                "FROM (",
                "  -- Read Elements From Data Source 'orders'",
                "  SELECT",
                "    orders_src_0.order_id",
                "    , orders_src_0.amount",
                "  FROM sales.orders orders_src_0",
                ") subq_0",
                "WHERE",
                "  (",
                "    subq_0.amount > 10",
                "  ) AND (",
                "    subq_0.amount < 100",
                "  )",
                "ORDER BY",
                "  subq_0.amount DESC",
                "LIMIT 10"));
        }

        @Test
        @DisplayName("Indent width is configurable")
        void indentWidth() {
            String sql = new SqlQueryPlanRenderer(4).render(filteredOrders(), DialectProfiles.DUCKDB);

            assertThat(sql).contains("\n    , subq_0.amount AS total\n")
                .contains("\n        , orders_src_0.amount\n")
                .doesNotEndWith("\n");
            assertThatThrownBy(() -> new SqlQueryPlanRenderer(0)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new SqlQueryPlanRenderer(9)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Single predicate stays on the WHERE line")
        void singlePredicate() {
            SqlSelectStatement root = SqlSelectStatement.builder("Constrain Output with WHERE")
                .select(ColumnReference.of("amount"), "amount")
                .from(ordersRead(), "subq_0")
                .where(BinaryExpression.greaterThan(ColumnReference.of("amount"), Literal.of(10L)))
                .build();

            assertThat(renderer.render(new SqlQueryPlan(root), DialectProfiles.BIGQUERY))
                .endsWith(") subq_0\nWHERE amount > 10");
        }
    }

    @Nested
    @DisplayName("Dialects")
    class Dialects {

        private SqlQueryPlan joinPlan() {
            SqlSelectStatement right = SqlSelectStatement.builder("Read Elements From Data Source 'users'")
                .select(ColumnReference.qualified("users_src_1", "user_id", LongType.get()), "user")
                .from(new SqlTableReference("sales.users"), "users_src_1")
                .build();
            SqlSelectStatement root = SqlSelectStatement.builder("Join Standard Outputs")
                .select(ColumnReference.qualified("subq_0", "order_id", LongType.get()), "order_id")
                .select(ColumnReference.qualified("subq_1", "user", LongType.get()), "user")
                .from(ordersRead(), "subq_0")
                .join(new SqlJoinDescription(right, "subq_1", SqlJoinType.LEFT_OUTER, BinaryExpression.equal(
                    ColumnReference.qualified("subq_0", "order_id", LongType.get()),
                    ColumnReference.qualified("subq_1", "user", LongType.get()))))
                .build();
            return new SqlQueryPlan(root);
        }

        @Test
        @DisplayName("Join keyword and identifier quoting differ per dialect")
        void joinKeywordAndQuoting() {
            String bigquery = renderer.render(joinPlan(), DialectProfiles.BIGQUERY);
            String duckdb = renderer.render(joinPlan(), DialectProfiles.DUCKDB);

            assertThat(bigquery).contains("\nLEFT OUTER JOIN (\n")
                .contains("\n  , subq_1.`user`\n")
                .contains("users_src_1.user_id AS `user`")
                .contains("\nON\n  subq_0.order_id = subq_1.`user`");
            assertThat(duckdb).contains("\nLEFT JOIN (\n")
                .contains("users_src_1.user_id AS \"user\"");
        }

        @Test
        @DisplayName("Same plan renders differently only where the dialects differ")
        void scenarioAcrossDialects() {
            SqlQueryPlan plan = new DataflowToSqlQueryPlanConverter().convert(ScenarioFixtures.joinToScdDimensionPlan());

            String bigquery = renderer.render(plan, DialectProfiles.BIGQUERY);
            String snowflake = renderer.render(plan, DialectProfiles.SNOWFLAKE);
            String postgres = renderer.render(plan, DialectProfiles.POSTGRES);

            assertThat(bigquery).contains("DATE_TRUNC(bookings_source_src_0.ds, isoweek) AS ds__week");
            assertThat(snowflake).contains("DATE_TRUNC('week', bookings_source_src_0.ds) AS ds__week")
                .contains("listings_src_1.user_id AS \"user\"")
                .contains("YEAROFWEEKISO(bookings_source_src_0.ds)");
            assertThat(postgres).contains("EXTRACT(isoyear FROM listings_src_1.active_to)");
            assertThat(bigquery.lines().count()).isEqualTo(snowflake.lines().count());
        }
    }
}
