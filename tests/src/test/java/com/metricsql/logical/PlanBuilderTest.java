package com.metricsql.logical;

import com.metricsql.dialect.Dialect;
import com.metricsql.exception.UnsupportedFeatureException;
import com.metricsql.expression.Expression;
import com.metricsql.expression.Operator;
import com.metricsql.expression.SqlFragment;
import com.metricsql.expression.SubqueryExpression;
import com.metricsql.generator.SQLGenerator;
import com.metricsql.query.Dimension;
import com.metricsql.query.Measure;
import com.metricsql.query.Query;
import com.metricsql.query.Sort;
import com.metricsql.query.TimeGrain;
import com.metricsql.query.TimeRange;
import com.metricsql.schema.SecurityPolicy;
import com.metricsql.test.TestBase;
import com.metricsql.test.TestCategories;
import com.metricsql.test.WebsiteAnalytics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static com.metricsql.expression.Expression.condition;
import static com.metricsql.expression.Expression.name;
import static com.metricsql.expression.Expression.value;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for plan tree construction, checked through the generated SQL.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Plan Builder Tests")
public class PlanBuilderTest extends TestBase {

    private static final Instant DEC_1 = Instant.parse("2023-12-01T00:00:00Z");

    private static final String BASE_JAN = "SELECT \"country\" AS \"country\", sum(views) AS \"total_views\" "
        + "FROM \"events\" WHERE \"event_time\" >= ? AND \"event_time\" < ? GROUP BY \"country\"";

    private PlanTree build(Query query, Dialect dialect) {
        return PlanBuilder.build(WebsiteAnalytics.view(), SecurityPolicy.open(), query, dialect);
    }

    private SqlFragment sql(Query query) {
        return sql(query, SecurityPolicy.open());
    }

    private SqlFragment sql(Query query, SecurityPolicy security) {
        Dialect dialect = WebsiteAnalytics.duckdb();
        PlanTree tree = PlanBuilder.build(WebsiteAnalytics.view(), security, query, dialect);
        SqlFragment sql = new SQLGenerator(dialect).generate(tree);
        logData("Generated SQL", sql);
        return sql;
    }

    @Nested
    @DisplayName("Aggregation")
    class Aggregation {

        @Test
        @DisplayName("Simple measures collapse to a single grouped block")
        void testSingleBlock() {
            Query query = WebsiteAnalytics.query()
                .dimension(Dimension.of("country"))
                .measure(Measure.of("total_views"))
                .timeRange(TimeRange.absolute(WebsiteAnalytics.JAN_1, WebsiteAnalytics.FEB_1))
                .sort(Sort.desc("total_views"))
                .limit(10L)
                .build();

            PlanTree tree = build(query, WebsiteAnalytics.duckdb());
            SqlFragment sql = sql(query);

            assertThat(tree.size()).isEqualTo(1);
            assertThat(tree.rootAlias()).isEqualTo(PlanBuilder.BASE_ALIAS);
            assertThat(sql.sql()).isEqualTo(BASE_JAN + " ORDER BY \"total_views\" DESC NULLS LAST LIMIT 10");
            assertThat(sql.args()).containsExactly(WebsiteAnalytics.JAN_1, WebsiteAnalytics.FEB_1);
        }

        @Test
        @DisplayName("Counts and expression dimensions")
        void testCounts() {
            Query query = WebsiteAnalytics.query()
                .dimension(Dimension.of("device"))
                .measure(Measure.computed("n", Measure.Compute.count()))
                .measure(Measure.computed("cities", Measure.Compute.countDistinct("city")))
                .build();

            assertThat(sql(query).sql()).isEqualTo(
                "SELECT (lower(device_type)) AS \"device\", count(*) AS \"n\", "
                    + "count(DISTINCT \"city\") AS \"cities\" FROM \"events\" GROUP BY (lower(device_type))");
        }

        @Test
        @DisplayName("Time grain truncates the time dimension")
        void testTimeGrain() {
            Query query = WebsiteAnalytics.query()
                .dimension(Dimension.of("event_time", TimeGrain.DAY))
                .measure(Measure.of("total_views"))
                .build();

            assertThat(sql(query).sql()).isEqualTo(
                "SELECT date_trunc('day', \"event_time\"::TIMESTAMP)::TIMESTAMP AS \"event_time\", "
                    + "sum(views) AS \"total_views\" FROM \"events\" "
                    + "GROUP BY date_trunc('day', \"event_time\"::TIMESTAMP)::TIMESTAMP");
        }

        @Test
        @DisplayName("Having on the single block becomes HAVING over aggregates")
        void testHaving() {
            Query query = WebsiteAnalytics.query()
                .dimension(Dimension.of("country"))
                .measure(Measure.of("total_views"))
                .having(condition(Operator.GT, name("total_views"), value(100)))
                .build();

            SqlFragment sql = sql(query);

            assertThat(sql.sql()).endsWith("GROUP BY \"country\" HAVING sum(views) > ?");
            assertThat(sql.args()).containsExactly(100);
        }

        @Test
        @DisplayName("Security row filter is combined with the query filter")
        void testRowFilter() {
            SecurityPolicy security = SecurityPolicy.restricted(Set.of(), Expression.eq("country", "US"));
            Query query = WebsiteAnalytics.query()
                .measure(Measure.of("total_views"))
                .where(Expression.eq("device", "mobile"))
                .build();

            SqlFragment sql = sql(query, security);

            assertThat(sql.sql()).isEqualTo("SELECT sum(views) AS \"total_views\" FROM \"events\" "
                + "WHERE (lower(device_type)) = ? AND \"country\" = ?");
            assertThat(sql.args()).containsExactly("mobile", "US");
        }
    }

    @Nested
    @DisplayName("Derived Measures")
    class DerivedMeasures {

        @Test
        @DisplayName("Each derived level adds a wrapper over the aggregate")
        void testDerivedLayer() {
            Query query = WebsiteAnalytics.query()
                .dimension(Dimension.of("country"))
                .measure(Measure.of("ctr"))
                .build();

            assertThat(sql(query).sql()).isEqualTo(
                "SELECT \"country\" AS \"country\", \"ctr\" AS \"ctr\" FROM ("
                    + "SELECT \"country\" AS \"country\", \"total_clicks\" AS \"total_clicks\", "
                    + "\"total_views\" AS \"total_views\", (total_clicks / NULLIF(total_views, 0)) AS \"ctr\" "
                    + "FROM (SELECT \"country\" AS \"country\", sum(clicks) AS \"total_clicks\", "
                    + "sum(views) AS \"total_views\" FROM \"events\" GROUP BY \"country\") AS \"base\""
                    + ") AS \"t1\"");
        }

        @Test
        @DisplayName("Nested derived measures get one layer per depth")
        void testNestedDerived() {
            Query query = WebsiteAnalytics.query()
                .measure(Measure.of("ctr_pct"))
                .build();

            PlanTree tree = build(query, WebsiteAnalytics.duckdb());

            // base, ctr layer, ctr_pct layer, root
            assertThat(tree.size()).isEqualTo(4);
            assertThat(tree.root().fields()).extracting(FieldNode::name).containsExactly("ctr_pct");
            assertThat(tree.block("t2").field("ctr_pct").expression().sql()).isEqualTo("(ctr * 100)");
        }
    }

    @Nested
    @DisplayName("Comparisons")
    class Comparisons {

        @Test
        @DisplayName("Comparison measures join both periods with a full outer join")
        void testComparisonJoin() {
            Query query = WebsiteAnalytics.query()
                .dimension(Dimension.of("country"))
                .measure(Measure.of("total_views"))
                .measure(Measure.computed("views_prev", Measure.Compute.comparisonValue("total_views")))
                .measure(Measure.computed("views_delta", Measure.Compute.comparisonDelta("total_views")))
                .measure(Measure.computed("views_ratio", Measure.Compute.comparisonRatio("total_views")))
                .timeRange(TimeRange.absolute(WebsiteAnalytics.JAN_1, WebsiteAnalytics.FEB_1))
                .comparisonTimeRange(TimeRange.absolute(DEC_1, WebsiteAnalytics.JAN_1))
                .build();

            PlanTree tree = build(query, WebsiteAnalytics.duckdb());
            SqlFragment sql = sql(query);

            assertThat(tree.comparisonJoin()).isEqualTo(new PlanTree.ComparisonJoin("t1",
                PlanBuilder.BASE_ALIAS, PlanBuilder.COMPARISON_ALIAS));
            assertThat(sql.sql()).isEqualTo(
                "SELECT COALESCE(\"base\".\"country\", \"comparison\".\"country\") AS \"country\", "
                    + "\"base\".\"total_views\" AS \"total_views\", "
                    + "\"comparison\".\"total_views\" AS \"views_prev\", "
                    + "(\"base\".\"total_views\" - \"comparison\".\"total_views\") AS \"views_delta\", "
                    + "(\"base\".\"total_views\" - \"comparison\".\"total_views\") / NULLIF(\"comparison\".\"total_views\", 0) "
                    + "AS \"views_ratio\" "
                    + "FROM (" + BASE_JAN + ") AS \"base\" "
                    + "FULL OUTER JOIN (" + BASE_JAN + ") AS \"comparison\" "
                    + "ON \"base\".\"country\" IS NOT DISTINCT FROM \"comparison\".\"country\"");
            assertThat(sql.args()).containsExactly(WebsiteAnalytics.JAN_1, WebsiteAnalytics.FEB_1,
                DEC_1, WebsiteAnalytics.JAN_1);
        }

        @Test
        @DisplayName("Comparison without dimensions joins on a constant")
        void testComparisonWithoutDimensions() {
            Query query = WebsiteAnalytics.query()
                .measure(Measure.computed("views_prev", Measure.Compute.comparisonValue("total_views")))
                .timeRange(TimeRange.absolute(WebsiteAnalytics.JAN_1, WebsiteAnalytics.FEB_1))
                .comparisonTimeRange(TimeRange.absolute(DEC_1, WebsiteAnalytics.JAN_1))
                .build();

            assertThat(sql(query).sql()).endsWith("AS \"comparison\" ON 1 = 1");
        }

        @Test
        @DisplayName("Having on a wrapper root filters the computed columns")
        void testWrapperHaving() {
            Query query = WebsiteAnalytics.query()
                .dimension(Dimension.of("country"))
                .measure(Measure.computed("views_delta", Measure.Compute.comparisonDelta("total_views")))
                .timeRange(TimeRange.absolute(WebsiteAnalytics.JAN_1, WebsiteAnalytics.FEB_1))
                .comparisonTimeRange(TimeRange.absolute(DEC_1, WebsiteAnalytics.JAN_1))
                .having(condition(Operator.LT, name("views_delta"), value(0)))
                .build();

            SqlFragment sql = sql(query);

            assertThat(sql.sql()).endsWith(
                " WHERE (\"base\".\"total_views\" - \"comparison\".\"total_views\") < ?");
            assertThat(sql.args()).last().isEqualTo(0);
        }
    }

    @Nested
    @DisplayName("Output Shape")
    class OutputShape {

        @Test
        @DisplayName("Display names relabel columns in a final projection")
        void testDisplayNames() {
            Query query = WebsiteAnalytics.query()
                .dimension(Dimension.of("country"))
                .measure(Measure.of("total_views"))
                .measure(Measure.computed("n", Measure.Compute.count()))
                .sort(Sort.desc("total_views"))
                .limit(5L)
                .useDisplayNames(true)
                .build();

            assertThat(sql(query).sql()).isEqualTo(
                "SELECT \"country\" AS \"Country\", \"total_views\" AS \"Total Views\", \"n\" AS \"Count\" "
                    + "FROM (SELECT \"country\" AS \"country\", sum(views) AS \"total_views\", count(*) AS \"n\" "
                    + "FROM \"events\" GROUP BY \"country\") AS \"base\" "
                    + "ORDER BY \"Total Views\" DESC NULLS LAST LIMIT 5");
        }

        @Test
        @DisplayName("Raw rows select every column")
        void testRows() {
            Query query = WebsiteAnalytics.query()
                .rows(true)
                .where(Expression.eq("device", "mobile"))
                .sort(Sort.asc("page"))
                .limit(3L)
                .offset(6L)
                .build();

            SqlFragment sql = sql(query);

            assertThat(sql.sql()).isEqualTo("SELECT * FROM \"events\" WHERE (lower(device_type)) = ? "
                + "ORDER BY \"page_path\" ASC NULLS LAST LIMIT 3 OFFSET 6");
            assertThat(sql.args()).containsExactly("mobile");
        }

        @Test
        @DisplayName("Pivot is rejected")
        void testPivot() {
            Query query = WebsiteAnalytics.query()
                .dimension(Dimension.of("country"))
                .measure(Measure.of("total_views"))
                .pivotOn("country")
                .build();

            assertThatThrownBy(() -> build(query, WebsiteAnalytics.duckdb()))
                .isInstanceOf(UnsupportedFeatureException.class)
                .hasMessageContaining("pivot");
        }
    }

    @Nested
    @DisplayName("Subqueries")
    class Subqueries {

        @Test
        @DisplayName("Subquery filter selects only its dimension")
        void testSubqueryFilter() {
            SubqueryExpression top = new SubqueryExpression("country", List.of("total_views"), null,
                condition(Operator.GT, name("total_views"), value(100)));
            Query query = WebsiteAnalytics.query()
                .dimension(Dimension.of("country"))
                .measure(Measure.of("total_views"))
                .where(condition(Operator.IN, name("country"), top))
                .build();

            SqlFragment sql = sql(query);

            assertThat(sql.sql()).isEqualTo("SELECT \"country\" AS \"country\", sum(views) AS \"total_views\" "
                + "FROM \"events\" WHERE \"country\" IN (SELECT \"country\" AS \"country\" FROM \"events\" "
                + "GROUP BY \"country\" HAVING sum(views) > ?) GROUP BY \"country\"");
            assertThat(sql.args()).containsExactly(100);
        }

        @Test
        @DisplayName("Derived measures in subquery having are unsupported")
        void testSubqueryDerived() {
            SubqueryExpression top = new SubqueryExpression("country", List.of("ctr"), null,
                condition(Operator.GT, name("ctr"), value(0.1)));
            Query query = WebsiteAnalytics.query()
                .measure(Measure.of("total_views"))
                .where(condition(Operator.IN, name("country"), top))
                .build();

            assertThatThrownBy(() -> sql(query)).isInstanceOf(UnsupportedFeatureException.class);
        }
    }
}
