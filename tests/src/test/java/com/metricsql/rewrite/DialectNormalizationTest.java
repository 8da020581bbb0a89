package com.metricsql.rewrite;

import com.metricsql.dialect.Dialect;
import com.metricsql.expression.SqlFragment;
import com.metricsql.generator.SQLGenerator;
import com.metricsql.logical.PlanBuilder;
import com.metricsql.logical.PlanTree;
import com.metricsql.query.Dimension;
import com.metricsql.query.Measure;
import com.metricsql.query.Query;
import com.metricsql.query.TimeRange;
import com.metricsql.runtime.CompilerConfig;
import com.metricsql.schema.SecurityPolicy;
import com.metricsql.test.TestBase;
import com.metricsql.test.TestCategories;
import com.metricsql.test.WebsiteAnalytics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@TestCategories.Tier2
@TestCategories.Unit
@TestCategories.Rewrite
@DisplayName("Dialect Normalization Tests")
public class DialectNormalizationTest extends TestBase {

    private final DialectNormalization pass = new DialectNormalization();

    private final Query query = WebsiteAnalytics.query()
        .dimension(Dimension.of("country"))
        .measure(Measure.computed("views_delta", Measure.Compute.comparisonDelta("total_views")))
        .timeRange(TimeRange.absolute(WebsiteAnalytics.JAN_1, WebsiteAnalytics.FEB_1))
        .comparisonTimeRange(TimeRange.absolute(Instant.parse("2023-12-01T00:00:00Z"), WebsiteAnalytics.JAN_1))
        .build();

    private SqlFragment normalize(Dialect dialect) {
        PlanTree tree = PlanBuilder.build(WebsiteAnalytics.view(), SecurityPolicy.open(), query, dialect);
        pass.apply(tree, WebsiteAnalytics.rewriteContext(dialect, CompilerConfig.defaults()));
        SqlFragment sql = new SQLGenerator(dialect).generate(tree);
        logData("Generated SQL", sql);
        return sql;
    }

    @Test
    @DisplayName("Druid groups the join block and aggregates its measures")
    void testDruidGrouping() {
        SqlFragment sql = normalize(WebsiteAnalytics.druid());

        String side = "SELECT \"country\" AS \"country\", sum(views) AS \"total_views\" FROM \"events\" "
            + "WHERE \"event_time\" >= ? AND \"event_time\" < ? GROUP BY 1";
        assertThat(sql.sql()).isEqualTo(
            "SELECT COALESCE(\"base\".\"country\", \"comparison\".\"country\") AS \"country\", "
                + "ANY_VALUE((\"base\".\"total_views\" - \"comparison\".\"total_views\")) AS \"views_delta\" "
                + "FROM (" + side + ") AS \"base\" FULL OUTER JOIN (" + side + ") AS \"comparison\" "
                + "ON \"base\".\"country\" = \"comparison\".\"country\" GROUP BY 1");
    }

    @Test
    @DisplayName("DuckDB leaves the join block ungrouped")
    void testDuckDBUnchanged() {
        SqlFragment sql = normalize(WebsiteAnalytics.duckdb());

        assertThat(sql.sql()).doesNotContain("ANY_VALUE").doesNotEndWith("GROUP BY \"country\"");
        assertThat(sql.sql()).endsWith("IS NOT DISTINCT FROM \"comparison\".\"country\"");
    }
}
