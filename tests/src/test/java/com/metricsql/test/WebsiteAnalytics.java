package com.metricsql.test;

import com.metricsql.compiler.CompileContext;
import com.metricsql.dialect.Dialect;
import com.metricsql.dialect.DialectRegistry;
import com.metricsql.query.Query;
import com.metricsql.rewrite.RewriteContext;
import com.metricsql.runtime.CompilerConfig;
import com.metricsql.runtime.ScalarQueryExecutor;
import com.metricsql.schema.DimensionDefinition;
import com.metricsql.schema.MeasureDefinition;
import com.metricsql.schema.MetricsView;
import com.metricsql.schema.SecurityPolicy;

import java.time.Instant;

/**
 * Shared fixture: a page-view metrics view over table {@code events}.
 */
public final class WebsiteAnalytics {

    public static final String VIEW = "website_analytics";
    public static final String TABLE = "events";
    public static final String TIME = "event_time";

    public static final Instant JAN_1 = Instant.parse("2024-01-01T00:00:00Z");
    public static final Instant FEB_1 = Instant.parse("2024-02-01T00:00:00Z");
    public static final Instant NOW = Instant.parse("2024-03-15T10:30:00Z");

    private WebsiteAnalytics() {
    }

    public static MetricsView view() {
        return MetricsView.builder(VIEW, TABLE)
            .timeDimension(TIME)
            .dimension(DimensionDefinition.column("country", "country").withDisplayName("Country"))
            .dimension(DimensionDefinition.column("city", "city"))
            .dimension(DimensionDefinition.expression("device", "lower(device_type)").withDisplayName("Device"))
            .dimension(DimensionDefinition.column("page", "page_path"))
            .measure(MeasureDefinition.simple("total_views", "sum(views)").withDisplayName("Total Views"))
            .measure(MeasureDefinition.simple("total_clicks", "sum(clicks)"))
            .measure(MeasureDefinition.simple("unique_users", "count(DISTINCT user_id)"))
            .measure(MeasureDefinition.derived("ctr", "total_clicks / NULLIF(total_views, 0)",
                "total_clicks", "total_views").withDisplayName("CTR"))
            .measure(MeasureDefinition.derived("ctr_pct", "ctr * 100", "ctr"))
            .build();
    }

    public static Query.Builder query() {
        return Query.builder(VIEW);
    }

    public static Dialect duckdb() {
        return DialectRegistry.get("duckdb");
    }

    public static Dialect druid() {
        return DialectRegistry.get("druid");
    }

    public static Dialect clickhouse() {
        return DialectRegistry.get("clickhouse");
    }

    public static CompileContext context() {
        return CompileContext.of(NOW);
    }

    public static RewriteContext rewriteContext(Dialect dialect, CompilerConfig config, ScalarQueryExecutor executor) {
        return new RewriteContext(view(), SecurityPolicy.open(), dialect, config, context(), executor);
    }

    public static RewriteContext rewriteContext(Dialect dialect, CompilerConfig config) {
        return rewriteContext(dialect, config, ScalarQueryExecutor.unavailable());
    }
}
