package com.metricsql.rewrite;

import com.metricsql.compiler.CompileContext;
import com.metricsql.dialect.Dialect;
import com.metricsql.query.Query;
import com.metricsql.runtime.CompilerConfig;
import com.metricsql.runtime.ScalarQueryExecutor;
import com.metricsql.schema.MetricsView;
import com.metricsql.schema.SecurityPolicy;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * Everything a rewrite pass may consult, plus the few facts passes hand forward
 * to the compiled result. One instance per compilation.
 */
public final class RewriteContext {

    private final MetricsView view;
    private final SecurityPolicy security;
    private final Dialect dialect;
    private final CompilerConfig config;
    private final CompileContext compileContext;
    private final ScalarQueryExecutor executor;
    private Query query;
    private Long rowCap;

    public RewriteContext(MetricsView view, SecurityPolicy security, Dialect dialect, CompilerConfig config,
                          CompileContext compileContext, ScalarQueryExecutor executor) {
        this.view = Objects.requireNonNull(view, "view must not be null");
        this.security = Objects.requireNonNull(security, "security must not be null");
        this.dialect = Objects.requireNonNull(dialect, "dialect must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.compileContext = Objects.requireNonNull(compileContext, "compileContext must not be null");
        this.executor = executor == null ? ScalarQueryExecutor.unavailable() : executor;
    }

    public MetricsView view() {
        return view;
    }

    public SecurityPolicy security() {
        return security;
    }

    public Dialect dialect() {
        return dialect;
    }

    public CompilerConfig config() {
        return config;
    }

    public CompileContext compileContext() {
        return compileContext;
    }

    public ScalarQueryExecutor executor() {
        return executor;
    }

    /**
     * Returns the query after all query-level passes, for use by tree passes.
     *
     * @return the rewritten query, or null before query passes ran
     */
    public Query query() {
        return query;
    }

    void setQuery(Query rewritten) {
        this.query = rewritten;
    }

    /**
     * Records that the query was capped: it selects {@code cap + 1} rows.
     *
     * @param cap the effective cap
     */
    public void recordRowCap(long cap) {
        this.rowCap = cap;
    }

    public OptionalLong rowCap() {
        return rowCap == null ? OptionalLong.empty() : OptionalLong.of(rowCap);
    }
}
