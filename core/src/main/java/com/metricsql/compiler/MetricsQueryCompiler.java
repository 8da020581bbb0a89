package com.metricsql.compiler;

import com.metricsql.dialect.Dialect;
import com.metricsql.dialect.DialectRegistry;
import com.metricsql.exception.CompileInvariantException;
import com.metricsql.exception.MetricsQueryException;
import com.metricsql.expression.SqlFragment;
import com.metricsql.generator.SQLGenerator;
import com.metricsql.logical.PlanBuilder;
import com.metricsql.logical.PlanTree;
import com.metricsql.query.Query;
import com.metricsql.rewrite.RewriteContext;
import com.metricsql.rewrite.RewritePipeline;
import com.metricsql.runtime.CompilationLogger;
import com.metricsql.runtime.CompilerConfig;
import com.metricsql.runtime.ScalarQueryExecutor;
import com.metricsql.schema.MetricsView;
import com.metricsql.schema.SecurityPolicy;
import com.metricsql.validation.QueryValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Compiles metrics queries to dialect SQL with positional arguments.
 *
 * <p>Compilation runs validation, the query rewrite passes, plan building, the
 * tree rewrite passes and SQL generation, in that order. It either returns a
 * complete statement or throws a {@link MetricsQueryException}; no partial SQL
 * is ever produced. A compiler is stateless between calls and may be shared.
 *
 * <p>Example usage:
 * <pre>
 *   MetricsQueryCompiler compiler = new MetricsQueryCompiler(
 *       CompilerConfig.fromSystemProperties(), DialectRegistry.get("duckdb"), executor);
 *   CompiledQuery compiled = compiler.compile(query, view, SecurityPolicy.open(),
 *       CompileContext.of(Instant.now()));
 * </pre>
 */
public class MetricsQueryCompiler {

    private static final Logger logger = LoggerFactory.getLogger(MetricsQueryCompiler.class);

    private final CompilerConfig config;
    private final Dialect dialect;
    private final ScalarQueryExecutor executor;
    private final RewritePipeline pipeline;

    public MetricsQueryCompiler(CompilerConfig config, Dialect dialect, ScalarQueryExecutor executor) {
        this(config, dialect, executor, RewritePipeline.standard());
    }

    public MetricsQueryCompiler(CompilerConfig config, Dialect dialect, ScalarQueryExecutor executor,
                                RewritePipeline pipeline) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.dialect = Objects.requireNonNull(dialect, "dialect must not be null");
        this.executor = executor == null ? ScalarQueryExecutor.unavailable() : executor;
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
    }

    /**
     * Creates a compiler for the dialect named by the configuration.
     *
     * @param config the configuration
     * @param executor the scalar executor for percent-of-total measures
     * @return the compiler
     * @throws IllegalArgumentException if the configured dialect is unknown
     */
    public static MetricsQueryCompiler forConfig(CompilerConfig config, ScalarQueryExecutor executor) {
        return new MetricsQueryCompiler(config, DialectRegistry.get(config.dialect()), executor);
    }

    /**
     * Compiles a query.
     *
     * @param query the query
     * @param view the metrics view the query targets
     * @param security the caller's security policy
     * @param context the per-request context
     * @return the SQL, its arguments and the applied row cap
     * @throws MetricsQueryException if the query cannot be compiled
     */
    public CompiledQuery compile(Query query, MetricsView view, SecurityPolicy security, CompileContext context) {
        Objects.requireNonNull(context, "context must not be null");
        SecurityPolicy policy = security == null ? SecurityPolicy.open() : security;
        String outer = CompilationLogger.startCompilation(view == null ? null : view.name());
        long start = System.nanoTime();
        try {
            QueryValidator.validate(query, view, policy);

            RewriteContext rewriteContext = new RewriteContext(view, policy, dialect, config, context, executor);
            Query rewritten = pipeline.rewriteQuery(query, rewriteContext);
            logger.debug("Rewritten query: {}", rewritten);
            PlanTree tree = PlanBuilder.build(view, policy, rewritten, dialect);
            tree = pipeline.rewritePlan(tree, rewriteContext);
            SqlFragment sql = new SQLGenerator(dialect).generate(tree);

            CompilationLogger.logSQLGeneration(sql.sql(), sql.args().size(), (System.nanoTime() - start) / 1_000_000);
            return new CompiledQuery(sql.sql(), sql.args(), rewriteContext.rowCap());
        } catch (CompileInvariantException e) {
            CompilationLogger.logError(e, true);
            throw e;
        } catch (MetricsQueryException e) {
            CompilationLogger.logError(e, false);
            throw e;
        } catch (RuntimeException e) {
            CompilationLogger.logError(e, true);
            throw new CompileInvariantException("Unexpected error while compiling query: " + e.getMessage(), e);
        } finally {
            CompilationLogger.endCompilation(outer);
        }
    }

    public Dialect dialect() {
        return dialect;
    }

    public CompilerConfig config() {
        return config;
    }

    @Override
    public String toString() {
        return "MetricsQueryCompiler(" + dialect.name() + ", " + config + ")";
    }
}
