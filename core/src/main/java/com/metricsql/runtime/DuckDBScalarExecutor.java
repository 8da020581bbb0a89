package com.metricsql.runtime;

import com.metricsql.compiler.CompileContext;
import com.metricsql.compiler.CompiledQuery;
import com.metricsql.compiler.MetricsQueryCompiler;
import com.metricsql.dialect.Dialect;
import com.metricsql.exception.QueryExecutionException;
import com.metricsql.query.Query;
import com.metricsql.schema.MetricsView;
import com.metricsql.schema.SecurityPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;

/**
 * Runs scalar queries on a DuckDB JDBC connection.
 *
 * <p>The scalar query is compiled for the same metrics view under the
 * caller's security policy, without percent-of-total support of its own, then executed as a
 * prepared statement. Timestamps are bound as UTC {@link LocalDateTime}s.
 *
 * <p>Example usage:
 * <pre>
 *   Connection conn = DriverManager.getConnection("jdbc:duckdb:");
 *   ScalarQueryExecutor executor = new DuckDBScalarExecutor(conn, view, dialect);
 *   MetricsQueryCompiler compiler = new MetricsQueryCompiler(config, dialect, executor);
 * </pre>
 */
public class DuckDBScalarExecutor implements ScalarQueryExecutor {

    private static final Logger logger = LoggerFactory.getLogger(DuckDBScalarExecutor.class);

    private final Connection connection;
    private final MetricsView view;
    private final MetricsQueryCompiler compiler;

    public DuckDBScalarExecutor(Connection connection, MetricsView view, Dialect dialect) {
        this.connection = Objects.requireNonNull(connection, "connection must not be null");
        this.view = Objects.requireNonNull(view, "view must not be null");
        // Uncapped: a scalar query returns one row
        CompilerConfig config = CompilerConfig.builder().rowCap(0L).dialect(dialect.name()).build();
        this.compiler = new MetricsQueryCompiler(config, dialect, ScalarQueryExecutor.unavailable());
    }

    @Override
    public Object executeScalar(Query query, SecurityPolicy security, CompileContext context)
            throws InterruptedException {
        CompiledQuery compiled = compiler.compile(query, view, security, context);
        if (context.isCancelled()) {
            throw new CancellationException("Compilation cancelled before total query");
        }

        String sql = compiled.sql();
        logger.debug("Executing scalar query: {}", sql);
        long start = System.nanoTime();
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            bindArgs(stmt, compiled.args());
            applyTimeout(stmt, context);
            try (ResultSet rs = stmt.executeQuery()) {
                Object value = rs.next() ? rs.getObject(1) : null;
                logger.debug("Scalar query returned {} in {}ms", value, (System.nanoTime() - start) / 1_000_000);
                return value;
            }
        } catch (SQLException e) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Interrupted while executing scalar query");
            }
            throw new QueryExecutionException("Failed to execute scalar query: " + e.getMessage(), e,
                sql, compiled.args());
        }
    }

    /**
     * Binds compiled arguments to a prepared statement, converting instants to UTC timestamps.
     *
     * @param stmt the statement
     * @param args the arguments in placeholder order
     * @throws SQLException if binding fails
     */
    public static void bindArgs(PreparedStatement stmt, List<Object> args) throws SQLException {
        for (int i = 0; i < args.size(); i++) {
            Object arg = args.get(i);
            if (arg instanceof Instant instant) {
                stmt.setObject(i + 1, LocalDateTime.ofInstant(instant, ZoneOffset.UTC));
            } else {
                stmt.setObject(i + 1, arg);
            }
        }
    }

    private static void applyTimeout(PreparedStatement stmt, CompileContext context) throws SQLException {
        if (context.timeout() == null) {
            return;
        }
        int seconds = (int) Math.max(1, context.timeout().toSeconds());
        try {
            stmt.setQueryTimeout(seconds);
        } catch (SQLFeatureNotSupportedException e) {
            logger.debug("Driver does not support query timeouts, running without one");
        }
    }
}
