package com.metricsql.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * Structured logging for one compilation.
 *
 * <p>Puts a {@code compileId} into the SLF4J MDC so that every log line of the
 * rewrite passes, the builder and the scalar executor can be correlated. A
 * nested compilation (the total query of a percent-of-total measure) gets its
 * own id and restores the outer one when it ends. Always end in a finally block.
 */
public final class CompilationLogger {

    private static final Logger logger = LoggerFactory.getLogger(CompilationLogger.class);

    public static final String MDC_COMPILE_ID = "compileId";

    private CompilationLogger() {
    }

    /**
     * Starts a compilation.
     *
     * @param metricsView the metrics view being queried
     * @return the id of the enclosing compilation, or null; pass it to {@link #endCompilation(String)}
     */
    public static String startCompilation(String metricsView) {
        String outer = MDC.get(MDC_COMPILE_ID);
        String compileId = "c_" + UUID.randomUUID().toString().substring(0, 8);
        MDC.put(MDC_COMPILE_ID, compileId);
        if (outer != null) {
            logger.debug("Compiling nested query against metrics view '{}' for {}", metricsView, outer);
        } else {
            logger.debug("Compiling query against metrics view '{}'", metricsView);
        }
        return outer;
    }

    public static void logSQLGeneration(String sql, int argCount, long elapsedMs) {
        logger.debug("Generated SQL in {}ms with {} args: {}", elapsedMs, argCount, sql);
    }

    /**
     * Logs a failed compilation. Compiler defects are logged at ERROR, user
     * errors at DEBUG.
     *
     * @param error the failure
     * @param defect whether the failure indicates a compiler bug
     */
    public static void logError(Throwable error, boolean defect) {
        if (defect) {
            logger.error("Compilation failed with internal error", error);
        } else {
            logger.debug("Compilation rejected: {}", error.getMessage());
        }
    }

    public static String currentCompileId() {
        return MDC.get(MDC_COMPILE_ID);
    }

    /**
     * Ends a compilation, restoring the enclosing compilation's id if any.
     *
     * @param outer the value returned by {@link #startCompilation(String)}
     */
    public static void endCompilation(String outer) {
        if (outer != null) {
            MDC.put(MDC_COMPILE_ID, outer);
        } else {
            MDC.remove(MDC_COMPILE_ID);
        }
    }
}
