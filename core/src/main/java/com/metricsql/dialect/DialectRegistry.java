package com.metricsql.dialect;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Process-wide registry of supported dialects, keyed by backend name.
 *
 * <p>Populated once during class initialization and read-only afterwards, so
 * lookups need no synchronization.
 */
public final class DialectRegistry {

    private static final Map<String, Dialect> DIALECTS;

    static {
        Map<String, Dialect> dialects = new TreeMap<>();
        register(dialects, new DuckDBDialect());
        register(dialects, new ClickHouseDialect());
        register(dialects, new DruidDialect());
        DIALECTS = Collections.unmodifiableMap(dialects);
    }

    private static void register(Map<String, Dialect> dialects, Dialect dialect) {
        dialects.put(dialect.name(), dialect);
    }

    /**
     * Returns the dialect registered under a name (case-insensitive).
     *
     * @param name the backend name, e.g. {@code "duckdb"}
     * @return the dialect
     * @throws IllegalArgumentException if no dialect is registered under that name
     */
    public static Dialect get(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException(
            "Unknown dialect: '" + name + "'. Valid values: " + String.join(", ", DIALECTS.keySet())));
    }

    public static Optional<Dialect> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(DIALECTS.get(name.trim().toLowerCase(Locale.ROOT)));
    }

    public static Set<String> names() {
        return DIALECTS.keySet();
    }

    private DialectRegistry() {}
}
