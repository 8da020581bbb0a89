package com.metricsql.logical;

import java.util.Objects;

/**
 * A block joined into its parent's FROM clause.
 *
 * @param alias alias of the joined block in the arena
 * @param kind the join kind
 * @param predicate the ON predicate, already escaped and qualified
 */
public record JoinChild(String alias, JoinKind kind, String predicate) {

    public JoinChild {
        Objects.requireNonNull(alias, "alias must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(predicate, "predicate must not be null");
    }

    public JoinChild withKind(JoinKind replacement) {
        return new JoinChild(alias, replacement, predicate);
    }
}
