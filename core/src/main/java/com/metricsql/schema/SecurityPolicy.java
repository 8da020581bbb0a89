package com.metricsql.schema;

import com.metricsql.expression.Expression;

import java.util.Optional;
import java.util.Set;

/**
 * Resolved row- and field-level access rules for the current caller.
 *
 * <p>The compiler consumes the policy in two ways only: a visibility check per
 * dimension or measure name, and an optional row filter that is ANDed into every
 * base filter.
 */
public interface SecurityPolicy {

    /**
     * Returns whether the named dimension or measure may be queried.
     *
     * @param field the dimension or measure name
     * @return true if visible
     */
    boolean canAccess(String field);

    /**
     * Returns the row filter restricting the rows visible to the caller.
     *
     * @return the filter, or empty if unrestricted
     */
    Optional<Expression> rowFilter();

    /**
     * Policy that allows everything.
     *
     * @return an open policy
     */
    static SecurityPolicy open() {
        return Restricted.OPEN;
    }

    /**
     * Policy hiding some fields and/or filtering rows.
     *
     * @param hiddenFields names that may not be queried
     * @param rowFilter row filter, or null
     * @return the policy
     */
    static SecurityPolicy restricted(Set<String> hiddenFields, Expression rowFilter) {
        return new Restricted(Set.copyOf(hiddenFields), rowFilter);
    }

    /**
     * Set-based policy used by {@link #open()} and {@link #restricted(Set, Expression)}.
     */
    record Restricted(Set<String> hiddenFields, Expression filter) implements SecurityPolicy {

        static final Restricted OPEN = new Restricted(Set.of(), null);

        @Override
        public boolean canAccess(String field) {
            return !hiddenFields.contains(field);
        }

        @Override
        public Optional<Expression> rowFilter() {
            return Optional.ofNullable(filter);
        }
    }
}
