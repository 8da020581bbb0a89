package com.metricsql.compiler;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-request state of one compilation: the execution timestamp that relative
 * time ranges resolve against, a priority and timeout forwarded to nested
 * executions, and a cancellation flag.
 */
public final class CompileContext {

    private final Instant executionTime;
    private final int priority;
    private final Duration timeout;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    private CompileContext(Builder builder) {
        this.executionTime = Objects.requireNonNull(builder.executionTime, "executionTime must not be null");
        this.priority = builder.priority;
        this.timeout = builder.timeout;
    }

    public static CompileContext of(Instant executionTime) {
        return builder().executionTime(executionTime).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Instant executionTime() {
        return executionTime;
    }

    public int priority() {
        return priority;
    }

    /**
     * Returns the timeout for nested executions, or null for none.
     *
     * @return the timeout
     */
    public Duration timeout() {
        return timeout;
    }

    /**
     * Requests cancellation. Checked before and after every nested execution.
     */
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Builder for {@link CompileContext}.
     */
    public static final class Builder {
        private Instant executionTime = Instant.now();
        private int priority;
        private Duration timeout;

        private Builder() {
        }

        public Builder executionTime(Instant time) {
            this.executionTime = time;
            return this;
        }

        public Builder priority(int value) {
            this.priority = value;
            return this;
        }

        public Builder timeout(Duration value) {
            this.timeout = value;
            return this;
        }

        public CompileContext build() {
            return new CompileContext(this);
        }
    }
}
