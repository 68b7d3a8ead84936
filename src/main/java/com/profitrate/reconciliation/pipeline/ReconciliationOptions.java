package com.profitrate.reconciliation.pipeline;

import java.time.Duration;

/**
 * Execution options for a reconciliation run.
 * Configures the worker pool and the time bounds of reads and variable chains.
 */
public class ReconciliationOptions {

    public static final int DEFAULT_MAX_WORKERS = 4;
    private static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration DEFAULT_CHAIN_TIMEOUT = Duration.ofMinutes(5);

    private final Integer workers;
    private final Duration readTimeout;
    private final Duration chainTimeout;

    private ReconciliationOptions(Builder builder) {
        this.workers = builder.workers;
        this.readTimeout = builder.readTimeout;
        this.chainTimeout = builder.chainTimeout;
    }

    /**
     * Explicit worker count, or null to use {@code min(4, variables)}.
     */
    public Integer getWorkers() {
        return workers;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public Duration getChainTimeout() {
        return chainTimeout;
    }

    /**
     * Worker pool size for a run over the given number of variables.
     */
    public int workersFor(int variableCount) {
        if (workers != null) {
            return workers;
        }
        return Math.max(1, Math.min(DEFAULT_MAX_WORKERS, variableCount));
    }

    public static ReconciliationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Integer workers;
        private Duration readTimeout = DEFAULT_READ_TIMEOUT;
        private Duration chainTimeout = DEFAULT_CHAIN_TIMEOUT;

        public Builder workers(Integer workers) {
            if (workers != null && workers < 1) {
                throw new IllegalArgumentException("workers must be >= 1, got " + workers);
            }
            this.workers = workers;
            return this;
        }

        public Builder readTimeout(Duration readTimeout) {
            validatePositive(readTimeout, "readTimeout");
            this.readTimeout = readTimeout;
            return this;
        }

        public Builder chainTimeout(Duration chainTimeout) {
            validatePositive(chainTimeout, "chainTimeout");
            this.chainTimeout = chainTimeout;
            return this;
        }

        private void validatePositive(Duration value, String name) {
            if (value == null || value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be positive, got " + value);
            }
        }

        public ReconciliationOptions build() {
            return new ReconciliationOptions(this);
        }
    }
}
