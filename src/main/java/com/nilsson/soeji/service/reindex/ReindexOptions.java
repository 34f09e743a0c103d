package com.nilsson.soeji.service.reindex;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 Settings of one reindex run. With no target selected every target runs, in declaration order.
 */
public final class ReindexOptions {

    public static final int DEFAULT_BATCH_SIZE = 100;
    public static final int DEFAULT_CONCURRENCY = 5;

    private final ReindexTarget only;
    private final int batchSize;
    private final int concurrency;
    private final long sleepMillis;
    private final boolean dryRun;
    private final boolean verbose;

    private ReindexOptions(Builder builder) {
        this.only = builder.only;
        this.batchSize = builder.batchSize;
        this.concurrency = builder.concurrency;
        this.sleepMillis = builder.sleepMillis;
        this.dryRun = builder.dryRun;
        this.verbose = builder.verbose;
    }

    public static ReindexOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<ReindexTarget> targets() {
        Set<ReindexTarget> targets = only == null ? EnumSet.allOf(ReindexTarget.class) : EnumSet.of(only);
        return List.copyOf(targets);
    }

    public ReindexTarget getOnly() {
        return only;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public int getConcurrency() {
        return concurrency;
    }

    public long getSleepMillis() {
        return sleepMillis;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public boolean isVerbose() {
        return verbose;
    }

    @Override
    public String toString() {
        return "ReindexOptions{only=" + (only == null ? "all" : only) + ", batchSize=" + batchSize
                + ", concurrency=" + concurrency + ", sleepMillis=" + sleepMillis
                + ", dryRun=" + dryRun + ", verbose=" + verbose + "}";
    }

    public static final class Builder {
        private ReindexTarget only;
        private int batchSize = DEFAULT_BATCH_SIZE;
        private int concurrency = DEFAULT_CONCURRENCY;
        private long sleepMillis;
        private boolean dryRun;
        private boolean verbose;

        private Builder() {
        }

        public Builder only(ReindexTarget target) {
            this.only = target;
            return this;
        }

        public Builder batchSize(int batchSize) {
            if (batchSize < 1) throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
            this.batchSize = batchSize;
            return this;
        }

        public Builder concurrency(int concurrency) {
            if (concurrency < 1) throw new IllegalArgumentException("Concurrency must be positive: " + concurrency);
            this.concurrency = concurrency;
            return this;
        }

        public Builder sleepMillis(long sleepMillis) {
            if (sleepMillis < 0) throw new IllegalArgumentException("Sleep must not be negative: " + sleepMillis);
            this.sleepMillis = sleepMillis;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder verbose(boolean verbose) {
            this.verbose = verbose;
            return this;
        }

        public ReindexOptions build() {
            return new ReindexOptions(this);
        }
    }
}
