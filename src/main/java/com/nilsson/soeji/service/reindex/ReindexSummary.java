package com.nilsson.soeji.service.reindex;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 Per-target outcome counts of a reindex run. Counters are updated concurrently by the workers.
 */
public class ReindexSummary {

    private final Map<ReindexTarget, TargetCounts> counts = new EnumMap<>(ReindexTarget.class);

    synchronized TargetCounts start(ReindexTarget target) {
        return counts.computeIfAbsent(target, t -> new TargetCounts());
    }

    public synchronized TargetCounts get(ReindexTarget target) {
        return counts.getOrDefault(target, new TargetCounts());
    }

    public synchronized Map<ReindexTarget, TargetCounts> all() {
        return Collections.unmodifiableMap(new EnumMap<>(counts));
    }

    public synchronized boolean hasFailures() {
        return counts.values().stream().anyMatch(c -> c.getFailed() > 0);
    }

    @Override
    public synchronized String toString() {
        StringBuilder sb = new StringBuilder();
        counts.forEach((target, c) -> sb.append(target).append(": ").append(c).append('\n'));
        return sb.toString().trim();
    }

    public static final class TargetCounts {
        private final AtomicInteger processed = new AtomicInteger();
        private final AtomicInteger failed = new AtomicInteger();
        private final AtomicInteger skipped = new AtomicInteger();

        void processed() {
            processed.incrementAndGet();
        }

        void failed() {
            failed.incrementAndGet();
        }

        void skipped() {
            skipped.incrementAndGet();
        }

        public int getProcessed() {
            return processed.get();
        }

        public int getFailed() {
            return failed.get();
        }

        public int getSkipped() {
            return skipped.get();
        }

        @Override
        public String toString() {
            return processed.get() + " processed, " + failed.get() + " failed, " + skipped.get() + " skipped";
        }
    }
}
