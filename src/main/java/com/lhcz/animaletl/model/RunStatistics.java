package com.lhcz.animaletl.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * 运行统计 (可变聚合)
 * 由流水线独占持有，所有修改都经过 {@link #update(Consumer)} 这一个加锁入口。
 */
public class RunStatistics {
    private final Object guard = new Object();
    private final Tally tally;

    public RunStatistics(Instant startedAt) {
        this.tally = new Tally(startedAt);
    }

    public void update(Consumer<Tally> mutation) {
        synchronized (guard) {
            mutation.accept(tally);
        }
    }

    public RunSummary snapshot() {
        synchronized (guard) {
            Instant end = tally.endedAt;
            Duration duration = end == null ? null : Duration.between(tally.startedAt, end);
            return new RunSummary(tally.startedAt, end, duration, tally.fetched, tally.transformed,
                    tally.loaded, tally.batchesProcessed, new ArrayList<>(tally.errors));
        }
    }

    /**
     * 计数器本体，只在 update 回调里可见
     */
    public static final class Tally {
        private final Instant startedAt;
        private Instant endedAt;
        private long fetched;
        private long transformed;
        private long loaded;
        private long batchesProcessed;
        private final List<String> errors = new ArrayList<>();

        private Tally(Instant startedAt) {
            this.startedAt = startedAt;
        }

        public void addFetched(long n) { fetched += n; }

        public void addTransformed(long n) { transformed += n; }

        public void addLoaded(long n) { loaded += n; }

        public void addBatch() { batchesProcessed++; }

        public void addError(String error) { errors.add(error); }

        public void addErrors(List<String> more) { errors.addAll(more); }

        public void markEnded(Instant at) { endedAt = at; }
    }
}
