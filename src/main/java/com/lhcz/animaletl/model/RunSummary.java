package com.lhcz.animaletl.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 一次运行结束后的统计快照 (不可变)
 */
public record RunSummary(
        Instant startedAt,
        Instant endedAt,
        Duration duration,
        long fetched,
        long transformed,
        long loaded,
        long batchesProcessed,
        List<String> errors
) {
    public RunSummary {
        errors = List.copyOf(errors);
    }

    /** 有错误但计数完整表示部分成功 */
    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
