package com.lhcz.animaletl.core;

import com.lhcz.animaletl.config.AppConfig;

import java.time.Duration;
import java.util.function.DoubleSupplier;

/**
 * 重试策略 (进程内共享，只读)
 * delay = min(baseDelay * backoffFactor^(attempt-1), maxDelay)，开启抖动时再乘以 [0.5, 1.0] 的随机系数。
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, double backoffFactor, boolean jitter) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts 必须 >= 1: " + maxAttempts);
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay 不能为负: " + baseDelay);
        }
        if (maxDelay == null || maxDelay.isNegative()) {
            throw new IllegalArgumentException("maxDelay 不能为负: " + maxDelay);
        }
        if (!(backoffFactor > 1.0)) {
            throw new IllegalArgumentException("backoffFactor 必须 > 1: " + backoffFactor);
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(5, Duration.ofSeconds(1), Duration.ofSeconds(60), 2.0, true);
    }

    public static RetryPolicy from(AppConfig.RetryConfig config) {
        return new RetryPolicy(
                config.maxAttempts(),
                seconds(config.baseDelaySeconds()),
                seconds(config.maxDelaySeconds()),
                config.backoffFactor(),
                config.jitter());
    }

    private static Duration seconds(double value) {
        return Duration.ofNanos(Math.round(value * 1_000_000_000L));
    }

    /**
     * 第 attempt 次失败后的等待时间 (attempt 从 1 开始)
     * @param random 返回 [0,1) 的随机数，仅在开启抖动时使用
     */
    public Duration delayFor(int attempt, DoubleSupplier random) {
        double base = baseDelay.toNanos() * Math.pow(backoffFactor, attempt - 1);
        double capped = Math.min(base, maxDelay.toNanos());
        if (jitter) {
            capped *= 0.5 + random.getAsDouble() * 0.5;
        }
        return Duration.ofNanos((long) capped);
    }
}
