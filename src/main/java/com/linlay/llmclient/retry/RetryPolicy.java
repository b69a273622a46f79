package com.linlay.llmclient.retry;

import com.linlay.llmclient.error.LlmException;

import java.time.Duration;

/**
 * 指数退避配置。第 n 次重试（从 1 开始）的延迟为 {@code min(maxDelay, baseDelay * multiplier^(n-1))}。
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, double multiplier) {

    public static final double DEFAULT_MULTIPLIER = 2.0;

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw LlmException.invalidConfig("retry.max_attempts", "must be at least 1");
        }
        baseDelay = baseDelay == null ? Duration.ZERO : baseDelay;
        maxDelay = maxDelay == null ? baseDelay : maxDelay;
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw LlmException.invalidConfig("retry.base_delay", "delays must not be negative");
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw LlmException.invalidConfig("retry.max_delay", "must not be smaller than base_delay");
        }
        if (multiplier < 1.0 || Double.isNaN(multiplier) || Double.isInfinite(multiplier)) {
            throw LlmException.invalidConfig("retry.multiplier", "must be a finite number >= 1.0");
        }
    }

    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay) {
        this(maxAttempts, baseDelay, maxDelay, DEFAULT_MULTIPLIER);
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofMillis(500), Duration.ofSeconds(8), DEFAULT_MULTIPLIER);
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, DEFAULT_MULTIPLIER);
    }

    public Duration backoff(long retryNumber) {
        if (retryNumber < 1 || baseDelay.isZero()) {
            return baseDelay;
        }
        double factor = Math.pow(multiplier, retryNumber - 1);
        double millis = baseDelay.toMillis() * factor;
        if (Double.isInfinite(millis) || millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) millis);
    }
}
