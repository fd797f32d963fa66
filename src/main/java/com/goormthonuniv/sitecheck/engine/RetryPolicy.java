package com.goormthonuniv.sitecheck.engine;

import com.goormthonuniv.sitecheck.analyzer.AnalyzerException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;

import java.time.Duration;
import java.util.Objects;

/**
 * 일시적 실패에 대한 재시도 예산. maxAttempts는 최초 호출을 포함한다.
 * n번째 시도(n >= 2) 전 대기 = min(initialBackoff * multiplier^(n-2), maxBackoff)
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff) {

    public RetryPolicy {
        Objects.requireNonNull(initialBackoff, "initialBackoff");
        Objects.requireNonNull(maxBackoff, "maxBackoff");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
        }
        if (initialBackoff.isNegative() || maxBackoff.isNegative()) {
            throw new IllegalArgumentException("backoff must not be negative");
        }
        if (!Double.isFinite(multiplier) || multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0: " + multiplier);
        }
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, 1.0, Duration.ZERO);
    }

    /** resilience4j 는 1ms 미만 간격을 받지 않으므로 0 은 1ms 로 올린다 */
    public IntervalFunction intervalFunction() {
        return IntervalFunction.ofExponentialBackoff(
                atLeastOneMilli(initialBackoff), multiplier, atLeastOneMilli(maxBackoff));
    }

    public Duration backoffBefore(int attempt) {
        if (attempt <= 1) return Duration.ZERO;
        return Duration.ofMillis(intervalFunction().apply(attempt - 1));
    }

    /** 일시적 분석기 예외만 재시도한다 */
    public RetryConfig toRetryConfig() {
        return RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(intervalFunction())
                .retryOnException(e -> e instanceof AnalyzerException ae && ae.isTransient())
                .build();
    }

    public RetryPolicy withMaxAttempts(int attempts) {
        return new RetryPolicy(attempts, initialBackoff, multiplier, maxBackoff);
    }

    private static Duration atLeastOneMilli(Duration d) {
        return d.toMillis() < 1 ? Duration.ofMillis(1) : d;
    }
}
