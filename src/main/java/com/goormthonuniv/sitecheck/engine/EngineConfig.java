package com.goormthonuniv.sitecheck.engine;

import com.goormthonuniv.sitecheck.dto.AnalysisOptions;

import java.time.Duration;
import java.util.Objects;

/**
 * 실행 1회에 적용되는 불변 엔진 설정. 전역 상태를 읽지 않고 생성 시점에 주입된다.
 */
public record EngineConfig(
        WeightTable weights,
        Duration analyzerTimeout,
        Duration pipelineDeadline,
        RetryPolicy retry
) {
    public EngineConfig {
        Objects.requireNonNull(weights, "weights");
        Objects.requireNonNull(retry, "retry");
        requirePositive(analyzerTimeout, "analyzerTimeout");
        requirePositive(pipelineDeadline, "pipelineDeadline");
    }

    public static EngineConfig defaults() {
        return new EngineConfig(WeightTable.defaults(), Duration.ofSeconds(20), Duration.ofSeconds(45),
                new RetryPolicy(3, Duration.ofMillis(500), 2.0, Duration.ofSeconds(4)));
    }

    /** 요청별 오버라이드를 합친 새 설정. 가중치는 세 개를 함께 지정해야 한다. */
    public EngineConfig withOverrides(AnalysisOptions options) {
        if (options == null) return this;

        WeightTable w = weights;
        if (options.hasAnyWeight()) {
            if (!options.hasAllWeights()) {
                throw new IllegalArgumentException("content, visual and reputation weights must be overridden together");
            }
            w = new WeightTable(options.contentWeight(), options.visualWeight(), options.reputationWeight());
        }
        Duration timeout = options.analyzerTimeoutMs() == null
                ? analyzerTimeout : Duration.ofMillis(options.analyzerTimeoutMs());
        Duration deadline = options.pipelineDeadlineMs() == null
                ? pipelineDeadline : Duration.ofMillis(options.pipelineDeadlineMs());
        RetryPolicy r = options.maxAttempts() == null ? retry : retry.withMaxAttempts(options.maxAttempts());
        return new EngineConfig(w, timeout, deadline, r);
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive: " + d);
        }
    }
}
