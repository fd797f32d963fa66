package com.goormthonuniv.sitecheck.engine;

import com.goormthonuniv.sitecheck.analyzer.AnalyzerSource;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 결합 결과. UNKNOWN 일 때는 근거 없는 수치를 내지 않도록 riskScore 가 null 이다.
 */
public record FusedResult(
        Double riskScore,                                   // 0.0~10.0, 소수 1자리
        double confidence,                                  // 0~1, 반올림 전 값
        Recommendation recommendation,
        Map<AnalyzerSource, Double> contributingWeights     // 재정규화된 실효 가중치
) {
    public FusedResult {
        contributingWeights = contributingWeights == null || contributingWeights.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(contributingWeights));
    }

    public static FusedResult unknown() {
        return new FusedResult(null, 0.0, Recommendation.UNKNOWN, Map.of());
    }

    public boolean isUnknown() {
        return recommendation == Recommendation.UNKNOWN;
    }
}
