package com.goormthonuniv.sitecheck.engine;

import com.goormthonuniv.sitecheck.analyzer.AnalyzerSource;

import java.util.EnumMap;
import java.util.Map;

/**
 * 분석기별 기본 가중치. 세 값 모두 0 이상이고 합이 1.0 이어야 한다(부동소수 오차 1e-6 허용).
 */
public record WeightTable(double content, double visual, double reputation) {

    private static final double SUM_TOLERANCE = 1e-6;

    public WeightTable {
        for (double w : new double[]{content, visual, reputation}) {
            if (!Double.isFinite(w) || w < 0.0) {
                throw new IllegalArgumentException("weights must be finite and non-negative: " + w);
            }
        }
        double sum = content + visual + reputation;
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new IllegalArgumentException("weights must sum to 1.0 but sum to " + sum);
        }
    }

    public static WeightTable defaults() {
        return new WeightTable(0.4, 0.3, 0.3);
    }

    public double weightOf(AnalyzerSource source) {
        return switch (source) {
            case CONTENT -> content;
            case VISUAL -> visual;
            case REPUTATION -> reputation;
        };
    }

    public Map<AnalyzerSource, Double> asMap() {
        Map<AnalyzerSource, Double> m = new EnumMap<>(AnalyzerSource.class);
        for (AnalyzerSource s : AnalyzerSource.values()) m.put(s, weightOf(s));
        return m;
    }
}
