package com.goormthonuniv.sitecheck.engine;

import com.goormthonuniv.sitecheck.analyzer.AnalyzerOutcome;
import com.goormthonuniv.sitecheck.analyzer.AnalyzerSource;
import com.goormthonuniv.sitecheck.util.TextUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * 사용 가능한 분석기 결과만으로 가중 결합한다.
 * <ol>
 *   <li>status == ok 인 결과만 quorum 으로 사용</li>
 *   <li>quorum 위에서 가중치 재정규화: w'_s = w_s / Σ w_t</li>
 *   <li>riskScore = round1(Σ w'_s · subScore_s), [0,10]</li>
 *   <li>confidence = (Σ w'_s · confidence_s) · (1 − 빠진 분석기의 원래 가중치 합), [0,1]. 반올림은 리포트에서만</li>
 * </ol>
 * 합산은 항상 {@link AnalyzerSource} 선언 순서로 하므로 결과 수집 순서와 무관하게 같은 값이 나온다.
 */
@Slf4j
@Component
public class ResultAggregator {

    private static final int SUM_SCALE = 12;

    public FusedResult fuse(Collection<AnalyzerOutcome> outcomes, WeightTable weights) {
        Map<AnalyzerSource, AnalyzerOutcome> bySource = new EnumMap<>(AnalyzerSource.class);
        for (AnalyzerOutcome o : outcomes) {
            if (bySource.putIfAbsent(o.source(), o) != null) {
                throw new IllegalArgumentException("duplicate outcome for " + o.source());
            }
        }

        double usableWeight = 0.0;
        double missingFraction = 0.0;
        int usableCount = 0;
        for (AnalyzerSource s : AnalyzerSource.values()) {
            AnalyzerOutcome o = bySource.get(s);
            if (o != null && o.isUsable()) {
                usableWeight += weights.weightOf(s);
                usableCount++;
            } else {
                // 결과 자체가 없는 소스도 빠진 것으로 본다
                missingFraction += weights.weightOf(s);
            }
        }

        if (usableCount == 0) {
            log.warn("no usable analyzer outcome; fused result is UNKNOWN");
            return FusedResult.unknown();
        }

        // quorum 전체 가중치가 0 이면 균등 분배
        boolean equalShare = usableWeight <= 0.0;
        BigDecimal quorumWeight = BigDecimal.ZERO;
        for (AnalyzerSource s : AnalyzerSource.values()) {
            AnalyzerOutcome o = bySource.get(s);
            if (o != null && o.isUsable()) {
                quorumWeight = quorumWeight.add(equalShare ? BigDecimal.ONE : BigDecimal.valueOf(weights.weightOf(s)));
            }
        }

        Map<AnalyzerSource, Double> effective = new EnumMap<>(AnalyzerSource.class);
        BigDecimal weightedScore = BigDecimal.ZERO;
        BigDecimal weightedConfidence = BigDecimal.ZERO;
        for (AnalyzerSource s : AnalyzerSource.values()) {
            AnalyzerOutcome o = bySource.get(s);
            if (o == null || !o.isUsable()) {
                effective.put(s, 0.0);
                continue;
            }
            BigDecimal w = equalShare ? BigDecimal.ONE : BigDecimal.valueOf(weights.weightOf(s));
            effective.put(s, w.divide(quorumWeight, SUM_SCALE, RoundingMode.HALF_UP).doubleValue());
            weightedScore = weightedScore.add(w.multiply(BigDecimal.valueOf(o.subScore())));
            weightedConfidence = weightedConfidence.add(w.multiply(BigDecimal.valueOf(o.confidence())));
        }

        // 십진 합을 나눈 뒤 한 번만 반올림한다 (2.95 → 3.0)
        BigDecimal score = weightedScore.divide(quorumWeight, SUM_SCALE, RoundingMode.HALF_UP);
        double riskScore = TextUtils.clamp(score.setScale(1, RoundingMode.HALF_UP).doubleValue(), 0.0, 10.0);
        double baseConfidence = weightedConfidence.divide(quorumWeight, SUM_SCALE, RoundingMode.HALF_UP).doubleValue();
        double confidence = TextUtils.clamp(baseConfidence * (1.0 - missingFraction), 0.0, 1.0);
        Recommendation recommendation = Recommendation.fromScore(riskScore);

        log.debug("fused score={} confidence={} base={} missingFraction={} weights={}",
                riskScore, confidence, baseConfidence, missingFraction, effective);
        return new FusedResult(riskScore, confidence, recommendation, effective);
    }
}
