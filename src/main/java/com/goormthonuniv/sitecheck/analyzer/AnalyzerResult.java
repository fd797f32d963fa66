package com.goormthonuniv.sitecheck.analyzer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** 분석기 한 번의 성공 결과. 범위를 벗어난 값은 비정상 응답으로 취급한다. */
public record AnalyzerResult(
        double subScore,                // 0.0~10.0
        double confidence,              // 0.0~1.0
        Map<String, Object> findings    // 카테고리별 원본 결과(불투명)
) {
    public AnalyzerResult {
        if (Double.isNaN(subScore) || subScore < 0.0 || subScore > 10.0) {
            throw new PermanentAnalyzerException("sub score out of range [0,10]: " + subScore);
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new PermanentAnalyzerException("confidence out of range [0,1]: " + confidence);
        }
        findings = findings == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(findings));
    }
}
