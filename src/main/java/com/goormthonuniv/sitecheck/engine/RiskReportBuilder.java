package com.goormthonuniv.sitecheck.engine;

import com.goormthonuniv.sitecheck.analyzer.AnalyzerOutcome;
import com.goormthonuniv.sitecheck.analyzer.AnalyzerSource;
import com.goormthonuniv.sitecheck.dto.RiskReport;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/** 결합 결과 + 분석기별 원본 findings 를 공개 스키마로 조립한다. 신뢰도는 여기서 소수 2자리로 표기만 맞춘다 */
@Component
public class RiskReportBuilder {

    public RiskReport build(String url, Instant analysisTimestamp, FusedResult fused,
                            Collection<AnalyzerOutcome> outcomes) {
        Map<String, Object> findings = new LinkedHashMap<>();
        for (AnalyzerSource s : AnalyzerSource.values()) {
            findings.put(s.getReportKey(), null);
        }
        for (AnalyzerOutcome o : outcomes) {
            if (o.isUsable()) {
                findings.put(o.source().getReportKey(), o.findings());
            }
        }
        return new RiskReport(url, fused.riskScore(), analysisTimestamp, findings,
                fused.recommendation(), round(fused.confidence(), 2));
    }

    /** 0에서 먼 쪽으로 반올림(HALF_UP) */
    static double round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
