package com.goormthonuniv.sitecheck.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.goormthonuniv.sitecheck.engine.Recommendation;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 외부 공개 리포트. 필드명/중첩 구조는 호환성 계약이다.
 * findings 의 세 카테고리는 분석기가 실패해도 생략하지 않고 null 로 내보낸다.
 */
@JsonPropertyOrder({"url", "risk_score", "analysis_timestamp", "findings", "recommendation", "confidence"})
@JsonInclude(JsonInclude.Include.ALWAYS)
public record RiskReport(
        @JsonProperty("url") String url,
        @JsonProperty("risk_score") Double riskScore,                   // UNKNOWN 이면 null
        @JsonProperty("analysis_timestamp") Instant analysisTimestamp,  // ISO-8601 UTC
        @JsonProperty("findings")
        @JsonInclude(value = JsonInclude.Include.ALWAYS, content = JsonInclude.Include.ALWAYS)
        Map<String, Object> findings,
        @JsonProperty("recommendation") Recommendation recommendation,
        @JsonProperty("confidence") double confidence
) {
    public RiskReport {
        findings = Collections.unmodifiableMap(new LinkedHashMap<>(findings == null ? Map.of() : findings));
    }
}
