package com.goormthonuniv.sitecheck.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;

/** 실행별 설정 오버라이드. 모든 필드 선택 */
public record AnalysisOptions(
        @JsonProperty("content_weight") @DecimalMin("0.0") @DecimalMax("1.0") Double contentWeight,
        @JsonProperty("visual_weight") @DecimalMin("0.0") @DecimalMax("1.0") Double visualWeight,
        @JsonProperty("reputation_weight") @DecimalMin("0.0") @DecimalMax("1.0") Double reputationWeight,
        @JsonProperty("analyzer_timeout_ms") @Positive @Max(MAX_DURATION_MS) Long analyzerTimeoutMs,
        @JsonProperty("pipeline_deadline_ms") @Positive @Max(MAX_DURATION_MS) Long pipelineDeadlineMs,
        @JsonProperty("max_attempts") @Min(1) @Max(10) Integer maxAttempts
) {
    /** 10분 */
    public static final long MAX_DURATION_MS = 600_000L;

    public static AnalysisOptions none() {
        return new AnalysisOptions(null, null, null, null, null, null);
    }

    public boolean hasAnyWeight() {
        return contentWeight != null || visualWeight != null || reputationWeight != null;
    }

    public boolean hasAllWeights() {
        return contentWeight != null && visualWeight != null && reputationWeight != null;
    }
}
