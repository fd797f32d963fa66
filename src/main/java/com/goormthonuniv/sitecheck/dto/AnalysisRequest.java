package com.goormthonuniv.sitecheck.dto;

import java.time.Instant;
import java.util.Objects;

/** 파이프라인 실행 1회의 입력. 생성 후 불변 */
public record AnalysisRequest(
        String url,
        Instant requestedAt,
        AnalysisOptions options
) {
    public AnalysisRequest {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(requestedAt, "requestedAt");
        options = options == null ? AnalysisOptions.none() : options;
    }

    public static AnalysisRequest of(String url) {
        return new AnalysisRequest(url, Instant.now(), AnalysisOptions.none());
    }
}
