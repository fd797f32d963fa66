package com.goormthonuniv.sitecheck.analyzer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Supervisor가 분석기 호출 한 건을 마무리하며 만드는 결과.
 * status == OK 일 때만 subScore/confidence가 존재한다.
 * 실패(timeout/error/skipped)도 null 대신 이 타입으로 표현해 집계기가 한 경로로 처리하게 한다.
 */
public record AnalyzerOutcome(
        AnalyzerSource source,
        OutcomeStatus status,
        Double subScore,
        Double confidence,
        Map<String, Object> findings,
        String errorDetail,
        int attempts,
        long elapsedMs
) {
    public AnalyzerOutcome {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(status, "status");
        boolean scored = subScore != null && confidence != null;
        if ((status == OutcomeStatus.OK) != scored) {
            throw new IllegalArgumentException(
                    "subScore/confidence must be present iff status is ok (status=" + status + ")");
        }
        if (status == OutcomeStatus.OK && (subScore < 0.0 || subScore > 10.0 || confidence < 0.0 || confidence > 1.0)) {
            throw new IllegalArgumentException("score or confidence out of range for " + source);
        }
        findings = findings == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(findings));
    }

    public static AnalyzerOutcome ok(AnalyzerSource source, AnalyzerResult result, int attempts, long elapsedMs) {
        return new AnalyzerOutcome(source, OutcomeStatus.OK, result.subScore(), result.confidence(),
                result.findings(), null, attempts, elapsedMs);
    }

    public static AnalyzerOutcome timeout(AnalyzerSource source, String detail, int attempts, long elapsedMs) {
        return new AnalyzerOutcome(source, OutcomeStatus.TIMEOUT, null, null, null, detail, attempts, elapsedMs);
    }

    public static AnalyzerOutcome error(AnalyzerSource source, String detail, int attempts, long elapsedMs) {
        return new AnalyzerOutcome(source, OutcomeStatus.ERROR, null, null, null, detail, attempts, elapsedMs);
    }

    public static AnalyzerOutcome skipped(AnalyzerSource source, String detail) {
        return new AnalyzerOutcome(source, OutcomeStatus.SKIPPED, null, null, null, detail, 0, 0L);
    }

    public boolean isUsable() {
        return status == OutcomeStatus.OK;
    }
}
