package com.goormthonuniv.sitecheck.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.goormthonuniv.sitecheck.analyzer.AnalyzerOutcome;
import com.goormthonuniv.sitecheck.analyzer.AnalyzerSource;
import com.goormthonuniv.sitecheck.analyzer.OutcomeStatus;

public record AnalyzerDiagnostic(
        AnalyzerSource source,
        OutcomeStatus status,
        @JsonProperty("sub_score") Double subScore,
        Double confidence,
        int attempts,
        @JsonProperty("elapsed_ms") long elapsedMs,
        @JsonProperty("error_detail") String errorDetail
) {
    public static AnalyzerDiagnostic from(AnalyzerOutcome o) {
        return new AnalyzerDiagnostic(o.source(), o.status(), o.subScore(), o.confidence(),
                o.attempts(), o.elapsedMs(), o.errorDetail());
    }
}
