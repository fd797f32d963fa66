package com.goormthonuniv.sitecheck.engine;

import com.goormthonuniv.sitecheck.analyzer.AnalyzerOutcome;
import com.goormthonuniv.sitecheck.dto.AnalysisRequest;
import com.goormthonuniv.sitecheck.dto.RiskReport;

import java.util.List;

/** 실행 1회의 최종 산출물. 공개 응답은 report 뿐이고 나머지는 진단용 */
public record AnalysisRun(
        String runId,
        AnalysisRequest request,
        PipelineState state,
        List<AnalyzerOutcome> outcomes,
        FusedResult fused,
        RiskReport report,
        List<String> errors,
        long processingTimeMs
) {
    public AnalysisRun {
        outcomes = List.copyOf(outcomes);
        errors = List.copyOf(errors);
    }
}
