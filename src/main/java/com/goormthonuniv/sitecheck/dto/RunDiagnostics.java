package com.goormthonuniv.sitecheck.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.goormthonuniv.sitecheck.engine.AnalysisRun;
import com.goormthonuniv.sitecheck.engine.PipelineState;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** 운영 진단용 응답. 공개 리포트 스키마는 건드리지 않고 실행 상세를 덧붙인다 */
public record RunDiagnostics(
        @JsonProperty("run_id") String runId,
        RiskReport report,
        PipelineState state,
        @JsonProperty("processing_time_ms") long processingTimeMs,
        @JsonProperty("effective_weights") Map<String, Double> effectiveWeights,
        List<AnalyzerDiagnostic> analyzers,
        List<String> errors
) {
    public static RunDiagnostics from(AnalysisRun run) {
        Map<String, Double> weights = new LinkedHashMap<>();
        run.fused().contributingWeights().forEach((s, w) -> weights.put(s.getId(), w));
        return new RunDiagnostics(
                run.runId(),
                run.report(),
                run.state(),
                run.processingTimeMs(),
                weights,
                run.outcomes().stream().map(AnalyzerDiagnostic::from).toList(),
                run.errors()
        );
    }
}
