package com.goormthonuniv.sitecheck.controller;

import com.goormthonuniv.sitecheck.dto.RiskReport;
import com.goormthonuniv.sitecheck.dto.RunDiagnostics;
import com.goormthonuniv.sitecheck.dto.SiteCheckRequest;
import com.goormthonuniv.sitecheck.engine.AnalysisOrchestrator;
import com.goormthonuniv.sitecheck.engine.AnalysisRun;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.*;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.*;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.Map;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class SiteCheckController {

    private final AnalysisOrchestrator orchestrator;
    private final Clock clock;

    @Operation(summary = "사이트 위험도 평가", description = "URL을 전달하면 콘텐츠/화면/평판 분석을 결합한 위험 리포트를 반환합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "평가 완료(분석 불가 시 recommendation=UNKNOWN)"),
            @ApiResponse(responseCode = "400", description = "요청 형식 오류"),
            @ApiResponse(responseCode = "500", description = "서버 오류")
    })
    @PostMapping("/check")
    public ResponseEntity<RiskReport> check(@Valid @RequestBody SiteCheckRequest req) {
        AnalysisRun run = orchestrator.analyze(req.toAnalysisRequest(clock.instant()));
        return ResponseEntity.ok(run.report());
    }

    @Operation(summary = "사이트 위험도 평가(진단 포함)", description = "리포트와 함께 파이프라인 상태, 분석기별 상태/재시도/소요시간을 반환합니다.")
    @PostMapping("/check/diagnostics")
    public ResponseEntity<RunDiagnostics> diagnostics(@Valid @RequestBody SiteCheckRequest req) {
        AnalysisRun run = orchestrator.analyze(req.toAnalysisRequest(clock.instant()));
        return ResponseEntity.ok(RunDiagnostics.from(run));
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        return Map.of(
                "status", "ok",
                "service", "sitecheck"
        );
    }
}
