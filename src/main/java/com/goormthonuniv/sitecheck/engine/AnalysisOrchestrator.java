package com.goormthonuniv.sitecheck.engine;

import com.goormthonuniv.sitecheck.analyzer.AnalyzerAdapter;
import com.goormthonuniv.sitecheck.analyzer.AnalyzerOutcome;
import com.goormthonuniv.sitecheck.analyzer.AnalyzerSource;
import com.goormthonuniv.sitecheck.dto.AnalysisRequest;
import com.goormthonuniv.sitecheck.dto.RiskReport;
import com.goormthonuniv.sitecheck.fetch.ContentFetcher;
import com.goormthonuniv.sitecheck.fetch.FetchException;
import com.goormthonuniv.sitecheck.fetch.FetchedContent;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * 파이프라인 상태 머신.
 * 콘텐츠 획득(순차) → 세 분석기 동시 디스패치(Supervisor 경유) → 데드라인 조인 → 집계 → 리포트.
 * <p>
 * 빈 자체는 상태가 없고 실행마다 상태/설정/runId 를 따로 가지므로 여러 실행이 동시에 돌아도 된다.
 * 어떤 경우에도 {@link RiskReport} 하나를 반환한다.
 */
@Slf4j
@Service
public class AnalysisOrchestrator {

    // ===== 의존성 =====
    private final ContentFetcher fetcher;
    private final Map<AnalyzerSource, AnalyzerAdapter> adapters;
    private final AnalyzerSupervisor supervisor;
    private final ResultAggregator aggregator;
    private final RiskReportBuilder reportBuilder;
    private final EngineConfig defaults;
    private final ExecutorService executor;
    private final Clock clock;

    public AnalysisOrchestrator(ContentFetcher fetcher,
                                List<AnalyzerAdapter> adapters,
                                AnalyzerSupervisor supervisor,
                                ResultAggregator aggregator,
                                RiskReportBuilder reportBuilder,
                                EngineConfig defaults,
                                @Qualifier("analyzerExecutor") ExecutorService executor,
                                Clock clock) {
        this.fetcher = fetcher;
        this.supervisor = supervisor;
        this.aggregator = aggregator;
        this.reportBuilder = reportBuilder;
        this.defaults = defaults;
        this.executor = executor;
        this.clock = clock;

        Map<AnalyzerSource, AnalyzerAdapter> bySource = new EnumMap<>(AnalyzerSource.class);
        for (AnalyzerAdapter a : adapters) {
            if (bySource.putIfAbsent(a.source(), a) != null) {
                throw new IllegalStateException("more than one analyzer registered for " + a.source());
            }
        }
        this.adapters = Collections.unmodifiableMap(bySource);
    }

    /** 메인 엔트리 */
    public AnalysisRun analyze(AnalysisRequest request) {
        // 오버라이드 검증은 실행 시작 전에 (잘못된 값은 IllegalArgumentException)
        EngineConfig config = defaults.withOverrides(request.options());
        String runId = UUID.randomUUID().toString().substring(0, 8);
        MDC.put("runId", runId);
        try {
            return run(runId, request, config);
        } finally {
            MDC.remove("runId");
        }
    }

    private AnalysisRun run(String runId, AnalysisRequest request, EngineConfig config) {
        long started = System.nanoTime();
        List<String> errors = new ArrayList<>();
        PipelineState state = PipelineState.PENDING;

        // 1) PENDING → FETCHING
        state = transition(state, PipelineState.FETCHING, request.url());
        Instant analysisTimestamp = clock.instant();
        FetchedContent content;
        try {
            content = fetcher.fetch(request.url());
        } catch (FetchException e) {
            log.warn("fetch failed ({}) for {}: {}", e.getFailure(), request.url(), e.getMessage());
            errors.add("fetch " + e.getFailure() + ": " + e.getMessage());
            return fetchFailed(runId, request, state, analysisTimestamp, errors, started);
        } catch (RuntimeException e) {
            log.error("unexpected fetch failure for {}", request.url(), e);
            errors.add("fetch error: " + e);
            return fetchFailed(runId, request, state, analysisTimestamp, errors, started);
        }

        // 2) FETCHING → ANALYZING : 세 분석기 동시 실행 + 글로벌 데드라인 조인
        state = transition(state, PipelineState.ANALYZING, request.url());
        List<AnalyzerOutcome> outcomes = dispatch(content, config);
        for (AnalyzerOutcome o : outcomes) {
            if (!o.isUsable()) {
                errors.add(o.source().getId() + " " + o.status().id() + ": " + o.errorDetail());
            }
        }

        // 3) ANALYZING → AGGREGATING → DONE | FAILED
        state = transition(state, PipelineState.AGGREGATING, request.url());
        FusedResult fused = aggregator.fuse(outcomes, config.weights());
        state = transition(state, fused.isUnknown() ? PipelineState.FAILED : PipelineState.DONE, request.url());
        if (fused.isUnknown()) {
            errors.add("no analyzer produced a usable result");
        }

        RiskReport report = reportBuilder.build(request.url(), analysisTimestamp, fused, outcomes);
        log.info("run finished url={} state={} score={} recommendation={} confidence={}",
                request.url(), state, fused.riskScore(), fused.recommendation(), fused.confidence());
        return new AnalysisRun(runId, request, state, outcomes, fused, report, errors, elapsedMs(started));
    }

    private AnalysisRun fetchFailed(String runId, AnalysisRequest request, PipelineState state,
                                    Instant analysisTimestamp, List<String> errors, long started) {
        PipelineState failed = transition(state, PipelineState.FAILED, request.url());
        FusedResult fused = FusedResult.unknown();
        RiskReport report = reportBuilder.build(request.url(), analysisTimestamp, fused, List.of());
        return new AnalysisRun(runId, request, failed, List.of(), fused, report, errors, elapsedMs(started));
    }

    /** 분석기당 작업 1개, 추가 팬아웃 없음. 결과는 항상 소스당 하나씩, 선언 순서로 반환 */
    private List<AnalyzerOutcome> dispatch(FetchedContent content, EngineConfig config) {
        Map<AnalyzerSource, AnalyzerOutcome> collected = new EnumMap<>(AnalyzerSource.class);
        List<AnalyzerSource> dispatched = new ArrayList<>();
        List<Callable<AnalyzerOutcome>> tasks = new ArrayList<>();

        for (AnalyzerSource source : AnalyzerSource.values()) {
            AnalyzerAdapter adapter = adapters.get(source);
            if (adapter == null) {
                collected.put(source, AnalyzerOutcome.skipped(source, "no analyzer registered"));
                continue;
            }
            dispatched.add(source);
            tasks.add(MdcTasks.wrap(() ->
                    supervisor.supervise(adapter, content, config.analyzerTimeout(), config.retry())));
        }

        List<Future<AnalyzerOutcome>> futures;
        try {
            // 데드라인이 지나면 invokeAll 이 미완료 작업을 인터럽트 취소한다
            futures = executor.invokeAll(tasks, config.pipelineDeadline().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            for (AnalyzerSource s : dispatched) {
                collected.put(s, AnalyzerOutcome.timeout(s, "orchestrator interrupted", 0, 0L));
            }
            return List.copyOf(collected.values());
        } catch (RejectedExecutionException e) {
            log.warn("analyzer executor saturated; {} analyzers not started", dispatched.size());
            for (AnalyzerSource s : dispatched) {
                collected.put(s, AnalyzerOutcome.error(s, "analyzer executor rejected task", 0, 0L));
            }
            return List.copyOf(collected.values());
        }

        long deadlineMs = config.pipelineDeadline().toMillis();
        for (int i = 0; i < futures.size(); i++) {
            AnalyzerSource source = dispatched.get(i);
            Future<AnalyzerOutcome> f = futures.get(i);
            collected.put(source, collect(source, f, deadlineMs));
        }
        return List.copyOf(collected.values());
    }

    private AnalyzerOutcome collect(AnalyzerSource source, Future<AnalyzerOutcome> f, long deadlineMs) {
        if (f.isCancelled()) {
            log.warn("analyzer={} still running at pipeline deadline ({}ms); recorded as timeout", source.getId(), deadlineMs);
            return AnalyzerOutcome.timeout(source, "pipeline deadline of " + deadlineMs + "ms exceeded", 0, deadlineMs);
        }
        try {
            return f.get();
        } catch (CancellationException e) {
            return AnalyzerOutcome.timeout(source, "pipeline deadline of " + deadlineMs + "ms exceeded", 0, deadlineMs);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.error("analyzer={} supervisor failed", source.getId(), cause);
            return AnalyzerOutcome.error(source, "supervisor failure: " + cause, 0, 0L);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return AnalyzerOutcome.timeout(source, "orchestrator interrupted", 0, 0L);
        }
    }

    private static PipelineState transition(PipelineState from, PipelineState to, String url) {
        if (!from.canTransitionTo(to)) {
            throw new IllegalStateException("illegal pipeline transition " + from + " -> " + to);
        }
        log.info("pipeline {} -> {} url={}", from, to, url);
        return to;
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
