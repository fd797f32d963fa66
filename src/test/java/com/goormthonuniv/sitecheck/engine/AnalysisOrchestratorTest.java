package com.goormthonuniv.sitecheck.engine;

import com.goormthonuniv.sitecheck.analyzer.AnalyzerAdapter;
import com.goormthonuniv.sitecheck.analyzer.AnalyzerOutcome;
import com.goormthonuniv.sitecheck.analyzer.OutcomeStatus;
import com.goormthonuniv.sitecheck.analyzer.PermanentAnalyzerException;
import com.goormthonuniv.sitecheck.analyzer.TransientAnalyzerException;
import com.goormthonuniv.sitecheck.dto.AnalysisOptions;
import com.goormthonuniv.sitecheck.dto.AnalysisRequest;
import com.goormthonuniv.sitecheck.dto.RiskReport;
import com.goormthonuniv.sitecheck.fetch.ContentFetcher;
import com.goormthonuniv.sitecheck.fetch.FetchException;
import com.goormthonuniv.sitecheck.fetch.FetchFailure;
import com.goormthonuniv.sitecheck.fetch.TestPages;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

import static com.goormthonuniv.sitecheck.analyzer.AnalyzerSource.CONTENT;
import static com.goormthonuniv.sitecheck.analyzer.AnalyzerSource.REPUTATION;
import static com.goormthonuniv.sitecheck.analyzer.AnalyzerSource.VISUAL;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AnalysisOrchestratorTest {

    private static final String URL = "https://shop.example.com/login";
    private static final Instant NOW = Instant.parse("2025-03-01T09:30:00Z");
    private static final RetryPolicy FAST_RETRY = new RetryPolicy(2, Duration.ofMillis(10), 2.0, Duration.ofMillis(20));
    private static final EngineConfig CONFIG = new EngineConfig(
            WeightTable.defaults(), Duration.ofSeconds(2), Duration.ofSeconds(5), FAST_RETRY);

    private final ContentFetcher fetcher = mock(ContentFetcher.class);
    private ExecutorService executor;

    @BeforeEach
    void setUp() throws FetchException {
        executor = Executors.newCachedThreadPool();
        when(fetcher.fetch(anyString())).thenAnswer(inv -> TestPages.page(inv.getArgument(0)));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private AnalysisOrchestrator orchestrator(EngineConfig config, AnalyzerAdapter... adapters) {
        return new AnalysisOrchestrator(fetcher, List.of(adapters), new AnalyzerSupervisor(executor),
                new ResultAggregator(), new RiskReportBuilder(), config, executor,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static AnalysisRequest request() {
        return AnalysisRequest.of(URL);
    }

    @Nested
    @DisplayName("정상 경로")
    class HappyPath {

        @Test
        @DisplayName("세 분석기 결과를 결합해 DONE 으로 끝난다")
        void allAnalyzersSucceed() {
            AnalysisRun run = orchestrator(CONFIG,
                    new ScriptedAdapter(CONTENT).thenReturn(8, 0.9),
                    new ScriptedAdapter(VISUAL).thenReturn(7, 0.8),
                    new ScriptedAdapter(REPUTATION).thenReturn(9, 0.95)).analyze(request());

            RiskReport report = run.report();
            assertThat(run.state()).isEqualTo(PipelineState.DONE);
            assertThat(run.errors()).isEmpty();
            assertThat(report.url()).isEqualTo(URL);
            assertThat(report.riskScore()).isEqualTo(8.0);
            assertThat(report.recommendation()).isEqualTo(Recommendation.HIGH);
            assertThat(report.analysisTimestamp()).isEqualTo(NOW);
            assertThat(report.findings()).containsOnlyKeys("content_analysis", "visual_analysis", "reputation_check");
            assertThat(report.findings().values()).doesNotContainNull();
            assertThat(run.outcomes()).extracting(AnalyzerOutcome::source).containsExactly(CONTENT, VISUAL, REPUTATION);
        }

        @Test
        @DisplayName("일시적 실패는 Supervisor 재시도로 흡수된다")
        void transientFailureRetried() {
            ScriptedAdapter flaky = new ScriptedAdapter(REPUTATION)
                    .thenThrow(new TransientAnalyzerException("503"))
                    .thenReturn(2, 0.7);

            AnalysisRun run = orchestrator(CONFIG,
                    new ScriptedAdapter(CONTENT).thenReturn(2, 0.7),
                    new ScriptedAdapter(VISUAL).thenReturn(2, 0.7),
                    flaky).analyze(request());

            assertThat(run.state()).isEqualTo(PipelineState.DONE);
            assertThat(run.outcomes().get(2).attempts()).isEqualTo(2);
            assertThat(run.report().recommendation()).isEqualTo(Recommendation.LOW);
        }

        @Test
        @DisplayName("분석기 스레드에도 runId 가 MDC 로 전달되고 실행 후 정리된다")
        void runIdPropagated() {
            AtomicReference<String> seen = new AtomicReference<>();
            ScriptedAdapter content = new ScriptedAdapter(CONTENT).then(() -> {
                seen.set(MDC.get("runId"));
                return ScriptedAdapter.result(1, 1);
            });

            AnalysisRun run = orchestrator(CONFIG, content,
                    new ScriptedAdapter(VISUAL).thenReturn(1, 1),
                    new ScriptedAdapter(REPUTATION).thenReturn(1, 1)).analyze(request());

            assertThat(seen.get()).isEqualTo(run.runId());
            assertThat(MDC.get("runId")).isNull();
        }

        @Test
        @DisplayName("요청별 가중치 오버라이드가 반영된다")
        void weightOverride() {
            AnalysisOptions options = new AnalysisOptions(1.0, 0.0, 0.0, null, null, null);
            AnalysisRun run = orchestrator(CONFIG,
                    new ScriptedAdapter(CONTENT).thenReturn(9, 0.9),
                    new ScriptedAdapter(VISUAL).thenReturn(1, 0.9),
                    new ScriptedAdapter(REPUTATION).thenReturn(1, 0.9))
                    .analyze(new AnalysisRequest(URL, NOW, options));

            assertThat(run.report().riskScore()).isEqualTo(9.0);
        }
    }

    @Nested
    @DisplayName("부분 실패")
    class Degraded {

        @Test
        @DisplayName("분석기 하나가 타임아웃이어도 나머지로 리포트를 만든다")
        void oneAnalyzerTimesOut() {
            EngineConfig tight = new EngineConfig(WeightTable.defaults(),
                    Duration.ofMillis(200), Duration.ofSeconds(5), FAST_RETRY);
            AnalysisRun run = orchestrator(tight,
                    new ScriptedAdapter(CONTENT).thenReturn(2, 0.7),
                    new ScriptedAdapter(VISUAL).thenSleep(5_000),
                    new ScriptedAdapter(REPUTATION).thenReturn(1, 0.6)).analyze(request());

            assertThat(run.state()).isEqualTo(PipelineState.DONE);
            assertThat(run.report().riskScore()).isEqualTo(1.6);
            assertThat(run.report().recommendation()).isEqualTo(Recommendation.LOW);
            assertThat(run.report().findings()).containsEntry("visual_analysis", null);
            assertThat(run.outcomes().get(1).status()).isEqualTo(OutcomeStatus.TIMEOUT);
            assertThat(run.errors()).anyMatch(e -> e.startsWith("visual timeout"));
        }

        @Test
        @DisplayName("파이프라인 데드라인이 지나면 남은 분석기는 timeout 으로 기록된다")
        void pipelineDeadline() {
            EngineConfig deadline = new EngineConfig(WeightTable.defaults(),
                    Duration.ofSeconds(10), Duration.ofMillis(300), FAST_RETRY);
            AnalysisRun run = orchestrator(deadline,
                    new ScriptedAdapter(CONTENT).thenReturn(5, 0.8),
                    new ScriptedAdapter(VISUAL).thenReturn(5, 0.8),
                    new ScriptedAdapter(REPUTATION).thenSleep(5_000)).analyze(request());

            AnalyzerOutcome reputation = run.outcomes().get(2);
            assertThat(reputation.status()).isEqualTo(OutcomeStatus.TIMEOUT);
            assertThat(run.state()).isEqualTo(PipelineState.DONE);
            assertThat(run.report().riskScore()).isEqualTo(5.0);
            assertThat(run.processingTimeMs()).isLessThan(3_000);
        }

        @Test
        @DisplayName("등록되지 않은 분석기는 skipped 로 처리된다")
        void missingAdapterSkipped() {
            AnalysisRun run = orchestrator(CONFIG,
                    new ScriptedAdapter(CONTENT).thenReturn(4, 0.8),
                    new ScriptedAdapter(REPUTATION).thenReturn(4, 0.8)).analyze(request());

            assertThat(run.outcomes()).hasSize(3);
            assertThat(run.outcomes().get(1).status()).isEqualTo(OutcomeStatus.SKIPPED);
            assertThat(run.report().findings()).containsEntry("visual_analysis", null);
            assertThat(run.report().riskScore()).isEqualTo(4.0);
        }

        @Test
        @DisplayName("모든 분석기가 실패하면 UNKNOWN, 상태 FAILED")
        void allAnalyzersFail() {
            AnalysisRun run = orchestrator(CONFIG,
                    new ScriptedAdapter(CONTENT).thenThrow(new PermanentAnalyzerException("401")),
                    new ScriptedAdapter(VISUAL).thenThrow(new PermanentAnalyzerException("no screenshot available")),
                    new ScriptedAdapter(REPUTATION).thenThrow(new TransientAnalyzerException("dns"))).analyze(request());

            assertThat(run.state()).isEqualTo(PipelineState.FAILED);
            assertThat(run.report().recommendation()).isEqualTo(Recommendation.UNKNOWN);
            assertThat(run.report().riskScore()).isNull();
            assertThat(run.report().confidence()).isZero();
            assertThat(run.errors()).contains("no analyzer produced a usable result");
        }

        @Test
        @DisplayName("분석기 풀이 포화되어 제출이 거부되면 error 로 기록하고 UNKNOWN 리포트를 낸다")
        void saturatedExecutor() {
            ScriptedAdapter content = new ScriptedAdapter(CONTENT).thenReturn(1, 1);
            AnalysisOrchestrator orchestrator = orchestrator(CONFIG, content,
                    new ScriptedAdapter(VISUAL).thenReturn(1, 1),
                    new ScriptedAdapter(REPUTATION).thenReturn(1, 1));
            executor.shutdown();

            AnalysisRun run = orchestrator.analyze(request());

            assertThat(run.state()).isEqualTo(PipelineState.FAILED);
            assertThat(run.outcomes()).allSatisfy(o -> {
                assertThat(o.status()).isEqualTo(OutcomeStatus.ERROR);
                assertThat(o.errorDetail()).isEqualTo("analyzer executor rejected task");
            });
            assertThat(content.calls()).isZero();
        }
    }

    @Nested
    @DisplayName("콘텐츠 획득 실패")
    class FetchFails {

        @Test
        @DisplayName("DNS 실패면 분석기를 호출하지 않고 UNKNOWN 리포트를 반환한다")
        void dnsFailure() throws FetchException {
            when(fetcher.fetch(anyString())).thenThrow(new FetchException(FetchFailure.DNS, "unknown host"));
            ScriptedAdapter content = new ScriptedAdapter(CONTENT).thenReturn(1, 1);
            ScriptedAdapter visual = new ScriptedAdapter(VISUAL).thenReturn(1, 1);
            ScriptedAdapter reputation = new ScriptedAdapter(REPUTATION).thenReturn(1, 1);

            AnalysisRun run = orchestrator(CONFIG, content, visual, reputation).analyze(request());

            assertThat(run.state()).isEqualTo(PipelineState.FAILED);
            assertThat(run.report().recommendation()).isEqualTo(Recommendation.UNKNOWN);
            assertThat(run.report().confidence()).isZero();
            assertThat(run.report().findings())
                    .containsOnlyKeys("content_analysis", "visual_analysis", "reputation_check")
                    .allSatisfy((k, v) -> assertThat(v).isNull());
            assertThat(run.errors()).singleElement().asString().startsWith("fetch DNS");
            assertThat(content.calls() + visual.calls() + reputation.calls()).isZero();
        }

        @Test
        @DisplayName("예상치 못한 런타임 예외도 실패 리포트로 바꾼다")
        void unexpectedFetchError() throws FetchException {
            when(fetcher.fetch(anyString())).thenThrow(new IllegalStateException("parser crashed"));

            AnalysisRun run = orchestrator(CONFIG, new ScriptedAdapter(CONTENT).thenReturn(1, 1)).analyze(request());

            assertThat(run.state()).isEqualTo(PipelineState.FAILED);
            assertThat(run.report().recommendation()).isEqualTo(Recommendation.UNKNOWN);
        }
    }

    @Test
    @DisplayName("같은 소스의 분석기가 두 개면 생성 시 거부")
    void duplicateAdapters() {
        assertThatThrownBy(() -> orchestrator(CONFIG,
                new ScriptedAdapter(CONTENT), new ScriptedAdapter(CONTENT)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("가중치 일부만 오버라이드하면 실행 전에 거부")
    void partialWeightOverrideRejected() {
        AnalysisOptions partial = new AnalysisOptions(0.5, null, null, null, null, null);
        AnalysisOrchestrator o = orchestrator(CONFIG, new ScriptedAdapter(CONTENT).thenReturn(1, 1));

        assertThatThrownBy(() -> o.analyze(new AnalysisRequest(URL, NOW, partial)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
