package com.goormthonuniv.sitecheck.engine;

import com.goormthonuniv.sitecheck.analyzer.AnalyzerAdapter;
import com.goormthonuniv.sitecheck.analyzer.AnalyzerException;
import com.goormthonuniv.sitecheck.analyzer.AnalyzerOutcome;
import com.goormthonuniv.sitecheck.analyzer.AnalyzerResult;
import com.goormthonuniv.sitecheck.analyzer.AnalyzerSource;
import com.goormthonuniv.sitecheck.fetch.FetchedContent;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * 분석기 호출 1건에 데드라인과 재시도 예산을 씌운다.
 * <p>
 * resilience4j {@link Retry} 가 시도/백오프를, {@link TimeLimiter} 가 분석기 데드라인을 맡는다.
 * 어떤 실패도 호출자에게 예외로 넘기지 않고 {@code timeout}/{@code error} 결과로 바꾼다.
 * <ul>
 *   <li>일시적 실패: 지수 백오프로 maxAttempts 까지 재시도</li>
 *   <li>영구 실패(및 분류되지 않은 예외): 즉시 error</li>
 *   <li>데드라인 경과, 또는 백오프가 데드라인을 넘길 때: 진행 중 시도를 인터럽트 취소하고 timeout</li>
 *   <li>감독 스레드 자체가 인터럽트되면(파이프라인 데드라인) 진행 중 시도를 취소하고 timeout</li>
 * </ul>
 */
@Slf4j
@Component
public class AnalyzerSupervisor {

    private final ExecutorService executor;

    public AnalyzerSupervisor(@Qualifier("analyzerExecutor") ExecutorService executor) {
        this.executor = executor;
    }

    public AnalyzerOutcome supervise(AnalyzerAdapter adapter, FetchedContent content,
                                     Duration deadline, RetryPolicy policy) {
        AnalyzerSource source = adapter.source();
        long startNanos = System.nanoTime();
        long deadlineNanos = startNanos + deadline.toNanos();
        AtomicInteger attempts = new AtomicInteger();

        Retry retry = Retry.of(source.getId(), policy.toRetryConfig());
        retry.getEventPublisher().onRetry(event ->
                log.warn("analyzer={} transient failure on attempt {}/{}: {}", source.getId(),
                        event.getNumberOfRetryAttempts(), policy.maxAttempts(),
                        event.getLastThrowable() == null ? "" : event.getLastThrowable().getMessage()));

        Supplier<AnalyzerResult> attempt = () -> {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("cancelled before attempt");
            }
            int n = attempts.incrementAndGet();
            try {
                return adapter.evaluate(content);
            } catch (AnalyzerException e) {
                if (e.isTransient() && n < policy.maxAttempts()
                        && System.nanoTime() + policy.backoffBefore(n + 1).toNanos() >= deadlineNanos) {
                    throw new RetryWindowClosedException(e);
                }
                throw e;
            }
        };
        Callable<AnalyzerResult> retried = MdcTasks.wrap(() -> Retry.decorateSupplier(retry, attempt).get());

        TimeLimiter limiter = TimeLimiter.of(source.getId(), TimeLimiterConfig.custom()
                .timeoutDuration(deadline)
                .cancelRunningFuture(true)
                .build());
        AtomicReference<Future<AnalyzerResult>> inFlight = new AtomicReference<>();
        Callable<AnalyzerResult> timed = TimeLimiter.decorateFutureSupplier(limiter, () -> {
            Future<AnalyzerResult> f = executor.submit(retried);
            inFlight.set(f);
            return f;
        });

        try {
            AnalyzerResult result = timed.call();
            if (result == null) {
                return AnalyzerOutcome.error(source, "analyzer returned no result", attempts.get(), elapsedMs(startNanos));
            }
            if (attempts.get() > 1) {
                log.info("analyzer={} succeeded on attempt {}", source.getId(), attempts.get());
            }
            return AnalyzerOutcome.ok(source, result, attempts.get(), elapsedMs(startNanos));
        } catch (TimeoutException e) {
            log.warn("analyzer={} exceeded deadline of {}ms on attempt {}", source.getId(), deadline.toMillis(), attempts.get());
            return AnalyzerOutcome.timeout(source,
                    "analyzer deadline of " + deadline.toMillis() + "ms exceeded", attempts.get(), elapsedMs(startNanos));
        } catch (InterruptedException e) {
            cancel(inFlight.get());
            Thread.currentThread().interrupt();
            return AnalyzerOutcome.timeout(source, "cancelled by pipeline deadline", attempts.get(), elapsedMs(startNanos));
        } catch (RejectedExecutionException e) {
            log.warn("analyzer={} rejected by saturated executor", source.getId());
            return AnalyzerOutcome.error(source, "analyzer executor rejected task", 0, elapsedMs(startNanos));
        } catch (RetryWindowClosedException e) {
            log.warn("analyzer={} stopped retrying, next backoff would cross the deadline", source.getId());
            return AnalyzerOutcome.timeout(source,
                    "deadline reached before retry; last error: " + e.getCause().getMessage(),
                    attempts.get(), elapsedMs(startNanos));
        } catch (AnalyzerException e) {
            if (e.isTransient()) {
                log.warn("analyzer={} gave up after {} attempts: {}", source.getId(), attempts.get(), e.getMessage());
                return AnalyzerOutcome.error(source,
                        "gave up after " + attempts.get() + " attempts: " + e.getMessage(), attempts.get(), elapsedMs(startNanos));
            }
            log.warn("analyzer={} failed permanently: {}", source.getId(), e.getMessage());
            return AnalyzerOutcome.error(source, e.getMessage(), attempts.get(), elapsedMs(startNanos));
        } catch (Exception e) {
            log.warn("analyzer={} failed permanently: {}", source.getId(), describe(e));
            return AnalyzerOutcome.error(source, describe(e), attempts.get(), elapsedMs(startNanos));
        }
    }

    private static void cancel(Future<?> future) {
        if (future != null) {
            future.cancel(true);
        }
    }

    private static String describe(Throwable t) {
        String msg = t.getMessage();
        return t.getClass().getSimpleName() + (msg == null ? "" : ": " + msg);
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }

    /** 다음 백오프가 분석기 데드라인을 넘겨 재시도를 포기할 때. 재시도 대상이 아니다 */
    private static final class RetryWindowClosedException extends RuntimeException {
        RetryWindowClosedException(AnalyzerException lastTransient) {
            super(lastTransient.getMessage(), lastTransient);
        }
    }
}
