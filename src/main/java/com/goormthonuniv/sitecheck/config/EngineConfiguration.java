package com.goormthonuniv.sitecheck.config;

import com.goormthonuniv.sitecheck.engine.EngineConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

@Slf4j
@Configuration
public class EngineConfiguration {

    /** 잘못된 가중치 테이블은 여기서 예외로 기동을 막는다 */
    @Bean
    public EngineConfig engineConfig(SiteCheckProperties properties) {
        EngineConfig config = properties.getEngine().toEngineConfig();
        log.info("engine config: weights={} analyzerTimeout={} pipelineDeadline={} retry={}",
                config.weights(), config.analyzerTimeout(), config.pipelineDeadline(), config.retry());
        return config;
    }

    /**
     * 분석기 디스패치 + 재시도 작업에 쓰는 풀. 실행마다 최대 6개 스레드를 쓴다.
     * 상한을 넘으면 제출이 거부되고 해당 분석기는 error 로 기록된다.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService analyzerExecutor(SiteCheckProperties properties) {
        int maxThreads = properties.getEngine().getMaxThreads();
        log.info("analyzer executor: maxThreads={}", maxThreads);
        return new ThreadPoolExecutor(0, maxThreads, 60L, TimeUnit.SECONDS, new SynchronousQueue<>(),
                new CustomizableThreadFactory("analyzer-"), new ThreadPoolExecutor.AbortPolicy());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
