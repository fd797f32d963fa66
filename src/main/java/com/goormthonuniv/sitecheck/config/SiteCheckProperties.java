package com.goormthonuniv.sitecheck.config;

import com.goormthonuniv.sitecheck.engine.EngineConfig;
import com.goormthonuniv.sitecheck.engine.RetryPolicy;
import com.goormthonuniv.sitecheck.engine.WeightTable;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * application.yml 의 sitecheck.* 바인딩.
 * 엔진 설정은 기동 시 한 번 {@link EngineConfig}로 변환되어 오케스트레이터에 주입된다.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "sitecheck")
public class SiteCheckProperties {

    private Engine engine = new Engine();
    private Fetch fetch = new Fetch();
    private Reputation reputation = new Reputation();

    @Getter
    @Setter
    public static class Engine {
        private Weights weights = new Weights();
        private Duration analyzerTimeout = Duration.ofSeconds(20);
        private Duration pipelineDeadline = Duration.ofSeconds(45);
        private Retry retry = new Retry();
        // 분석기 풀 스레드 상한 (실행당 최대 6개)
        private int maxThreads = 64;

        public EngineConfig toEngineConfig() {
            return new EngineConfig(
                    new WeightTable(weights.content, weights.visual, weights.reputation),
                    analyzerTimeout,
                    pipelineDeadline,
                    new RetryPolicy(retry.maxAttempts, retry.initialBackoff, retry.multiplier, retry.maxBackoff)
            );
        }
    }

    @Getter
    @Setter
    public static class Weights {
        private double content = 0.4;
        private double visual = 0.3;
        private double reputation = 0.3;
    }

    @Getter
    @Setter
    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(500);
        private double multiplier = 2.0;
        private Duration maxBackoff = Duration.ofSeconds(4);
    }

    @Getter
    @Setter
    public static class Fetch {
        private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/122.0.0.0 Safari/537.36";
        private Duration timeout = Duration.ofSeconds(15);
        private int maxBodyBytes = 2 * 1024 * 1024;
        private int maxLinks = 50;
        private Screenshot screenshot = new Screenshot();
    }

    @Getter
    @Setter
    public static class Screenshot {
        /** 헤드리스 렌더링 서비스 엔드포인트(?url=). 비어 있으면 스크린샷 생략 */
        private String endpoint = "";
        private String outputDir = "screenshots";
    }

    @Getter
    @Setter
    public static class Reputation {
        private Duration cacheTtl = Duration.ofMinutes(15);
        private long cacheMaxSize = 2000;
        private int searchLimit = 8;
    }
}
