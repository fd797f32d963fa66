package com.goormthonuniv.sitecheck.config;

import com.goormthonuniv.sitecheck.engine.EngineConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.time.Duration;

@Configuration
public class WebConfig {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);

    @Bean
    @Primary
    public RestClient restClient() {
        // 외부 검색/렌더링 호출용. 분석기 데드라인보다 짧게 잡는다
        return RestClient.builder().requestFactory(requestFactory(Duration.ofSeconds(15))).build();
    }

    /** 모델 호출용. 읽기 타임아웃이 분석기 데드라인을 넘지 않아야 취소된 시도의 스레드가 풀려난다 */
    @Bean
    public RestClient llmRestClient(EngineConfig engineConfig) {
        return RestClient.builder().requestFactory(requestFactory(engineConfig.analyzerTimeout())).build();
    }

    static SimpleClientHttpRequestFactory requestFactory(Duration readTimeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(CONNECT_TIMEOUT);
        factory.setReadTimeout(readTimeout);
        return factory;
    }

    @Bean
    public WebMvcConfigurer corsConfigurer() {
        return new WebMvcConfigurer() {
            @Override public void addCorsMappings(CorsRegistry registry) {
                registry.addMapping("/**")
                        .allowedOrigins("*")
                        .allowedMethods("GET","POST","OPTIONS");
            }
        };
    }
}
