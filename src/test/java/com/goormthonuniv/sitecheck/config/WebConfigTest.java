package com.goormthonuniv.sitecheck.config;

import com.goormthonuniv.sitecheck.analyzer.TransientAnalyzerException;
import com.goormthonuniv.sitecheck.engine.EngineConfig;
import com.goormthonuniv.sitecheck.engine.RetryPolicy;
import com.goormthonuniv.sitecheck.engine.WeightTable;
import com.goormthonuniv.sitecheck.llm.OpenAiClient;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebConfigTest {

    private final ExecutorService handlers = Executors.newCachedThreadPool();
    private HttpServer server;
    private String endpoint;

    @BeforeEach
    void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v1/chat/completions", exchange -> {
            try {
                Thread.sleep(3_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            byte[] body = "{\"choices\":[{\"message\":{\"content\":\"late\"}}]}".getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.setExecutor(handlers);
        server.start();
        endpoint = "http://127.0.0.1:" + server.getAddress().getPort() + "/v1/chat/completions";
    }

    @AfterEach
    void stop() {
        server.stop(0);
        handlers.shutdownNow();
    }

    @Test
    @DisplayName("모델 클라이언트는 분석기 데드라인 안에 읽기 타임아웃으로 끊고 일시적 실패로 분류한다")
    void llmClientReadTimeoutFollowsAnalyzerDeadline() {
        EngineConfig config = new EngineConfig(WeightTable.defaults(), Duration.ofMillis(300),
                Duration.ofSeconds(5), RetryPolicy.noRetry());
        OpenAiClient client = new OpenAiClient(new WebConfig().llmRestClient(config), endpoint, "k", "m", "vm");

        long started = System.nanoTime();
        assertThatThrownBy(() -> client.complete("sys", "user"))
                .isInstanceOf(TransientAnalyzerException.class)
                .hasMessageContaining("I/O error");
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(2));
    }
}
