package com.goormthonuniv.sitecheck.fetch;

import com.goormthonuniv.sitecheck.config.SiteCheckProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * 외부 헤드리스 렌더링 서비스(GET endpoint?url=...)에서 PNG를 받아 파일로 저장한다.
 * 스크린샷은 선택 입력이라 실패해도 fetch 자체는 실패시키지 않는다(화면 분석기만 error 처리됨).
 */
@Slf4j
@Component
public class HttpScreenshotRenderer implements ScreenshotRenderer {

    private final RestClient rest;
    private final String endpoint;
    private final Path outputDir;

    public HttpScreenshotRenderer(RestClient rest, SiteCheckProperties properties) {
        this.rest = rest;
        this.endpoint = properties.getFetch().getScreenshot().getEndpoint();
        this.outputDir = Path.of(properties.getFetch().getScreenshot().getOutputDir());
    }

    @Override
    public Optional<String> render(String url) {
        if (endpoint == null || endpoint.isBlank()) return Optional.empty();
        try {
            URI uri = URI.create(endpoint + "?url=" + URLEncoder.encode(url, StandardCharsets.UTF_8));
            byte[] png = rest.get().uri(uri).retrieve().body(byte[].class);
            if (png == null || png.length == 0) {
                log.warn("screenshot renderer returned empty body for {}", url);
                return Optional.empty();
            }
            Files.createDirectories(outputDir);
            String host = Optional.ofNullable(URI.create(url).getHost()).orElse("unknown");
            Path file = outputDir.resolve("screenshot_%s_%d.png".formatted(host, System.currentTimeMillis()));
            Files.write(file, png);
            return Optional.of(file.toString());
        } catch (RestClientException | IOException | IllegalArgumentException e) {
            log.warn("screenshot unavailable for {}: {}", url, e.getMessage());
            return Optional.empty();
        }
    }
}
