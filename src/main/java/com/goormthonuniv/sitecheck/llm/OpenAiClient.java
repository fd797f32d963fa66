package com.goormthonuniv.sitecheck.llm;

import com.goormthonuniv.sitecheck.analyzer.PermanentAnalyzerException;
import com.goormthonuniv.sitecheck.analyzer.TransientAnalyzerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.Map;

/**
 * OpenAI chat completions 얇은 클라이언트.
 * 실패는 분석기 예외로 분류한다: 429/5xx/I·O(읽기 타임아웃 포함) → 일시적, 그 외 4xx·비정상 응답 → 영구.
 */
@Slf4j
@Component
public class OpenAiClient {

    private final RestClient rest;
    private final String endpoint;
    private final String apiKey;
    private final String model;
    private final String visionModel;

    public OpenAiClient(@Qualifier("llmRestClient") RestClient rest,
                        @Value("${sitecheck.ai.openai.endpoint:https://api.openai.com/v1/chat/completions}") String endpoint,
                        @Value("${sitecheck.ai.openai.apiKey:}") String apiKey,
                        @Value("${sitecheck.ai.openai.model:gpt-4o-mini}") String model,
                        @Value("${sitecheck.ai.openai.visionModel:gpt-4o-mini}") String visionModel) {
        this.rest = rest;
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.model = model;
        this.visionModel = visionModel;
    }

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    public String complete(String system, String user) {
        Map<String, Object> body = Map.of(
                "model", model,
                "messages", List.of(
                        Map.of("role", "system", "content", system),
                        Map.of("role", "user", "content", user)
                ),
                "temperature", 0,
                "response_format", Map.of("type", "json_object")
        );
        return send(body);
    }

    /** imageDataUrl: data:image/png;base64,... */
    public String completeWithImage(String system, String user, String imageDataUrl) {
        Map<String, Object> body = Map.of(
                "model", visionModel,
                "messages", List.of(
                        Map.of("role", "system", "content", system),
                        Map.of("role", "user", "content", List.of(
                                Map.of("type", "text", "text", user),
                                Map.of("type", "image_url", "image_url", Map.of("url", imageDataUrl))
                        ))
                ),
                "temperature", 0
        );
        return send(body);
    }

    private String send(Map<String, Object> body) {
        if (!isConfigured()) {
            throw new PermanentAnalyzerException("OpenAI api key not configured");
        }
        Map<?, ?> res;
        try {
            res = rest.post()
                    .uri(endpoint)
                    .header("Authorization", "Bearer " + apiKey)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(Map.class);
        } catch (HttpStatusCodeException e) {
            throw classify(e.getStatusCode(), e);
        } catch (ResourceAccessException e) {
            throw new TransientAnalyzerException("OpenAI I/O error: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new PermanentAnalyzerException("OpenAI response unreadable: " + e.getMessage(), e);
        }

        String content = extractContent(res);
        log.debug("openai reply chars={}", content.length());
        return content;
    }

    @SuppressWarnings("unchecked")
    static String extractContent(Map<?, ?> res) {
        if (res == null) {
            throw new PermanentAnalyzerException("OpenAI returned empty body");
        }
        Object choices = res.get("choices");
        if (!(choices instanceof List<?> list) || list.isEmpty() || !(list.get(0) instanceof Map<?, ?> first)) {
            throw new PermanentAnalyzerException("OpenAI response has no choices");
        }
        Object message = first.get("message");
        Object content = message instanceof Map<?, ?> m ? ((Map<String, Object>) m).get("content") : null;
        if (!(content instanceof String s) || s.isBlank()) {
            throw new PermanentAnalyzerException("OpenAI content empty");
        }
        return s;
    }

    static RuntimeException classify(HttpStatusCode status, Exception cause) {
        if (status.value() == 429 || status.is5xxServerError()) {
            return new TransientAnalyzerException("OpenAI HTTP " + status.value(), cause);
        }
        return new PermanentAnalyzerException("OpenAI rejected request: HTTP " + status.value(), cause);
    }
}
