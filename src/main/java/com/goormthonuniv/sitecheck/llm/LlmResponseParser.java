package com.goormthonuniv.sitecheck.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.goormthonuniv.sitecheck.util.TextUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 모델 응답에서 JSON 판정을 꺼낸다.
 * 응답 앞뒤에 설명이 섞여 있어도 첫 '{' ~ 마지막 '}' 구간을 시도하고,
 * 그래도 안 되면 키워드로 대략적인 위험도를 추정한다(parsed=false).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmResponseParser {

    private static final List<String> HIGH_RISK_WORDS = List.of("high risk", "phishing", "suspicious", "fake", "scam");
    private static final List<String> LOW_RISK_WORDS = List.of("legitimate", "safe", "low risk", "trusted");

    private final ObjectMapper objectMapper;

    public Map<String, Object> parse(String response) {
        if (response != null) {
            int start = response.indexOf('{');
            int end = response.lastIndexOf('}');
            if (start >= 0 && end > start) {
                try {
                    Map<String, Object> json = objectMapper.readValue(
                            response.substring(start, end + 1), new TypeReference<LinkedHashMap<String, Object>>() {});
                    json.put("parsed", true);
                    return json;
                } catch (JsonProcessingException e) {
                    log.debug("model reply is not valid JSON: {}", e.getOriginalMessage());
                }
            }
        }
        return fromText(response);
    }

    private Map<String, Object> fromText(String response) {
        double risk = 5.0;
        if (!TextUtils.findKeywords(response, HIGH_RISK_WORDS).isEmpty()) {
            risk = 8.0;
        } else if (!TextUtils.findKeywords(response, LOW_RISK_WORDS).isEmpty()) {
            risk = 2.0;
        }
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("risk_score", risk);
        m.put("confidence", 0.6);
        m.put("suspicious_elements", List.of("AI analysis inconclusive"));
        m.put("legitimate_indicators", List.of());
        m.put("explanation", "AI response could not be parsed properly");
        m.put("parsed", false);
        return m;
    }

    public static double number(Map<String, Object> m, String key, double fallback) {
        Object v = m.get(key);
        if (v instanceof Number n) return n.doubleValue();
        if (v instanceof String s) {
            try {
                return Double.parseDouble(s.strip());
            } catch (NumberFormatException ignored) {
                return fallback;
            }
        }
        return fallback;
    }

    public static List<String> strings(Map<String, Object> m, String key) {
        Object v = m.get(key);
        if (!(v instanceof List<?> list)) return List.of();
        List<String> out = new ArrayList<>();
        for (Object o : list) {
            if (o != null) out.add(o.toString());
        }
        return out;
    }

    public static String text(Map<String, Object> m, String key) {
        Object v = m.get(key);
        if (v == null) return null;
        String s = v.toString().strip();
        return s.isEmpty() || "null".equalsIgnoreCase(s) ? null : s;
    }
}
