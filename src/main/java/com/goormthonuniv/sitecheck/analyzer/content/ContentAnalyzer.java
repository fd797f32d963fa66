package com.goormthonuniv.sitecheck.analyzer.content;

import com.goormthonuniv.sitecheck.analyzer.AnalyzerAdapter;
import com.goormthonuniv.sitecheck.analyzer.AnalyzerResult;
import com.goormthonuniv.sitecheck.analyzer.AnalyzerSource;
import com.goormthonuniv.sitecheck.analyzer.PermanentAnalyzerException;
import com.goormthonuniv.sitecheck.fetch.FetchedContent;
import com.goormthonuniv.sitecheck.fetch.PageForm;
import com.goormthonuniv.sitecheck.llm.LlmResponseParser;
import com.goormthonuniv.sitecheck.llm.OpenAiClient;
import com.goormthonuniv.sitecheck.util.TextUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.goormthonuniv.sitecheck.llm.LlmResponseParser.number;
import static com.goormthonuniv.sitecheck.llm.LlmResponseParser.strings;
import static com.goormthonuniv.sitecheck.llm.LlmResponseParser.text;

/**
 * 페이지 텍스트/폼/메타 정보를 LLM 에 보내 피싱 여부를 판정한다.
 * 모델 미설정이거나 모델이 요청을 영구 거절하면 규칙 기반 점수로 대체한다.
 * 일시적 실패는 그대로 던져 Supervisor 가 재시도하게 둔다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContentAnalyzer implements AnalyzerAdapter {

    private static final int TEXT_PREVIEW_CHARS = 1000;
    private static final List<String> RULE_KEYWORDS = List.of("urgent", "verify", "suspended", "expires");

    private final OpenAiClient openAi;
    private final LlmResponseParser parser;

    @Override
    public AnalyzerSource source() {
        return AnalyzerSource.CONTENT;
    }

    @Override
    public AnalyzerResult evaluate(FetchedContent content) {
        SecurityFlags flags = SecurityFlags.of(content);
        if (!openAi.isConfigured()) {
            return ruleBased(content, flags, null);
        }

        String reply;
        try {
            reply = openAi.complete(Prompt.SYSTEM, "Analyze this website for phishing:\n\n" + summarize(content));
        } catch (PermanentAnalyzerException e) {
            log.warn("content model unavailable, using rules: {}", e.getMessage());
            return ruleBased(content, flags, e.getMessage());
        }

        Map<String, Object> verdict = parser.parse(reply);
        Map<String, Object> findings = new LinkedHashMap<>();
        findings.put("method", "llm");
        findings.put("security_flags", flags.toFindings());
        findings.put("suspicious_elements", strings(verdict, "suspicious_elements"));
        findings.put("legitimate_indicators", strings(verdict, "legitimate_indicators"));
        findings.put("brand_impersonation", text(verdict, "brand_impersonation"));
        findings.put("explanation", text(verdict, "explanation"));
        findings.put("model_output_parsed", verdict.get("parsed"));

        return new AnalyzerResult(
                number(verdict, "risk_score", 5.0),
                number(verdict, "confidence", 0.5),
                findings);
    }

    /** 모델 없이 점수화: https 없음 +2, 키워드 개당 +1, 비밀번호 폼 +1, risk = min(1.5 * factors, 10) */
    AnalyzerResult ruleBased(FetchedContent content, SecurityFlags flags, String llmError) {
        int riskFactors = 0;
        List<String> suspicious = new ArrayList<>();
        List<String> legitimate = new ArrayList<>();

        if (!flags.hasHttps()) {
            riskFactors += 2;
            suspicious.add("No HTTPS encryption");
        } else {
            legitimate.add("HTTPS encryption present");
        }

        List<String> found = TextUtils.findKeywords(content.text(), RULE_KEYWORDS);
        riskFactors += found.size();
        found.forEach(k -> suspicious.add("Suspicious keyword: " + k));

        if (flags.hasLoginForms()) {
            riskFactors += 1;
            suspicious.add("Password input forms detected");
        }

        double risk = Math.min(riskFactors * 1.5, 10.0);

        Map<String, Object> findings = new LinkedHashMap<>();
        findings.put("method", "rules");
        findings.put("security_flags", flags.toFindings());
        findings.put("suspicious_elements", suspicious);
        findings.put("legitimate_indicators", legitimate);
        findings.put("brand_impersonation", null);
        findings.put("explanation", "Rule-based analysis found " + riskFactors + " risk factors");
        if (llmError != null) findings.put("llm_error", llmError);
        return new AnalyzerResult(risk, 0.7, findings);
    }

    static String summarize(FetchedContent content) {
        List<String> parts = new ArrayList<>();
        parts.add("URL: " + content.url());
        if (content.finalUrl() != null && !content.finalUrl().equals(content.url())) {
            parts.add("Redirected to: " + content.finalUrl());
        }
        if (content.title() != null) parts.add("Title: " + content.title());
        if (content.metaDescription() != null) parts.add("Meta Description: " + content.metaDescription());
        if (!content.text().isBlank()) {
            parts.add("Text Content Preview: " + TextUtils.truncate(content.text(), TEXT_PREVIEW_CHARS));
        }
        if (!content.forms().isEmpty()) {
            String forms = content.forms().stream()
                    .limit(3)
                    .map(ContentAnalyzer::describeForm)
                    .collect(Collectors.joining("; "));
            parts.add("Forms: " + forms);
        }
        if (!content.links().isEmpty()) parts.add("Links count: " + content.links().size());
        return String.join("\n", parts);
    }

    private static String describeForm(PageForm form) {
        return "Form with fields: " + form.fields().stream().map(PageForm.Field::type).collect(Collectors.joining(", "));
    }

    static class Prompt {
        static final String SYSTEM = """
        You are a cybersecurity expert specialising in phishing site detection.

        Analyse the supplied website content and determine:
        1. Suspicious elements that indicate phishing
        2. Legitimate indicators
        3. A risk score from 0 to 10 (10 = almost certainly phishing)
        4. Your confidence in the analysis from 0 to 1

        Pay attention to:
        - Pressure wording (urgent, limited time, verify account, suspended)
        - Forms asking for credentials, card numbers or personal data
        - Design quality and spelling mistakes
        - Suspicious URLs and domains
        - Imitation of well-known brands

        Reply with JSON only:
        {
          "risk_score": <float 0-10>,
          "confidence": <float 0-1>,
          "suspicious_elements": ["..."],
          "legitimate_indicators": ["..."],
          "explanation": "...",
          "brand_impersonation": "<brand>" or null
        }
        """;
    }
}
