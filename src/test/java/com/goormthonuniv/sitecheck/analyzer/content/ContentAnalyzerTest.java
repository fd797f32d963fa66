package com.goormthonuniv.sitecheck.analyzer.content;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.goormthonuniv.sitecheck.analyzer.AnalyzerResult;
import com.goormthonuniv.sitecheck.analyzer.PermanentAnalyzerException;
import com.goormthonuniv.sitecheck.analyzer.TransientAnalyzerException;
import com.goormthonuniv.sitecheck.fetch.FetchedContent;
import com.goormthonuniv.sitecheck.fetch.TestPages;
import com.goormthonuniv.sitecheck.llm.LlmResponseParser;
import com.goormthonuniv.sitecheck.llm.OpenAiClient;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ContentAnalyzerTest {

    private final OpenAiClient openAi = mock(OpenAiClient.class);
    private final ContentAnalyzer analyzer = new ContentAnalyzer(openAi, new LlmResponseParser(new ObjectMapper()));

    @Nested
    @DisplayName("규칙 기반(모델 미설정)")
    class RuleBased {

        @BeforeEach
        void noModel() {
            when(openAi.isConfigured()).thenReturn(false);
        }

        @Test
        @DisplayName("http + 긴급 키워드 + 비밀번호 폼 = 위험 요인 6개, 9.0점")
        void phishyPage() {
            FetchedContent page = TestPages.page("http://secure-login.example.tk",
                    "URGENT: verify your account or it will be suspended", List.of(TestPages.loginForm()));

            AnalyzerResult r = analyzer.evaluate(page);

            // https 없음 2 + urgent/verify/suspended 3 + 비밀번호 폼 1 = 6 → 9.0
            assertThat(r.subScore()).isEqualTo(9.0);
            assertThat(r.confidence()).isEqualTo(0.7);
            assertThat(r.findings()).containsEntry("method", "rules");
            assertThat(r.findings().get("explanation")).isEqualTo("Rule-based analysis found 6 risk factors");
            @SuppressWarnings("unchecked")
            Map<String, Object> flags = (Map<String, Object>) r.findings().get("security_flags");
            assertThat(flags).containsEntry("has_https", false)
                    .containsEntry("has_suspicious_keywords", true)
                    .containsEntry("has_login_forms", true);
        }

        @Test
        @DisplayName("https 이고 특이사항이 없으면 0점")
        void cleanPage() {
            AnalyzerResult r = analyzer.evaluate(TestPages.page("https://example.com", "Welcome to our bakery", List.of()));

            assertThat(r.subScore()).isZero();
            assertThat(r.findings().get("legitimate_indicators")).asInstanceOf(InstanceOfAssertFactories.LIST).contains("HTTPS encryption present");
        }

        @Test
        @DisplayName("점수는 10 을 넘지 않는다")
        void capped() {
            FetchedContent page = TestPages.page("http://x.example",
                    "urgent urgent verify suspended expires", List.of(TestPages.loginForm()));
            // 2 + 4 + 1 = 7 → 10.5 → 10
            assertThat(analyzer.evaluate(page).subScore()).isEqualTo(10.0);
        }
    }

    @Nested
    @DisplayName("LLM 판정")
    class ModelBased {

        @BeforeEach
        void modelOn() {
            when(openAi.isConfigured()).thenReturn(true);
        }

        @Test
        @DisplayName("모델의 JSON 판정을 그대로 점수로 쓴다")
        void parsesVerdict() {
            when(openAi.complete(anyString(), anyString())).thenReturn("""
                    {"risk_score": 8.5, "confidence": 0.9,
                     "suspicious_elements": ["fake PayPal login"],
                     "legitimate_indicators": [],
                     "explanation": "credential harvesting page",
                     "brand_impersonation": "PayPal"}
                    """);

            AnalyzerResult r = analyzer.evaluate(TestPages.page("https://paypal-secure.example.tk", "Log in", List.of()));

            assertThat(r.subScore()).isEqualTo(8.5);
            assertThat(r.confidence()).isEqualTo(0.9);
            assertThat(r.findings())
                    .containsEntry("method", "llm")
                    .containsEntry("brand_impersonation", "PayPal")
                    .containsEntry("model_output_parsed", true);
            verify(openAi).complete(eq(ContentAnalyzer.Prompt.SYSTEM), contains("URL: https://paypal-secure.example.tk"));
        }

        @Test
        @DisplayName("모델이 영구 거절하면 규칙 기반으로 대체")
        void permanentFallsBackToRules() {
            when(openAi.complete(anyString(), anyString()))
                    .thenThrow(new PermanentAnalyzerException("OpenAI rejected request: HTTP 400"));

            AnalyzerResult r = analyzer.evaluate(TestPages.page("https://example.com"));

            assertThat(r.findings())
                    .containsEntry("method", "rules")
                    .containsEntry("llm_error", "OpenAI rejected request: HTTP 400");
        }

        @Test
        @DisplayName("일시적 실패는 재시도를 위해 그대로 던진다")
        void transientPropagates() {
            when(openAi.complete(anyString(), anyString())).thenThrow(new TransientAnalyzerException("OpenAI HTTP 503"));

            assertThatThrownBy(() -> analyzer.evaluate(TestPages.page("https://example.com")))
                    .isInstanceOf(TransientAnalyzerException.class);
        }

        @Test
        @DisplayName("범위를 벗어난 모델 점수는 영구 실패")
        void outOfRangeScore() {
            when(openAi.complete(anyString(), anyString())).thenReturn("{\"risk_score\": 42, \"confidence\": 0.5}");

            assertThatThrownBy(() -> analyzer.evaluate(TestPages.page("https://example.com")))
                    .isInstanceOf(PermanentAnalyzerException.class);
        }
    }

    @Test
    @DisplayName("요약에는 리다이렉트, 폼, 링크 정보가 들어간다")
    void summarize() {
        FetchedContent page = TestPages.page("https://a.example", "hello", List.of(TestPages.loginForm()));

        String summary = ContentAnalyzer.summarize(page);

        assertThat(summary)
                .contains("URL: https://a.example")
                .contains("Title: Test page")
                .contains("Form with fields: email, password")
                .doesNotContain("Redirected to");
    }
}
