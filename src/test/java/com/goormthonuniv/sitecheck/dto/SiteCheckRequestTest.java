package com.goormthonuniv.sitecheck.dto;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class SiteCheckRequestTest {

    private static jakarta.validation.ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void setUp() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void tearDown() {
        factory.close();
    }

    @Test
    @DisplayName("http/https 절대 URL 만 허용")
    void urlPattern() {
        assertThat(validator.validate(new SiteCheckRequest("https://a.example/x?y=1", null))).isEmpty();
        assertThat(validator.validate(new SiteCheckRequest("HTTP://A.EXAMPLE", null))).isEmpty();
        assertThat(validator.validate(new SiteCheckRequest("ftp://a.example", null))).hasSize(1);
        assertThat(validator.validate(new SiteCheckRequest("", null))).isNotEmpty();
        assertThat(validator.validate(new SiteCheckRequest("https://a b.example", null))).hasSize(1);
    }

    @Test
    @DisplayName("스킴 없는 주소는 https 를 붙여 받아들인다")
    void schemelessUrlGetsHttps() {
        SiteCheckRequest req = new SiteCheckRequest("  rora.it.com/login ", null);

        assertThat(req.url()).isEqualTo("https://rora.it.com/login");
        assertThat(validator.validate(req)).isEmpty();
        assertThat(new SiteCheckRequest("http://plain.example", null).url()).isEqualTo("http://plain.example");
    }

    @Test
    @DisplayName("타임아웃/데드라인 오버라이드는 10분을 넘을 수 없다")
    void durationOverridesBounded() {
        AnalysisOptions huge = new AnalysisOptions(null, null, null, 10_000_000_000_000L, 9_000_000_000_000L, null);
        AnalysisOptions atLimit = new AnalysisOptions(null, null, null,
                AnalysisOptions.MAX_DURATION_MS, AnalysisOptions.MAX_DURATION_MS, null);

        assertThat(validator.validate(new SiteCheckRequest("https://a.example", huge)))
                .extracting(v -> v.getPropertyPath().toString())
                .containsExactlyInAnyOrder("options.analyzerTimeoutMs", "options.pipelineDeadlineMs");
        assertThat(validator.validate(new SiteCheckRequest("https://a.example", atLimit))).isEmpty();
    }

    @Test
    @DisplayName("옵션 값 범위 검증")
    void optionRanges() {
        AnalysisOptions bad = new AnalysisOptions(1.5, null, null, -1L, null, 11);

        Set<ConstraintViolation<SiteCheckRequest>> violations =
                validator.validate(new SiteCheckRequest("https://a.example", bad));

        assertThat(violations).extracting(v -> v.getPropertyPath().toString())
                .containsExactlyInAnyOrder("options.contentWeight", "options.analyzerTimeoutMs", "options.maxAttempts");
    }

    @Test
    @DisplayName("내부 요청으로 바꿀 때 옵션 기본값을 채운다")
    void toAnalysisRequest() {
        Instant now = Instant.parse("2025-03-01T00:00:00Z");

        AnalysisRequest r = new SiteCheckRequest("https://a.example", null).toAnalysisRequest(now);

        assertThat(r.options()).isEqualTo(AnalysisOptions.none());
        assertThat(r.requestedAt()).isEqualTo(now);
    }
}
