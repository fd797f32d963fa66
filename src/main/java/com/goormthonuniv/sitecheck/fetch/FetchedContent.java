package com.goormthonuniv.sitecheck.fetch;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * 실행 1회 동안 세 분석기가 읽기 전용으로 공유하는 페이지 스냅샷.
 * 생성 이후 변경되지 않는다(컬렉션은 모두 불변 복사본).
 */
public record FetchedContent(
        String url,                 // 요청 URL
        String finalUrl,            // 리다이렉트 후 최종 URL
        String html,
        String text,
        String title,
        String metaDescription,
        List<String> metaKeywords,
        List<String> links,
        List<PageForm> forms,
        String screenshotRef,       // 없으면 null
        DomainMetadata domainMetadata,
        int statusCode,
        long responseTimeMs,
        Instant fetchedAt
) {
    public FetchedContent {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(domainMetadata, "domainMetadata");
        html = html == null ? "" : html;
        text = text == null ? "" : text;
        metaKeywords = metaKeywords == null ? List.of() : List.copyOf(metaKeywords);
        links = links == null ? List.of() : List.copyOf(links);
        forms = forms == null ? List.of() : List.copyOf(forms);
    }

    public boolean hasScreenshot() {
        return screenshotRef != null && !screenshotRef.isBlank();
    }
}
