package com.goormthonuniv.sitecheck.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

import java.time.Instant;

public record SiteCheckRequest(
        @NotBlank
        @Pattern(regexp = "(?i)^https?://\\S+$", message = "must be an absolute http(s) url")
        String url,
        @Valid AnalysisOptions options     // 선택
) {
    /** 스킴 없이 들어온 주소(example.com)는 https 로 간주한다. 다른 스킴은 그대로 두어 검증에서 걸러진다 */
    public SiteCheckRequest {
        if (url != null) {
            url = url.strip();
            if (!url.isEmpty() && !url.contains("://")) {
                url = "https://" + url;
            }
        }
    }

    public AnalysisRequest toAnalysisRequest(Instant now) {
        return new AnalysisRequest(url, now, options);
    }
}
