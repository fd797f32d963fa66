package com.goormthonuniv.sitecheck.analyzer;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum AnalyzerSource {
    CONTENT("content", "content_analysis"),
    VISUAL("visual", "visual_analysis"),
    REPUTATION("reputation", "reputation_check");

    private final String id;
    /** 발행 리포트의 findings 키 */
    private final String reportKey;

    @JsonValue
    public String getId() {
        return id;
    }
}
