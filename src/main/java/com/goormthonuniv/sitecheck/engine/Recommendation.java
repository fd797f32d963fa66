package com.goormthonuniv.sitecheck.engine;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum Recommendation {
    LOW("LOW RISK"),
    MEDIUM("MEDIUM RISK"),
    HIGH("HIGH RISK"),
    UNKNOWN("UNKNOWN");

    static final double MEDIUM_FROM = 3.0;
    static final double HIGH_FROM = 6.0;

    @JsonValue
    private final String label;

    /** 경계값은 위 구간에 속한다: [0,3) LOW, [3,6) MEDIUM, [6,10] HIGH */
    public static Recommendation fromScore(double riskScore) {
        if (riskScore >= HIGH_FROM) return HIGH;
        if (riskScore >= MEDIUM_FROM) return MEDIUM;
        return LOW;
    }
}
