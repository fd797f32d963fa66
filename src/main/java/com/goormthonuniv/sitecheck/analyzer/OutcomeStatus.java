package com.goormthonuniv.sitecheck.analyzer;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum OutcomeStatus {
    OK, TIMEOUT, ERROR, SKIPPED;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
