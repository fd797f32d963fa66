package com.goormthonuniv.sitecheck.analyzer;

/** 분석기 실패의 공통 부모. 재시도 여부는 {@link #isTransient()}로만 판단한다. */
public abstract class AnalyzerException extends RuntimeException {

    protected AnalyzerException(String message) {
        super(message);
    }

    protected AnalyzerException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract boolean isTransient();
}
