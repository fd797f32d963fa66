package com.goormthonuniv.sitecheck.fetch;

import lombok.Getter;

/** 콘텐츠 획득 실패. 분석기를 하나도 돌릴 수 없으므로 실행 전체가 실패로 끝난다. */
@Getter
public class FetchException extends Exception {

    private final FetchFailure failure;

    public FetchException(FetchFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public FetchException(FetchFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }
}
