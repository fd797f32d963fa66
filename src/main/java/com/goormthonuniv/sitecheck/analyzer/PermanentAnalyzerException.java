package com.goormthonuniv.sitecheck.analyzer;

/** 인증 실패, 잘못된 입력, 비정상 응답 등 재시도해도 소용없는 실패 */
public class PermanentAnalyzerException extends AnalyzerException {

    public PermanentAnalyzerException(String message) {
        super(message);
    }

    public PermanentAnalyzerException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isTransient() {
        return false;
    }
}
