package com.goormthonuniv.sitecheck.analyzer;

/** 네트워크 오류, 레이트리밋(429), 5xx 등 다시 시도하면 성공할 수 있는 실패 */
public class TransientAnalyzerException extends AnalyzerException {

    public TransientAnalyzerException(String message) {
        super(message);
    }

    public TransientAnalyzerException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
