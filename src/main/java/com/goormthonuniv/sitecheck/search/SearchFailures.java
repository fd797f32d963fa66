package com.goormthonuniv.sitecheck.search;

import com.goormthonuniv.sitecheck.analyzer.PermanentAnalyzerException;
import com.goormthonuniv.sitecheck.analyzer.TransientAnalyzerException;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;

/** 검색 API 예외를 분석기 예외로 분류 */
final class SearchFailures {

    private SearchFailures() {}

    static RuntimeException classify(String adapter, RestClientException e) {
        if (e instanceof HttpStatusCodeException http) {
            int code = http.getStatusCode().value();
            if (code == 429 || http.getStatusCode().is5xxServerError()) {
                return new TransientAnalyzerException(adapter + " HTTP " + code, e);
            }
            return new PermanentAnalyzerException(adapter + " rejected query: HTTP " + code, e);
        }
        if (e instanceof ResourceAccessException) {
            return new TransientAnalyzerException(adapter + " I/O error: " + e.getMessage(), e);
        }
        return new PermanentAnalyzerException(adapter + " response unreadable: " + e.getMessage(), e);
    }
}
