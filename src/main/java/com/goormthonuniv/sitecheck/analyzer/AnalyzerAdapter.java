package com.goormthonuniv.sitecheck.analyzer;

import com.goormthonuniv.sitecheck.fetch.FetchedContent;

/**
 * 외부 분석 기능(LLM, 검색, 이미지 분류 등) 하나를 감싸는 공통 계약.
 * <p>
 * 구현체는 성공 시 항상 {@link AnalyzerResult}를 반환하고, 실패는
 * {@link TransientAnalyzerException}(재시도 가능) 또는 {@link PermanentAnalyzerException}으로 던진다.
 * 전달받은 {@link FetchedContent}는 다른 분석기와 공유되므로 절대 변경하지 않는다.
 */
public interface AnalyzerAdapter {

    AnalyzerSource source();

    AnalyzerResult evaluate(FetchedContent content);
}
