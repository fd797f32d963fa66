package com.goormthonuniv.sitecheck.search;

import java.util.List;

public interface SearchAdapter {
    String name(); // "google_cse", "bing"

    /** 키 미설정 등으로 호출 자체가 불가능하면 false */
    boolean isEnabled();

    /** 실패 시 TransientAnalyzerException / PermanentAnalyzerException */
    List<SearchResult> search(String query, int limit);
}
