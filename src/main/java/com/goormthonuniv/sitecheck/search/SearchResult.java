package com.goormthonuniv.sitecheck.search;

public record SearchResult(
        String source,      // 어댑터명
        String title,
        String url,
        String snippet
) {}
