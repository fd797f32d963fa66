package com.goormthonuniv.sitecheck.fetch;

public interface ContentFetcher {
    FetchedContent fetch(String url) throws FetchException;
}
