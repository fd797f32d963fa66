package com.goormthonuniv.sitecheck.fetch;

public enum FetchFailure {
    INVALID_URL,
    DNS,
    TLS,
    CONNECTION,
    TIMEOUT,
    HTTP_STATUS,
    UNSUPPORTED_CONTENT
}
