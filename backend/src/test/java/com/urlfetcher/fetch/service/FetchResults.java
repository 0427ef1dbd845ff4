package com.urlfetcher.fetch.service;

import com.urlfetcher.fetch.model.HttpFetchResult;

final class FetchResults {
    private FetchResults() {
    }

    static HttpFetchResult ok(String body) {
        return new HttpFetchResult(200, body, "text/plain", null, null);
    }

    static HttpFetchResult failed(String errorCode) {
        return new HttpFetchResult(0, null, null, errorCode, "stubbed failure");
    }
}
