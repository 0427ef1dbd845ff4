package com.urlfetcher.fetch.http;

import com.urlfetcher.fetch.model.HttpFetchResult;

/**
 * Performs a single HTTP GET. Failures are reported through {@link HttpFetchResult#errorCode()}
 * rather than thrown.
 */
public interface PageFetcher {
    HttpFetchResult get(String url);
}
