package com.urlfetcher.fetch.model;

import java.util.Objects;

/**
 * Snapshot of a fetch job. The registry swaps in a new snapshot on every status change, so a
 * reference held by a caller never changes underneath it.
 */
public record FetchJob(long id, String url, JobStatus status, UrlResponse response) {
    public FetchJob {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(status, "status");
    }

    public static FetchJob waiting(long id, String url) {
        return new FetchJob(id, url, JobStatus.WAITING, null);
    }

    public FetchJob withStatus(JobStatus next, UrlResponse result) {
        return new FetchJob(id, url, next, result != null ? result : response);
    }
}
