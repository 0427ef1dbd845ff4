package com.urlfetcher.fetch.service;

import com.urlfetcher.config.FetcherProperties;
import com.urlfetcher.fetch.http.PageFetcher;
import com.urlfetcher.fetch.model.FetchJob;
import com.urlfetcher.fetch.model.HttpFetchResult;
import com.urlfetcher.fetch.model.JobStatus;
import com.urlfetcher.fetch.model.UrlResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Resolves one queued job, either from a fresh cache entry or with a network fetch.
 */
@Service
public class FetchJobProcessor {
    private static final Logger log = LoggerFactory.getLogger(FetchJobProcessor.class);

    private final FetchContext context;
    private final PageFetcher pageFetcher;
    private final Clock clock;
    private final Duration freshness;

    public FetchJobProcessor(
        FetchContext context,
        PageFetcher pageFetcher,
        Clock clock,
        FetcherProperties properties
    ) {
        this.context = context;
        this.pageFetcher = pageFetcher;
        this.clock = clock;
        this.freshness = properties.getCache().getFreshness();
    }

    /**
     * Drives the job to a terminal state. Fetch failures end as {@code error}; they are never
     * thrown.
     *
     * @throws JobNotFoundException when the id was queued without being registered
     */
    public FetchJob process(long jobId) {
        FetchJob job = context.registry().find(jobId)
            .orElseThrow(() -> new JobNotFoundException(jobId));

        Optional<UrlResponse> cached = context.cache().lookup(job.url());
        if (cached.isPresent() && isFresh(cached.get(), clock.instant())) {
            log.debug("Job {} served from cache entry captured at {}", jobId, cached.get().timestamp());
            return transition(jobId, JobStatus.DONE_CACHED, cached.get());
        }

        transition(jobId, JobStatus.FETCHING, null);
        log.debug("Job {} fetching {}", jobId, job.url());
        HttpFetchResult result = pageFetcher.get(job.url());
        if (result == null || !result.isSuccessful()) {
            String code = result == null ? "no_result" : result.errorCode();
            String message = result == null ? null : result.errorMessage();
            log.warn("Job {} failed to fetch {}: {} {}", jobId, job.url(), code, message);
            return transition(jobId, JobStatus.ERROR, null);
        }

        UrlResponse response = new UrlResponse(job.url(), result.body(), clock.instant());
        context.cache().publish(response);
        log.debug("Job {} fetched {} (status {}, {} chars)", jobId, job.url(), result.statusCode(),
            response.body().length());
        return transition(jobId, JobStatus.DONE, response);
    }

    boolean isFresh(UrlResponse response, Instant now) {
        Duration age = Duration.between(response.timestamp(), now);
        return age.compareTo(freshness) < 0;
    }

    private FetchJob transition(long jobId, JobStatus next, UrlResponse response) {
        return context.registry().transition(jobId, next, response)
            .orElseThrow(() -> new JobNotFoundException(jobId));
    }
}
